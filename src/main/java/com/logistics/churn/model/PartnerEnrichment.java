package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Derived partner profile for partner cards")
public class PartnerEnrichment {

    @Schema(example = "312")
    private int orderCount;

    @Schema(description = "Items across all orders", example = "904")
    private int itemsTotal;

    @Schema(example = "2.9")
    private double avgItemsPerOrder;

    @Schema(description = "Mean order weight, kg", example = "1.8")
    private double avgWeightPerOrder;

    @Schema(example = "14")
    private int uniqueSkus;

    @Schema(example = "0.04")
    private double skuPerOrder;

    @Schema(description = "Most frequent direction", example = "Express/FBS")
    private String directionPreference;

    @Schema(description = "Most frequent normalized marketplace", example = "OZON")
    private String marketplacePreference;

    @Schema(description = "Most frequent warehouse", example = "Express Moscow")
    private String warehousePreference;

    @Schema(description = "Orders per day over the last 30 days", example = "2.1")
    private double orderFrequency;

    @Schema(description = "Concentration in one direction/marketplace (0-100)", example = "100")
    private int concentrationRisk;

    @Schema(description = "Inverse of concentration (0-100)", example = "0")
    private int diversificationScore;

    @Schema(description = "Weight consistency and recent activity (0-100)", example = "72")
    private int fulfillmentScore;

    public static PartnerEnrichment empty() {
        return PartnerEnrichment.builder()
                .directionPreference("")
                .marketplacePreference("")
                .warehousePreference("")
                .diversificationScore(100)
                .fulfillmentScore(50)
                .build();
    }
}
