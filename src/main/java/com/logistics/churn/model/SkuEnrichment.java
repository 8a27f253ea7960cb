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
@Schema(description = "Derived SKU profile built from report-side fields")
public class SkuEnrichment {

    @Schema(example = "48")
    private int orderCount;

    @Schema(description = "Distinct partners ordering the SKU", example = "2")
    private int partnerCount;

    @Schema(description = "Mean report weight over matched orders", example = "0.75")
    private double avgWeight;

    @Schema(description = "Mean report quantity over matched orders", example = "1.5")
    private double avgQty;

    @Schema(example = "Express/FBS")
    private String directionPreference;

    @Schema(example = "WB")
    private String marketplacePreference;

    @Schema(example = "Yaroslavka")
    private String warehousePreference;
}
