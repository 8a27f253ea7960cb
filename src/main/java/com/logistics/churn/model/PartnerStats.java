package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Order statistics for one partner in one direction, rebuilt on every analysis call")
public class PartnerStats {

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    private String partner;

    @Schema(description = "Logistics direction", example = "Express/FBS")
    private String direction;

    @Schema(description = "Number of orders", example = "312")
    private int totalOrders;

    @Schema(description = "Distinct SKUs ordered", example = "14")
    private int uniqueSku;

    @Schema(description = "Distinct warehouses used", example = "3")
    private int uniqueWarehouses;

    @Schema(description = "Orders per elapsed day between first and last order", example = "3.47")
    private double avgOrdersPerDay;

    @Schema(description = "Median of per-day order counts", example = "3.0")
    private double medianOrdersPerDay;

    @Schema(description = "Mean days between distinct order dates", example = "1.2")
    private double orderFrequency;

    @Schema(description = "Coefficient of variation of per-day order counts", example = "0.64")
    private double volatility;

    @Schema(description = "Date of the first order")
    private LocalDate firstOrderDate;

    @Schema(description = "Date of the last order")
    private LocalDate lastOrderDate;

    @Schema(description = "Whole days since the last order", example = "4")
    private long daysSinceLastOrder;

    @Schema(description = "Ordered within the activity window (30 days)", example = "true")
    private boolean active;

    @Schema(description = "No orders beyond the churn window (60 days)", example = "false")
    private boolean churned;

    @Schema(description = "Additive churn risk heuristic (0-100)", example = "25")
    private int churnRisk;

    @Schema(description = "Concentration of orders in one direction/marketplace (0-100)", example = "100")
    private int concentrationRisk;

    @Schema(description = "Channel diversity, inverse of concentration (0-100)", example = "0")
    private int diversificationScore;

    @Schema(description = "Weight consistency and recent regularity (0-100)", example = "72")
    private int fulfillmentScore;

    @Schema(description = "Signals that contributed to the churn risk")
    @Builder.Default
    private List<StatsAlert> alerts = new ArrayList<>();

    /**
     * Stats for a partner without qualifying records: every numeric field is zero, apart
     * from the neutral diversification (100) and fulfillment (50) scores.
     */
    public static PartnerStats empty(String partner, String direction) {
        return PartnerStats.builder()
                .partner(partner)
                .direction(direction)
                .diversificationScore(100)
                .fulfillmentScore(50)
                .alerts(new ArrayList<>())
                .build();
    }
}
