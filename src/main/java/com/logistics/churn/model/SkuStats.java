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
@Schema(description = "Order statistics for one SKU of one partner in one direction")
public class SkuStats {

    @Schema(description = "SKU / article code", example = "ART-5521")
    private String sku;

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    private String partner;

    @Schema(description = "Logistics direction", example = "Express/FBS")
    private String direction;

    @Schema(description = "Number of orders", example = "48")
    private int totalOrders;

    @Schema(description = "Orders per elapsed day", example = "0.8")
    private double avgOrdersPerDay;

    @Schema(description = "Median of per-day order counts", example = "1.0")
    private double medianOrdersPerDay;

    @Schema(description = "Mean days between distinct order dates", example = "2.5")
    private double orderFrequency;

    @Schema(description = "Date of the first order")
    private LocalDate firstOrderDate;

    @Schema(description = "Date of the last order")
    private LocalDate lastOrderDate;

    @Schema(description = "Whole days since the last order", example = "12")
    private long daysSinceLastOrder;

    @Schema(description = "Signals raised for the SKU")
    @Builder.Default
    private List<StatsAlert> alerts = new ArrayList<>();
}
