package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "SKU assortment figures of one calendar month")
public class SkuMonthMetrics {

    @Schema(description = "Calendar month", example = "2025-05")
    private YearMonth month;

    @Schema(description = "SKUs first seen in this month or earlier", example = "42")
    private int totalSku;

    @Schema(description = "SKUs ordered in this month", example = "30")
    private int activeSku;

    @Schema(description = "SKUs first seen in this month", example = "4")
    private int newSku;

    @Schema(description = "SKUs last ordered by this month and silent for more than the churn window", example = "3")
    private int churnedSku;

    @Schema(description = "Orders of the month per active SKU", example = "5.2")
    private double avgOrdersPerSku;

    @Schema(description = "Share of the month's orders held by the top 20% of SKUs, in percent", example = "61.5")
    private double topSkuConcentration;
}
