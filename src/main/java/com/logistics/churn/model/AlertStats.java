package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary counts over a set of prioritized alerts")
public class AlertStats {

    @Schema(description = "Total number of alerts", example = "42")
    private int total;

    @Schema(description = "Alert count per scored severity")
    private Map<RiskLevel, Integer> bySeverity;

    @Schema(description = "Alert count per customer size")
    private Map<CustomerSize, Integer> byCustomerSize;

    @Schema(description = "Alert count per category")
    private Map<AlertCategory, Integer> byCategory;

    @Schema(description = "Rounded mean priority score", example = "51")
    private int avgPriorityScore;

    @Schema(description = "Number of newly detected alerts", example = "7")
    private int newAlerts;
}
