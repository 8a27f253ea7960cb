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
@Schema(description = "Health signal attached to partner or SKU statistics")
public class StatsAlert {

    @Schema(description = "Whether the signal concerns a partner or a SKU", example = "PARTNER")
    private AlertScope scope;

    @Schema(description = "Severity of the signal", example = "HIGH")
    private AlertSeverity severity;

    @Schema(description = "Human-readable description", example = "No orders for 45 days")
    private String message;

    @Schema(description = "Metric that triggered the signal", example = "inactivity")
    private String metric;

    @Schema(description = "Observed metric value", example = "45")
    private double value;

    @Schema(description = "Threshold the value exceeded, if any", example = "12.5")
    private Double threshold;
}
