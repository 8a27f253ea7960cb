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
@Schema(description = "Order-volume risk of the last 30 days against days 31-60")
public class RiskTrajectory {

    @Schema(description = "Risk of the last 30 days (0-100)", example = "40")
    private int current;

    @Schema(description = "Risk of days 31-60 (0-100)", example = "70")
    private int previous;

    @Schema(description = "current - previous", example = "-30")
    private int change;

    @Schema(description = "Trend derived from the change", example = "IMPROVING")
    private RiskTrend trend;
}
