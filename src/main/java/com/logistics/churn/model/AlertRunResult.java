package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of one alert generation pass")
public class AlertRunResult {

    @Schema(description = "Reference time of the pass")
    private LocalDateTime evaluatedAt;

    @Schema(description = "Partners analyzed", example = "57")
    private int partnerCount;

    @Schema(description = "Raw anomalies")
    private List<AnomalyAlert> anomalies;

    @Schema(description = "Anomalies enriched with priority")
    private List<PrioritizedAlert> alerts;

    @Schema(description = "Prioritized alerts grouped for presentation")
    private List<AlertGroup> groups;

    @Schema(description = "Alerts written to the alert store", example = "12")
    private int storedCount;
}
