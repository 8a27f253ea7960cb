package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable once built: groups are published to the partner alert cache and shared
 * between readers.
 */
@Value
@Schema(description = "Alerts sharing a category and severity, ordered by priority")
public class AlertGroup {

    @Schema(description = "Risk category", example = "CHURN_RISK")
    AlertCategory category;

    @Schema(description = "Scored severity", example = "HIGH")
    RiskLevel severity;

    @Schema(description = "Alerts in descending priority order")
    List<PrioritizedAlert> alerts;

    @Schema(description = "Number of alerts in the group", example = "3")
    int count;

    @Schema(description = "Sum of the priority scores of the group", example = "187")
    int totalPriorityScore;

    @Builder
    public AlertGroup(AlertCategory category, RiskLevel severity, List<PrioritizedAlert> alerts,
                      int count, int totalPriorityScore) {
        this.category = category;
        this.severity = severity;
        this.alerts = alerts == null ? List.of() : List.copyOf(alerts);
        this.count = count;
        this.totalPriorityScore = totalPriorityScore;
    }
}
