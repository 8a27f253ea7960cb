package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
@Schema(description = "Anomaly enriched with business context and a comparable priority score")
public class PrioritizedAlert {

    @Schema(description = "Alert identifier, stable across passes for the same signal",
            example = "PARTNER-017:-:order_decline:7d")
    private String id;

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    private String partnerId;

    @Schema(description = "SKU identifier for SKU-scoped alerts", example = "ART-5521")
    private String sku;

    @Schema(description = "Raw anomaly kind", example = "ORDER_DECLINE")
    private AlertType alertType;

    @Schema(description = "Business risk category", example = "REVENUE_DROP")
    private AlertCategory category;

    @Schema(description = "Severity derived from the priority score", example = "HIGH")
    private RiskLevel severity;

    @Schema(description = "Severity assigned at detection, kept next to the scored one", example = "MEDIUM")
    private AlertSeverity rawSeverity;

    @Schema(description = "Priority score (0-100), higher is more urgent", example = "64")
    private int priorityScore;

    @Schema(description = "Human-readable description")
    private String message;

    @Schema(description = "Customer size class of the partner", example = "LARGE")
    private CustomerSize customerSize;

    @Schema(description = "Partner churn risk (0-100)", example = "55")
    private int churnRisk;

    @Schema(description = "Estimated revenue exposed by this anomaly", example = "45000")
    private double revenueAtRisk;

    @Schema(description = "Current value", example = "0.10")
    private String currentValue;

    @Schema(description = "Baseline value", example = "0.33")
    private String benchmarkValue;

    @Schema(description = "Percentage change versus baseline", example = "-70.0")
    private Double percentageChange;

    @Schema(description = "Direction of the change", example = "DOWN")
    private ChangeDirection direction;

    @Schema(description = "Escalation level for the priority score", example = "NORMAL")
    private EscalationLevel escalationLevel;

    @Schema(description = "Recommended response time in hours", example = "2")
    private int responseTimeHours;

    @Schema(description = "When the alert was first detected")
    private LocalDateTime detectedAt;

    @Schema(description = "When the alert was last recomputed")
    private LocalDateTime lastUpdated;

    @Schema(description = "Whether the signal was not known before this pass", example = "true")
    private boolean isNew;
}
