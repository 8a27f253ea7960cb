package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Insert/query shape of the alert store. One stored alert per detected anomaly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Alert as kept by the alert store")
public class StoredAlert {

    @Schema(description = "Store-assigned identifier", example = "3f0c8a52-8a6e-4c36-9a57-0b7a3f1f4d21")
    private String id;

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    private String partnerId;

    @Schema(description = "SKU identifier", example = "ART-5521")
    private String skuId;

    @Schema(description = "Anomaly kind", example = "ORDER_DECLINE")
    private AlertType alertType;

    @Schema(description = "Severity at detection", example = "HIGH")
    private AlertSeverity severity;

    @Schema(description = "Severity derived from the priority score, when scored", example = "MEDIUM")
    private RiskLevel scoredSeverity;

    @Schema(description = "Comparison timeframe", example = "SEVEN_DAYS")
    private Timeframe timeframe;

    @Schema(description = "Human-readable description")
    private String message;

    @Schema(description = "Baseline value", example = "0.33")
    private String benchmarkValue;

    @Schema(description = "Current value", example = "0.10")
    private String currentValue;

    @Schema(description = "Percentage change", example = "-70.0")
    private String percentageChange;

    @Schema(description = "Direction of the change", example = "DOWN")
    private ChangeDirection direction;

    @Schema(description = "Whether an operator resolved the alert", example = "false")
    private boolean resolved;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    @Schema(description = "Last update timestamp in epoch milliseconds", example = "1739886764000")
    private long updatedAt;

    /**
     * Convert a detected anomaly 1:1 into the store's insert shape, unresolved.
     */
    public static StoredAlert fromAnomaly(AnomalyAlert anomaly, long now) {
        return StoredAlert.builder()
                .partnerId(anomaly.getPartnerId())
                .skuId(anomaly.getSkuId())
                .alertType(anomaly.getAlertType())
                .severity(anomaly.getSeverity())
                .timeframe(anomaly.getTimeframe())
                .message(anomaly.getMessage())
                .benchmarkValue(anomaly.getBenchmarkValue())
                .currentValue(anomaly.getCurrentValue())
                .percentageChange(anomaly.getPercentageChange())
                .direction(anomaly.getDirection())
                .resolved(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public String alertKey() {
        return partnerId + ":" + (skuId != null ? skuId : "-") + ":"
                + alertType.getCode() + ":" + timeframe.getCode();
    }
}
