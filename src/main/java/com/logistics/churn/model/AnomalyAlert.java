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
@Schema(description = "Raw anomaly signal produced by a detection pass")
public class AnomalyAlert {

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    private String partnerId;

    @Schema(description = "SKU identifier, present for SKU-scoped alerts", example = "ART-5521")
    private String skuId;

    @Schema(description = "Anomaly kind", example = "ORDER_DECLINE")
    private AlertType alertType;

    @Schema(description = "Statistical severity at detection", example = "HIGH")
    private AlertSeverity severity;

    @Schema(description = "Comparison timeframe", example = "SEVEN_DAYS")
    private Timeframe timeframe;

    @Schema(description = "Human-readable description", example = "Orders fell 70.0% over the last 7 days")
    private String message;

    @Schema(description = "Baseline value the current value was compared against", example = "0.33")
    private String benchmarkValue;

    @Schema(description = "Current value", example = "0.10")
    private String currentValue;

    @Schema(description = "Percentage change versus the baseline", example = "-70.0")
    private String percentageChange;

    @Schema(description = "Direction of the change", example = "DOWN")
    private ChangeDirection direction;

    public boolean isSkuScoped() {
        return skuId != null;
    }

    /**
     * Identity of the signal across passes: the same partner, SKU, type and timeframe
     * raise the same key, whatever the measured values.
     */
    public String alertKey() {
        return partnerId + ":" + (skuId != null ? skuId : "-") + ":"
                + alertType.getCode() + ":" + timeframe.getCode();
    }
}
