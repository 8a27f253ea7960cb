package com.logistics.churn.engine.checks;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.engine.DetectionContext;
import com.logistics.churn.engine.PartnerCheck;
import com.logistics.churn.model.AlertSeverity;
import com.logistics.churn.model.AlertType;
import com.logistics.churn.model.AnomalyAlert;
import com.logistics.churn.model.ChangeDirection;
import com.logistics.churn.model.Timeframe;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * The partner ships from fewer warehouses than it used to: distinct warehouses of the last
 * 7 days below warehouseDropRatio of the 30-day count. Always MEDIUM.
 */
@Component
@Order(50)
public class WarehouseDropCheck implements PartnerCheck {

    private final AnalyticsConfig config;

    public WarehouseDropCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.WAREHOUSE_ANOMALY;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(DetectionContext context) {
        int baseline = context.baselineWarehouseCount();
        int current = context.getWeek().getWarehouseCount();
        if (baseline <= 0 || current >= baseline * config.getDetection().getWarehouseDropRatio()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .alertType(AlertType.WAREHOUSE_ANOMALY)
                .severity(AlertSeverity.MEDIUM)
                .timeframe(Timeframe.SEVEN_DAYS)
                .message(String.format(Locale.ROOT, "Active warehouses dropped from %d to %d", baseline, current))
                .benchmarkValue(String.valueOf(baseline))
                .currentValue(String.valueOf(current))
                .direction(ChangeDirection.DOWN)
                .build());
    }
}
