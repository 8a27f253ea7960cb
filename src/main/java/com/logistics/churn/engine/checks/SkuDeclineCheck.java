package com.logistics.churn.engine.checks;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.engine.SkuCheck;
import com.logistics.churn.engine.SkuDetectionContext;
import com.logistics.churn.engine.StatsMath;
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
 * SKU volume collapse: orders of the last 7 days against orders of the last 30 days.
 * Compares raw counts, so the 7-day window must hold less than half of the 30-day volume.
 */
@Component
@Order(20)
public class SkuDeclineCheck implements SkuCheck {

    private final AnalyticsConfig config;

    public SkuDeclineCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.ORDER_DECLINE;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(SkuDetectionContext context) {
        int baseline = context.getMonth().getOrderCount();
        if (baseline <= 0) {
            return Optional.empty();
        }

        int current = context.getWeek().getOrderCount();
        double change = StatsMath.percentChange(current, baseline);
        if (change >= -config.getDetection().getSkuDeclinePct()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .skuId(context.getSku())
                .alertType(AlertType.ORDER_DECLINE)
                .severity(AlertSeverity.MEDIUM)
                .timeframe(Timeframe.SEVEN_DAYS)
                .message(String.format(Locale.ROOT, "SKU orders fell by %s%%", StatsMath.formatPercent(Math.abs(change))))
                .benchmarkValue(String.valueOf(baseline))
                .currentValue(String.valueOf(current))
                .percentageChange(StatsMath.formatPercent(change))
                .direction(ChangeDirection.DOWN)
                .build());
    }
}
