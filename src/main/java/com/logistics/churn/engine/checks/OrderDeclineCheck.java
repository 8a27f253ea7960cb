package com.logistics.churn.engine.checks;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.engine.DetectionContext;
import com.logistics.churn.engine.PartnerCheck;
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
 * Detects a drop of the last-7-day order rate against the 30-day baseline rate.
 *
 * Baseline: the stored 30-day rate when a historical benchmark exists, else orders of the
 * last 30 days / 30. A change below -declinePct raises the alert; below -declineHighPct it
 * is HIGH.
 */
@Component
@Order(10)
public class OrderDeclineCheck implements PartnerCheck {

    private final AnalyticsConfig config;

    public OrderDeclineCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.ORDER_DECLINE;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(DetectionContext context) {
        double baseline = context.baselineRate();
        if (baseline <= 0) {
            return Optional.empty();
        }

        double current = context.getWeek().getRatePerDay();
        double change = StatsMath.percentChange(current, baseline);
        AnalyticsConfig.Detection t = config.getDetection();
        if (change >= -t.getDeclinePct()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .alertType(AlertType.ORDER_DECLINE)
                .severity(change < -t.getDeclineHighPct() ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .timeframe(Timeframe.SEVEN_DAYS)
                .message(String.format(Locale.ROOT, "Orders fell by %s%% over the last 7 days",
                        StatsMath.formatPercent(Math.abs(change))))
                .benchmarkValue(StatsMath.formatRate(baseline))
                .currentValue(StatsMath.formatRate(current))
                .percentageChange(StatsMath.formatPercent(change))
                .direction(ChangeDirection.DOWN)
                .build());
    }
}
