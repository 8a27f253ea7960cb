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
 * Compares the per-day order rate of the last 30 days with the rate of days 31-60.
 * Catches partners that slowed down a month ago, which the 7-day check misses once the
 * 30-day baseline itself has dropped.
 */
@Component
@Order(20)
public class MonthlyOrderDeclineCheck implements PartnerCheck {

    private final AnalyticsConfig config;

    public MonthlyOrderDeclineCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.ORDER_DECLINE;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(DetectionContext context) {
        double prior = context.getPriorMonth().getRatePerDay();
        if (prior <= 0) {
            return Optional.empty();
        }

        double current = context.getMonth().getRatePerDay();
        double change = StatsMath.percentChange(current, prior);
        AnalyticsConfig.Detection t = config.getDetection();
        if (change >= -t.getDeclinePct()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .alertType(AlertType.ORDER_DECLINE)
                .severity(change < -t.getDeclineHighPct() ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .timeframe(Timeframe.THIRTY_DAYS)
                .message(String.format(Locale.ROOT, "Orders fell by %s%% over the last 30 days compared with the 30 days before",
                        StatsMath.formatPercent(Math.abs(change))))
                .benchmarkValue(StatsMath.formatRate(prior))
                .currentValue(StatsMath.formatRate(current))
                .percentageChange(StatsMath.formatPercent(change))
                .direction(ChangeDirection.DOWN)
                .build());
    }
}
