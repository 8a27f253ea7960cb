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
 * Order rhythm became irregular: the coefficient of variation of 7-day order intervals
 * exceeds the 30-day one by more than volatilityIncreasePct.
 */
@Component
@Order(40)
public class VolatilitySpikeCheck implements PartnerCheck {

    private final AnalyticsConfig config;

    public VolatilitySpikeCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.VOLATILITY_SPIKE;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(DetectionContext context) {
        double baseline = context.baselineVolatility();
        if (baseline <= 0) {
            return Optional.empty();
        }

        double current = context.getWeek().getIntervalVolatility();
        double increase = StatsMath.percentChange(current, baseline);
        AnalyticsConfig.Detection t = config.getDetection();
        if (increase <= t.getVolatilityIncreasePct()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .alertType(AlertType.VOLATILITY_SPIKE)
                .severity(increase > t.getVolatilityIncreaseHighPct() ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .timeframe(Timeframe.SEVEN_DAYS)
                .message(String.format(Locale.ROOT, "Order volatility grew by %s%%", StatsMath.formatPercent(increase)))
                .benchmarkValue(StatsMath.formatRate(baseline))
                .currentValue(StatsMath.formatRate(current))
                .percentageChange(StatsMath.formatPercent(increase))
                .direction(ChangeDirection.UP)
                .build());
    }
}
