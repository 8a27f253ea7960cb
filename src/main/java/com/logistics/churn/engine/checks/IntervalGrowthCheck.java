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
 * Churn signal: the mean interval between orders of the last 7 days is longer than the
 * 30-day mean interval by more than intervalGrowthPct.
 */
@Component
@Order(30)
public class IntervalGrowthCheck implements PartnerCheck {

    private final AnalyticsConfig config;

    public IntervalGrowthCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.CHURN_RISK;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(DetectionContext context) {
        double baseline = context.baselineInterval();
        double current = context.getWeek().getMeanInterval();
        if (baseline <= 0 || current <= baseline) {
            return Optional.empty();
        }

        double increase = StatsMath.percentChange(current, baseline);
        AnalyticsConfig.Detection t = config.getDetection();
        if (increase <= t.getIntervalGrowthPct()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .alertType(AlertType.CHURN_RISK)
                .severity(increase > t.getIntervalGrowthHighPct() ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .timeframe(Timeframe.SEVEN_DAYS)
                .message(String.format(Locale.ROOT, "Interval between orders grew by %s%%", StatsMath.formatPercent(increase)))
                .benchmarkValue(StatsMath.formatRate(baseline))
                .currentValue(StatsMath.formatRate(current))
                .percentageChange(StatsMath.formatPercent(increase))
                .direction(ChangeDirection.UP)
                .build());
    }
}
