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
 * Dependency on a single partner: its share of all orders of the last 30 days is above
 * concentrationSharePct. Skipped when the dataset holds fewer than concentrationMinPartners
 * partners, where any partner trivially owns the whole volume.
 */
@Component
@Order(60)
public class ConcentrationCheck implements PartnerCheck {

    private final AnalyticsConfig config;

    public ConcentrationCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.CONCENTRATION_RISK;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(DetectionContext context) {
        AnalyticsConfig.Detection t = config.getDetection();
        if (context.getDatasetPartnerCount() < t.getConcentrationMinPartners()
                || context.getDatasetOrders30d() <= 0) {
            return Optional.empty();
        }

        double share = context.getMonth().getOrderCount() * 100.0 / context.getDatasetOrders30d();
        if (share <= t.getConcentrationSharePct()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .alertType(AlertType.CONCENTRATION_RISK)
                .severity(share > t.getConcentrationHighSharePct() ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .timeframe(Timeframe.THIRTY_DAYS)
                .message(String.format(Locale.ROOT, "Partner accounts for %s%% of all orders of the last 30 days",
                        StatsMath.formatPercent(share)))
                .benchmarkValue(StatsMath.formatPercent(t.getConcentrationSharePct()))
                .currentValue(StatsMath.formatPercent(share))
                .direction(ChangeDirection.UP)
                .build());
    }
}
