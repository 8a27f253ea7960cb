package com.logistics.churn.engine;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.model.AlertScope;
import com.logistics.churn.model.AlertSeverity;
import com.logistics.churn.model.PartnerStats;
import com.logistics.churn.model.StatsAlert;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Additive churn risk of a partner.
 *
 * <pre>
 *   +30  orders of the last 30 days fell more than 30% below the 30 days before
 *   +25  days since the last order exceed 1.5 x the usual order interval
 *   +15  fewer than 3 SKUs with more than 10 orders
 *   +10  per-day volatility above 1.5
 *   +40  no order for more than 30 days
 * </pre>
 *
 * The sum is capped at 100. Past the churned threshold (60 days) the partner is churned and
 * the risk is 100. Every satisfied term also attaches a {@link StatsAlert}.
 */
@Component
public class ChurnRiskHeuristic {

    private final AnalyticsConfig config;

    public ChurnRiskHeuristic(AnalyticsConfig config) {
        this.config = config;
    }

    /**
     * Score the partner, setting {@code churnRisk} and {@code churned} and appending the
     * triggered alerts to {@code stats}.
     *
     * @param stats       partner stats with volume, frequency and recency already filled in
     * @param last30Count orders of the last 30 days
     * @param prior30Count orders of days 31-60
     */
    public void apply(PartnerStats stats, int last30Count, int prior30Count) {
        AnalyticsConfig.ChurnRisk c = config.getChurnRisk();
        long daysSince = stats.getDaysSinceLastOrder();
        int risk = 0;

        if (prior30Count > 0) {
            double decline = (prior30Count - last30Count) * 100.0 / prior30Count;
            if (decline > c.getDeclinePct()) {
                stats.getAlerts().add(alert(AlertSeverity.HIGH,
                        String.format(Locale.ROOT, "Orders fell by %.0f%% over the last 30 days", decline),
                        "order_decline", decline, null));
                risk += c.getDeclinePoints();
            }
        }

        double intervalThreshold = stats.getOrderFrequency() * c.getIntervalMultiplier();
        if (daysSince > intervalThreshold) {
            stats.getAlerts().add(alert(AlertSeverity.MEDIUM,
                    String.format(Locale.ROOT, "Days since last order (%d) exceed the usual interval (%.1f days)",
                            daysSince, stats.getOrderFrequency()),
                    "order_interval", daysSince, intervalThreshold));
            risk += c.getIntervalPoints();
        }

        if (stats.getUniqueSku() < c.getMinSkuCount() && stats.getTotalOrders() > c.getSkuMinOrders()) {
            stats.getAlerts().add(alert(AlertSeverity.LOW,
                    String.format(Locale.ROOT, "Few active SKUs (%d)", stats.getUniqueSku()),
                    "sku_count", stats.getUniqueSku(), null));
            risk += c.getSkuPoints();
        }

        if (stats.getVolatility() > c.getVolatilityLimit()) {
            stats.getAlerts().add(alert(AlertSeverity.LOW,
                    String.format(Locale.ROOT, "High order volatility (CV=%.2f)", stats.getVolatility()),
                    "volatility", stats.getVolatility(), null));
            risk += c.getVolatilityPoints();
        }

        if (daysSince > c.getInactivityDays()) {
            stats.getAlerts().add(alert(AlertSeverity.HIGH,
                    String.format(Locale.ROOT, "No orders for %d days", daysSince),
                    "inactivity", daysSince, null));
            risk += c.getInactivityPoints();
        }

        boolean churned = daysSince > config.getChurnedDays();
        stats.setChurned(churned);
        stats.setChurnRisk(churned ? 100 : Math.min(100, risk));
    }

    private static StatsAlert alert(AlertSeverity severity, String message, String metric,
                                    double value, Double threshold) {
        return StatsAlert.builder()
                .scope(AlertScope.PARTNER)
                .severity(severity)
                .message(message)
                .metric(metric)
                .value(value)
                .threshold(threshold)
                .build();
    }
}
