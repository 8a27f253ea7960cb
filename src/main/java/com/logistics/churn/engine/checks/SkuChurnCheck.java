package com.logistics.churn.engine.checks;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.engine.SkuCheck;
import com.logistics.churn.engine.SkuDetectionContext;
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
 * SKU no longer ordered: MEDIUM once the last order is more than skuChurnDays old,
 * HIGH past skuChurnHighDays.
 */
@Component
@Order(10)
public class SkuChurnCheck implements SkuCheck {

    private final AnalyticsConfig config;

    public SkuChurnCheck(AnalyticsConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.SKU_CHURN;
    }

    @Override
    public Optional<AnomalyAlert> evaluate(SkuDetectionContext context) {
        long days = context.getDaysSinceLastOrder();
        AnalyticsConfig.Detection t = config.getDetection();
        if (days <= t.getSkuChurnDays()) {
            return Optional.empty();
        }

        boolean dropped = days > t.getSkuChurnHighDays();
        return Optional.of(AnomalyAlert.builder()
                .partnerId(context.getPartnerId())
                .skuId(context.getSku())
                .alertType(AlertType.SKU_CHURN)
                .severity(dropped ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .timeframe(Timeframe.THIRTY_DAYS)
                .message(dropped
                        ? String.format(Locale.ROOT, "SKU dropped out: %d days without orders", days)
                        : String.format(Locale.ROOT, "SKU not ordered for %d days", days))
                .currentValue(String.valueOf(days))
                .direction(ChangeDirection.UP)
                .build());
    }
}
