package com.logistics.churn.engine;

import com.logistics.churn.model.AlertType;
import com.logistics.churn.model.AnomalyAlert;

import java.util.Optional;

/**
 * A partner-level anomaly check. Implementations are Spring components picked up by
 * {@link AnomalyDetector}; {@code @Order} fixes the order their alerts are emitted in.
 */
public interface PartnerCheck {

    /**
     * The alert type this check raises.
     */
    AlertType getAlertType();

    /**
     * Evaluate the partner's windows.
     *
     * @param context windows, baseline and dataset totals for one partner
     * @return the alert, or empty when the behavior is within bounds or the check has no
     *         usable baseline
     */
    Optional<AnomalyAlert> evaluate(DetectionContext context);
}
