package com.logistics.churn.engine;

import com.logistics.churn.model.AlertType;
import com.logistics.churn.model.AnomalyAlert;

import java.util.Optional;

/**
 * An anomaly check scoped to one SKU of one partner.
 */
public interface SkuCheck {

    AlertType getAlertType();

    Optional<AnomalyAlert> evaluate(SkuDetectionContext context);
}
