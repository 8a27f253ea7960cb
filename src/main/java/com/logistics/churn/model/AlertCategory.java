package com.logistics.churn.model;

/**
 * Business risk category an alert is grouped under.
 */
public enum AlertCategory {
    CHURN_RISK,
    REVENUE_DROP,
    VOLATILITY,
    WAREHOUSE_ANOMALY,
    SKU_ANOMALY,
    CONCENTRATION;

    /**
     * Map a raw alert type to its category. A decline scoped to a single SKU is an SKU
     * anomaly rather than a partner-level revenue drop.
     */
    public static AlertCategory of(AlertType type, boolean skuScoped) {
        switch (type) {
            case ORDER_DECLINE:
                return skuScoped ? SKU_ANOMALY : REVENUE_DROP;
            case CHURN_RISK:
                return CHURN_RISK;
            case VOLATILITY_SPIKE:
                return VOLATILITY;
            case WAREHOUSE_ANOMALY:
                return WAREHOUSE_ANOMALY;
            case SKU_CHURN:
                return SKU_ANOMALY;
            case CONCENTRATION_RISK:
                return CONCENTRATION;
            default:
                throw new IllegalArgumentException("Unmapped alert type: " + type);
        }
    }
}
