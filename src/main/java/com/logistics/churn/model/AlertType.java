package com.logistics.churn.model;

/**
 * Raw anomaly kinds emitted by the detector. The code is the value stored by the alert store.
 */
public enum AlertType {
    ORDER_DECLINE("order_decline"),
    CHURN_RISK("churn_risk"),
    VOLATILITY_SPIKE("volatility_spike"),
    WAREHOUSE_ANOMALY("warehouse_anomaly"),
    SKU_CHURN("sku_churn"),
    CONCENTRATION_RISK("concentration_risk");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AlertType fromCode(String code) {
        for (AlertType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: " + code);
    }
}
