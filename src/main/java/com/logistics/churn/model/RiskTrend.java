package com.logistics.churn.model;

/**
 * Direction of a partner's risk between the previous and the current 30 days.
 */
public enum RiskTrend {
    IMPROVING,
    STABLE,
    DEGRADING
}
