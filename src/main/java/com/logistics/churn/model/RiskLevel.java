package com.logistics.churn.model;

/**
 * Business-impact severity derived from a priority score.
 * Declared in presentation order: CRITICAL ranks first.
 */
public enum RiskLevel {
    CRITICAL(1),
    HIGH(4),
    MEDIUM(24),
    LOW(72);

    private final int responseTimeHours;

    RiskLevel(int responseTimeHours) {
        this.responseTimeHours = responseTimeHours;
    }

    public int getResponseTimeHours() {
        return responseTimeHours;
    }

    public int rank() {
        return ordinal();
    }

    public static RiskLevel fromScore(double score) {
        if (score >= 80) return CRITICAL;
        if (score >= 60) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }
}
