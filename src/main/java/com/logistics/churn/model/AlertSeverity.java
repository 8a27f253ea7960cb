package com.logistics.churn.model;

/**
 * Statistical severity assigned at detection time.
 *
 * Each level carries the anomaly-severity value used by priority scoring and the share of
 * monthly revenue considered exposed by an anomaly of that level.
 */
public enum AlertSeverity {
    LOW("low", 25, 0.1),
    MEDIUM("medium", 50, 0.1),
    HIGH("high", 75, 0.3),
    CRITICAL("critical", 95, 0.5);

    private final String code;
    private final int severityValue;
    private final double revenueExposure;

    AlertSeverity(String code, int severityValue, double revenueExposure) {
        this.code = code;
        this.severityValue = severityValue;
        this.revenueExposure = revenueExposure;
    }

    public String getCode() {
        return code;
    }

    public int getSeverityValue() {
        return severityValue;
    }

    public double getRevenueExposure() {
        return revenueExposure;
    }

    public static AlertSeverity fromCode(String code) {
        for (AlertSeverity severity : values()) {
            if (severity.code.equals(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: " + code);
    }
}
