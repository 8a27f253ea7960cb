package com.logistics.churn.model;

public enum BenchmarkPeriod {
    SEVEN_DAYS("7d"),
    THIRTY_DAYS("30d"),
    NINETY_DAYS("90d"),
    ALL("all");

    private final String code;

    BenchmarkPeriod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static BenchmarkPeriod fromCode(String code) {
        for (BenchmarkPeriod period : values()) {
            if (period.code.equals(code)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown benchmark period: " + code);
    }
}
