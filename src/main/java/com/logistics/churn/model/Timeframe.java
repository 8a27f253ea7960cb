package com.logistics.churn.model;

public enum Timeframe {
    SEVEN_DAYS("7d", 7),
    THIRTY_DAYS("30d", 30);

    private final String code;
    private final int days;

    Timeframe(String code, int days) {
        this.code = code;
        this.days = days;
    }

    public String getCode() {
        return code;
    }

    public int getDays() {
        return days;
    }

    public static Timeframe fromCode(String code) {
        for (Timeframe timeframe : values()) {
            if (timeframe.code.equals(code)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + code);
    }
}
