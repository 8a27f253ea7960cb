package com.logistics.churn.model;

public enum EscalationLevel {
    IMMEDIATE,
    URGENT,
    NORMAL,
    LOW;

    public static EscalationLevel fromScore(int priorityScore) {
        if (priorityScore >= 85) return IMMEDIATE;
        if (priorityScore >= 70) return URGENT;
        if (priorityScore >= 50) return NORMAL;
        return LOW;
    }
}
