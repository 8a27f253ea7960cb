package com.logistics.churn.model;

public enum CustomerSize {
    LARGE(20, 0.5),
    MEDIUM(12, 1.0),
    SMALL(5, 2.0);

    // Contribution to the priority score
    private final int priorityWeight;

    // Larger customers get a faster recommended response
    private final double responseTimeMultiplier;

    CustomerSize(int priorityWeight, double responseTimeMultiplier) {
        this.priorityWeight = priorityWeight;
        this.responseTimeMultiplier = responseTimeMultiplier;
    }

    public int getPriorityWeight() {
        return priorityWeight;
    }

    public double getResponseTimeMultiplier() {
        return responseTimeMultiplier;
    }
}
