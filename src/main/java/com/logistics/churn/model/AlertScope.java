package com.logistics.churn.model;

public enum AlertScope {
    PARTNER,
    SKU
}
