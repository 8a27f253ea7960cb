package com.logistics.churn.model;

public enum BenchmarkMetric {
    AVG_ORDERS_PER_DAY("avg_orders_per_day"),
    ORDER_INTERVAL("order_interval"),
    VOLATILITY("volatility"),
    WAREHOUSE_COUNT("warehouse_count"),
    SKU_COUNT("sku_count"),
    ORDERS_PER_SKU("orders_per_sku");

    private final String code;

    BenchmarkMetric(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static BenchmarkMetric fromCode(String code) {
        for (BenchmarkMetric metric : values()) {
            if (metric.code.equals(code)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown benchmark metric: " + code);
    }
}
