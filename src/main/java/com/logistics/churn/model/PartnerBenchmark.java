package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Windowed behavior metrics of a partner, used as a detection baseline")
public class PartnerBenchmark {

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    private String partnerId;

    @Schema(description = "Orders per day over the last 7 days", example = "0.43")
    private double avgOrdersPerDay7d;

    @Schema(description = "Orders per day over the last 30 days", example = "0.33")
    private double avgOrdersPerDay30d;

    @Schema(description = "Mean days between orders over the last 7 days", example = "1.5")
    private double orderInterval7d;

    @Schema(description = "Mean days between orders over the last 30 days", example = "2.8")
    private double orderInterval30d;

    @Schema(description = "Coefficient of variation of order intervals, 7 days", example = "0.4")
    private double volatility7d;

    @Schema(description = "Coefficient of variation of order intervals, 30 days", example = "0.6")
    private double volatility30d;

    @Schema(description = "Distinct warehouses over the last 7 days", example = "1")
    private int warehouseCount7d;

    @Schema(description = "Distinct warehouses over the last 30 days", example = "3")
    private int warehouseCount30d;

    @Schema(description = "Distinct SKUs across all of the partner's orders", example = "12")
    private int skuCount;

    public static PartnerBenchmark empty(String partnerId) {
        return PartnerBenchmark.builder().partnerId(partnerId).build();
    }

    /**
     * Flatten into stored snapshots, one per metric and period.
     */
    public List<Benchmark> toBenchmarks(long updatedAt) {
        List<Benchmark> snapshots = new ArrayList<>();
        snapshots.add(snapshot(BenchmarkMetric.AVG_ORDERS_PER_DAY, BenchmarkPeriod.SEVEN_DAYS, avgOrdersPerDay7d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.AVG_ORDERS_PER_DAY, BenchmarkPeriod.THIRTY_DAYS, avgOrdersPerDay30d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.ORDER_INTERVAL, BenchmarkPeriod.SEVEN_DAYS, orderInterval7d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.ORDER_INTERVAL, BenchmarkPeriod.THIRTY_DAYS, orderInterval30d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.VOLATILITY, BenchmarkPeriod.SEVEN_DAYS, volatility7d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.VOLATILITY, BenchmarkPeriod.THIRTY_DAYS, volatility30d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.WAREHOUSE_COUNT, BenchmarkPeriod.SEVEN_DAYS, warehouseCount7d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.WAREHOUSE_COUNT, BenchmarkPeriod.THIRTY_DAYS, warehouseCount30d, updatedAt));
        snapshots.add(snapshot(BenchmarkMetric.SKU_COUNT, BenchmarkPeriod.ALL, skuCount, updatedAt));
        return snapshots;
    }

    /**
     * Rebuild from stored snapshots. Metrics without a snapshot stay at zero;
     * SKU-level snapshots are ignored.
     */
    public static PartnerBenchmark fromBenchmarks(String partnerId, List<Benchmark> snapshots) {
        PartnerBenchmark benchmark = empty(partnerId);
        for (Benchmark b : snapshots) {
            if (b.getSkuId() != null) continue;
            boolean week = b.getPeriod() == BenchmarkPeriod.SEVEN_DAYS;
            boolean month = b.getPeriod() == BenchmarkPeriod.THIRTY_DAYS;
            switch (b.getMetric()) {
                case AVG_ORDERS_PER_DAY:
                    if (week) benchmark.setAvgOrdersPerDay7d(b.getValue());
                    if (month) benchmark.setAvgOrdersPerDay30d(b.getValue());
                    break;
                case ORDER_INTERVAL:
                    if (week) benchmark.setOrderInterval7d(b.getValue());
                    if (month) benchmark.setOrderInterval30d(b.getValue());
                    break;
                case VOLATILITY:
                    if (week) benchmark.setVolatility7d(b.getValue());
                    if (month) benchmark.setVolatility30d(b.getValue());
                    break;
                case WAREHOUSE_COUNT:
                    if (week) benchmark.setWarehouseCount7d((int) b.getValue());
                    if (month) benchmark.setWarehouseCount30d((int) b.getValue());
                    break;
                case SKU_COUNT:
                    benchmark.setSkuCount((int) b.getValue());
                    break;
                default:
                    break;
            }
        }
        return benchmark;
    }

    private Benchmark snapshot(BenchmarkMetric metric, BenchmarkPeriod period, double value, long updatedAt) {
        return Benchmark.builder()
                .partnerId(partnerId)
                .metric(metric)
                .period(period)
                .value(value)
                .updatedAt(updatedAt)
                .build();
    }
}
