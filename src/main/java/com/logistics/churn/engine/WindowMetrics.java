package com.logistics.churn.engine;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Order metrics of one trailing window: volume, per-day rate, mean interval between
 * consecutive orders and its coefficient of variation, distinct warehouses and SKUs.
 */
@Value
@Builder
public class WindowMetrics {

    int days;
    int orderCount;
    double ratePerDay;
    double meanInterval;
    double intervalVolatility;
    int warehouseCount;
    int skuCount;

    /**
     * Metrics over the orders placed at or after {@code since}.
     */
    public static WindowMetrics since(List<DatedOrder> orders, LocalDateTime since, int days) {
        List<DatedOrder> window = new ArrayList<>();
        for (DatedOrder order : orders) {
            if (order.isOnOrAfter(since)) {
                window.add(order);
            }
        }
        return of(window, days);
    }

    /**
     * Metrics over the orders placed in {@code [from, to)}.
     */
    public static WindowMetrics between(List<DatedOrder> orders, LocalDateTime from, LocalDateTime to, int days) {
        List<DatedOrder> window = new ArrayList<>();
        for (DatedOrder order : orders) {
            if (order.isOnOrAfter(from) && order.orderedAt().isBefore(to)) {
                window.add(order);
            }
        }
        return of(window, days);
    }

    static WindowMetrics of(List<DatedOrder> window, int days) {
        List<Long> intervals = intervals(window);
        return WindowMetrics.builder()
                .days(days)
                .orderCount(window.size())
                .ratePerDay(days > 0 ? (double) window.size() / days : 0.0)
                .meanInterval(StatsMath.mean(intervals))
                .intervalVolatility(StatsMath.coefficientOfVariation(intervals))
                .warehouseCount((int) window.stream().map(DatedOrder::warehouse).filter(Objects::nonNull).distinct().count())
                .skuCount((int) window.stream().map(DatedOrder::sku).filter(Objects::nonNull).distinct().count())
                .build();
    }

    /**
     * Whole days between consecutive orders in time order. Orders on the same day give 0.
     */
    static List<Long> intervals(List<DatedOrder> window) {
        if (window.size() < 2) return List.of();
        List<LocalDateTime> times = new ArrayList<>(window.size());
        for (DatedOrder order : window) {
            times.add(order.orderedAt());
        }
        times.sort(null);
        List<Long> intervals = new ArrayList<>(times.size() - 1);
        for (int i = 1; i < times.size(); i++) {
            intervals.add(OrderDates.daysBetween(times.get(i - 1), times.get(i)));
        }
        return intervals;
    }
}
