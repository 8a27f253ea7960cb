package com.logistics.churn.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Descriptive statistics and value formatting. Degenerate inputs (empty, zero mean)
 * yield 0 rather than NaN or an exception.
 */
public final class StatsMath {

    private StatsMath() {}

    public static double mean(List<? extends Number> values) {
        if (values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (Number v : values) {
            sum += v.doubleValue();
        }
        return sum / values.size();
    }

    public static double populationStdDev(List<? extends Number> values) {
        if (values.isEmpty()) return 0.0;
        double avg = mean(values);
        double squares = 0.0;
        for (Number v : values) {
            double diff = v.doubleValue() - avg;
            squares += diff * diff;
        }
        return Math.sqrt(squares / values.size());
    }

    /**
     * Population standard deviation divided by the mean.
     */
    public static double coefficientOfVariation(List<? extends Number> values) {
        double avg = mean(values);
        if (avg == 0.0) return 0.0;
        return populationStdDev(values) / avg;
    }

    public static double median(List<? extends Number> values) {
        if (values.isEmpty()) return 0.0;
        List<Double> sorted = new ArrayList<>(values.size());
        for (Number v : values) {
            sorted.add(v.doubleValue());
        }
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 0
                ? (sorted.get(mid - 1) + sorted.get(mid)) / 2.0
                : sorted.get(mid);
    }

    /**
     * Relative change of {@code current} versus {@code baseline} in percent.
     * Callers guard against a zero baseline.
     */
    public static double percentChange(double current, double baseline) {
        return (current - baseline) / baseline * 100.0;
    }

    public static String formatRate(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public static String formatPercent(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
