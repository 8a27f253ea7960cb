package com.logistics.churn.config;

import com.logistics.churn.model.AlertSeverity;
import com.logistics.churn.model.AlertType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger cachedPartnerCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.cachedPartnerCount = registry.gauge("partner_alerts.cache.size", new AtomicInteger(0));
    }

    public void recordAlert(AlertType type, AlertSeverity severity) {
        Counter.builder("alerts.detected.count")
                .tag("alert_type", type.getCode())
                .tag("severity", severity.getCode())
                .register(registry)
                .increment();
    }

    public void recordCheckFailure(String check) {
        Counter.builder("detector.check.failure.count")
                .tag("check", check)
                .register(registry)
                .increment();
    }

    public void recordSkippedRecords(int count) {
        if (count <= 0) return;
        Counter.builder("aggregation.records.skipped")
                .register(registry)
                .increment(count);
    }

    public void recordPass(String pass, long durationNanos) {
        Timer.builder("alerts.pass.duration")
                .tag("pass", pass)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("partner_alerts.cache.requests")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void updateCachedPartnerCount(int count) {
        cachedPartnerCount.set(count);
    }
}
