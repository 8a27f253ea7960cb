package com.logistics.churn.service;

import com.aerospike.client.AerospikeException;
import com.logistics.churn.config.MetricsConfig;
import com.logistics.churn.engine.AnomalyDetector;
import com.logistics.churn.model.AlertGroup;
import com.logistics.churn.model.AlertRunResult;
import com.logistics.churn.model.AnomalyAlert;
import com.logistics.churn.model.Benchmark;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerBenchmark;
import com.logistics.churn.model.PartnerScoringProfile;
import com.logistics.churn.model.PartnerStats;
import com.logistics.churn.model.PrioritizedAlert;
import com.logistics.churn.model.StoredAlert;
import com.logistics.churn.repository.AlertRepository;
import com.logistics.churn.repository.AlertStoreException;
import com.logistics.churn.repository.BenchmarkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batch alert generation: one full pass over the dataset, with stored benchmarks as
 * baselines and the alert store as the record of what was already raised.
 *
 * Pipeline:
 *   1. Aggregate partner stats (churn risk per partner)
 *   2. Detect anomalies for every partner and SKU
 *   3. Score each anomaly against the partner's business profile
 *   4. Group for presentation
 *   5. Persist new alerts and refresh benchmarks (runAndStore only)
 */
@Service
public class AlertGenerationService {

    private static final Logger log = LoggerFactory.getLogger(AlertGenerationService.class);

    private final AggregationService aggregationService;
    private final AnomalyDetector anomalyDetector;
    private final AlertScoringService scoringService;
    private final AlertGroupingService groupingService;
    private final AlertRepository alertRepository;
    private final BenchmarkRepository benchmarkRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertGenerationService(AggregationService aggregationService,
                                  AnomalyDetector anomalyDetector,
                                  AlertScoringService scoringService,
                                  AlertGroupingService groupingService,
                                  AlertRepository alertRepository,
                                  BenchmarkRepository benchmarkRepository,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.aggregationService = aggregationService;
        this.anomalyDetector = anomalyDetector;
        this.scoringService = scoringService;
        this.groupingService = groupingService;
        this.alertRepository = alertRepository;
        this.benchmarkRepository = benchmarkRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public AlertRunResult run(List<OrderRecord> records) {
        return run(records, null, Set.of(), LocalDateTime.now(clock));
    }

    /**
     * Compute alerts without touching the stores.
     *
     * @param historical     stored baselines by partner id, may be null
     * @param knownAlertKeys keys of alerts raised by earlier passes; the rest are new
     */
    public AlertRunResult run(List<OrderRecord> records, Map<String, PartnerBenchmark> historical,
                              Set<String> knownAlertKeys, LocalDateTime now) {
        if (records == null) {
            throw new IllegalArgumentException("Order records must not be null");
        }
        long start = System.nanoTime();

        List<PartnerStats> partnerStats = aggregationService.calculatePartnerStats(records, now);
        List<AnomalyAlert> anomalies = anomalyDetector.generateAllAlerts(records, historical, now);
        Map<String, PartnerScoringProfile> profiles = scoringService.buildProfiles(records, partnerStats, now);
        List<PrioritizedAlert> prioritized = scoringService.prioritizeAll(anomalies, profiles, knownAlertKeys, now);
        List<AlertGroup> groups = groupingService.groupAndPrioritizeAlerts(prioritized);

        metricsConfig.recordPass("alert_generation", System.nanoTime() - start);
        log.info("Alert pass complete: partners={}, anomalies={}, groups={}",
                profiles.size(), anomalies.size(), groups.size());

        return AlertRunResult.builder()
                .evaluatedAt(now)
                .partnerCount(profiles.size())
                .anomalies(anomalies)
                .alerts(prioritized)
                .groups(groups)
                .storedCount(0)
                .build();
    }

    public AlertRunResult runAndStore(List<OrderRecord> records) {
        return runAndStore(records, LocalDateTime.now(clock));
    }

    /**
     * Full pass against the stores: stored benchmarks become baselines, alerts already
     * open in the alert store are not stored again, new alerts are inserted and the
     * benchmarks are refreshed from this pass.
     *
     * @throws AlertStoreException when a store operation fails
     */
    public AlertRunResult runAndStore(List<OrderRecord> records, LocalDateTime now) {
        Map<String, PartnerBenchmark> historical = loadBenchmarks();
        Set<String> known = openAlertKeys();

        AlertRunResult result = run(records, historical, known, now);
        long nowMillis = now.atZone(clock.getZone()).toInstant().toEpochMilli();

        Map<String, PrioritizedAlert> byKey = new HashMap<>();
        for (PrioritizedAlert alert : result.getAlerts()) {
            byKey.put(alert.getId(), alert);
        }

        int stored = 0;
        try {
            for (AnomalyAlert anomaly : result.getAnomalies()) {
                PrioritizedAlert scored = byKey.get(anomaly.alertKey());
                if (scored == null || !scored.isNew()) continue;
                StoredAlert alert = anomalyDetector.toStoredAlert(anomaly, nowMillis);
                alert.setScoredSeverity(scored.getSeverity());
                alertRepository.save(alert);
                stored++;
            }
        } catch (AerospikeException e) {
            log.error("Failed to store alerts after {} writes: {}", stored, e.getMessage(), e);
            throw new AlertStoreException("Failed to store alerts", e);
        }

        refreshBenchmarks(records, now);
        result.setStoredCount(stored);
        log.info("Stored {} new alerts ({} already open)", stored, result.getAlerts().size() - stored);
        return result;
    }

    /**
     * Stored benchmarks grouped into one baseline per partner.
     *
     * @throws AlertStoreException when the benchmark store cannot be read
     */
    public Map<String, PartnerBenchmark> loadBenchmarks() {
        List<Benchmark> snapshots;
        try {
            snapshots = benchmarkRepository.findAll();
        } catch (AerospikeException e) {
            log.error("Failed to load benchmarks: {}", e.getMessage(), e);
            throw new AlertStoreException("Failed to load benchmarks", e);
        }

        Map<String, List<Benchmark>> byPartner = new LinkedHashMap<>();
        for (Benchmark b : snapshots) {
            byPartner.computeIfAbsent(b.getPartnerId(), k -> new ArrayList<>()).add(b);
        }
        Map<String, PartnerBenchmark> baselines = new LinkedHashMap<>();
        byPartner.forEach((partnerId, list) -> baselines.put(partnerId, PartnerBenchmark.fromBenchmarks(partnerId, list)));
        return baselines;
    }

    /**
     * Recompute every partner's windowed metrics and upsert them.
     *
     * @return number of partners written
     */
    public int refreshBenchmarks(List<OrderRecord> records, LocalDateTime now) {
        Map<String, PartnerBenchmark> benchmarks = anomalyDetector.calculatePartnerBenchmarks(records, now);
        long nowMillis = now.atZone(clock.getZone()).toInstant().toEpochMilli();
        try {
            for (PartnerBenchmark benchmark : benchmarks.values()) {
                benchmarkRepository.upsertAll(benchmark.toBenchmarks(nowMillis));
            }
        } catch (AerospikeException e) {
            log.error("Failed to refresh benchmarks: {}", e.getMessage(), e);
            throw new AlertStoreException("Failed to refresh benchmarks", e);
        }
        log.info("Benchmarks refreshed for {} partners", benchmarks.size());
        return benchmarks.size();
    }

    public List<StoredAlert> alertsForPartner(String partnerId) {
        try {
            return alertRepository.findByPartner(partnerId, AlertRepository.DEFAULT_PARTNER_LIMIT);
        } catch (AerospikeException e) {
            throw new AlertStoreException("Failed to read alerts of partner " + partnerId, e);
        }
    }

    public List<StoredAlert> unresolvedAlerts() {
        try {
            return alertRepository.findUnresolved(AlertRepository.DEFAULT_UNRESOLVED_LIMIT);
        } catch (AerospikeException e) {
            throw new AlertStoreException("Failed to read unresolved alerts", e);
        }
    }

    public boolean resolveAlert(String alertId) {
        try {
            return alertRepository.resolve(alertId, clock.millis());
        } catch (AerospikeException e) {
            log.error("Failed to resolve alert {}: {}", alertId, e.getMessage(), e);
            throw new AlertStoreException("Failed to resolve alert " + alertId, e);
        }
    }

    private Set<String> openAlertKeys() {
        Set<String> keys = new HashSet<>();
        try {
            for (StoredAlert alert : alertRepository.findUnresolved(Integer.MAX_VALUE)) {
                keys.add(alert.alertKey());
            }
        } catch (AerospikeException e) {
            log.error("Failed to read open alerts: {}", e.getMessage(), e);
            throw new AlertStoreException("Failed to read open alerts", e);
        }
        return keys;
    }
}
