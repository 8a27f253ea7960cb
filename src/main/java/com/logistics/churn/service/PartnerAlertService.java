package com.logistics.churn.service;

import com.logistics.churn.cache.PartnerAlertCache;
import com.logistics.churn.cache.PartnerAlertCacheStats;
import com.logistics.churn.engine.AnomalyDetector;
import com.logistics.churn.model.AlertGroup;
import com.logistics.churn.model.AnomalyAlert;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerScoringProfile;
import com.logistics.churn.model.PartnerStats;
import com.logistics.churn.model.PrioritizedAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Interactive view: grouped alerts of one partner, computed on demand by the same engine
 * as the batch pass and memoized until the dataset changes.
 */
@Service
public class PartnerAlertService {

    private static final Logger log = LoggerFactory.getLogger(PartnerAlertService.class);

    private final AnomalyDetector anomalyDetector;
    private final AggregationService aggregationService;
    private final AlertScoringService scoringService;
    private final AlertGroupingService groupingService;
    private final PartnerAlertCache cache;
    private final Clock clock;

    public PartnerAlertService(AnomalyDetector anomalyDetector,
                               AggregationService aggregationService,
                               AlertScoringService scoringService,
                               AlertGroupingService groupingService,
                               PartnerAlertCache cache,
                               Clock clock) {
        this.anomalyDetector = anomalyDetector;
        this.aggregationService = aggregationService;
        this.scoringService = scoringService;
        this.groupingService = groupingService;
        this.cache = cache;
        this.clock = clock;
    }

    public List<AlertGroup> getPartnerAlerts(List<OrderRecord> records, String partnerId) {
        return getPartnerAlerts(records, partnerId, LocalDateTime.now(clock));
    }

    /**
     * Grouped alerts of a partner. Served from the cache when present; otherwise computed
     * against the whole dataset (size class and concentration are relative measures) and
     * cached. Every alert of an uncached computation is new.
     */
    public List<AlertGroup> getPartnerAlerts(List<OrderRecord> records, String partnerId, LocalDateTime now) {
        Optional<List<AlertGroup>> cached = cache.get(partnerId);
        if (cached.isPresent()) {
            return cached.get();
        }

        boolean marked = cache.markInProgress(partnerId);
        if (!marked) {
            log.debug("Alerts of partner {} are already being computed, computing again", partnerId);
        }
        try {
            List<AnomalyAlert> anomalies = new ArrayList<>();
            anomalies.addAll(anomalyDetector.detectPartnerAnomalies(records, partnerId, null, now));
            anomalies.addAll(anomalyDetector.detectSkuAnomalies(records, partnerId, now));

            List<AlertGroup> groups;
            if (anomalies.isEmpty()) {
                groups = List.of();
            } else {
                List<PartnerStats> stats = aggregationService.calculatePartnerStats(records, now);
                Map<String, PartnerScoringProfile> profiles = scoringService.buildProfiles(records, stats, now);
                List<PrioritizedAlert> prioritized = scoringService.prioritizeAll(anomalies, profiles, Set.of(), now);
                groups = groupingService.groupAndPrioritizeAlerts(prioritized);
            }
            log.debug("Computed {} alert groups for partner {}", groups.size(), partnerId);
            return cache.put(partnerId, groups);
        } finally {
            // the marker belongs to the computation that set it
            if (marked) {
                cache.clearInProgress(partnerId);
            }
        }
    }

    public List<PrioritizedAlert> getPartnerAlertList(List<OrderRecord> records, String partnerId, LocalDateTime now) {
        return groupingService.flatten(getPartnerAlerts(records, partnerId, now));
    }

    public boolean isProcessing(String partnerId) {
        return cache.isInProgress(partnerId);
    }

    /**
     * Drop every cached result; call whenever the record collection is replaced.
     */
    public void onDatasetReplaced() {
        cache.invalidateAll();
    }

    public void invalidatePartner(String partnerId) {
        cache.invalidate(partnerId);
    }

    public PartnerAlertCacheStats cacheStats() {
        return cache.stats();
    }
}
