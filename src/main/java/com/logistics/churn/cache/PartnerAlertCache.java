package com.logistics.churn.cache;

import com.logistics.churn.config.MetricsConfig;
import com.logistics.churn.model.AlertGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-partner memo of grouped alerts, owned by the Spring context.
 *
 * Values are unmodifiable lists built completely before they are published, so readers
 * never see a partial result. Concurrent puts for the same partner: last write wins.
 * In-progress markers are advisory and never block a caller.
 */
@Component
public class PartnerAlertCache {

    private static final Logger log = LoggerFactory.getLogger(PartnerAlertCache.class);

    // partnerId -> grouped alerts
    private final ConcurrentHashMap<String, List<AlertGroup>> entries = new ConcurrentHashMap<>();
    private final Set<String> inProgress = ConcurrentHashMap.newKeySet();
    private final MetricsConfig metricsConfig;

    public PartnerAlertCache(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    public Optional<List<AlertGroup>> get(String partnerId) {
        List<AlertGroup> groups = entries.get(partnerId);
        metricsConfig.recordCacheLookup(groups != null);
        return Optional.ofNullable(groups);
    }

    public List<AlertGroup> put(String partnerId, List<AlertGroup> groups) {
        List<AlertGroup> published = List.copyOf(groups);
        entries.put(partnerId, published);
        metricsConfig.updateCachedPartnerCount(entries.size());
        return published;
    }

    public void invalidate(String partnerId) {
        if (entries.remove(partnerId) != null) {
            log.debug("Invalidated cached alerts of partner {}", partnerId);
        }
        metricsConfig.updateCachedPartnerCount(entries.size());
    }

    public void invalidateAll() {
        int cleared = entries.size();
        entries.clear();
        metricsConfig.updateCachedPartnerCount(0);
        log.info("Partner alert cache cleared: {} entries dropped", cleared);
    }

    /**
     * @return false when the partner was already marked
     */
    public boolean markInProgress(String partnerId) {
        return inProgress.add(partnerId);
    }

    public void clearInProgress(String partnerId) {
        inProgress.remove(partnerId);
    }

    public boolean isInProgress(String partnerId) {
        return inProgress.contains(partnerId);
    }

    public PartnerAlertCacheStats stats() {
        List<String> partners = new ArrayList<>(entries.keySet());
        Collections.sort(partners);
        return PartnerAlertCacheStats.builder()
                .size(partners.size())
                .partners(partners)
                .inProgress(inProgress.size())
                .build();
    }
}
