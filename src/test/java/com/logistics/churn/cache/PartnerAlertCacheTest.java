package com.logistics.churn.cache;

import com.logistics.churn.config.MetricsConfig;
import com.logistics.churn.model.AlertCategory;
import com.logistics.churn.model.AlertGroup;
import com.logistics.churn.model.CustomerSize;
import com.logistics.churn.model.PrioritizedAlert;
import com.logistics.churn.model.RiskLevel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.logistics.churn.testutil.TestDataFactory.createPrioritizedAlert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartnerAlertCacheTest {

    private SimpleMeterRegistry registry;
    private PartnerAlertCache cache;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        cache = new PartnerAlertCache(new MetricsConfig(registry));
    }

    @Test
    void get_missThenHit_countedSeparately() {
        assertThat(cache.get("P-1")).isEmpty();
        cache.put("P-1", List.of(group()));

        assertThat(cache.get("P-1")).hasValueSatisfying(groups -> assertThat(groups).hasSize(1));
        assertThat(registry.get("partner_alerts.cache.requests").tag("result", "miss").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("partner_alerts.cache.requests").tag("result", "hit").counter().count()).isEqualTo(1.0);
    }

    @Test
    void put_publishesImmutableSnapshot() {
        List<AlertGroup> source = new ArrayList<>(List.of(group()));

        List<AlertGroup> published = cache.put("P-1", source);
        source.clear();

        assertThat(cache.get("P-1")).hasValueSatisfying(groups -> assertThat(groups).hasSize(1));
        assertThatThrownBy(() -> published.add(group())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void get_returnedGroupsCannotBeChangedByReader() {
        List<PrioritizedAlert> members = new ArrayList<>(List.of(
                createPrioritizedAlert("a", AlertCategory.CHURN_RISK, RiskLevel.HIGH, 70, CustomerSize.LARGE, true)));
        cache.put("P-1", List.of(AlertGroup.builder()
                .category(AlertCategory.CHURN_RISK)
                .severity(RiskLevel.HIGH)
                .alerts(members)
                .count(1)
                .totalPriorityScore(70)
                .build()));
        members.clear();

        AlertGroup read = cache.get("P-1").orElseThrow().get(0);
        assertThatThrownBy(() -> read.getAlerts().clear()).isInstanceOf(UnsupportedOperationException.class);

        AlertGroup again = cache.get("P-1").orElseThrow().get(0);
        assertThat(again.getAlerts()).extracting(PrioritizedAlert::getId).containsExactly("a");
        assertThat(again.getCount()).isEqualTo(1);
        assertThat(again.getSeverity()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void invalidate_singleAndAll() {
        cache.put("P-1", List.of());
        cache.put("P-2", List.of());

        cache.invalidate("P-1");
        assertThat(cache.stats().getPartners()).containsExactly("P-2");
        assertThat(registry.get("partner_alerts.cache.size").gauge().value()).isEqualTo(1.0);

        cache.invalidateAll();
        assertThat(cache.stats().getSize()).isZero();
        assertThat(registry.get("partner_alerts.cache.size").gauge().value()).isZero();
    }

    @Test
    void markInProgress_secondMarkRefusedUntilCleared() {
        assertThat(cache.markInProgress("P-1")).isTrue();
        assertThat(cache.markInProgress("P-1")).isFalse();
        assertThat(cache.isInProgress("P-1")).isTrue();
        assertThat(cache.stats().getInProgress()).isEqualTo(1);

        cache.clearInProgress("P-1");
        assertThat(cache.isInProgress("P-1")).isFalse();
    }

    @Test
    void stats_partnersSorted() {
        cache.put("P-B", List.of());
        cache.put("P-A", List.of());

        assertThat(cache.stats().getPartners()).containsExactly("P-A", "P-B");
    }

    @Test
    void concurrentPuts_allPartnersPresent() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(100);
        for (int i = 0; i < 100; i++) {
            String partner = "P-" + i;
            pool.submit(() -> {
                try {
                    cache.put(partner, List.of(group()));
                    cache.get(partner);
                } finally {
                    done.countDown();
                }
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        assertThat(cache.stats().getSize()).isEqualTo(100);
    }

    private static AlertGroup group() {
        return AlertGroup.builder()
                .category(AlertCategory.CHURN_RISK)
                .severity(RiskLevel.HIGH)
                .alerts(List.of())
                .count(0)
                .build();
    }
}
