package com.logistics.churn.service;

import com.logistics.churn.cache.PartnerAlertCache;
import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.engine.AnomalyDetector;
import com.logistics.churn.engine.ChurnRiskHeuristic;
import com.logistics.churn.engine.OrderNormalizer;
import com.logistics.churn.model.AlertCategory;
import com.logistics.churn.model.AlertGroup;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PrioritizedAlert;
import com.logistics.churn.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.logistics.churn.testutil.TestDataFactory.NOW;
import static com.logistics.churn.testutil.TestDataFactory.createOrdersDaysAgo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PartnerAlertServiceTest {

    private AnomalyDetector detector;
    private PartnerAlertCache cache;
    private PartnerAlertService service;

    @BeforeEach
    void setUp() {
        AnalyticsConfig config = TestDataFactory.createConfig();
        OrderNormalizer normalizer = TestDataFactory.createNormalizer(config);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        detector = spy(TestDataFactory.createDetector(config));
        cache = new PartnerAlertCache(TestDataFactory.createMetrics());
        AggregationService aggregation = new AggregationService(normalizer, new ChurnRiskHeuristic(config),
                new EnrichmentService(normalizer), config, TestDataFactory.createMetrics(), clock);
        service = new PartnerAlertService(detector, aggregation,
                new AlertScoringService(normalizer, config), new AlertGroupingService(), cache, clock);
    }

    @Test
    void getPartnerAlerts_decliningPartner_groupedAllNew() {
        List<AlertGroup> groups = service.getPartnerAlerts(decliningPartner(), "P-1", NOW);

        assertThat(groups).singleElement().satisfies(g -> {
            assertThat(g.getCategory()).isEqualTo(AlertCategory.REVENUE_DROP);
            assertThat(g.getAlerts()).allMatch(PrioritizedAlert::isNew);
        });
        assertThat(service.isProcessing("P-1")).isFalse();
    }

    @Test
    void getPartnerAlerts_partnerAlreadyMarked_leavesOtherComputationsMarker() {
        cache.markInProgress("P-1");

        service.getPartnerAlerts(decliningPartner(), "P-1", NOW);

        assertThat(service.isProcessing("P-1")).isTrue();
        cache.clearInProgress("P-1");
        assertThat(service.isProcessing("P-1")).isFalse();
    }

    @Test
    void getPartnerAlerts_secondCall_servedFromCache() {
        List<OrderRecord> records = decliningPartner();

        List<AlertGroup> first = service.getPartnerAlerts(records, "P-1", NOW);
        List<AlertGroup> second = service.getPartnerAlerts(records, "P-1", NOW);

        assertThat(second).isSameAs(first);
        verify(detector, times(1)).detectPartnerAnomalies(any(), eq("P-1"), any(), any());
    }

    @Test
    void onDatasetReplaced_recomputesFromNewRecords() {
        service.getPartnerAlerts(decliningPartner(), "P-1", NOW);

        service.onDatasetReplaced();
        List<AlertGroup> afterReplace = service.getPartnerAlerts(
                createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 1, 2, 3), "P-1", NOW);

        assertThat(afterReplace).isEmpty();
        assertThat(service.cacheStats().getPartners()).containsExactly("P-1");
    }

    @Test
    void invalidatePartner_onlyThatPartnerDropped() {
        List<OrderRecord> records = new ArrayList<>(decliningPartner());
        records.addAll(createOrdersDaysAgo("P-2", "SKU-2", "WH-2", 1, 2));
        service.getPartnerAlerts(records, "P-1", NOW);
        service.getPartnerAlerts(records, "P-2", NOW);

        service.invalidatePartner("P-1");

        assertThat(service.cacheStats().getPartners()).containsExactly("P-2");
    }

    @Test
    void getPartnerAlertList_flattenedInGroupOrder() {
        List<PrioritizedAlert> flat = service.getPartnerAlertList(decliningPartner(), "P-1", NOW);

        assertThat(flat).singleElement().satisfies(a -> assertThat(a.getPartnerId()).isEqualTo("P-1"));
    }

    @Test
    void getPartnerAlerts_detectorFails_inProgressMarkerCleared() {
        doThrow(new IllegalStateException("boom")).when(detector)
                .detectPartnerAnomalies(any(), eq("P-9"), any(), any());

        assertThatThrownBy(() -> service.getPartnerAlerts(decliningPartner(), "P-9", NOW))
                .isInstanceOf(IllegalStateException.class);

        assertThat(service.isProcessing("P-9")).isFalse();
        assertThat(service.cacheStats().getPartners()).doesNotContain("P-9");
    }

    private static List<OrderRecord> decliningPartner() {
        return createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 31, 34, 37, 40, 43, 46, 49, 52, 55, 58, 1, 3, 5);
    }
}
