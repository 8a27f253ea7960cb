package com.logistics.churn;

import com.logistics.churn.config.AerospikeConfig;
import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.config.TestAerospikeConfig;
import com.logistics.churn.engine.PartnerCheck;
import com.logistics.churn.engine.SkuCheck;
import com.logistics.churn.engine.checks.ConcentrationCheck;
import com.logistics.churn.engine.checks.OrderDeclineCheck;
import com.logistics.churn.engine.checks.SkuChurnCheck;
import com.logistics.churn.model.AlertRunResult;
import com.logistics.churn.service.AlertGenerationService;
import com.logistics.churn.service.PartnerAlertService;
import com.logistics.churn.testutil.InMemoryAerospike;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import static com.logistics.churn.testutil.TestDataFactory.NOW;
import static com.logistics.churn.testutil.TestDataFactory.createOrdersDaysAgo;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestAerospikeConfig.class)
class ChurnAnalyticsApplicationTest {

    @Autowired private AnalyticsConfig analyticsConfig;
    @Autowired private List<PartnerCheck> partnerChecks;
    @Autowired private List<SkuCheck> skuChecks;
    @Autowired private AlertGenerationService generationService;
    @Autowired private PartnerAlertService partnerAlertService;
    @Autowired private InMemoryAerospike store;

    @Test
    void contextLoads_configurationBound() {
        assertThat(analyticsConfig.zoneId()).isEqualTo(ZoneId.of("UTC"));
        assertThat(analyticsConfig.getDetection().getDeclinePct()).isEqualTo(30.0);
        assertThat(analyticsConfig.getDirectionOverrides()).containsEntry("VSROK", "VSROK");
    }

    @Test
    void checksRegisteredInOrder() {
        assertThat(partnerChecks).hasSize(6);
        assertThat(partnerChecks.get(0)).isInstanceOf(OrderDeclineCheck.class);
        assertThat(partnerChecks.get(5)).isInstanceOf(ConcentrationCheck.class);
        assertThat(skuChecks).hasSize(2);
        assertThat(skuChecks.get(0)).isInstanceOf(SkuChurnCheck.class);
    }

    @Test
    void alertPass_endToEnd() {
        AlertRunResult result = generationService.run(
                createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 31, 34, 37, 40, 43, 46, 49, 52, 55, 58, 1, 3, 5),
                null, Set.of(), NOW);

        assertThat(result.getAlerts()).hasSize(1);
        assertThat(partnerAlertService.cacheStats().getSize()).isZero();
    }

    @Test
    void alertPassWithStore_writesThroughConfiguredClient() {
        int alertsBefore = store.size(AerospikeConfig.SET_ALERTS);

        AlertRunResult result = generationService.runAndStore(
                createOrdersDaysAgo("P-STORE", "SKU-1", "WH-1", 31, 34, 37, 40, 43, 46, 49, 52, 55, 58, 1, 3, 5),
                NOW);

        assertThat(result.getStoredCount()).isEqualTo(1);
        assertThat(store.size(AerospikeConfig.SET_ALERTS)).isEqualTo(alertsBefore + 1);
        assertThat(store.size(AerospikeConfig.SET_BENCHMARKS)).isPositive();
    }
}
