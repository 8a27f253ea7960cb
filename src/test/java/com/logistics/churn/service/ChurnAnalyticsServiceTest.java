package com.logistics.churn.service;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.model.ChurnBaseline;
import com.logistics.churn.model.CustomerSize;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerChurnProfile;
import com.logistics.churn.model.PartnerStats;
import com.logistics.churn.model.RiskTrajectory;
import com.logistics.churn.model.RiskTrend;
import com.logistics.churn.model.SegmentPortrait;
import com.logistics.churn.model.SkuMonthMetrics;
import com.logistics.churn.model.SuccessPatterns;
import com.logistics.churn.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.logistics.churn.testutil.TestDataFactory.NOW;
import static com.logistics.churn.testutil.TestDataFactory.createOrder;
import static com.logistics.churn.testutil.TestDataFactory.createOrdersDaysAgo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ChurnAnalyticsServiceTest {

    private ChurnAnalyticsService churnAnalytics;

    @BeforeEach
    void setUp() {
        AnalyticsConfig config = TestDataFactory.createConfig();
        churnAnalytics = new ChurnAnalyticsService(TestDataFactory.createNormalizer(config), config,
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void getPartnerSegment_weightedOrdersAndWarehouses() {
        assertThat(churnAnalytics.getPartnerSegment(partner("P-1", 40, 1))).isEqualTo(CustomerSize.SMALL);
        assertThat(churnAnalytics.getPartnerSegment(partner("P-2", 100, 2))).isEqualTo(CustomerSize.MEDIUM);
        assertThat(churnAnalytics.getPartnerSegment(partner("P-3", 300, 1))).isEqualTo(CustomerSize.LARGE);
    }

    @Test
    void calculateChurnScore_termsRelativeToBaseline() {
        ChurnBaseline baseline = ChurnBaseline.builder()
                .avgInterval(2.0).avgVolatility(0.5).avgSku(4.0).avgWarehouses(2.0).build();
        PartnerStats stats = partner("P-1", 30, 2);
        stats.setOrderFrequency(4.0);
        stats.setVolatility(0.25);
        stats.setUniqueSku(2);

        // interval capped at 40, volatility 15, SKUs 10, warehouses 0
        assertThat(churnAnalytics.calculateChurnScore(stats, baseline)).isCloseTo(65.0, within(1e-9));
    }

    @Test
    void calculateChurnScore_churnedOrEmptyBaseline() {
        PartnerStats churned = partner("P-1", 30, 2);
        churned.setChurned(true);

        assertThat(churnAnalytics.calculateChurnScore(churned, new ChurnBaseline())).isEqualTo(100.0);
        assertThat(churnAnalytics.calculateChurnScore(partner("P-2", 30, 2), new ChurnBaseline())).isZero();
    }

    @Test
    void calculateBaseline_intervalAndVolatilityFromRetainedPartners() {
        PartnerStats retained = partner("P-1", 30, 1);
        retained.setOrderFrequency(2.0);
        retained.setVolatility(0.4);
        retained.setUniqueSku(4);
        PartnerStats churned = partner("P-2", 5, 1);
        churned.setChurned(true);
        churned.setOrderFrequency(10.0);
        churned.setVolatility(2.0);

        ChurnBaseline baseline = churnAnalytics.calculateBaseline(List.of(retained, churned));

        assertThat(baseline.getAvgInterval()).isEqualTo(2.0);
        assertThat(baseline.getAvgVolatility()).isEqualTo(0.4);
        assertThat(baseline.getAvgSku()).isEqualTo(2.0);
        assertThat(baseline.getAvgWarehouses()).isEqualTo(1.0);

        ChurnBaseline allChurned = churnAnalytics.calculateBaseline(List.of(churned));
        assertThat(allChurned.getAvgInterval()).isEqualTo(1.0);
        assertThat(allChurned.getAvgVolatility()).isEqualTo(0.5);
        assertThat(allChurned.getAvgSku()).isEqualTo(1.0);
    }

    @Test
    void calculateRiskTrajectory_fewerRecentOrders_degrading() {
        List<OrderRecord> records = new ArrayList<>(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 1, 2));
        records.addAll(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 31, 32, 33, 34, 35, 36, 37, 38, 39, 40));

        RiskTrajectory trajectory = churnAnalytics.calculateRiskTrajectory(records, "P-1", NOW);

        assertThat(trajectory.getCurrent()).isEqualTo(90);
        assertThat(trajectory.getPrevious()).isEqualTo(50);
        assertThat(trajectory.getChange()).isEqualTo(40);
        assertThat(trajectory.getTrend()).isEqualTo(RiskTrend.DEGRADING);
    }

    @Test
    void calculateRiskTrajectory_moreRecentOrders_improving() {
        List<OrderRecord> records = new ArrayList<>(
                createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 1, 2, 3, 4, 5, 6, 7, 8, 9, 30));
        records.addAll(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 45, 60));

        RiskTrajectory trajectory = churnAnalytics.calculateRiskTrajectory(records, "P-1", NOW);

        assertThat(trajectory.getCurrent()).isEqualTo(50);
        assertThat(trajectory.getPrevious()).isEqualTo(90);
        assertThat(trajectory.getTrend()).isEqualTo(RiskTrend.IMPROVING);
    }

    @Test
    void calculateRiskTrajectory_changeWithinBandOrNoOrders_stable() {
        List<OrderRecord> records = new ArrayList<>(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 1, 2, 3));
        records.addAll(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 40, 41));

        RiskTrajectory withinBand = churnAnalytics.calculateRiskTrajectory(records, "P-1", NOW);
        RiskTrajectory unknown = churnAnalytics.calculateRiskTrajectory(records, "P-404", NOW);

        assertThat(withinBand.getChange()).isEqualTo(-5);
        assertThat(withinBand.getTrend()).isEqualTo(RiskTrend.STABLE);
        assertThat(unknown.getCurrent()).isEqualTo(100);
        assertThat(unknown.getPrevious()).isEqualTo(100);
        assertThat(unknown.getTrend()).isEqualTo(RiskTrend.STABLE);
    }

    @Test
    void analyzeSuccessPatterns_splitsSuccessfulFromLapsed() {
        PartnerStats strong = healthy("P-1", 50, 5, 1.0, 0.2, 2);
        PartnerStats steady = healthy("P-2", 30, 3, 3.0, 0.4, 1);
        PartnerStats middling = healthy("P-3", 30, 3, 2.0, 0.3, 1);
        middling.setChurnRisk(40);
        PartnerStats lapsed = partner("P-4", 12, 1);
        lapsed.setActive(false);
        lapsed.setOrderFrequency(8.0);
        lapsed.setDaysSinceLastOrder(70);

        SuccessPatterns patterns = churnAnalytics.analyzeSuccessPatterns(List.of(strong, steady, middling, lapsed));

        assertThat(patterns.getSuccessful().getPartnerCount()).isEqualTo(2);
        assertThat(patterns.getSuccessful().getAvgOrderFrequency()).isEqualTo(2.0);
        assertThat(patterns.getSuccessful().getMedianSkuCount()).isEqualTo(4.0);
        assertThat(patterns.getSuccessful().getAvgVolatility()).isCloseTo(0.3, within(1e-9));
        assertThat(patterns.getUnsuccessful().getPartnerCount()).isEqualTo(1);
        assertThat(patterns.getUnsuccessful().getMedianOrderFrequency()).isEqualTo(8.0);
    }

    @Test
    void analyzeSuccessPatterns_noPartners_zeroPatterns() {
        SuccessPatterns patterns = churnAnalytics.analyzeSuccessPatterns(List.of());

        assertThat(patterns.getSuccessful().getPartnerCount()).isZero();
        assertThat(patterns.getUnsuccessful().getAvgOrderFrequency()).isZero();
    }

    @Test
    void generateSegmentPortraits_perDirectionAndSegment() {
        PartnerStats retained = partner("P-1", 10, 1);
        retained.setDirection("A");
        retained.setOrderFrequency(3.0);
        PartnerStats churned = partner("P-2", 20, 1);
        churned.setDirection("A");
        churned.setChurned(true);
        churned.setOrderFrequency(20.0);
        PartnerStats big = partner("P-3", 400, 3);
        big.setDirection("B");

        List<SegmentPortrait> portraits = churnAnalytics.generateSegmentPortraits(
                List.of(retained, churned, big), List.of("A", "B", "C"));

        assertThat(portraits).extracting(SegmentPortrait::getDirection).containsExactly("A", "B");
        SegmentPortrait small = portraits.get(0);
        assertThat(small.getSegment()).isEqualTo(CustomerSize.SMALL);
        assertThat(small.getPartnersCount()).isEqualTo(2);
        assertThat(small.getChurnRate()).isEqualTo(50.0);
        assertThat(small.getAvgOrders()).isEqualTo(15.0);
        assertThat(small.getAvgInterval()).isEqualTo(3.0);
        assertThat(portraits.get(1).getSegment()).isEqualTo(CustomerSize.LARGE);
    }

    @Test
    void calculateSkuMetrics_monthlyAssortment() {
        List<OrderRecord> records = new ArrayList<>();
        records.add(createOrder("P-1", "SKU-1", "WH-1", LocalDateTime.of(2025, 3, 10, 9, 0)));
        records.add(createOrder("P-1", "SKU-2", "WH-1", LocalDateTime.of(2025, 3, 11, 9, 0)));
        for (int day = 1; day <= 3; day++) {
            records.add(createOrder("P-1", "SKU-1", "WH-1", LocalDateTime.of(2025, 4, day, 9, 0)));
        }
        records.add(createOrder("P-2", "SKU-3", "WH-1", LocalDateTime.of(2025, 4, 20, 9, 0)));
        records.add(createOrder("P-1", "SKU-1", "WH-1", LocalDateTime.of(2025, 6, 1, 9, 0)));
        records.add(createOrder("P-2", "SKU-4", "WH-1", LocalDateTime.of(2025, 6, 2, 9, 0)));
        records.add(createOrder("P-2", "", "WH-1", LocalDateTime.of(2025, 6, 3, 9, 0)));

        List<SkuMonthMetrics> metrics = churnAnalytics.calculateSkuMetrics(records, NOW);

        assertThat(metrics).extracting(SkuMonthMetrics::getMonth)
                .containsExactly(YearMonth.of(2025, 3), YearMonth.of(2025, 4), YearMonth.of(2025, 6));

        SkuMonthMetrics march = metrics.get(0);
        assertThat(march.getTotalSku()).isEqualTo(2);
        assertThat(march.getNewSku()).isEqualTo(2);
        assertThat(march.getChurnedSku()).isEqualTo(1);
        assertThat(march.getTopSkuConcentration()).isEqualTo(50.0);

        SkuMonthMetrics april = metrics.get(1);
        assertThat(april.getTotalSku()).isEqualTo(3);
        assertThat(april.getActiveSku()).isEqualTo(2);
        assertThat(april.getNewSku()).isEqualTo(1);
        assertThat(april.getAvgOrdersPerSku()).isEqualTo(2.0);
        assertThat(april.getTopSkuConcentration()).isEqualTo(75.0);

        SkuMonthMetrics june = metrics.get(2);
        assertThat(june.getTotalSku()).isEqualTo(4);
        assertThat(june.getActiveSku()).isEqualTo(2);
        assertThat(june.getChurnedSku()).isEqualTo(1);
    }

    @Test
    void profilePartners_keepsOrderWithTrajectoryAndScore() {
        List<OrderRecord> records = new ArrayList<>(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 1, 2));
        PartnerStats first = partner("P-2", 10, 1);
        first.setChurned(true);
        PartnerStats second = partner("P-1", 2, 1);

        List<PartnerChurnProfile> profiles = churnAnalytics.profilePartners(records, List.of(first, second), NOW);

        assertThat(profiles).extracting(p -> p.getStats().getPartner()).containsExactly("P-2", "P-1");
        assertThat(profiles.get(0).getChurnScore()).isEqualTo(100.0);
        assertThat(profiles.get(0).getTrajectory().getCurrent()).isEqualTo(100);
        assertThat(profiles.get(1).getSegment()).isEqualTo(CustomerSize.SMALL);
        assertThat(profiles.get(1).getTrajectory().getCurrent()).isEqualTo(90);
    }

    private static PartnerStats partner(String id, int orders, int warehouses) {
        return PartnerStats.builder()
                .partner(id)
                .direction("Express/FBS")
                .totalOrders(orders)
                .uniqueWarehouses(warehouses)
                .active(true)
                .build();
    }

    private static PartnerStats healthy(String id, int orders, int skus, double frequency, double volatility,
                                        int warehouses) {
        PartnerStats stats = partner(id, orders, warehouses);
        stats.setUniqueSku(skus);
        stats.setOrderFrequency(frequency);
        stats.setVolatility(volatility);
        stats.setChurnRisk(10);
        return stats;
    }
}
