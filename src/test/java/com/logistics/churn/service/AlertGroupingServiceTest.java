package com.logistics.churn.service;

import com.logistics.churn.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.logistics.churn.testutil.TestDataFactory.createPrioritizedAlert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertGroupingServiceTest {

    private AlertGroupingService groupingService;

    private List<PrioritizedAlert> alerts;

    @BeforeEach
    void setUp() {
        groupingService = new AlertGroupingService();
        alerts = List.of(
                createPrioritizedAlert("a", AlertCategory.REVENUE_DROP, RiskLevel.HIGH, 62, CustomerSize.MEDIUM, true),
                createPrioritizedAlert("b", AlertCategory.CHURN_RISK, RiskLevel.CRITICAL, 85, CustomerSize.LARGE, false),
                createPrioritizedAlert("c", AlertCategory.REVENUE_DROP, RiskLevel.HIGH, 70, CustomerSize.LARGE, true),
                createPrioritizedAlert("d", AlertCategory.SKU_ANOMALY, RiskLevel.LOW, 20, CustomerSize.SMALL, true),
                createPrioritizedAlert("e", AlertCategory.VOLATILITY, RiskLevel.HIGH, 61, CustomerSize.SMALL, false));
    }

    @Test
    void groupAndPrioritizeAlerts_severityThenWeightThenCategory() {
        List<AlertGroup> groups = groupingService.groupAndPrioritizeAlerts(alerts);

        assertThat(groups).extracting(AlertGroup::getCategory).containsExactly(
                AlertCategory.CHURN_RISK, AlertCategory.REVENUE_DROP, AlertCategory.VOLATILITY, AlertCategory.SKU_ANOMALY);
        AlertGroup revenue = groups.get(1);
        assertThat(revenue.getCount()).isEqualTo(2);
        assertThat(revenue.getTotalPriorityScore()).isEqualTo(132);
        assertThat(revenue.getAlerts()).extracting(PrioritizedAlert::getId).containsExactly("c", "a");
    }

    @Test
    void groupAndPrioritizeAlerts_equalWeight_categoryOrderBreaksTie() {
        List<PrioritizedAlert> tied = List.of(
                createPrioritizedAlert("x", AlertCategory.CONCENTRATION, RiskLevel.MEDIUM, 45, CustomerSize.SMALL, true),
                createPrioritizedAlert("y", AlertCategory.CHURN_RISK, RiskLevel.MEDIUM, 45, CustomerSize.SMALL, true));

        List<AlertGroup> groups = groupingService.groupAndPrioritizeAlerts(tied);

        assertThat(groups).extracting(AlertGroup::getCategory)
                .containsExactly(AlertCategory.CHURN_RISK, AlertCategory.CONCENTRATION);
    }

    @Test
    void groupAndPrioritizeAlerts_repeated_sameOrder() {
        List<PrioritizedAlert> first = groupingService.flatten(groupingService.groupAndPrioritizeAlerts(alerts));
        List<PrioritizedAlert> second = groupingService.flatten(groupingService.groupAndPrioritizeAlerts(alerts));

        assertThat(second).extracting(PrioritizedAlert::getId)
                .containsExactlyElementsOf(first.stream().map(PrioritizedAlert::getId).toList());
    }

    @Test
    void flatten_preservesGroupOrder() {
        List<PrioritizedAlert> flat = groupingService.flatten(groupingService.groupAndPrioritizeAlerts(alerts));

        assertThat(flat).extracting(PrioritizedAlert::getId).containsExactly("b", "c", "a", "e", "d");
    }

    @Test
    void filterAlerts_combinedCriteria() {
        AlertFilter filter = AlertFilter.builder()
                .severities(Set.of(RiskLevel.HIGH, RiskLevel.CRITICAL))
                .minPriorityScore(62)
                .isNew(true)
                .build();

        assertThat(groupingService.filterAlerts(alerts, filter))
                .extracting(PrioritizedAlert::getId).containsExactly("a", "c");
        assertThat(groupingService.filterAlerts(alerts, null)).hasSize(5);
        assertThat(groupingService.filterAlerts(alerts, AlertFilter.builder()
                .customerSizes(Set.of(CustomerSize.SMALL)).build()))
                .extracting(PrioritizedAlert::getId).containsExactly("d", "e");
    }

    @Test
    void topCriticalAlerts_highAndCriticalByPriority() {
        assertThat(groupingService.topCriticalAlerts(alerts, 2))
                .extracting(PrioritizedAlert::getId).containsExactly("b", "c");
        assertThat(groupingService.topCriticalAlerts(alerts, 10)).hasSize(4);
        assertThat(groupingService.topCriticalAlerts(alerts, 0)).isEmpty();
        assertThatThrownBy(() -> groupingService.topCriticalAlerts(alerts, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calculateAlertStats_countsAndRoundedAverage() {
        AlertStats stats = groupingService.calculateAlertStats(alerts);

        assertThat(stats.getTotal()).isEqualTo(5);
        assertThat(stats.getBySeverity()).containsEntry(RiskLevel.HIGH, 3)
                .containsEntry(RiskLevel.CRITICAL, 1)
                .containsEntry(RiskLevel.MEDIUM, 0);
        assertThat(stats.getByCustomerSize()).containsEntry(CustomerSize.LARGE, 2);
        assertThat(stats.getByCategory()).containsEntry(AlertCategory.REVENUE_DROP, 2)
                .containsEntry(AlertCategory.CONCENTRATION, 0);
        // (62 + 85 + 70 + 20 + 61) / 5 = 59.6
        assertThat(stats.getAvgPriorityScore()).isEqualTo(60);
        assertThat(stats.getNewAlerts()).isEqualTo(3);
    }

    @Test
    void calculateAlertStats_empty_zeroes() {
        AlertStats stats = groupingService.calculateAlertStats(List.of());

        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getAvgPriorityScore()).isZero();
        assertThat(stats.getBySeverity()).hasSize(4).allSatisfy((k, v) -> assertThat(v).isZero());
    }
}
