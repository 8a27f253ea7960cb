package com.logistics.churn.service;

import com.logistics.churn.model.AlertCategory;
import com.logistics.churn.model.AlertFilter;
import com.logistics.churn.model.AlertGroup;
import com.logistics.churn.model.AlertStats;
import com.logistics.churn.model.CustomerSize;
import com.logistics.churn.model.PrioritizedAlert;
import com.logistics.churn.model.RiskLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Presentation ordering of prioritized alerts: grouping, filtering, top-N and summary
 * counts. Pure functions of their input; sorts are stable.
 */
@Service
public class AlertGroupingService {

    private static final Comparator<PrioritizedAlert> BY_PRIORITY_DESC =
            Comparator.comparingInt(PrioritizedAlert::getPriorityScore).reversed();

    // Severity rank first, then heavier groups, then category declaration order
    private static final Comparator<AlertGroup> GROUP_ORDER =
            Comparator.comparingInt((AlertGroup g) -> g.getSeverity().rank())
                    .thenComparing(Comparator.comparingInt(AlertGroup::getTotalPriorityScore).reversed())
                    .thenComparingInt(g -> g.getCategory().ordinal());

    /**
     * Group by (category, scored severity). Alerts within a group are ordered by
     * descending priority.
     */
    public List<AlertGroup> groupAndPrioritizeAlerts(List<PrioritizedAlert> alerts) {
        Map<String, List<PrioritizedAlert>> grouped = new LinkedHashMap<>();
        for (PrioritizedAlert alert : alerts) {
            grouped.computeIfAbsent(alert.getCategory() + "_" + alert.getSeverity(), k -> new ArrayList<>())
                    .add(alert);
        }

        List<AlertGroup> groups = new ArrayList<>(grouped.size());
        for (List<PrioritizedAlert> members : grouped.values()) {
            List<PrioritizedAlert> sorted = new ArrayList<>(members);
            sorted.sort(BY_PRIORITY_DESC);
            groups.add(AlertGroup.builder()
                    .category(sorted.get(0).getCategory())
                    .severity(sorted.get(0).getSeverity())
                    .alerts(sorted)
                    .count(sorted.size())
                    .totalPriorityScore(sorted.stream().mapToInt(PrioritizedAlert::getPriorityScore).sum())
                    .build());
        }
        groups.sort(GROUP_ORDER);
        return groups;
    }

    public List<PrioritizedAlert> filterAlerts(List<PrioritizedAlert> alerts, AlertFilter filter) {
        AlertFilter f = filter != null ? filter : AlertFilter.none();
        return alerts.stream().filter(f).collect(Collectors.toList());
    }

    /**
     * CRITICAL and HIGH alerts by descending priority, at most {@code limit}.
     */
    public List<PrioritizedAlert> topCriticalAlerts(List<PrioritizedAlert> alerts, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
        return alerts.stream()
                .filter(a -> a.getSeverity() == RiskLevel.CRITICAL || a.getSeverity() == RiskLevel.HIGH)
                .sorted(BY_PRIORITY_DESC)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public AlertStats calculateAlertStats(List<PrioritizedAlert> alerts) {
        Map<RiskLevel, Integer> bySeverity = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) bySeverity.put(level, 0);
        Map<CustomerSize, Integer> bySize = new EnumMap<>(CustomerSize.class);
        for (CustomerSize size : CustomerSize.values()) bySize.put(size, 0);
        Map<AlertCategory, Integer> byCategory = new EnumMap<>(AlertCategory.class);
        for (AlertCategory category : AlertCategory.values()) byCategory.put(category, 0);

        int scoreSum = 0;
        int newAlerts = 0;
        for (PrioritizedAlert alert : alerts) {
            bySeverity.merge(alert.getSeverity(), 1, Integer::sum);
            bySize.merge(alert.getCustomerSize(), 1, Integer::sum);
            byCategory.merge(alert.getCategory(), 1, Integer::sum);
            scoreSum += alert.getPriorityScore();
            if (alert.isNew()) newAlerts++;
        }

        return AlertStats.builder()
                .total(alerts.size())
                .bySeverity(bySeverity)
                .byCustomerSize(bySize)
                .byCategory(byCategory)
                .avgPriorityScore(alerts.isEmpty() ? 0 : Math.round((float) scoreSum / alerts.size()))
                .newAlerts(newAlerts)
                .build();
    }

    public List<PrioritizedAlert> flatten(List<AlertGroup> groups) {
        List<PrioritizedAlert> flat = new ArrayList<>();
        for (AlertGroup group : groups) {
            flat.addAll(group.getAlerts());
        }
        return flat;
    }
}
