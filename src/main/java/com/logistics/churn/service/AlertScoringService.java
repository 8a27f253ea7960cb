package com.logistics.churn.service;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.engine.DatedOrder;
import com.logistics.churn.engine.OrderNormalizer;
import com.logistics.churn.model.AlertCategory;
import com.logistics.churn.model.AlertSeverity;
import com.logistics.churn.model.AnomalyAlert;
import com.logistics.churn.model.CustomerSize;
import com.logistics.churn.model.EscalationLevel;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerScoringProfile;
import com.logistics.churn.model.PartnerStats;
import com.logistics.churn.model.PrioritizedAlert;
import com.logistics.churn.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns raw anomalies into comparable, business-weighted alerts.
 *
 * Priority (0-100) = customer size weight (20/12/5)
 *                  + churnRisk x 0.30
 *                  + anomaly severity value (95/75/50/25) x 0.25
 *                  + min(20, revenueAtRisk / 100000 x 20)
 *                  + 5 for a signal not seen before,
 * rounded and capped at 100. The score then sets the alert's severity, so a statistically
 * HIGH anomaly of a small, healthy partner may present as LOW.
 */
@Service
public class AlertScoringService {

    private static final Logger log = LoggerFactory.getLogger(AlertScoringService.class);

    private final OrderNormalizer normalizer;
    private final AnalyticsConfig config;

    public AlertScoringService(OrderNormalizer normalizer, AnalyticsConfig config) {
        this.normalizer = normalizer;
        this.config = config;
    }

    /**
     * Scoring profile of every partner in the records. The churn risk of a partner is the
     * highest risk among its (partner, direction) stats.
     */
    public Map<String, PartnerScoringProfile> buildProfiles(List<OrderRecord> records,
                                                           List<PartnerStats> partnerStats,
                                                           LocalDateTime now) {
        Map<String, List<DatedOrder>> byPartner = new LinkedHashMap<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            byPartner.computeIfAbsent(order.partner(), k -> new ArrayList<>()).add(order);
        }

        Map<String, Integer> churnRisk = new HashMap<>();
        for (PartnerStats stats : partnerStats) {
            churnRisk.merge(stats.getPartner(), stats.getChurnRisk(), Math::max);
        }

        List<Integer> allCounts = new ArrayList<>(byPartner.size());
        byPartner.values().forEach(orders -> allCounts.add(orders.size()));
        Map<Integer, Double> ranks = percentileRanks(allCounts);

        LocalDateTime cutoff = now.minusDays(30);
        Map<String, PartnerScoringProfile> profiles = new LinkedHashMap<>();
        byPartner.forEach((partnerId, orders) -> {
            int warehouses = (int) orders.stream().map(DatedOrder::warehouse).filter(Objects::nonNull).distinct().count();
            int orders30d = (int) orders.stream().filter(o -> o.isOnOrAfter(cutoff)).count();
            profiles.put(partnerId, PartnerScoringProfile.builder()
                    .partnerId(partnerId)
                    .orderCount(orders.size())
                    .warehouseCount(warehouses)
                    .orders30d(orders30d)
                    .percentile(ranks.get(orders.size()))
                    .customerSize(classifyCustomerSize(orders.size(), warehouses, ranks.get(orders.size())))
                    .churnRisk(churnRisk.getOrDefault(partnerId, 0))
                    .monthlyRevenue(estimateMonthlyRevenue(orders30d))
                    .build());
        });
        return profiles;
    }

    /**
     * Share of partners ranked below this order count. Tied counts share the average of
     * their positions, so equal partners always land in the same size class.
     */
    public double percentileRank(int orderCount, List<Integer> allOrderCounts) {
        return percentileRanks(allOrderCounts).getOrDefault(orderCount, 0.0);
    }

    /**
     * Percentile rank of every distinct order count, from a single sort.
     */
    public Map<Integer, Double> percentileRanks(List<Integer> allOrderCounts) {
        List<Integer> sorted = new ArrayList<>(allOrderCounts);
        Collections.sort(sorted);
        Map<Integer, Double> ranks = new HashMap<>();
        int first = 0;
        while (first < sorted.size()) {
            int value = sorted.get(first);
            int last = first;
            while (last + 1 < sorted.size() && sorted.get(last + 1) == value) {
                last++;
            }
            ranks.put(value, ((first + last) / 2.0) / sorted.size());
            first = last + 1;
        }
        return ranks;
    }

    public CustomerSize classifyCustomerSize(int orderCount, int warehouseCount, List<Integer> allOrderCounts) {
        return classifyCustomerSize(orderCount, warehouseCount, percentileRank(orderCount, allOrderCounts));
    }

    public CustomerSize classifyCustomerSize(int orderCount, int warehouseCount, double percentile) {
        AnalyticsConfig.Scoring s = config.getScoring();
        if (percentile >= s.getLargePercentile()
                || (orderCount >= s.getLargeMinOrders() && warehouseCount >= s.getLargeMinWarehouses())) {
            return CustomerSize.LARGE;
        }
        if (percentile >= s.getMediumPercentile()
                || (orderCount >= s.getMediumMinOrders() && warehouseCount >= s.getMediumMinWarehouses())) {
            return CustomerSize.MEDIUM;
        }
        return CustomerSize.SMALL;
    }

    /**
     * Last-30-day order rate projected over 30 days at the configured average order value.
     */
    public long estimateMonthlyRevenue(int orders30d) {
        double avgOrdersPerDay = orders30d / 30.0;
        return Math.round(avgOrdersPerDay * 30 * config.getAvgOrderValue());
    }

    public double revenueAtRisk(long monthlyRevenue, AlertSeverity severity) {
        return monthlyRevenue * severity.getRevenueExposure();
    }

    public int calculatePriorityScore(CustomerSize customerSize, int churnRisk, int anomalySeverity,
                                      double revenueAtRisk, boolean isNew) {
        AnalyticsConfig.Scoring s = config.getScoring();
        double score = customerSize.getPriorityWeight();
        score += churnRisk * s.getChurnWeight();
        score += anomalySeverity * s.getSeverityWeight();
        score += Math.min(revenueAtRisk / s.getRevenueScale() * s.getRevenueCap(), s.getRevenueCap());
        if (isNew) {
            score += s.getNewAlertBonus();
        }
        return (int) Math.max(0, Math.min(Math.round(score), 100));
    }

    public RiskLevel scoreToSeverity(int priorityScore) {
        return RiskLevel.fromScore(priorityScore);
    }

    /**
     * Severity response hours scaled by customer size: a LARGE partner gets half the time.
     */
    public int recommendedResponseHours(RiskLevel severity, CustomerSize customerSize) {
        return (int) Math.round(severity.getResponseTimeHours() * customerSize.getResponseTimeMultiplier());
    }

    public PrioritizedAlert prioritize(AnomalyAlert alert, PartnerScoringProfile profile,
                                       boolean isNew, LocalDateTime now) {
        PartnerScoringProfile p = profile != null ? profile : PartnerScoringProfile.unknown(alert.getPartnerId());
        double revenueAtRisk = revenueAtRisk(p.getMonthlyRevenue(), alert.getSeverity());
        int priorityScore = calculatePriorityScore(p.getCustomerSize(), p.getChurnRisk(),
                alert.getSeverity().getSeverityValue(), revenueAtRisk, isNew);
        RiskLevel severity = scoreToSeverity(priorityScore);

        return PrioritizedAlert.builder()
                .id(alert.alertKey())
                .partnerId(alert.getPartnerId())
                .sku(alert.getSkuId())
                .alertType(alert.getAlertType())
                .category(AlertCategory.of(alert.getAlertType(), alert.isSkuScoped()))
                .severity(severity)
                .rawSeverity(alert.getSeverity())
                .priorityScore(priorityScore)
                .message(alert.getMessage())
                .customerSize(p.getCustomerSize())
                .churnRisk(p.getChurnRisk())
                .revenueAtRisk(revenueAtRisk)
                .currentValue(alert.getCurrentValue())
                .benchmarkValue(alert.getBenchmarkValue())
                .percentageChange(parsePercentage(alert.getPercentageChange()))
                .direction(alert.getDirection())
                .escalationLevel(EscalationLevel.fromScore(priorityScore))
                .responseTimeHours(recommendedResponseHours(severity, p.getCustomerSize()))
                .detectedAt(now)
                .lastUpdated(now)
                .isNew(isNew)
                .build();
    }

    /**
     * Prioritize a batch. An alert is new when its key is not among {@code knownAlertKeys};
     * with no known keys every alert is new.
     */
    public List<PrioritizedAlert> prioritizeAll(List<AnomalyAlert> alerts,
                                                Map<String, PartnerScoringProfile> profiles,
                                                Set<String> knownAlertKeys,
                                                LocalDateTime now) {
        Set<String> known = knownAlertKeys != null ? knownAlertKeys : new HashSet<>();
        List<PrioritizedAlert> prioritized = new ArrayList<>(alerts.size());
        for (AnomalyAlert alert : alerts) {
            prioritized.add(prioritize(alert, profiles.get(alert.getPartnerId()),
                    !known.contains(alert.alertKey()), now));
        }
        log.debug("Prioritized {} alerts ({} known before)", prioritized.size(), known.size());
        return prioritized;
    }

    private Double parsePercentage(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            log.warn("Unreadable percentage change '{}'", value);
            return null;
        }
    }
}
