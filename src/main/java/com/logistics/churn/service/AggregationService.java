package com.logistics.churn.service;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.config.MetricsConfig;
import com.logistics.churn.engine.ChurnRiskHeuristic;
import com.logistics.churn.engine.DatedOrder;
import com.logistics.churn.engine.OrderDates;
import com.logistics.churn.engine.OrderNormalizer;
import com.logistics.churn.engine.StatsMath;
import com.logistics.churn.model.AlertScope;
import com.logistics.churn.model.AlertSeverity;
import com.logistics.churn.model.DirectionStats;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerEnrichment;
import com.logistics.churn.model.PartnerStats;
import com.logistics.churn.model.SkuStats;
import com.logistics.churn.model.StatsAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns order records into per-partner, per-SKU and per-direction statistics.
 *
 * Partners are keyed by (partner, direction) and SKUs by (SKU, partner, direction); a
 * partner shipping in two directions yields two stats objects. Outputs are sorted by
 * total orders, descending, ties keeping first-seen order.
 */
@Service
public class AggregationService {

    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    static final String ALL_DIRECTIONS = "all";

    private final OrderNormalizer normalizer;
    private final ChurnRiskHeuristic churnRiskHeuristic;
    private final EnrichmentService enrichmentService;
    private final AnalyticsConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AggregationService(OrderNormalizer normalizer,
                              ChurnRiskHeuristic churnRiskHeuristic,
                              EnrichmentService enrichmentService,
                              AnalyticsConfig config,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.normalizer = normalizer;
        this.churnRiskHeuristic = churnRiskHeuristic;
        this.enrichmentService = enrichmentService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public List<PartnerStats> calculatePartnerStats(List<OrderRecord> records) {
        return calculatePartnerStats(records, LocalDateTime.now(clock));
    }

    public List<PartnerStats> calculatePartnerStats(List<OrderRecord> records, LocalDateTime now) {
        long start = System.nanoTime();
        List<DatedOrder> orders = normalizer.normalize(records);

        Map<String, List<DatedOrder>> byPartner = new LinkedHashMap<>();
        Map<String, List<DatedOrder>> byPartnerDirection = new LinkedHashMap<>();
        for (DatedOrder order : orders) {
            byPartner.computeIfAbsent(order.partner(), k -> new ArrayList<>()).add(order);
            byPartnerDirection.computeIfAbsent(order.partner() + "_" + order.direction(), k -> new ArrayList<>())
                    .add(order);
        }

        // Channel mix scores describe the whole partner, across its directions
        Map<String, PartnerEnrichment> profiles = new LinkedHashMap<>();
        byPartner.forEach((partner, partnerOrders) ->
                profiles.put(partner, enrichmentService.profile(partnerOrders, now)));

        List<PartnerStats> stats = new ArrayList<>(byPartnerDirection.size());
        for (List<DatedOrder> group : byPartnerDirection.values()) {
            DatedOrder first = group.get(0);
            stats.add(buildPartnerStats(first.partner(), first.direction(), group,
                    profiles.get(first.partner()), now));
        }
        stats.sort(Comparator.comparingInt(PartnerStats::getTotalOrders).reversed());

        metricsConfig.recordPass("partner_stats", System.nanoTime() - start);
        log.info("Partner stats computed: records={}, partners={}, groups={}",
                records.size(), byPartner.size(), stats.size());
        return stats;
    }

    /**
     * Stats of a single partner across all its directions. A partner without qualifying
     * records gets {@link PartnerStats#empty}.
     */
    public PartnerStats calculatePartnerStats(List<OrderRecord> records, String partnerId, LocalDateTime now) {
        List<DatedOrder> partnerOrders = new ArrayList<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            if (order.partner().equals(partnerId)) {
                partnerOrders.add(order);
            }
        }
        if (partnerOrders.isEmpty()) {
            return PartnerStats.empty(partnerId, ALL_DIRECTIONS);
        }
        long directions = partnerOrders.stream().map(DatedOrder::direction).distinct().count();
        String direction = directions == 1 ? partnerOrders.get(0).direction() : ALL_DIRECTIONS;
        return buildPartnerStats(partnerId, direction, partnerOrders,
                enrichmentService.profile(partnerOrders, now), now);
    }

    public List<SkuStats> calculateSkuStats(List<OrderRecord> records) {
        return calculateSkuStats(records, LocalDateTime.now(clock));
    }

    public List<SkuStats> calculateSkuStats(List<OrderRecord> records, LocalDateTime now) {
        Map<String, List<DatedOrder>> bySku = new LinkedHashMap<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            if (order.sku() == null || order.sku().isBlank()) continue;
            String key = order.sku() + "_" + order.partner() + "_" + order.direction();
            bySku.computeIfAbsent(key, k -> new ArrayList<>()).add(order);
        }

        AnalyticsConfig.SkuHealth health = config.getSkuHealth();
        List<SkuStats> stats = new ArrayList<>(bySku.size());
        for (List<DatedOrder> group : bySku.values()) {
            DatedOrder first = group.get(0);
            DailyProfile daily = DailyProfile.of(group);
            long daysSince = OrderDates.daysBetween(daily.lastOrderAt, now);

            SkuStats sku = SkuStats.builder()
                    .sku(first.sku())
                    .partner(first.partner())
                    .direction(first.direction())
                    .totalOrders(group.size())
                    .avgOrdersPerDay(daily.avgOrdersPerDay(group.size()))
                    .medianOrdersPerDay(StatsMath.median(daily.counts()))
                    .orderFrequency(daily.orderFrequency())
                    .firstOrderDate(daily.firstOrderAt.toLocalDate())
                    .lastOrderDate(daily.lastOrderAt.toLocalDate())
                    .daysSinceLastOrder(daysSince)
                    .build();

            if (sku.getAvgOrdersPerDay() < health.getLowFrequencyRate()
                    && sku.getTotalOrders() > health.getLowFrequencyMinOrders()) {
                sku.getAlerts().add(skuAlert(AlertSeverity.LOW,
                        String.format(Locale.ROOT, "Low order frequency (%.2f orders/day)", sku.getAvgOrdersPerDay()),
                        "low_frequency", sku.getAvgOrdersPerDay()));
            }
            if (daysSince > health.getOrderGapDays()) {
                sku.getAlerts().add(skuAlert(AlertSeverity.MEDIUM,
                        String.format(Locale.ROOT, "No orders for %d days", daysSince), "order_gap", daysSince));
            }
            stats.add(sku);
        }
        stats.sort(Comparator.comparingInt(SkuStats::getTotalOrders).reversed());
        return stats;
    }

    public List<DirectionStats> calculateDirectionStats(List<OrderRecord> records) {
        Map<String, List<DatedOrder>> byDirection = new LinkedHashMap<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            byDirection.computeIfAbsent(order.direction(), k -> new ArrayList<>()).add(order);
        }

        List<DirectionStats> stats = new ArrayList<>(byDirection.size());
        byDirection.forEach((direction, group) -> {
            Map<String, Integer> perPartner = new LinkedHashMap<>();
            group.forEach(o -> perPartner.merge(o.partner(), 1, Integer::sum));
            List<Integer> counts = new ArrayList<>(perPartner.values());

            stats.add(DirectionStats.builder()
                    .direction(direction)
                    .totalOrders(group.size())
                    .totalPartners(perPartner.size())
                    .totalSku((int) group.stream().map(DatedOrder::sku).filter(sku -> sku != null && !sku.isBlank()).distinct().count())
                    .avgOrdersPerPartner(StatsMath.mean(counts))
                    .medianOrdersPerPartner(StatsMath.median(counts))
                    .build());
        });
        stats.sort(Comparator.comparingInt(DirectionStats::getTotalOrders).reversed());
        return stats;
    }

    /**
     * Records ordered within the last {@code days} days. {@code null} keeps every record;
     * otherwise records with an unreadable date are dropped.
     */
    public List<OrderRecord> filterByTimeRange(List<OrderRecord> records, Integer days, LocalDateTime now) {
        if (records == null) {
            throw new IllegalArgumentException("Order records must not be null");
        }
        if (days == null) {
            return new ArrayList<>(records);
        }
        if (days < 0) {
            throw new IllegalArgumentException("Time range must not be negative: " + days);
        }
        LocalDateTime cutoff = now.minusDays(days);
        List<OrderRecord> filtered = new ArrayList<>();
        for (OrderRecord record : records) {
            Optional<LocalDateTime> orderedAt = OrderDates.parse(record.getOrderDate());
            if (orderedAt.isPresent() && !orderedAt.get().isBefore(cutoff)) {
                filtered.add(record);
            }
        }
        return filtered;
    }

    /**
     * Records attributed to {@code direction}; {@code "all"} keeps every record.
     */
    public List<OrderRecord> filterByDirection(List<OrderRecord> records, String direction) {
        if (records == null) {
            throw new IllegalArgumentException("Order records must not be null");
        }
        if (direction == null || ALL_DIRECTIONS.equals(direction)) {
            return new ArrayList<>(records);
        }
        List<OrderRecord> filtered = new ArrayList<>();
        for (OrderRecord record : records) {
            if (direction.equals(normalizer.directionOf(record))) {
                filtered.add(record);
            }
        }
        return filtered;
    }

    /**
     * Distinct known directions of the records, sorted.
     */
    public List<String> getDirections(List<OrderRecord> records) {
        TreeSet<String> directions = new TreeSet<>();
        for (OrderRecord record : records) {
            String direction = normalizer.directionOf(record);
            if (!OrderNormalizer.UNKNOWN_DIRECTION.equals(direction)) {
                directions.add(direction);
            }
        }
        return new ArrayList<>(directions);
    }

    private PartnerStats buildPartnerStats(String partner, String direction, List<DatedOrder> group,
                                           PartnerEnrichment profile, LocalDateTime now) {
        DailyProfile daily = DailyProfile.of(group);
        long daysSince = OrderDates.daysBetween(daily.lastOrderAt, now);

        PartnerStats stats = PartnerStats.builder()
                .partner(partner)
                .direction(direction)
                .totalOrders(group.size())
                .uniqueSku((int) group.stream().map(DatedOrder::sku).filter(sku -> sku != null && !sku.isBlank()).distinct().count())
                .uniqueWarehouses((int) group.stream().map(DatedOrder::warehouse).filter(Objects::nonNull).distinct().count())
                .avgOrdersPerDay(daily.avgOrdersPerDay(group.size()))
                .medianOrdersPerDay(StatsMath.median(daily.counts()))
                .orderFrequency(daily.orderFrequency())
                .volatility(StatsMath.coefficientOfVariation(daily.counts()))
                .firstOrderDate(daily.firstOrderAt.toLocalDate())
                .lastOrderDate(daily.lastOrderAt.toLocalDate())
                .daysSinceLastOrder(daysSince)
                .active(daysSince <= config.getActiveDays())
                .concentrationRisk(profile.getConcentrationRisk())
                .diversificationScore(profile.getDiversificationScore())
                .fulfillmentScore(profile.getFulfillmentScore())
                .alerts(new ArrayList<>())
                .build();

        int last30 = 0;
        int prior30 = 0;
        LocalDateTime monthAgo = now.minusDays(30);
        LocalDateTime twoMonthsAgo = now.minusDays(60);
        for (DatedOrder order : group) {
            if (order.isOnOrAfter(monthAgo)) {
                last30++;
            } else if (order.isOnOrAfter(twoMonthsAgo)) {
                prior30++;
            }
        }
        churnRiskHeuristic.apply(stats, last30, prior30);
        return stats;
    }

    private static StatsAlert skuAlert(AlertSeverity severity, String message, String metric, double value) {
        return StatsAlert.builder()
                .scope(AlertScope.SKU)
                .severity(severity)
                .message(message)
                .metric(metric)
                .value(value)
                .build();
    }

    /**
     * Per-day order counts of one group plus its first and last order time.
     */
    private static final class DailyProfile {
        private final TreeMap<LocalDate, Integer> perDay;
        private final LocalDateTime firstOrderAt;
        private final LocalDateTime lastOrderAt;

        private DailyProfile(TreeMap<LocalDate, Integer> perDay, LocalDateTime firstOrderAt, LocalDateTime lastOrderAt) {
            this.perDay = perDay;
            this.firstOrderAt = firstOrderAt;
            this.lastOrderAt = lastOrderAt;
        }

        static DailyProfile of(List<DatedOrder> group) {
            TreeMap<LocalDate, Integer> perDay = new TreeMap<>();
            LocalDateTime first = null;
            LocalDateTime last = null;
            for (DatedOrder order : group) {
                perDay.merge(order.orderDay(), 1, Integer::sum);
                if (first == null || order.orderedAt().isBefore(first)) first = order.orderedAt();
                if (last == null || order.orderedAt().isAfter(last)) last = order.orderedAt();
            }
            return new DailyProfile(perDay, first, last);
        }

        List<Integer> counts() {
            return new ArrayList<>(perDay.values());
        }

        // Elapsed whole days between first and last order, at least 1
        long totalDays() {
            return Math.max(1, OrderDates.daysBetween(firstOrderAt, lastOrderAt));
        }

        double avgOrdersPerDay(int totalOrders) {
            return (double) totalOrders / totalDays();
        }

        // Mean gap between distinct order days; elapsed days with fewer than two days
        double orderFrequency() {
            if (perDay.size() < 2) {
                return totalDays();
            }
            List<Long> gaps = new ArrayList<>(perDay.size() - 1);
            LocalDate previous = null;
            for (LocalDate day : perDay.keySet()) {
                if (previous != null) {
                    gaps.add(OrderDates.daysBetween(previous, day));
                }
                previous = day;
            }
            return StatsMath.mean(gaps);
        }
    }
}
