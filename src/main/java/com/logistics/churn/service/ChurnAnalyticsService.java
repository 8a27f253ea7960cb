package com.logistics.churn.service;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.engine.DatedOrder;
import com.logistics.churn.engine.OrderNormalizer;
import com.logistics.churn.engine.StatsMath;
import com.logistics.churn.model.ChurnBaseline;
import com.logistics.churn.model.ChurnPattern;
import com.logistics.churn.model.CustomerSize;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerChurnProfile;
import com.logistics.churn.model.PartnerStats;
import com.logistics.churn.model.RiskTrajectory;
import com.logistics.churn.model.RiskTrend;
import com.logistics.churn.model.SegmentPortrait;
import com.logistics.churn.model.SkuMonthMetrics;
import com.logistics.churn.model.SuccessPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Relative churn analytics over partner stats: size segments, a churn score measured against
 * the dataset averages, the 30-day risk trajectory, success patterns, segment portraits and
 * monthly SKU figures.
 */
@Service
public class ChurnAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(ChurnAnalyticsService.class);

    // Segment portrait order
    private static final List<CustomerSize> SEGMENTS =
            List.of(CustomerSize.SMALL, CustomerSize.MEDIUM, CustomerSize.LARGE);

    private final OrderNormalizer normalizer;
    private final AnalyticsConfig config;
    private final Clock clock;

    public ChurnAnalyticsService(OrderNormalizer normalizer, AnalyticsConfig config, Clock clock) {
        this.normalizer = normalizer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Size segment from absolute volume: orders weigh 0.6 and warehouses, scaled by 50,
     * weigh 0.4. Below 50 is SMALL, below 200 MEDIUM.
     */
    public CustomerSize getPartnerSegment(PartnerStats partner) {
        AnalyticsConfig.ChurnProfile c = config.getChurnProfile();
        double score = partner.getTotalOrders() * c.getSegmentOrderWeight()
                + partner.getUniqueWarehouses() * c.getSegmentWarehouseScale() * c.getSegmentWarehouseWeight();
        if (score < c.getSegmentMediumScore()) {
            return CustomerSize.SMALL;
        }
        return score < c.getSegmentLargeScore() ? CustomerSize.MEDIUM : CustomerSize.LARGE;
    }

    /**
     * Averages of a partner population. Interval and volatility come from partners that have
     * not churned (1.0 and 0.5 when there are none); a zero SKU or warehouse mean becomes 1.
     */
    public ChurnBaseline calculateBaseline(List<PartnerStats> partners) {
        List<PartnerStats> retained = partners.stream().filter(p -> !p.isChurned()).collect(Collectors.toList());
        double avgSku = average(partners, PartnerStats::getUniqueSku);
        double avgWarehouses = average(partners, PartnerStats::getUniqueWarehouses);
        return ChurnBaseline.builder()
                .avgInterval(retained.isEmpty() ? 1.0 : average(retained, PartnerStats::getOrderFrequency))
                .avgVolatility(retained.isEmpty() ? 0.5 : average(retained, PartnerStats::getVolatility))
                .avgSku(avgSku > 0 ? avgSku : 1.0)
                .avgWarehouses(avgWarehouses > 0 ? avgWarehouses : 1.0)
                .build();
    }

    /**
     * Churn score in 0-100 relative to {@code baseline}. A churned partner scores 100.
     * <ul>
     *   <li>interval: up to 40, proportional to interval / average interval</li>
     *   <li>volatility: up to 30, proportional to volatility / average volatility</li>
     *   <li>SKUs: 20 minus 20 x (SKUs / average SKUs), floored at 0</li>
     *   <li>warehouses: 10 minus 10 x (warehouses / average warehouses), floored at 0</li>
     * </ul>
     * A term with a non-positive average contributes nothing.
     */
    public double calculateChurnScore(PartnerStats partner, ChurnBaseline baseline) {
        if (partner.isChurned()) {
            return 100.0;
        }
        AnalyticsConfig.ChurnProfile c = config.getChurnProfile();
        double score = 0.0;
        if (baseline.getAvgInterval() > 0) {
            double ratio = partner.getOrderFrequency() / baseline.getAvgInterval();
            score += Math.min(c.getIntervalPoints(), ratio * c.getIntervalPoints());
        }
        if (baseline.getAvgVolatility() > 0) {
            double ratio = partner.getVolatility() / baseline.getAvgVolatility();
            score += Math.min(c.getVolatilityPoints(), ratio * c.getVolatilityPoints());
        }
        if (baseline.getAvgSku() > 0) {
            double ratio = partner.getUniqueSku() / baseline.getAvgSku();
            score += Math.max(0.0, c.getSkuPoints() - ratio * c.getSkuPoints());
        }
        if (baseline.getAvgWarehouses() > 0) {
            double ratio = partner.getUniqueWarehouses() / baseline.getAvgWarehouses();
            score += Math.max(0.0, c.getWarehousePoints() - ratio * c.getWarehousePoints());
        }
        return Math.min(100.0, Math.max(0.0, score));
    }

    public RiskTrajectory calculateRiskTrajectory(List<OrderRecord> records, String partnerId) {
        return calculateRiskTrajectory(records, partnerId, LocalDateTime.now(clock));
    }

    /**
     * Volume risk of the last 30 days against days 31-60: 100 for a period without orders,
     * else 100 - 5 per order, floored at 0. A change beyond 5 points either way is a trend.
     */
    public RiskTrajectory calculateRiskTrajectory(List<OrderRecord> records, String partnerId, LocalDateTime now) {
        List<DatedOrder> partnerOrders = new ArrayList<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            if (order.partner().equals(partnerId)) {
                partnerOrders.add(order);
            }
        }
        return trajectory(partnerOrders, now);
    }

    /**
     * Every partner stat with its segment, churn score against the population's baseline
     * and risk trajectory. Keeps the order of {@code partnerStats}.
     */
    public List<PartnerChurnProfile> profilePartners(List<OrderRecord> records, List<PartnerStats> partnerStats,
                                                     LocalDateTime now) {
        Map<String, List<DatedOrder>> byPartner = new HashMap<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            byPartner.computeIfAbsent(order.partner(), k -> new ArrayList<>()).add(order);
        }

        ChurnBaseline baseline = calculateBaseline(partnerStats);
        List<PartnerChurnProfile> profiles = new ArrayList<>(partnerStats.size());
        for (PartnerStats stats : partnerStats) {
            profiles.add(PartnerChurnProfile.builder()
                    .stats(stats)
                    .segment(getPartnerSegment(stats))
                    .churnScore(calculateChurnScore(stats, baseline))
                    .trajectory(trajectory(byPartner.getOrDefault(stats.getPartner(), List.of()), now))
                    .build());
        }
        log.debug("Profiled {} partners against baseline {}", profiles.size(), baseline);
        return profiles;
    }

    /**
     * Successful partners are active, below 30 churn risk, above 20 orders and on at least
     * 3 SKUs. Unsuccessful partners are inactive, above 60 churn risk or silent for longer
     * than the churn window. A partner may be in neither group.
     */
    public SuccessPatterns analyzeSuccessPatterns(List<PartnerStats> partnerStats) {
        AnalyticsConfig.ChurnProfile c = config.getChurnProfile();
        List<PartnerStats> successful = partnerStats.stream()
                .filter(p -> p.isActive()
                        && p.getChurnRisk() < c.getSuccessMaxChurnRisk()
                        && p.getTotalOrders() > c.getSuccessMinOrders()
                        && p.getUniqueSku() >= c.getSuccessMinSku())
                .collect(Collectors.toList());
        List<PartnerStats> unsuccessful = partnerStats.stream()
                .filter(p -> !p.isActive()
                        || p.getChurnRisk() > c.getUnsuccessfulMinChurnRisk()
                        || p.getDaysSinceLastOrder() > config.getChurnedDays())
                .collect(Collectors.toList());

        return SuccessPatterns.builder()
                .successful(pattern(successful))
                .unsuccessful(pattern(unsuccessful))
                .build();
    }

    /**
     * One portrait per (direction, segment) holding at least one partner, directions in the
     * given order and segments from SMALL to LARGE. Interval, volatility and churn score
     * averages cover partners that have not churned only.
     */
    public List<SegmentPortrait> generateSegmentPortraits(List<PartnerStats> partnerStats, List<String> directions) {
        List<SegmentPortrait> portraits = new ArrayList<>();
        for (String direction : directions) {
            for (CustomerSize segment : SEGMENTS) {
                List<PartnerStats> members = partnerStats.stream()
                        .filter(p -> direction.equals(p.getDirection()) && getPartnerSegment(p) == segment)
                        .collect(Collectors.toList());
                if (members.isEmpty()) continue;

                List<PartnerStats> retained = members.stream().filter(p -> !p.isChurned()).collect(Collectors.toList());
                long churned = members.size() - retained.size();
                ChurnBaseline baseline = calculateBaseline(members);
                double avgChurnScore = retained.stream()
                        .mapToDouble(p -> calculateChurnScore(p, baseline))
                        .average()
                        .orElse(0.0);

                portraits.add(SegmentPortrait.builder()
                        .segment(segment)
                        .direction(direction)
                        .partnersCount(members.size())
                        .churnRate(churned * 100.0 / members.size())
                        .avgOrders(average(members, PartnerStats::getTotalOrders))
                        .avgSku(average(members, PartnerStats::getUniqueSku))
                        .avgWarehouses(average(members, PartnerStats::getUniqueWarehouses))
                        .avgInterval(average(retained, PartnerStats::getOrderFrequency))
                        .avgVolatility(average(retained, PartnerStats::getVolatility))
                        .avgChurnScore(avgChurnScore)
                        .build());
            }
        }
        return portraits;
    }

    public List<SkuMonthMetrics> calculateSkuMetrics(List<OrderRecord> records) {
        return calculateSkuMetrics(records, LocalDateTime.now(clock));
    }

    /**
     * Assortment figures per calendar month, oldest month first. A SKU counts as churned in
     * a month when its last order month is not after that month and lies before the month
     * that was current 60 days ago. Records without a SKU are ignored.
     */
    public List<SkuMonthMetrics> calculateSkuMetrics(List<OrderRecord> records, LocalDateTime now) {
        Map<YearMonth, List<DatedOrder>> byMonth = new TreeMap<>();
        Map<String, YearMonth> firstSeen = new HashMap<>();
        Map<String, YearMonth> lastSeen = new HashMap<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            if (order.sku() == null || order.sku().isBlank()) continue;
            YearMonth month = YearMonth.from(order.orderedAt());
            byMonth.computeIfAbsent(month, k -> new ArrayList<>()).add(order);
            firstSeen.merge(order.sku(), month, (a, b) -> a.isBefore(b) ? a : b);
            lastSeen.merge(order.sku(), month, (a, b) -> a.isAfter(b) ? a : b);
        }

        YearMonth churnCutoff = YearMonth.from(now.minusDays(config.getChurnProfile().getSkuChurnDays()));
        List<SkuMonthMetrics> metrics = new ArrayList<>(byMonth.size());
        byMonth.forEach((month, orders) -> {
            Map<String, Integer> skuOrders = new LinkedHashMap<>();
            for (DatedOrder order : orders) {
                skuOrders.merge(order.sku(), 1, Integer::sum);
            }
            Set<String> active = skuOrders.keySet();

            metrics.add(SkuMonthMetrics.builder()
                    .month(month)
                    .totalSku((int) firstSeen.values().stream().filter(m -> !m.isAfter(month)).count())
                    .activeSku(active.size())
                    .newSku((int) active.stream().filter(sku -> month.equals(firstSeen.get(sku))).count())
                    .churnedSku((int) lastSeen.values().stream()
                            .filter(last -> last.isBefore(churnCutoff) && !last.isAfter(month))
                            .count())
                    .avgOrdersPerSku((double) orders.size() / active.size())
                    .topSkuConcentration(topShare(skuOrders, orders.size()))
                    .build());
        });
        return metrics;
    }

    private RiskTrajectory trajectory(List<DatedOrder> partnerOrders, LocalDateTime now) {
        LocalDateTime monthAgo = now.minusDays(30);
        LocalDateTime twoMonthsAgo = now.minusDays(60);
        int current = 0;
        int previous = 0;
        for (DatedOrder order : partnerOrders) {
            if (order.isOnOrAfter(monthAgo)) {
                current++;
            } else if (order.isOnOrAfter(twoMonthsAgo)) {
                previous++;
            }
        }

        AnalyticsConfig.ChurnProfile c = config.getChurnProfile();
        int currentRisk = volumeRisk(current, c.getTrajectoryPointsPerOrder());
        int previousRisk = volumeRisk(previous, c.getTrajectoryPointsPerOrder());
        int change = currentRisk - previousRisk;
        RiskTrend trend = RiskTrend.STABLE;
        if (change < -c.getTrajectoryStableBand()) {
            trend = RiskTrend.IMPROVING;
        } else if (change > c.getTrajectoryStableBand()) {
            trend = RiskTrend.DEGRADING;
        }
        return RiskTrajectory.builder()
                .current(currentRisk)
                .previous(previousRisk)
                .change(change)
                .trend(trend)
                .build();
    }

    private static int volumeRisk(int orders, int pointsPerOrder) {
        return orders == 0 ? 100 : Math.max(0, 100 - orders * pointsPerOrder);
    }

    // Share of orders held by the top N% of SKUs (at least one SKU), in percent
    private double topShare(Map<String, Integer> skuOrders, int totalOrders) {
        if (totalOrders == 0) return 0.0;
        int top = Math.max(1, (int) Math.ceil(skuOrders.size() * config.getChurnProfile().getTopSkuShare()));
        int topOrders = skuOrders.values().stream()
                .sorted(Comparator.reverseOrder())
                .limit(top)
                .mapToInt(Integer::intValue)
                .sum();
        return topOrders * 100.0 / totalOrders;
    }

    private static ChurnPattern pattern(List<PartnerStats> partners) {
        if (partners.isEmpty()) {
            return ChurnPattern.empty();
        }
        List<Double> frequencies = values(partners, PartnerStats::getOrderFrequency);
        List<Double> skus = values(partners, PartnerStats::getUniqueSku);
        List<Double> warehouses = values(partners, PartnerStats::getUniqueWarehouses);
        List<Double> volatilities = values(partners, PartnerStats::getVolatility);
        return ChurnPattern.builder()
                .partnerCount(partners.size())
                .avgOrderFrequency(StatsMath.mean(frequencies))
                .medianOrderFrequency(StatsMath.median(frequencies))
                .avgSkuCount(StatsMath.mean(skus))
                .medianSkuCount(StatsMath.median(skus))
                .avgWarehouseCount(StatsMath.mean(warehouses))
                .medianWarehouseCount(StatsMath.median(warehouses))
                .avgVolatility(StatsMath.mean(volatilities))
                .medianVolatility(StatsMath.median(volatilities))
                .build();
    }

    private static List<Double> values(List<PartnerStats> partners, ToDoubleFunction<PartnerStats> field) {
        List<Double> values = new ArrayList<>(partners.size());
        for (PartnerStats p : partners) {
            values.add(field.applyAsDouble(p));
        }
        return values;
    }

    private static double average(List<PartnerStats> partners, ToDoubleFunction<PartnerStats> field) {
        return StatsMath.mean(values(partners, field));
    }
}
