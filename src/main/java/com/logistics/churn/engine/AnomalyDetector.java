package com.logistics.churn.engine;

import com.logistics.churn.config.MetricsConfig;
import com.logistics.churn.model.AnomalyAlert;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerBenchmark;
import com.logistics.churn.model.StoredAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Short-window vs long-window anomaly detection over order records.
 *
 * Runs every registered {@link PartnerCheck} per partner and every {@link SkuCheck} per SKU
 * of that partner. All windows of a pass are measured from the single {@code now} handed in,
 * so the same records and {@code now} always produce the same alerts.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final OrderNormalizer normalizer;
    private final List<PartnerCheck> partnerChecks;
    private final List<SkuCheck> skuChecks;
    private final MetricsConfig metricsConfig;

    public AnomalyDetector(OrderNormalizer normalizer,
                           List<PartnerCheck> partnerChecks,
                           List<SkuCheck> skuChecks,
                           MetricsConfig metricsConfig) {
        this.normalizer = normalizer;
        this.partnerChecks = List.copyOf(partnerChecks);
        this.skuChecks = List.copyOf(skuChecks);
        this.metricsConfig = metricsConfig;

        for (PartnerCheck check : this.partnerChecks) {
            log.info("Registered partner check: {} -> {}", check.getAlertType(), check.getClass().getSimpleName());
        }
        for (SkuCheck check : this.skuChecks) {
            log.info("Registered SKU check: {} -> {}", check.getAlertType(), check.getClass().getSimpleName());
        }
    }

    /**
     * Alerts for every partner of the dataset, partners in first-seen order, each partner's
     * own alerts followed by its SKU alerts.
     *
     * @param records    the full order collection
     * @param historical stored baselines keyed by partner id; may be null or partial
     * @param now        reference time of the pass
     */
    public List<AnomalyAlert> generateAllAlerts(List<OrderRecord> records,
                                                Map<String, PartnerBenchmark> historical,
                                                LocalDateTime now) {
        List<DatedOrder> orders = normalizer.normalize(records);
        Map<String, List<DatedOrder>> byPartner = groupByPartner(orders);
        int datasetOrders30d = countSince(orders, now.minusDays(30));

        List<AnomalyAlert> alerts = new ArrayList<>();
        for (Map.Entry<String, List<DatedOrder>> entry : byPartner.entrySet()) {
            String partnerId = entry.getKey();
            PartnerBenchmark baseline = historical != null ? historical.get(partnerId) : null;
            alerts.addAll(runPartnerChecks(partnerId, entry.getValue(), baseline,
                    datasetOrders30d, byPartner.size(), now));
            alerts.addAll(runSkuChecks(partnerId, entry.getValue(), now));
        }

        log.info("Detection pass at {}: partners={}, orders={}, alerts={}",
                now, byPartner.size(), orders.size(), alerts.size());
        return alerts;
    }

    /**
     * Partner-level alerts of one partner. Dataset-wide measures (concentration) still use
     * the whole record collection.
     */
    public List<AnomalyAlert> detectPartnerAnomalies(List<OrderRecord> records, String partnerId,
                                                     Map<String, PartnerBenchmark> historical,
                                                     LocalDateTime now) {
        List<DatedOrder> orders = normalizer.normalize(records);
        Map<String, List<DatedOrder>> byPartner = groupByPartner(orders);
        List<DatedOrder> partnerOrders = byPartner.getOrDefault(partnerId, List.of());
        PartnerBenchmark baseline = historical != null ? historical.get(partnerId) : null;
        return runPartnerChecks(partnerId, partnerOrders, baseline,
                countSince(orders, now.minusDays(30)), byPartner.size(), now);
    }

    public List<AnomalyAlert> detectSkuAnomalies(List<OrderRecord> records, String partnerId, LocalDateTime now) {
        List<DatedOrder> orders = normalizer.normalize(records);
        return runSkuChecks(partnerId, groupByPartner(orders).getOrDefault(partnerId, List.of()), now);
    }

    /**
     * Current windowed metrics of one partner, in the shape kept by the benchmark store.
     */
    public PartnerBenchmark calculatePartnerBenchmark(List<OrderRecord> records, String partnerId, LocalDateTime now) {
        List<DatedOrder> orders = normalizer.normalize(records);
        return benchmarkOf(partnerId, groupByPartner(orders).getOrDefault(partnerId, List.of()), now);
    }

    public Map<String, PartnerBenchmark> calculatePartnerBenchmarks(List<OrderRecord> records, LocalDateTime now) {
        Map<String, PartnerBenchmark> benchmarks = new LinkedHashMap<>();
        groupByPartner(normalizer.normalize(records))
                .forEach((partnerId, orders) -> benchmarks.put(partnerId, benchmarkOf(partnerId, orders, now)));
        return benchmarks;
    }

    public StoredAlert toStoredAlert(AnomalyAlert alert, long nowMillis) {
        return StoredAlert.fromAnomaly(alert, nowMillis);
    }

    private List<AnomalyAlert> runPartnerChecks(String partnerId, List<DatedOrder> orders,
                                                PartnerBenchmark historical, int datasetOrders30d,
                                                int datasetPartnerCount, LocalDateTime now) {
        if (orders.isEmpty()) {
            return Collections.emptyList();
        }

        DetectionContext context = DetectionContext.builder()
                .partnerId(partnerId)
                .now(now)
                .orders(orders)
                .week(WindowMetrics.since(orders, now.minusDays(7), 7))
                .month(WindowMetrics.since(orders, now.minusDays(30), 30))
                .priorMonth(WindowMetrics.between(orders, now.minusDays(60), now.minusDays(30), 30))
                .historical(historical)
                .datasetOrders30d(datasetOrders30d)
                .datasetPartnerCount(datasetPartnerCount)
                .build();

        List<AnomalyAlert> alerts = new ArrayList<>();
        for (PartnerCheck check : partnerChecks) {
            try {
                Optional<AnomalyAlert> alert = check.evaluate(context);
                alert.ifPresent(a -> emit(a, alerts));
            } catch (Exception e) {
                metricsConfig.recordCheckFailure(check.getClass().getSimpleName());
                log.error("Error running {} for partner {}: {}",
                        check.getClass().getSimpleName(), partnerId, e.getMessage(), e);
                // Don't let one bad check block the rest of the pass
            }
        }
        return alerts;
    }

    private List<AnomalyAlert> runSkuChecks(String partnerId, List<DatedOrder> partnerOrders, LocalDateTime now) {
        Map<String, List<DatedOrder>> bySku = new LinkedHashMap<>();
        for (DatedOrder order : partnerOrders) {
            String sku = order.sku();
            if (sku == null || sku.isBlank()) continue;
            bySku.computeIfAbsent(sku, k -> new ArrayList<>()).add(order);
        }

        List<AnomalyAlert> alerts = new ArrayList<>();
        for (Map.Entry<String, List<DatedOrder>> entry : bySku.entrySet()) {
            List<DatedOrder> skuOrders = entry.getValue();
            LocalDateTime lastOrderAt = skuOrders.stream()
                    .map(DatedOrder::orderedAt)
                    .max(LocalDateTime::compareTo)
                    .orElseThrow();

            SkuDetectionContext context = SkuDetectionContext.builder()
                    .partnerId(partnerId)
                    .sku(entry.getKey())
                    .now(now)
                    .orders(skuOrders)
                    .week(WindowMetrics.since(skuOrders, now.minusDays(7), 7))
                    .month(WindowMetrics.since(skuOrders, now.minusDays(30), 30))
                    .lastOrderAt(lastOrderAt)
                    .daysSinceLastOrder(OrderDates.daysBetween(lastOrderAt, now))
                    .build();

            for (SkuCheck check : skuChecks) {
                try {
                    check.evaluate(context).ifPresent(a -> emit(a, alerts));
                } catch (Exception e) {
                    metricsConfig.recordCheckFailure(check.getClass().getSimpleName());
                    log.error("Error running {} for partner {} SKU {}: {}",
                            check.getClass().getSimpleName(), partnerId, entry.getKey(), e.getMessage(), e);
                }
            }
        }
        return alerts;
    }

    private void emit(AnomalyAlert alert, List<AnomalyAlert> alerts) {
        alerts.add(alert);
        metricsConfig.recordAlert(alert.getAlertType(), alert.getSeverity());
        log.debug("Anomaly {} [{}] for partner {}{}: {}",
                alert.getAlertType(), alert.getSeverity(), alert.getPartnerId(),
                alert.getSkuId() != null ? " SKU " + alert.getSkuId() : "", alert.getMessage());
    }

    private PartnerBenchmark benchmarkOf(String partnerId, List<DatedOrder> orders, LocalDateTime now) {
        if (orders.isEmpty()) {
            return PartnerBenchmark.empty(partnerId);
        }
        WindowMetrics week = WindowMetrics.since(orders, now.minusDays(7), 7);
        WindowMetrics month = WindowMetrics.since(orders, now.minusDays(30), 30);
        return PartnerBenchmark.builder()
                .partnerId(partnerId)
                .avgOrdersPerDay7d(week.getRatePerDay())
                .avgOrdersPerDay30d(month.getRatePerDay())
                .orderInterval7d(week.getMeanInterval())
                .orderInterval30d(month.getMeanInterval())
                .volatility7d(week.getIntervalVolatility())
                .volatility30d(month.getIntervalVolatility())
                .warehouseCount7d(week.getWarehouseCount())
                .warehouseCount30d(month.getWarehouseCount())
                .skuCount((int) orders.stream().map(DatedOrder::sku).filter(Objects::nonNull).distinct().count())
                .build();
    }

    static Map<String, List<DatedOrder>> groupByPartner(List<DatedOrder> orders) {
        Map<String, List<DatedOrder>> byPartner = new LinkedHashMap<>();
        for (DatedOrder order : orders) {
            byPartner.computeIfAbsent(order.partner(), k -> new ArrayList<>()).add(order);
        }
        return byPartner;
    }

    private static int countSince(List<DatedOrder> orders, LocalDateTime cutoff) {
        int count = 0;
        for (DatedOrder order : orders) {
            if (order.isOnOrAfter(cutoff)) count++;
        }
        return count;
    }
}
