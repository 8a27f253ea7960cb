package com.logistics.churn.service;

import com.logistics.churn.engine.DatedOrder;
import com.logistics.churn.engine.OrderNormalizer;
import com.logistics.churn.engine.StatsMath;
import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerEnrichment;
import com.logistics.churn.model.ReportDetails;
import com.logistics.churn.model.SkuEnrichment;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Derived partner and SKU profiles: preferences, averages and the concentration,
 * diversification and fulfillment scores shown on partner cards.
 */
@Service
public class EnrichmentService {

    private final OrderNormalizer normalizer;

    public EnrichmentService(OrderNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public PartnerEnrichment enrichPartner(List<OrderRecord> records, String partnerId, LocalDateTime now) {
        List<DatedOrder> partnerOrders = new ArrayList<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            if (order.partner().equals(partnerId)) {
                partnerOrders.add(order);
            }
        }
        return profile(partnerOrders, now);
    }

    /**
     * Partner profile from already normalized orders of that partner.
     *
     * concentrationRisk = mean of the top direction share and the top marketplace share;
     * diversificationScore = 100 - concentrationRisk; fulfillmentScore = mean of weight
     * consistency (100 - 10 x std-dev of order weights, floored at 0) and 50 when the partner
     * ordered in the last 30 days. No orders gives diversification 100 and fulfillment 50.
     */
    public PartnerEnrichment profile(List<DatedOrder> partnerOrders, LocalDateTime now) {
        if (partnerOrders.isEmpty()) {
            return PartnerEnrichment.empty();
        }

        int orderCount = partnerOrders.size();
        int itemsTotal = 0;
        List<Double> weights = new ArrayList<>(orderCount);
        int recent = 0;
        LocalDateTime cutoff = now.minusDays(30);
        for (DatedOrder order : partnerOrders) {
            itemsTotal += order.record().getItemCount();
            weights.add(order.record().getTotalWeight());
            if (order.isOnOrAfter(cutoff)) recent++;
        }
        int uniqueSkus = (int) partnerOrders.stream().map(DatedOrder::sku)
                .filter(s -> s != null && !s.isBlank()).distinct().count();

        Map<String, Integer> directions = countOccurrences(partnerOrders, DatedOrder::direction);
        Map<String, Integer> marketplaces = countOccurrences(partnerOrders,
                o -> o.record().getNormalizedMarketplace());
        Map<String, Integer> warehouses = countOccurrences(partnerOrders, DatedOrder::warehouse);

        double orderFrequency = recent / 30.0;
        double concentration = (topShare(directions, orderCount) + topShare(marketplaces, orderCount)) / 2.0;
        double weightConsistency = Math.max(0.0, 100.0 - StatsMath.populationStdDev(weights) * 10.0);
        double fulfillment = (weightConsistency + (orderFrequency > 0 ? 50.0 : 0.0)) / 2.0;

        return PartnerEnrichment.builder()
                .orderCount(orderCount)
                .itemsTotal(itemsTotal)
                .avgItemsPerOrder(round2((double) itemsTotal / orderCount))
                .avgWeightPerOrder(round2(StatsMath.mean(weights)))
                .uniqueSkus(uniqueSkus)
                .skuPerOrder(round2((double) uniqueSkus / orderCount))
                .directionPreference(topValue(directions))
                .marketplacePreference(topValue(marketplaces))
                .warehousePreference(topValue(warehouses))
                .orderFrequency(round2(orderFrequency))
                .concentrationRisk((int) Math.round(concentration))
                .diversificationScore((int) Math.round(Math.max(0.0, 100.0 - concentration)))
                .fulfillmentScore((int) Math.round(fulfillment))
                .build();
    }

    /**
     * SKU profile over all partners. Report weight and quantity averages only count matched
     * orders with positive values.
     */
    public SkuEnrichment enrichSku(List<OrderRecord> records, String sku) {
        List<DatedOrder> skuOrders = new ArrayList<>();
        for (DatedOrder order : normalizer.normalize(records)) {
            if (sku.equals(order.sku())) {
                skuOrders.add(order);
            }
        }
        if (skuOrders.isEmpty()) {
            return SkuEnrichment.builder()
                    .directionPreference("")
                    .marketplacePreference("")
                    .warehousePreference("")
                    .build();
        }

        List<Double> weights = new ArrayList<>();
        List<Integer> quantities = new ArrayList<>();
        for (DatedOrder order : skuOrders) {
            ReportDetails report = order.record().getReport().orElse(null);
            if (report == null) continue;
            if (report.getWeight() != null && report.getWeight() > 0) weights.add(report.getWeight());
            if (report.getQuantity() != null && report.getQuantity() > 0) quantities.add(report.getQuantity());
        }

        return SkuEnrichment.builder()
                .orderCount(skuOrders.size())
                .partnerCount((int) skuOrders.stream().map(DatedOrder::partner).distinct().count())
                .avgWeight(round2(StatsMath.mean(weights)))
                .avgQty(round2(StatsMath.mean(quantities)))
                .directionPreference(topValue(countOccurrences(skuOrders, DatedOrder::direction)))
                .marketplacePreference(topValue(countOccurrences(skuOrders,
                        o -> o.record().getNormalizedMarketplace())))
                .warehousePreference(topValue(countOccurrences(skuOrders, DatedOrder::warehouse)))
                .build();
    }

    private static Map<String, Integer> countOccurrences(List<DatedOrder> orders, Function<DatedOrder, String> field) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        orders.stream()
                .map(field)
                .filter(Objects::nonNull)
                .filter(v -> !v.isBlank())
                .forEach(v -> counts.merge(v, 1, Integer::sum));
        return counts;
    }

    // Most frequent value; the first seen wins a tie
    private static String topValue(Map<String, Integer> counts) {
        String top = "";
        int best = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                top = e.getKey();
            }
        }
        return top;
    }

    private static double topShare(Map<String, Integer> counts, int total) {
        int max = 0;
        for (int c : counts.values()) {
            max = Math.max(max, c);
        }
        return total > 0 ? max * 100.0 / total : 0.0;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
