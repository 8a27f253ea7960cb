package com.logistics.churn.testutil;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.config.MetricsConfig;
import com.logistics.churn.engine.AnomalyDetector;
import com.logistics.churn.engine.OrderNormalizer;
import com.logistics.churn.engine.checks.ConcentrationCheck;
import com.logistics.churn.engine.checks.IntervalGrowthCheck;
import com.logistics.churn.engine.checks.MonthlyOrderDeclineCheck;
import com.logistics.churn.engine.checks.OrderDeclineCheck;
import com.logistics.churn.engine.checks.SkuChurnCheck;
import com.logistics.churn.engine.checks.SkuDeclineCheck;
import com.logistics.churn.engine.checks.VolatilitySpikeCheck;
import com.logistics.churn.engine.checks.WarehouseDropCheck;
import com.logistics.churn.model.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 15, 12, 0);

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TestDataFactory() {}

    public static OrderRecord createOrder(String partner, String sku, String warehouse, LocalDateTime orderedAt) {
        return OrderRecord.builder()
                .partner(partner)
                .orderNumber("DS-" + orderedAt.hashCode())
                .orderId("ORD-" + partner + "-" + orderedAt)
                .orderType("FBS")
                .itemCount(2)
                .totalWeight(1.5)
                .warehouse(warehouse)
                .status("DELIVERED")
                .orderDate(orderedAt.format(ORDER_DATE))
                .marketplace("Ozon")
                .sku(sku)
                .direction("Express/FBS")
                .normalizedMarketplace("OZON")
                .sourceFile("orders.xlsx")
                .build();
    }

    /**
     * One order per entry of {@code daysAgo}, each placed that many days before {@link #NOW}.
     */
    public static List<OrderRecord> createOrdersDaysAgo(String partner, String sku, String warehouse, int... daysAgo) {
        List<OrderRecord> orders = new ArrayList<>();
        for (int d : daysAgo) {
            orders.add(createOrder(partner, sku, warehouse, NOW.minusDays(d)));
        }
        return orders;
    }

    public static AnalyticsConfig createConfig() {
        return new AnalyticsConfig();
    }

    public static MetricsConfig createMetrics() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    public static OrderNormalizer createNormalizer(AnalyticsConfig config) {
        return new OrderNormalizer(config, createMetrics());
    }

    public static AnomalyDetector createDetector(AnalyticsConfig config) {
        return new AnomalyDetector(createNormalizer(config),
                List.of(new OrderDeclineCheck(config),
                        new MonthlyOrderDeclineCheck(config),
                        new IntervalGrowthCheck(config),
                        new VolatilitySpikeCheck(config),
                        new WarehouseDropCheck(config),
                        new ConcentrationCheck(config)),
                List.of(new SkuChurnCheck(config),
                        new SkuDeclineCheck(config)),
                createMetrics());
    }

    public static AnomalyAlert createAnomaly(String partnerId, String skuId, AlertType type, AlertSeverity severity) {
        return AnomalyAlert.builder()
                .partnerId(partnerId)
                .skuId(skuId)
                .alertType(type)
                .severity(severity)
                .timeframe(Timeframe.SEVEN_DAYS)
                .message("Test anomaly " + type.getCode())
                .benchmarkValue("0.33")
                .currentValue("0.10")
                .percentageChange("-70.0")
                .direction(ChangeDirection.DOWN)
                .build();
    }

    public static PrioritizedAlert createPrioritizedAlert(String id, AlertCategory category, RiskLevel severity,
                                                          int priorityScore, CustomerSize size, boolean isNew) {
        return PrioritizedAlert.builder()
                .id(id)
                .partnerId("P-" + id)
                .alertType(AlertType.ORDER_DECLINE)
                .category(category)
                .severity(severity)
                .rawSeverity(AlertSeverity.MEDIUM)
                .priorityScore(priorityScore)
                .message("Alert " + id)
                .customerSize(size)
                .churnRisk(40)
                .detectedAt(NOW)
                .lastUpdated(NOW)
                .isNew(isNew)
                .build();
    }

    public static PartnerScoringProfile createProfile(String partnerId, CustomerSize size, int churnRisk, long monthlyRevenue) {
        return PartnerScoringProfile.builder()
                .partnerId(partnerId)
                .orderCount(100)
                .warehouseCount(1)
                .orders30d(10)
                .customerSize(size)
                .churnRisk(churnRisk)
                .monthlyRevenue(monthlyRevenue)
                .build();
    }
}
