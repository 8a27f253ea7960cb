package com.logistics.churn.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsConfig {

    // Average order value used by the monthly revenue estimate
    private double avgOrderValue = 5000.0;

    // Partners whose records are always attributed to a fixed direction
    private Map<String, String> directionOverrides = new HashMap<>(Map.of("VSROK", "VSROK"));

    // Zone used to turn the clock into "now"; empty means the system zone
    private String zone = "";

    // A partner is active when its last order is at most this many days old
    private int activeDays = 30;

    // A partner is churned when its last order is older than this
    private int churnedDays = 60;

    private Detection detection = new Detection();

    private ChurnRisk churnRisk = new ChurnRisk();

    private SkuHealth skuHealth = new SkuHealth();

    private Scoring scoring = new Scoring();

    private ChurnProfile churnProfile = new ChurnProfile();

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    /**
     * Thresholds of the windowed anomaly checks. Percentages are positive magnitudes.
     */
    @Data
    public static class Detection {
        private double declinePct = 30.0;
        private double declineHighPct = 50.0;
        private double intervalGrowthPct = 25.0;
        private double intervalGrowthHighPct = 50.0;
        private double volatilityIncreasePct = 40.0;
        private double volatilityIncreaseHighPct = 80.0;
        private double warehouseDropRatio = 0.5;
        private double concentrationSharePct = 30.0;
        private double concentrationHighSharePct = 50.0;
        private int concentrationMinPartners = 2;
        private int skuChurnDays = 30;
        private int skuChurnHighDays = 60;
        private double skuDeclinePct = 50.0;
    }

    /**
     * Additive churn risk heuristic. Each satisfied condition adds its points; the sum is
     * capped at 100.
     */
    @Data
    public static class ChurnRisk {
        private double declinePct = 30.0;
        private int declinePoints = 30;
        private double intervalMultiplier = 1.5;
        private int intervalPoints = 25;
        private int minSkuCount = 3;
        private int skuMinOrders = 10;
        private int skuPoints = 15;
        private double volatilityLimit = 1.5;
        private int volatilityPoints = 10;
        private int inactivityDays = 30;
        private int inactivityPoints = 40;
    }

    @Data
    public static class SkuHealth {
        private double lowFrequencyRate = 0.5;
        private int lowFrequencyMinOrders = 5;
        private int orderGapDays = 30;
    }

    @Data
    public static class Scoring {
        private double largePercentile = 0.75;
        private double mediumPercentile = 0.40;
        private int largeMinOrders = 500;
        private int largeMinWarehouses = 2;
        private int mediumMinOrders = 100;
        private int mediumMinWarehouses = 1;
        private double churnWeight = 0.30;
        private double severityWeight = 0.25;
        private double revenueCap = 20.0;
        private double revenueScale = 100000.0;
        private int newAlertBonus = 5;
    }

    /**
     * Relative churn analytics: size segments, churn score against dataset averages, risk
     * trajectory, success patterns and monthly SKU figures.
     */
    @Data
    public static class ChurnProfile {
        // segment score = orders x orderWeight + warehouses x warehouseScale x warehouseWeight
        private double segmentOrderWeight = 0.6;
        private double segmentWarehouseWeight = 0.4;
        private double segmentWarehouseScale = 50.0;
        private double segmentMediumScore = 50.0;
        private double segmentLargeScore = 200.0;

        private double intervalPoints = 40.0;
        private double volatilityPoints = 30.0;
        private double skuPoints = 20.0;
        private double warehousePoints = 10.0;

        private int trajectoryPointsPerOrder = 5;
        private int trajectoryStableBand = 5;

        private int successMaxChurnRisk = 30;
        private int successMinOrders = 20;
        private int successMinSku = 3;
        private int unsuccessfulMinChurnRisk = 60;

        private int skuChurnDays = 60;
        private double topSkuShare = 0.2;
    }
}
