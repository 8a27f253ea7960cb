package com.logistics.churn.engine;

import com.logistics.churn.model.PartnerBenchmark;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything a partner-level check may look at. Built once per partner per pass.
 */
@Data
@Builder
public class DetectionContext {

    private String partnerId;

    // Reference time shared by every check of the pass
    private LocalDateTime now;

    private List<DatedOrder> orders;

    // Last 7 days, last 30 days, and days 31-60 before now
    private WindowMetrics week;
    private WindowMetrics month;
    private WindowMetrics priorMonth;

    // Stored baseline of earlier passes, null when none was supplied
    private PartnerBenchmark historical;

    // Orders of all partners in the last 30 days, and number of partners in the dataset
    private int datasetOrders30d;
    private int datasetPartnerCount;

    public double baselineRate() {
        return historical != null ? historical.getAvgOrdersPerDay30d() : month.getRatePerDay();
    }

    public double baselineInterval() {
        return historical != null ? historical.getOrderInterval30d() : month.getMeanInterval();
    }

    public double baselineVolatility() {
        return historical != null ? historical.getVolatility30d() : month.getIntervalVolatility();
    }

    public int baselineWarehouseCount() {
        return historical != null ? historical.getWarehouseCount30d() : month.getWarehouseCount();
    }
}
