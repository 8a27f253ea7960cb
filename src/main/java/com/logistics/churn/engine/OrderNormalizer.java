package com.logistics.churn.engine;

import com.logistics.churn.config.AnalyticsConfig;
import com.logistics.churn.config.MetricsConfig;
import com.logistics.churn.model.OrderRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw order records into {@link DatedOrder}s. Records without a partner or with an
 * order date none of the accepted formats can read are skipped, never rejected.
 */
@Component
public class OrderNormalizer {

    private static final Logger log = LoggerFactory.getLogger(OrderNormalizer.class);

    public static final String UNKNOWN_DIRECTION = "unknown";

    private final AnalyticsConfig config;
    private final MetricsConfig metricsConfig;

    public OrderNormalizer(AnalyticsConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public List<DatedOrder> normalize(Collection<OrderRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("Order records must not be null");
        }
        List<DatedOrder> orders = new ArrayList<>(records.size());
        int skipped = 0;
        for (OrderRecord record : records) {
            if (record == null || !record.hasPartner()) {
                skipped++;
                continue;
            }
            Optional<LocalDateTime> orderedAt = OrderDates.parse(record.getOrderDate());
            if (orderedAt.isEmpty()) {
                skipped++;
                continue;
            }
            orders.add(new DatedOrder(record, orderedAt.get(), directionOf(record)));
        }
        if (skipped > 0) {
            log.warn("Skipped {} of {} order records without partner or readable order date",
                    skipped, records.size());
            metricsConfig.recordSkippedRecords(skipped);
        }
        return orders;
    }

    /**
     * Direction a record is attributed to: a configured override for its partner, else the
     * record's computed direction.
     */
    public String directionOf(OrderRecord record) {
        String override = record.getPartner() != null
                ? config.getDirectionOverrides().get(record.getPartner())
                : null;
        if (override != null) {
            return override;
        }
        String direction = record.getDirection();
        return direction == null || direction.isBlank() ? UNKNOWN_DIRECTION : direction;
    }
}
