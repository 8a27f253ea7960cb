package com.logistics.churn.engine;

import com.logistics.churn.model.OrderRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * An order record that passed normalization: it has a partner, a parsed order time and a
 * resolved direction.
 */
public record DatedOrder(OrderRecord record, LocalDateTime orderedAt, String direction) {

    public String partner() {
        return record.getPartner();
    }

    public String sku() {
        return record.getSku();
    }

    public String warehouse() {
        return record.getWarehouse();
    }

    public LocalDate orderDay() {
        return orderedAt.toLocalDate();
    }

    public boolean isOnOrAfter(LocalDateTime cutoff) {
        return !orderedAt.isBefore(cutoff);
    }
}
