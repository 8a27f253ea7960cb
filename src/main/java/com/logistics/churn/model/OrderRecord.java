package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * One fulfillment event from the canonical merged dataset.
 *
 * Records are immutable snapshots. Partner and order date are required for a record to
 * take part in any aggregate; the analytics layer skips records lacking either instead
 * of failing. The order date is kept as delivered because several date formats reach
 * the engine and parsing is its concern.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Canonical order record produced by the ingestion service")
public class OrderRecord {

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    String partner;

    @Schema(description = "Order number assigned by the delivery service", example = "DS-000183")
    String orderNumber;

    @Schema(description = "Order identifier (dedup key of the ingestion service)", example = "ORD-7782001")
    String orderId;

    @Schema(description = "Order type", example = "FBS")
    String orderType;

    @Schema(description = "Number of items in the order", example = "3")
    int itemCount;

    @Schema(description = "Total order weight, kg", example = "2.4")
    double totalWeight;

    @Schema(description = "Warehouse", example = "Express Moscow")
    String warehouse;

    @Schema(description = "Order status", example = "DELIVERED")
    String status;

    @Schema(description = "Order date as delivered by ingestion", example = "2025-03-14 10:21:00")
    String orderDate;

    @Schema(description = "Marketplace as entered", example = "OZON")
    String marketplace;

    @Schema(description = "SKU / article code", example = "ART-5521")
    String sku;

    @Schema(description = "Report-side fields, absent when the order was not matched")
    ReportDetails report;

    @Schema(description = "Computed logistics direction", example = "Express/FBS")
    String direction;

    @Schema(description = "Normalized marketplace", example = "OZON")
    String normalizedMarketplace;

    @Schema(description = "Source file the record came from", example = "orders_2025_03.xlsx")
    String sourceFile;

    @Schema(description = "Last update timestamp of the record", example = "2025-03-15 08:00:00")
    String lastUpdated;

    public Optional<ReportDetails> getReport() {
        return Optional.ofNullable(report);
    }

    public boolean hasPartner() {
        return partner != null && !partner.isBlank();
    }
}
