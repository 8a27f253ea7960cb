package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Report-side fields joined onto an order by the ingestion service.
 * Present only when the order matched a row of the fulfillment report.
 */
@Value
@Builder
@Schema(description = "Fulfillment report fields matched to an order")
public class ReportDetails {

    @Schema(description = "Weight from the report, kg", example = "1.25")
    Double weight;

    @Schema(description = "Quantity from the report", example = "2")
    Integer quantity;

    @Schema(description = "Warehouse from the report", example = "Express Moscow")
    String warehouse;

    @Schema(description = "Status from the report", example = "DELIVERED")
    String status;

    @Schema(description = "Order date from the report", example = "2025-03-14 10:21:00")
    String orderDate;
}
