package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Stored historical metric snapshot used as a comparison baseline")
public class Benchmark {

    @Schema(description = "Partner identifier", example = "PARTNER-017")
    private String partnerId;

    @Schema(description = "SKU identifier for SKU-level benchmarks", example = "ART-5521")
    private String skuId;

    @Schema(description = "Measured metric", example = "AVG_ORDERS_PER_DAY")
    private BenchmarkMetric metric;

    @Schema(description = "Period the metric covers", example = "THIRTY_DAYS")
    private BenchmarkPeriod period;

    @Schema(description = "Metric value", example = "0.33")
    private double value;

    @Schema(description = "Snapshot timestamp in epoch milliseconds", example = "1739886764000")
    private long updatedAt;

    public String benchmarkKey() {
        return partnerId + ":" + (skuId != null ? skuId : "-") + ":" + metric.getCode() + ":" + period.getCode();
    }
}
