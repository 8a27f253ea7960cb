package com.logistics.churn.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mean and median behaviour of a group of partners. Every value is 0 for an empty group.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Typical behaviour of a group of partners")
public class ChurnPattern {

    @Schema(description = "Partners in the group", example = "12")
    private int partnerCount;

    private double avgOrderFrequency;
    private double medianOrderFrequency;
    private double avgSkuCount;
    private double medianSkuCount;
    private double avgWarehouseCount;
    private double medianWarehouseCount;
    private double avgVolatility;
    private double medianVolatility;

    public static ChurnPattern empty() {
        return new ChurnPattern();
    }
}
