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
@Schema(description = "Averages of the partners of one size segment in one direction")
public class SegmentPortrait {

    private CustomerSize segment;

    private String direction;

    private int partnersCount;

    @Schema(description = "Churned partners in percent", example = "25.0")
    private double churnRate;

    private double avgOrders;
    private double avgSku;
    private double avgWarehouses;

    @Schema(description = "Mean order interval of partners that have not churned")
    private double avgInterval;

    @Schema(description = "Mean volatility of partners that have not churned")
    private double avgVolatility;

    @Schema(description = "Mean churn score of partners that have not churned")
    private double avgChurnScore;
}
