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
@Schema(description = "Order totals for one logistics direction")
public class DirectionStats {

    @Schema(description = "Direction", example = "VSROK")
    private String direction;

    @Schema(description = "Orders in the direction", example = "5120")
    private int totalOrders;

    @Schema(description = "Distinct partners", example = "38")
    private int totalPartners;

    @Schema(description = "Distinct SKUs", example = "911")
    private int totalSku;

    @Schema(description = "Mean orders per partner", example = "134.7")
    private double avgOrdersPerPartner;

    @Schema(description = "Median orders per partner", example = "61.0")
    private double medianOrdersPerPartner;
}
