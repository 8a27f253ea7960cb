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
@Schema(description = "Dataset averages a partner's churn score is measured against")
public class ChurnBaseline {

    @Schema(description = "Mean order interval of partners that have not churned", example = "3.2")
    private double avgInterval;

    @Schema(description = "Mean volatility of partners that have not churned", example = "0.8")
    private double avgVolatility;

    @Schema(description = "Mean distinct SKU count", example = "6.5")
    private double avgSku;

    @Schema(description = "Mean distinct warehouse count", example = "1.7")
    private double avgWarehouses;
}
