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
@Schema(description = "Business context of a partner used to weigh its alerts")
public class PartnerScoringProfile {

    @Schema(example = "PARTNER-017")
    private String partnerId;

    @Schema(description = "All orders of the partner", example = "312")
    private int orderCount;

    @Schema(description = "Distinct warehouses across all orders", example = "3")
    private int warehouseCount;

    @Schema(description = "Orders of the last 30 days", example = "41")
    private int orders30d;

    @Schema(description = "Percentile rank of the order count among all partners", example = "0.82")
    private double percentile;

    @Schema(example = "LARGE")
    private CustomerSize customerSize;

    @Schema(description = "Highest churn risk across the partner's directions", example = "55")
    private int churnRisk;

    @Schema(description = "Estimated monthly revenue", example = "205000")
    private long monthlyRevenue;

    public static PartnerScoringProfile unknown(String partnerId) {
        return PartnerScoringProfile.builder()
                .partnerId(partnerId)
                .customerSize(CustomerSize.SMALL)
                .build();
    }
}
