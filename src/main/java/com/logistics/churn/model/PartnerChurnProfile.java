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
@Schema(description = "Partner stats with size segment, relative churn score and risk trajectory")
public class PartnerChurnProfile {

    private PartnerStats stats;

    @Schema(description = "Size segment from order and warehouse volume", example = "MEDIUM")
    private CustomerSize segment;

    @Schema(description = "Churn score relative to the dataset averages (0-100)", example = "57.5")
    private double churnScore;

    private RiskTrajectory trajectory;
}
