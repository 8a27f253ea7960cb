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
@Schema(description = "Behaviour of successful partners next to partners that lapsed or are at risk")
public class SuccessPatterns {

    @Schema(description = "Active, low-risk, high-volume partners with a broad SKU range")
    private ChurnPattern successful;

    @Schema(description = "Inactive, high-risk or long-silent partners")
    private ChurnPattern unsuccessful;
}
