package com.logistics.churn.engine;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class SkuDetectionContext {

    private String partnerId;
    private String sku;
    private LocalDateTime now;
    private List<DatedOrder> orders;
    private WindowMetrics week;
    private WindowMetrics month;
    private LocalDateTime lastOrderAt;
    private long daysSinceLastOrder;
}
