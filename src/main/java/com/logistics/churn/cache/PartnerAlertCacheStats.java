package com.logistics.churn.cache;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PartnerAlertCacheStats {
    int size;
    List<String> partners;
    int inProgress;
}
