package com.logistics.churn.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Presentation filter over prioritized alerts. Unset criteria match everything;
 * set criteria are combined with AND.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertFilter implements Predicate<PrioritizedAlert> {

    private Set<RiskLevel> severities;
    private Set<CustomerSize> customerSizes;
    private Set<AlertCategory> categories;
    private Integer minPriorityScore;
    private Boolean isNew;

    public static AlertFilter none() {
        return new AlertFilter();
    }

    @Override
    public boolean test(PrioritizedAlert alert) {
        if (severities != null && !severities.isEmpty() && !severities.contains(alert.getSeverity())) {
            return false;
        }
        if (customerSizes != null && !customerSizes.isEmpty() && !customerSizes.contains(alert.getCustomerSize())) {
            return false;
        }
        if (categories != null && !categories.isEmpty() && !categories.contains(alert.getCategory())) {
            return false;
        }
        if (minPriorityScore != null && alert.getPriorityScore() < minPriorityScore) {
            return false;
        }
        return isNew == null || alert.isNew() == isNew;
    }
}
