package com.analyticssync.domain.model;

import lombok.Value;

/**
 * Composite cache key: one dataset per (property, range start, range end).
 */
@Value
public class CacheKey {

    String propertyId;
    String startDate;
    String endDate;

    public static CacheKey of(String propertyId, DateRange dateRange) {
        return new CacheKey(propertyId, dateRange.getStartDate(), dateRange.getEndDate());
    }

    @Override
    public String toString() {
        return propertyId + ":" + startDate + ":" + endDate;
    }
}
