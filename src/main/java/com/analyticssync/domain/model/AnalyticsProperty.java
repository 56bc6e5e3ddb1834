package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An analytics property (the entity being cached) as listed by the upstream catalog.
 */
@Value
@Builder
@Jacksonized
public class AnalyticsProperty {

    String propertyId;
    String name;
    String displayName;
    String propertyType;
    String parent;
    String timeZone;
    String currencyCode;

    public static AnalyticsProperty of(String propertyId) {
        return AnalyticsProperty.builder()
                .propertyId(propertyId)
                .name("properties/" + propertyId)
                .displayName(propertyId)
                .build();
    }
}
