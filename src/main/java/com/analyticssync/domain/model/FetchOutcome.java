package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Successful per-property result inside a {@link BatchResult}.
 */
@Value
@Builder
public class FetchOutcome {

    String propertyId;
    String displayName;
    AnalyticsReport payload;
    long fetchTimeMs;
    long users;
    long sessions;
    boolean highPerformer;
    DataSource source;
}
