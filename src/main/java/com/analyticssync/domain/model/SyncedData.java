package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Payload of a single-property fetch together with how it was obtained.
 *
 * Lets callers tell a fresh result from a stale fallback without a separate status lookup.
 */
@Value
@Builder
public class SyncedData {

    String propertyId;
    AnalyticsReport payload;
    DataSource source;
    Instant writtenAt;
    long fetchTimeMs;

    /** Upstream error that caused a stale fallback, otherwise null. */
    String errorMessage;

    public boolean isDegraded() {
        return source == DataSource.STALE_FALLBACK;
    }
}
