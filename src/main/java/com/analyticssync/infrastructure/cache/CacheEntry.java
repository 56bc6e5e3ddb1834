package com.analyticssync.infrastructure.cache;

import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.CacheKey;
import lombok.Value;

import java.time.Instant;

/**
 * Cached report with its write time and a content fingerprint for change detection.
 */
@Value
public class CacheEntry {

    CacheKey key;
    AnalyticsReport payload;
    Instant writtenAt;
    String fingerprint;

    public static CacheEntry of(CacheKey key, AnalyticsReport payload, Instant writtenAt) {
        return new CacheEntry(key, payload, writtenAt, ContentFingerprint.of(payload));
    }
}
