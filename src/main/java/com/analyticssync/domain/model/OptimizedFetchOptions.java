package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Options for a filtered, concurrency-bounded fetch over the property catalog.
 *
 * Null numeric fields fall back to the engine's configured defaults.
 */
@Value
@Builder
public class OptimizedFetchOptions {

    FilterCriteria filterCriteria;
    Integer maxEntities;
    Integer concurrency;

    /** Successes with fewer users than this are dropped from the result. */
    Long minTrafficThreshold;

    @Builder.Default
    boolean useCache = true;

    public static OptimizedFetchOptions defaults() {
        return OptimizedFetchOptions.builder().build();
    }
}
