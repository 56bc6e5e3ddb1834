package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregate result of a batch fetch.
 *
 * successful and failed never share a property; a property may be missing from both
 * only when it succeeded but fell below the caller's minimum traffic threshold.
 */
@Value
@Builder(toBuilder = true)
public class BatchResult {

    @Builder.Default
    List<FetchOutcome> successful = List.of();

    @Builder.Default
    List<FailedFetch> failed = List.of();

    long totalFetchTimeMs;
    int cacheHits;
    int cacheMisses;

    public static BatchResult empty() {
        return BatchResult.builder().build();
    }
}
