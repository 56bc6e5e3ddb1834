package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of the most recent fetch attempt for a property (not per date range).
 */
@Value
@Builder
public class SyncStatus {

    String propertyId;
    Instant lastSyncAt;
    SyncState state;
    String errorMessage;
}
