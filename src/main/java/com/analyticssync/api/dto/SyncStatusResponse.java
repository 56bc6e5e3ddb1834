package com.analyticssync.api.dto;

import com.analyticssync.domain.model.CacheStats;
import com.analyticssync.domain.model.SyncStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SyncStatusResponse {

    Map<String, SyncStatus> syncStatus;
    CacheStats cacheStats;
    boolean autoSyncRunning;
    Instant timestamp;
}
