package com.analyticssync.api.dto;

import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.SyncStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class SyncResponse {

    List<String> syncedProperties;
    int syncedCount;
    int totalProperties;
    Map<String, SyncStatus> syncStatus;
    boolean autoSyncEnabled;
    DateRange dateRange;
    Instant timestamp;
}
