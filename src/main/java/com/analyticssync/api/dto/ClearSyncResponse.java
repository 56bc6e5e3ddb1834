package com.analyticssync.api.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ClearSyncResponse {

    /** Null when the whole cache was cleared. */
    List<String> clearedProperties;

    boolean autoSyncStopped;
    Instant timestamp;
}
