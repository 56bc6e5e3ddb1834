package com.analyticssync.domain.model;

import lombok.Value;

import java.time.Instant;

@Value
public class CacheStats {
    int size;
    int maxSize;
    Instant oldestWrittenAt;
    Instant newestWrittenAt;
}
