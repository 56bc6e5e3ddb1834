package com.analyticssync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Cache, batching and auto-sync settings. Documented in application.yml under app.sync.
 */
@ConfigurationProperties(prefix = "app.sync")
@Getter
@Setter
public class SyncEngineProperties {

    /** Age after which a cache entry is stale. */
    private Duration cacheTtl = Duration.ofMinutes(5);

    /** Maximum cached (property, date range) datasets; the oldest is evicted beyond this. */
    private int maxCacheSize = 1000;

    /** Properties fetched concurrently per wave. */
    private int defaultConcurrency = 3;

    /** Pause between waves of a batch, on top of the upstream's own rate limiting. */
    private Duration interWaveDelay = Duration.ofMillis(100);

    private Duration autoSyncInterval = Duration.ofMinutes(2);

    /** Upper bound on properties fetched by an optimized fetch. */
    private int defaultMaxEntities = 20;

    /** Users at or above which a property counts as a high performer. */
    private long highPerformerThreshold = 1000;

    private int fetchPoolSize = 8;

    private int schedulerPoolSize = 4;
}
