package com.analyticssync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Analytics Sync Engine
 *
 * In-process caching and synchronization layer between analytics dashboards and the
 * analytics reporting backend.
 *
 * Architecture:
 * - REST API for on-demand fetches, batch sync and sync status
 * - TTL cache with bounded size and stale fallback on upstream failure
 * - Wave-based batch fetching with bounded concurrency
 * - Per-property background refresh with cancellation
 * - Preference-driven selection of which properties to fetch
 */
@SpringBootApplication
public class AnalyticsSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsSyncApplication.class, args);
    }
}
