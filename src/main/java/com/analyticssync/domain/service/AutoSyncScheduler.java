package com.analyticssync.domain.service;

import com.analyticssync.config.SyncEngineConfig;
import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.SyncedData;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic background refresh, one independent timer per property.
 *
 * Tick Flow:
 * 1. Skip if this property's previous tick is still fetching
 * 2. Force-refresh the property through the coordinator
 * 3. Log and count failures; the timer keeps running
 *
 * Each property owns a cancellation token. stop() cancels the timers and the tokens, so
 * fetches a tick already dispatched are interrupted and never write back.
 */
@Slf4j
@Service
public class AutoSyncScheduler {

    private final BatchFetchCoordinator coordinator;
    private final TaskScheduler taskScheduler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, SyncTask> tasks = new LinkedHashMap<>();

    public AutoSyncScheduler(BatchFetchCoordinator coordinator,
                             @Qualifier(SyncEngineConfig.AUTO_SYNC_SCHEDULER) TaskScheduler taskScheduler,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.coordinator = coordinator;
        this.taskScheduler = taskScheduler;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Replace any running timers with one per property. The first tick fires one interval from now.
     */
    public synchronized void start(String credentials, List<AnalyticsProperty> properties, DateRange dateRange,
                                   Duration interval) {
        if (properties == null || dateRange == null) {
            throw new IllegalArgumentException("Properties and date range are required");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Auto-sync interval must be positive: " + interval);
        }
        stop();

        for (AnalyticsProperty property : properties) {
            String propertyId = property.getPropertyId();
            if (tasks.containsKey(propertyId)) {
                continue;
            }
            SyncTask task = new SyncTask(propertyId);
            task.schedule = taskScheduler.scheduleAtFixedRate(
                    () -> tick(task, credentials, dateRange),
                    clock.instant().plus(interval),
                    interval);
            tasks.put(propertyId, task);
        }

        log.info("Auto-sync started for {} properties every {}", tasks.size(), interval);
    }

    /**
     * Cancel every timer and every fetch a tick has in flight. Safe to call when nothing runs.
     */
    public synchronized void stop() {
        if (tasks.isEmpty()) {
            return;
        }
        for (SyncTask task : tasks.values()) {
            task.schedule.cancel(false);
            task.token.cancel();
        }
        log.info("Auto-sync stopped for {} properties", tasks.size());
        tasks.clear();
    }

    public synchronized Set<String> scheduledProperties() {
        return Set.copyOf(tasks.keySet());
    }

    public synchronized boolean isRunning() {
        return !tasks.isEmpty();
    }

    void tick(SyncTask task, String credentials, DateRange dateRange) {
        if (task.token.isCancelled()) {
            return;
        }
        CompletableFuture<SyncedData> running = task.running.get();
        if (running != null && !running.isDone()) {
            log.debug("Skipping auto-sync tick for property {}: previous tick still running", task.propertyId);
            countTick("skipped");
            return;
        }

        CompletableFuture<SyncedData> fetch;
        try {
            fetch = coordinator.fetchOne(credentials, task.propertyId, dateRange, true, task.token);
        } catch (RuntimeException e) {
            log.warn("Auto-sync failed for property {}: {}", task.propertyId, e.getMessage());
            countTick("error");
            return;
        }
        task.running.set(fetch);

        fetch.whenComplete((data, error) -> {
            if (error == null) {
                countTick(data.isDegraded() ? "error" : "success");
                if (data.isDegraded()) {
                    log.warn("Auto-sync failed for property {}: {}", task.propertyId, data.getErrorMessage());
                }
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof CancellationException) {
                log.debug("Auto-sync fetch for property {} cancelled", task.propertyId);
                return;
            }
            log.warn("Auto-sync failed for property {}: {}", task.propertyId, cause.getMessage());
            countTick("error");
        });
    }

    private void countTick(String result) {
        Counter.builder("analytics.autosync.ticks")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    static final class SyncTask {

        private final String propertyId;
        private final CancellationToken token = new CancellationToken();
        private final AtomicReference<CompletableFuture<SyncedData>> running = new AtomicReference<>();
        private ScheduledFuture<?> schedule;

        SyncTask(String propertyId) {
            this.propertyId = propertyId;
        }
    }
}
