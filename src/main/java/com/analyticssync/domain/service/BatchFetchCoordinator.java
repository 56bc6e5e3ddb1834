package com.analyticssync.domain.service;

import com.analyticssync.config.SyncEngineConfig;
import com.analyticssync.config.SyncEngineProperties;
import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.BatchResult;
import com.analyticssync.domain.model.CacheKey;
import com.analyticssync.domain.model.DataSource;
import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.FailedFetch;
import com.analyticssync.domain.model.FetchOutcome;
import com.analyticssync.domain.model.SyncedData;
import com.analyticssync.domain.sync.SyncStatusTracker;
import com.analyticssync.domain.sync.UpdateListenerBus;
import com.analyticssync.infrastructure.cache.CacheEntry;
import com.analyticssync.infrastructure.cache.CacheStore;
import com.analyticssync.infrastructure.cache.ContentFingerprint;
import com.analyticssync.infrastructure.upstream.AnalyticsDataFetcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Read-through fetching of analytics reports, one property or many.
 *
 * Single Fetch Flow:
 * 1. Fresh cache entry and no forced refresh: return it (cache hit)
 * 2. Otherwise mark the property SYNCING and call upstream on the fetch pool
 * 3. Success: replace the cache entry, mark SUCCESS, notify listeners
 * 4. Failure: mark ERROR; serve the cached entry if one exists (even stale), else fail
 *
 * Concurrent requests for the same key share one upstream call (single-flight).
 *
 * Batch Flow:
 * - Properties are split into waves of size concurrency, in input order
 * - A wave is fetched concurrently; the next wave starts only after every fetch of this one settled
 * - A short pause between waves keeps the upstream quota happy
 * - Per-property failures are collected, never thrown
 *
 * No timeout is imposed here; the upstream client owns its timeouts.
 */
@Slf4j
@Service
public class BatchFetchCoordinator {

    private final AnalyticsDataFetcher fetcher;
    private final CacheStore cacheStore;
    private final SyncStatusTracker statusTracker;
    private final UpdateListenerBus listenerBus;
    private final AsyncTaskExecutor fetchExecutor;
    private final MeterRegistry meterRegistry;
    private final SyncEngineProperties properties;
    private final Clock clock;

    private final Map<CacheKey, CompletableFuture<SyncedData>> inFlight = new ConcurrentHashMap<>();

    public BatchFetchCoordinator(AnalyticsDataFetcher fetcher,
                                 CacheStore cacheStore,
                                 SyncStatusTracker statusTracker,
                                 UpdateListenerBus listenerBus,
                                 @Qualifier(SyncEngineConfig.FETCH_EXECUTOR) AsyncTaskExecutor fetchExecutor,
                                 MeterRegistry meterRegistry,
                                 SyncEngineProperties properties,
                                 Clock clock) {
        this.fetcher = fetcher;
        this.cacheStore = cacheStore;
        this.statusTracker = statusTracker;
        this.listenerBus = listenerBus;
        this.fetchExecutor = fetchExecutor;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Same as the cancellable overload, with a token that is never cancelled.
     */
    public CompletableFuture<SyncedData> fetchOne(String credentials, String propertyId, DateRange dateRange,
                                                  boolean forceRefresh) {
        return fetchOne(credentials, propertyId, dateRange, forceRefresh, CancellationToken.none());
    }

    /**
     * Resolve one property against the cache, calling upstream on a miss or forced refresh.
     *
     * If the token is cancelled while the upstream call it started is running, the call is
     * interrupted and its result discarded: cache, status and listeners are left untouched.
     * The token does not apply when this call joins a fetch someone else started.
     */
    public CompletableFuture<SyncedData> fetchOne(String credentials, String propertyId, DateRange dateRange,
                                                  boolean forceRefresh, CancellationToken token) {
        CacheKey key = CacheKey.of(propertyId, dateRange);
        Optional<CacheEntry> cached = cacheStore.get(key);

        if (!forceRefresh && cached.isPresent() && cacheStore.isFresh(cached.get())) {
            log.debug("Cache hit for key: {}", key);
            countCache("hit");
            CacheEntry entry = cached.get();
            return CompletableFuture.completedFuture(SyncedData.builder()
                    .propertyId(propertyId)
                    .payload(entry.getPayload())
                    .source(DataSource.CACHE)
                    .writtenAt(entry.getWrittenAt())
                    .build());
        }

        CompletableFuture<SyncedData> promise = new CompletableFuture<>();
        CompletableFuture<SyncedData> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            log.debug("Joining in-flight fetch for key: {}", key);
            countCache("miss");
            // An abandoned auto-sync fetch must not fail requesters that merely joined it
            return existing.exceptionallyCompose(e -> isCancellation(e) && !token.isCancelled()
                    ? fetchOne(credentials, propertyId, dateRange, forceRefresh, token)
                    : CompletableFuture.failedFuture(e));
        }

        log.debug("Cache miss for key: {}", key);
        dispatch(new Attempt(credentials, key, dateRange, token, promise));
        return promise;
    }

    /**
     * Fetch many properties in sequential waves of bounded concurrency.
     *
     * @param minTrafficThreshold successes with fewer users are dropped; null or 0 keeps all
     * @throws IllegalArgumentException on malformed input; upstream failures never throw
     */
    public BatchResult fetchBatch(String credentials, List<AnalyticsProperty> batch, DateRange dateRange,
                                  int concurrency, boolean forceRefresh, Long minTrafficThreshold) {
        if (batch == null || dateRange == null) {
            throw new IllegalArgumentException("Properties and date range are required");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        List<FetchOutcome> successful = new ArrayList<>();
        List<FailedFetch> failed = new ArrayList<>();
        int cacheHits = 0;
        int cacheMisses = 0;

        for (int i = 0; i < batch.size(); i += concurrency) {
            List<AnalyticsProperty> wave = batch.subList(i, Math.min(i + concurrency, batch.size()));

            List<CompletableFuture<SyncedData>> futures = new ArrayList<>(wave.size());
            for (AnalyticsProperty property : wave) {
                futures.add(fetchIsolated(credentials, property.getPropertyId(), dateRange, forceRefresh));
            }

            // Wait for the whole wave, failures included
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .exceptionally(e -> null)
                    .join();

            for (int j = 0; j < wave.size(); j++) {
                AnalyticsProperty property = wave.get(j);
                SyncedData data;
                try {
                    data = futures.get(j).join();
                } catch (CompletionException | CancellationException e) {
                    String error = messageOf(e);
                    log.warn("Failed to fetch data for property {}: {}", property.getPropertyId(), error);
                    failed.add(new FailedFetch(property.getPropertyId(), error));
                    continue;
                }

                if (data.getSource() == DataSource.CACHE) {
                    cacheHits++;
                } else {
                    cacheMisses++;
                }

                FetchOutcome outcome = toOutcome(property, data);
                if (minTrafficThreshold != null && minTrafficThreshold > 0 && outcome.getUsers() < minTrafficThreshold) {
                    log.debug("Dropping property {} below traffic threshold ({} < {})",
                            property.getPropertyId(), outcome.getUsers(), minTrafficThreshold);
                    continue;
                }
                successful.add(outcome);
            }

            if (i + concurrency < batch.size()) {
                pauseBetweenWaves();
            }
        }

        successful.sort(Comparator.comparingLong(FetchOutcome::getUsers).reversed());
        long totalTime = System.currentTimeMillis() - startTime;

        sample.stop(Timer.builder("analytics.batch.latency")
                .register(meterRegistry));
        Counter.builder("analytics.batch.executed")
                .register(meterRegistry)
                .increment();

        log.info("Batch fetch completed: {} succeeded, {} failed, {} cache hits, {} ms",
                successful.size(), failed.size(), cacheHits, totalTime);

        return BatchResult.builder()
                .successful(successful)
                .failed(failed)
                .totalFetchTimeMs(totalTime)
                .cacheHits(cacheHits)
                .cacheMisses(cacheMisses)
                .build();
    }

    /**
     * Fetch fresh data and compare its fingerprint with the cached entry's. Never writes the cache.
     *
     * @return true when nothing is cached or the content differs; false when the fetch fails
     */
    public boolean hasDataChanged(String credentials, String propertyId, DateRange dateRange) {
        Optional<CacheEntry> cached = cacheStore.get(CacheKey.of(propertyId, dateRange));
        if (cached.isEmpty()) {
            return true;
        }
        try {
            AnalyticsReport fresh = fetcher.fetchReport(credentials, propertyId, dateRange);
            return !ContentFingerprint.of(fresh).equals(cached.get().getFingerprint());
        } catch (Exception e) {
            log.warn("Failed to check data changes for property {}: {}", propertyId, e.getMessage());
            return false;
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private void dispatch(Attempt attempt) {
        attempt.syncClaim = statusTracker.markSyncing(attempt.key.getPropertyId());

        Future<?> task;
        try {
            task = fetchExecutor.submit(() -> runUpstream(attempt));
        } catch (RuntimeException e) {
            log.error("Could not schedule fetch for key {}: {}", attempt.key, e.getMessage());
            statusTracker.markError(attempt.key.getPropertyId(), e.getMessage());
            inFlight.remove(attempt.key, attempt.promise);
            countCache("miss");
            attempt.promise.completeExceptionally(e);
            return;
        }

        Runnable deregister = attempt.token.onCancel(() -> {
            abandon(attempt);
            task.cancel(true);
        });
        attempt.promise.whenComplete((data, error) -> deregister.run());
    }

    private void runUpstream(Attempt attempt) {
        if (attempt.token.isCancelled()) {
            return;
        }
        String propertyId = attempt.key.getPropertyId();
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        AnalyticsReport report;
        try {
            report = fetcher.fetchReport(attempt.credentials, propertyId, attempt.dateRange);
        } catch (Exception e) {
            sample.stop(upstreamTimer("error"));
            settleFailure(attempt, e, System.currentTimeMillis() - startTime);
            return;
        }
        sample.stop(upstreamTimer("success"));
        settleSuccess(attempt, report, System.currentTimeMillis() - startTime);
    }

    private void settleSuccess(Attempt attempt, AnalyticsReport report, long fetchTime) {
        String propertyId = attempt.key.getPropertyId();
        CacheEntry entry = CacheEntry.of(attempt.key, report, clock.instant());

        synchronized (attempt) {
            if (attempt.settled || attempt.token.isCancelled()) {
                log.debug("Discarding result for key {}: fetch was cancelled", attempt.key);
                return;
            }
            attempt.settled = true;
            cacheStore.put(attempt.key, entry);
            statusTracker.markSuccess(propertyId);
            inFlight.remove(attempt.key, attempt.promise);
        }

        countCache("miss");
        listenerBus.publish(propertyId, report, attempt.dateRange);
        log.debug("Fetched property {} in {} ms", propertyId, fetchTime);

        attempt.promise.complete(SyncedData.builder()
                .propertyId(propertyId)
                .payload(report)
                .source(DataSource.NETWORK)
                .writtenAt(entry.getWrittenAt())
                .fetchTimeMs(fetchTime)
                .build());
    }

    private void settleFailure(Attempt attempt, Exception error, long fetchTime) {
        String propertyId = attempt.key.getPropertyId();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        Optional<CacheEntry> fallback;
        synchronized (attempt) {
            if (attempt.settled || attempt.token.isCancelled()) {
                log.debug("Ignoring failure for key {}: fetch was cancelled", attempt.key);
                return;
            }
            attempt.settled = true;
            statusTracker.markError(propertyId, message);
            fallback = cacheStore.get(attempt.key);
            inFlight.remove(attempt.key, attempt.promise);
        }

        if (fallback.isPresent()) {
            log.warn("Using stale cache for property {} due to fetch error: {}", propertyId, message);
            countCache("stale");
            attempt.promise.complete(SyncedData.builder()
                    .propertyId(propertyId)
                    .payload(fallback.get().getPayload())
                    .source(DataSource.STALE_FALLBACK)
                    .writtenAt(fallback.get().getWrittenAt())
                    .fetchTimeMs(fetchTime)
                    .errorMessage(message)
                    .build());
            return;
        }
        countCache("miss");
        attempt.promise.completeExceptionally(error);
    }

    private void abandon(Attempt attempt) {
        synchronized (attempt) {
            if (attempt.settled) {
                return;
            }
            attempt.settled = true;
            statusTracker.restore(attempt.syncClaim);
            inFlight.remove(attempt.key, attempt.promise);
        }
        log.debug("Abandoned fetch for key {}", attempt.key);
        attempt.promise.completeExceptionally(new CancellationException("Fetch for " + attempt.key + " was cancelled"));
    }

    private CompletableFuture<SyncedData> fetchIsolated(String credentials, String propertyId, DateRange dateRange,
                                                        boolean forceRefresh) {
        try {
            return fetchOne(credentials, propertyId, dateRange, forceRefresh);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private FetchOutcome toOutcome(AnalyticsProperty property, SyncedData data) {
        AnalyticsReport report = data.getPayload();
        long users = report.getUsers();
        return FetchOutcome.builder()
                .propertyId(property.getPropertyId())
                .displayName(property.getDisplayName())
                .payload(report)
                .fetchTimeMs(data.getFetchTimeMs())
                .users(users)
                .sessions(report.getSessions())
                .highPerformer(users >= properties.getHighPerformerThreshold())
                .source(data.getSource())
                .build();
    }

    private void pauseBetweenWaves() {
        Duration delay = properties.getInterWaveDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch fetch interrupted between waves", e);
        }
    }

    private void countCache(String result) {
        Counter.builder("analytics.cache")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private Timer upstreamTimer(String outcome) {
        return Timer.builder("analytics.upstream.latency")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private static boolean isCancellation(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof CancellationException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String messageOf(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * One dispatched upstream call and the bookkeeping needed to settle or abandon it exactly once.
     */
    private static final class Attempt {

        private final String credentials;
        private final CacheKey key;
        private final DateRange dateRange;
        private final CancellationToken token;
        private final CompletableFuture<SyncedData> promise;

        private SyncStatusTracker.SyncClaim syncClaim;
        private boolean settled;

        private Attempt(String credentials, CacheKey key, DateRange dateRange, CancellationToken token,
                        CompletableFuture<SyncedData> promise) {
            this.credentials = credentials;
            this.key = key;
            this.dateRange = dateRange;
            this.token = token;
            this.promise = promise;
        }
    }
}
