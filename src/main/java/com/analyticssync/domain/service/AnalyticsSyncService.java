package com.analyticssync.domain.service;

import com.analyticssync.config.SyncEngineProperties;
import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.BatchResult;
import com.analyticssync.domain.model.CacheKey;
import com.analyticssync.domain.model.CacheStats;
import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.FetchOutcome;
import com.analyticssync.domain.model.FilterCriteria;
import com.analyticssync.domain.model.OptimizedFetchOptions;
import com.analyticssync.domain.model.PropertyPriority;
import com.analyticssync.domain.model.SortBy;
import com.analyticssync.domain.model.SyncStatus;
import com.analyticssync.domain.model.SyncedData;
import com.analyticssync.domain.sync.DataUpdateListener;
import com.analyticssync.domain.sync.SyncStatusTracker;
import com.analyticssync.domain.sync.UpdateListenerBus;
import com.analyticssync.infrastructure.cache.CacheStore;
import com.analyticssync.infrastructure.preferences.PropertyPreferenceStore;
import com.analyticssync.infrastructure.upstream.PropertyCatalog;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point of the sync engine, consumed by dashboards, the REST API and the assistant.
 *
 * Owns no state of its own: cache, statuses, listeners and timers live in the collaborators,
 * all of them instances created from configuration. dispose() tears everything down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsSyncService {

    private final BatchFetchCoordinator coordinator;
    private final AutoSyncScheduler autoSyncScheduler;
    private final SmartFilterSelector filterSelector;
    private final PropertyCatalog propertyCatalog;
    private final PropertyPreferenceStore preferenceStore;
    private final CacheStore cacheStore;
    private final SyncStatusTracker statusTracker;
    private final UpdateListenerBus listenerBus;
    private final SyncEngineProperties properties;
    private final Clock clock;

    /**
     * Payload for one property, served from cache while fresh.
     *
     * Upstream failures degrade to the cached payload when there is one; the failure is then
     * only visible through {@link #getSyncStatus} or {@link #getDataWithStatus}.
     *
     * @throws com.analyticssync.infrastructure.upstream.UpstreamFetchException if the fetch
     *         failed and nothing was cached
     */
    public AnalyticsReport getData(String credentials, String propertyId, DateRange dateRange, boolean forceRefresh) {
        return getDataWithStatus(credentials, propertyId, dateRange, forceRefresh).getPayload();
    }

    /**
     * Like {@link #getData}, but tells a fresh result from a stale fallback.
     */
    public SyncedData getDataWithStatus(String credentials, String propertyId, DateRange dateRange,
                                        boolean forceRefresh) {
        return await(coordinator.fetchOne(credentials, propertyId, dateRange, forceRefresh));
    }

    /**
     * Fetch the given properties with the default concurrency. Failed properties are left out.
     */
    public Map<String, AnalyticsReport> batchGetData(String credentials, List<AnalyticsProperty> batch,
                                                     DateRange dateRange, boolean forceRefresh) {
        BatchResult result = coordinator.fetchBatch(credentials, batch, dateRange,
                properties.getDefaultConcurrency(), forceRefresh, null);

        Map<String, AnalyticsReport> data = new LinkedHashMap<>();
        for (FetchOutcome outcome : result.getSuccessful()) {
            data.put(outcome.getPropertyId(), outcome.getPayload());
        }
        return data;
    }

    /**
     * Fetch a filtered, capped selection of the caller's whole property catalog.
     *
     * Flow:
     * 1. List every accessible property
     * 2. Narrow the list with the filter selector, capped at maxEntities
     * 3. Batch-fetch the selection
     * 4. Record an access for every successful property
     */
    public BatchResult fetchOptimized(String credentials, DateRange dateRange, OptimizedFetchOptions options) {
        OptimizedFetchOptions effective = options != null ? options : OptimizedFetchOptions.defaults();
        long startTime = System.currentTimeMillis();

        List<AnalyticsProperty> catalog = propertyCatalog.listProperties(credentials);
        if (catalog.isEmpty()) {
            log.info("No analytics properties available for optimized fetch");
            return BatchResult.empty();
        }

        int maxEntities = effective.getMaxEntities() != null ? effective.getMaxEntities() : properties.getDefaultMaxEntities();
        int concurrency = effective.getConcurrency() != null ? effective.getConcurrency() : properties.getDefaultConcurrency();

        List<AnalyticsProperty> selected = filterSelector.select(catalog, effective.getFilterCriteria(), maxEntities);
        log.info("Optimized fetch: {} of {} properties selected", selected.size(), catalog.size());

        BatchResult result = coordinator.fetchBatch(credentials, selected, dateRange, concurrency,
                !effective.isUseCache(), effective.getMinTrafficThreshold());

        Instant now = clock.instant();
        for (FetchOutcome outcome : result.getSuccessful()) {
            preferenceStore.markAccessed(outcome.getPropertyId(), now);
        }

        return result.toBuilder()
                .totalFetchTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    public List<AnalyticsProperty> listProperties(String credentials) {
        return propertyCatalog.listProperties(credentials);
    }

    /**
     * @param interval refresh period; null uses the configured default
     */
    public void startAutoSync(String credentials, List<AnalyticsProperty> batch, DateRange dateRange,
                              Duration interval) {
        autoSyncScheduler.start(credentials, batch, dateRange,
                interval != null ? interval : properties.getAutoSyncInterval());
    }

    public void stopAutoSync() {
        autoSyncScheduler.stop();
    }

    public boolean isAutoSyncRunning() {
        return autoSyncScheduler.isRunning();
    }

    public void subscribe(DataUpdateListener listener) {
        listenerBus.subscribe(listener);
    }

    public void unsubscribe(DataUpdateListener listener) {
        listenerBus.unsubscribe(listener);
    }

    /**
     * @param propertyIds null for every known property
     */
    public Map<String, SyncStatus> getSyncStatus(Collection<String> propertyIds) {
        return statusTracker.get(propertyIds);
    }

    /**
     * Drop cached data for the given properties, all date ranges, or everything when null.
     */
    public void clearCache(Collection<String> propertyIds) {
        if (propertyIds == null) {
            cacheStore.clear();
            log.info("Cache cleared");
            return;
        }
        int removed = cacheStore.invalidateProperties(propertyIds);
        log.info("Cleared {} cache entries for {} properties", removed, propertyIds.size());
    }

    public void invalidate(Collection<CacheKey> keys) {
        cacheStore.invalidate(keys);
    }

    public CacheStats cacheStats() {
        return cacheStore.stats();
    }

    public boolean hasDataChanged(String credentials, String propertyId, DateRange dateRange) {
        return coordinator.hasDataChanged(credentials, propertyId, dateRange);
    }

    public Map<String, FilterCriteria> quickFilterSuggestions() {
        int active = preferenceStore.stats().getActive();

        Map<String, FilterCriteria> suggestions = new LinkedHashMap<>();
        suggestions.put("topPerformers", FilterCriteria.builder()
                .priorities(List.of(PropertyPriority.HIGH))
                .activeOnly(true)
                .limit(10)
                .sortBy(SortBy.PRIORITY)
                .build());
        suggestions.put("recentlyUsed", FilterCriteria.builder()
                .activeOnly(true)
                .limit(15)
                .sortBy(SortBy.LAST_ACCESSED)
                .build());
        suggestions.put("favorites", FilterCriteria.builder()
                .priorities(List.of(PropertyPriority.HIGH, PropertyPriority.MEDIUM))
                .activeOnly(true)
                .limit(Math.min(20, (int) Math.floor(active * 0.3)))
                .sortBy(SortBy.PRIORITY)
                .build());
        return suggestions;
    }

    /**
     * Stop auto-sync and drop listeners, cached data and statuses.
     */
    @PreDestroy
    public void dispose() {
        autoSyncScheduler.stop();
        listenerBus.clear();
        cacheStore.clear();
        statusTracker.clear();
        log.info("Analytics sync engine disposed");
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
