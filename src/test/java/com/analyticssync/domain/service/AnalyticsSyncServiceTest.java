package com.analyticssync.domain.service;

import com.analyticssync.config.SyncEngineProperties;
import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.BatchResult;
import com.analyticssync.domain.model.DataSource;
import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.FailedFetch;
import com.analyticssync.domain.model.FetchOutcome;
import com.analyticssync.domain.model.FilterCriteria;
import com.analyticssync.domain.model.FilterStats;
import com.analyticssync.domain.model.OptimizedFetchOptions;
import com.analyticssync.domain.model.SyncedData;
import com.analyticssync.domain.sync.SyncStatusTracker;
import com.analyticssync.domain.sync.UpdateListenerBus;
import com.analyticssync.infrastructure.cache.CacheStore;
import com.analyticssync.infrastructure.preferences.PropertyPreferenceStore;
import com.analyticssync.infrastructure.upstream.ErrorCategory;
import com.analyticssync.infrastructure.upstream.PropertyCatalog;
import com.analyticssync.infrastructure.upstream.UpstreamFetchException;
import com.analyticssync.support.MutableClock;
import com.analyticssync.support.TestReports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnalyticsSyncService.
 *
 * Collaborators are mocked; these tests cover the wiring between them.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsSyncServiceTest {

    private static final String TOKEN = "token";
    private static final DateRange RANGE = DateRange.lastSevenDays();

    @Mock
    private BatchFetchCoordinator coordinator;

    @Mock
    private AutoSyncScheduler autoSyncScheduler;

    @Mock
    private SmartFilterSelector filterSelector;

    @Mock
    private PropertyCatalog propertyCatalog;

    @Mock
    private PropertyPreferenceStore preferenceStore;

    @Mock
    private CacheStore cacheStore;

    @Mock
    private SyncStatusTracker statusTracker;

    @Mock
    private UpdateListenerBus listenerBus;

    private MutableClock clock;
    private AnalyticsSyncService syncService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-02-01T10:00:00Z");
        SyncEngineProperties properties = new SyncEngineProperties();
        syncService = new AnalyticsSyncService(coordinator, autoSyncScheduler, filterSelector, propertyCatalog,
                preferenceStore, cacheStore, statusTracker, listenerBus, properties, clock);
    }

    @Test
    void testGetData_ReturnsPayload() {
        // Given
        AnalyticsReport report = TestReports.withUsers(42);
        when(coordinator.fetchOne(TOKEN, "A", RANGE, false)).thenReturn(CompletableFuture.completedFuture(
                SyncedData.builder().propertyId("A").payload(report).source(DataSource.STALE_FALLBACK).build()));

        // When
        AnalyticsReport result = syncService.getData(TOKEN, "A", RANGE, false);

        // Then
        assertSame(report, result);
    }

    @Test
    void testGetData_RaisesUpstreamErrorUnwrapped() {
        // Given
        UpstreamFetchException failure = new UpstreamFetchException(ErrorCategory.NETWORK, "down");
        when(coordinator.fetchOne(TOKEN, "A", RANGE, true)).thenReturn(CompletableFuture.failedFuture(failure));

        // When
        UpstreamFetchException e = assertThrows(UpstreamFetchException.class,
                () -> syncService.getData(TOKEN, "A", RANGE, true));

        // Then
        assertSame(failure, e);
    }

    @Test
    void testBatchGetData_MapsSuccessesOnly() {
        // Given
        List<AnalyticsProperty> batch = List.of(AnalyticsProperty.of("A"), AnalyticsProperty.of("B"));
        AnalyticsReport report = TestReports.withUsers(10);
        when(coordinator.fetchBatch(TOKEN, batch, RANGE, 3, false, null)).thenReturn(BatchResult.builder()
                .successful(List.of(FetchOutcome.builder().propertyId("A").payload(report).build()))
                .failed(List.of(new FailedFetch("B", "down")))
                .build());

        // When
        Map<String, AnalyticsReport> result = syncService.batchGetData(TOKEN, batch, RANGE, false);

        // Then
        assertEquals(Map.of("A", report), result);
    }

    @Test
    void testFetchOptimized_SelectsFetchesAndMarksAccessed() {
        // Given
        List<AnalyticsProperty> catalog = List.of(AnalyticsProperty.of("A"), AnalyticsProperty.of("B"));
        List<AnalyticsProperty> selected = List.of(AnalyticsProperty.of("A"));
        FilterCriteria criteria = FilterCriteria.builder().activeOnly(true).build();
        when(propertyCatalog.listProperties(TOKEN)).thenReturn(catalog);
        when(filterSelector.select(catalog, criteria, 5)).thenReturn(selected);
        when(coordinator.fetchBatch(TOKEN, selected, RANGE, 3, true, 100L)).thenReturn(BatchResult.builder()
                .successful(List.of(FetchOutcome.builder().propertyId("A").build()))
                .build());

        // When
        BatchResult result = syncService.fetchOptimized(TOKEN, RANGE, OptimizedFetchOptions.builder()
                .filterCriteria(criteria)
                .maxEntities(5)
                .minTrafficThreshold(100L)
                .useCache(false)
                .build());

        // Then
        assertEquals(1, result.getSuccessful().size());
        verify(preferenceStore).markAccessed("A", clock.instant());
        verify(preferenceStore, never()).markAccessed(eq("B"), any());
    }

    @Test
    void testFetchOptimized_EmptyCatalog() {
        // Given
        when(propertyCatalog.listProperties(TOKEN)).thenReturn(List.of());

        // When
        BatchResult result = syncService.fetchOptimized(TOKEN, RANGE, null);

        // Then
        assertTrue(result.getSuccessful().isEmpty());
        verifyNoInteractions(coordinator, filterSelector);
    }

    @Test
    void testStartAutoSync_DefaultInterval() {
        // Given
        List<AnalyticsProperty> batch = List.of(AnalyticsProperty.of("A"));

        // When
        syncService.startAutoSync(TOKEN, batch, RANGE, null);

        // Then
        verify(autoSyncScheduler).start(TOKEN, batch, RANGE, Duration.ofMinutes(2));
    }

    @Test
    void testClearCache_AllOrSelected() {
        // When
        syncService.clearCache(null);
        syncService.clearCache(List.of("A"));

        // Then
        verify(cacheStore).clear();
        verify(cacheStore).invalidateProperties(List.of("A"));
    }

    @Test
    void testQuickFilterSuggestions_FavoritesScaleWithActiveCount() {
        // Given
        when(preferenceStore.stats())
                .thenReturn(new FilterStats(20, 10, Map.of(), Map.of()))
                .thenReturn(new FilterStats(200, 100, Map.of(), Map.of()));

        // When
        Map<String, FilterCriteria> few = syncService.quickFilterSuggestions();
        Map<String, FilterCriteria> many = syncService.quickFilterSuggestions();

        // Then
        assertEquals(List.of("topPerformers", "recentlyUsed", "favorites"), List.copyOf(few.keySet()));
        assertEquals(3, few.get("favorites").getLimit());
        assertEquals(20, many.get("favorites").getLimit());
    }

    @Test
    void testDispose_TearsEverythingDown() {
        // When
        syncService.dispose();

        // Then
        verify(autoSyncScheduler).stop();
        verify(listenerBus).clear();
        verify(cacheStore).clear();
        verify(statusTracker).clear();
    }
}
