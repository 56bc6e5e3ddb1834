package com.analyticssync.api;

import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.BatchResult;
import com.analyticssync.domain.model.CacheStats;
import com.analyticssync.domain.model.DataSource;
import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.OptimizedFetchOptions;
import com.analyticssync.domain.model.SyncedData;
import com.analyticssync.domain.service.AnalyticsSyncService;
import com.analyticssync.infrastructure.upstream.ErrorCategory;
import com.analyticssync.infrastructure.upstream.UpstreamFetchException;
import com.analyticssync.support.TestReports;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalyticsSyncController.class)
class AnalyticsSyncControllerTest {

    private static final String BEARER = "Bearer token";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalyticsSyncService syncService;

    @Test
    void testGetPropertyData_RequiresBearerToken() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/properties/123/data"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.statusCode").value(401))
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        verifyNoInteractions(syncService);
    }

    @Test
    void testGetPropertyData_DefaultRange() throws Exception {
        // Given
        when(syncService.getDataWithStatus("token", "123", DateRange.of("30daysAgo", "today"), false))
                .thenReturn(SyncedData.builder()
                        .propertyId("123")
                        .payload(TestReports.withUsers(42))
                        .source(DataSource.STALE_FALLBACK)
                        .errorMessage("down")
                        .build());

        // When / Then
        mockMvc.perform(get("/api/v1/analytics/properties/123/data").header("Authorization", BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("STALE_FALLBACK"))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.payload.rowCount").value(1));
    }

    @Test
    void testGetPropertyData_UpstreamFailureMapping() throws Exception {
        // Given
        when(syncService.getDataWithStatus(eq("token"), eq("1"), any(), anyBoolean()))
                .thenThrow(new UpstreamFetchException(ErrorCategory.AUTHENTICATION, "token expired"));
        when(syncService.getDataWithStatus(eq("token"), eq("2"), any(), anyBoolean()))
                .thenThrow(new UpstreamFetchException(ErrorCategory.NETWORK, "down"));

        // When / Then
        mockMvc.perform(get("/api/v1/analytics/properties/1/data").header("Authorization", BEARER))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("token expired"));
        mockMvc.perform(get("/api/v1/analytics/properties/2/data").header("Authorization", BEARER))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.statusCode").value(502));
    }

    @Test
    void testSync_EmptyBodySyncsAllPropertiesForLastWeek() throws Exception {
        // Given
        List<AnalyticsProperty> properties = List.of(AnalyticsProperty.of("1"), AnalyticsProperty.of("2"));
        when(syncService.listProperties("token")).thenReturn(properties);
        when(syncService.batchGetData("token", properties, DateRange.lastSevenDays(), false))
                .thenReturn(Map.of("1", TestReports.withUsers(5)));
        when(syncService.getSyncStatus(List.of("1", "2"))).thenReturn(Map.of());

        // When / Then
        mockMvc.perform(post("/api/v1/analytics/sync").header("Authorization", BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.syncedCount").value(1))
                .andExpect(jsonPath("$.totalProperties").value(2))
                .andExpect(jsonPath("$.autoSyncEnabled").value(false))
                .andExpect(jsonPath("$.dateRange.startDate").value("7daysAgo"));

        verify(syncService, never()).startAutoSync(any(), any(), any(), any());
    }

    @Test
    void testSync_MatchesByIdOrNameAndStartsAutoSync() throws Exception {
        // Given
        AnalyticsProperty first = AnalyticsProperty.of("1");
        AnalyticsProperty second = AnalyticsProperty.of("2");
        AnalyticsProperty third = AnalyticsProperty.of("3");
        when(syncService.listProperties("token")).thenReturn(List.of(first, second, third));
        when(syncService.batchGetData(eq("token"), anyList(), any(), eq(true))).thenReturn(Map.of());

        String body = "{\"propertyIds\":[\"1\",\"properties/3\"],"
                + "\"dateRange\":{\"startDate\":\"2024-01-01\",\"endDate\":\"2024-01-31\"},"
                + "\"forceRefresh\":true,\"enableAutoSync\":true,\"autoSyncIntervalSeconds\":60}";

        // When
        mockMvc.perform(post("/api/v1/analytics/sync")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoSyncEnabled").value(true));

        // Then
        DateRange range = DateRange.of("2024-01-01", "2024-01-31");
        verify(syncService).batchGetData("token", List.of(first, third), range, true);
        verify(syncService).startAutoSync("token", List.of(first, third), range, Duration.ofSeconds(60));
    }

    @Test
    void testSync_NoMatchingProperties() throws Exception {
        // Given
        when(syncService.listProperties("token")).thenReturn(List.of(AnalyticsProperty.of("1")));

        // When / Then
        mockMvc.perform(post("/api/v1/analytics/sync")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"propertyIds\":[\"999\"]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.statusCode").value(404));

        verify(syncService, never()).batchGetData(any(), any(), any(), anyBoolean());
    }

    @Test
    void testSyncStatus_ReturnsStatusesAndCacheStats() throws Exception {
        // Given
        when(syncService.getSyncStatus(List.of("1", "2"))).thenReturn(Map.of());
        when(syncService.cacheStats()).thenReturn(new CacheStats(3, 1000, null, null));

        // When / Then
        mockMvc.perform(get("/api/v1/analytics/sync").param("propertyIds", "1,2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheStats.size").value(3))
                .andExpect(jsonPath("$.cacheStats.maxSize").value(1000));
    }

    @Test
    void testClearSync_ClearsAllAndStopsAutoSync() throws Exception {
        mockMvc.perform(delete("/api/v1/analytics/sync")
                        .header("Authorization", BEARER)
                        .param("stopAutoSync", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoSyncStopped").value(true));

        verify(syncService).clearCache(null);
        verify(syncService).stopAutoSync();
    }

    @Test
    void testOptimized_RequiresDateRange() throws Exception {
        mockMvc.perform(post("/api/v1/analytics/optimized")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxEntities\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.statusCode").value(400));

        verifyNoInteractions(syncService);
    }

    @Test
    void testOptimized_PassesOptions() throws Exception {
        // Given
        when(syncService.fetchOptimized(eq("token"), any(), any())).thenReturn(BatchResult.empty());
        String body = "{\"dateRange\":{\"startDate\":\"30daysAgo\",\"endDate\":\"today\"},"
                + "\"filterCriteria\":{\"priorities\":[\"HIGH\"],\"activeOnly\":true,\"sortBy\":\"PRIORITY\"},"
                + "\"maxEntities\":5,\"concurrency\":2,\"useCache\":false}";

        // When
        mockMvc.perform(post("/api/v1/analytics/optimized")
                        .header("Authorization", BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheHits").value(0));

        // Then
        ArgumentCaptor<OptimizedFetchOptions> options = ArgumentCaptor.forClass(OptimizedFetchOptions.class);
        verify(syncService).fetchOptimized(eq("token"), eq(DateRange.of("30daysAgo", "today")), options.capture());
        assertEquals(5, options.getValue().getMaxEntities());
        assertEquals(2, options.getValue().getConcurrency());
        assertFalse(options.getValue().isUseCache());
        assertTrue(options.getValue().getFilterCriteria().isActiveOnly());
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
