package com.analyticssync.api;

import com.analyticssync.api.dto.ClearSyncResponse;
import com.analyticssync.api.dto.OptimizedFetchRequest;
import com.analyticssync.api.dto.SyncRequest;
import com.analyticssync.api.dto.SyncResponse;
import com.analyticssync.api.dto.SyncStatusResponse;
import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.BatchResult;
import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.SyncedData;
import com.analyticssync.domain.service.AnalyticsSyncService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST API for the analytics sync engine.
 *
 * Endpoints:
 * - GET /api/v1/analytics/properties/{propertyId}/data - Data for one property, cache first
 * - POST /api/v1/analytics/sync - Sync properties, optionally start auto-sync
 * - GET /api/v1/analytics/sync - Sync status and cache statistics
 * - DELETE /api/v1/analytics/sync - Clear cache, optionally stop auto-sync
 * - POST /api/v1/analytics/optimized - Filtered, capped fetch over the property catalog
 *
 * Every endpoint except health and sync status needs an "Authorization: Bearer ..." header;
 * the token is passed to the analytics backend as is.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsSyncController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AnalyticsSyncService syncService;

    /**
     * GET /api/v1/analytics/properties/{propertyId}/data?startDate=30daysAgo&endDate=today&forceRefresh=false
     *
     * Response carries the payload and where it came from (CACHE, NETWORK or STALE_FALLBACK).
     */
    @GetMapping("/properties/{propertyId}/data")
    public ResponseEntity<SyncedData> getPropertyData(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String propertyId,
            @RequestParam(defaultValue = "30daysAgo") String startDate,
            @RequestParam(defaultValue = "today") String endDate,
            @RequestParam(defaultValue = "false") boolean forceRefresh) {

        String credentials = bearerToken(authorization);
        log.info("Get property data: propertyId={}, range={}..{}, forceRefresh={}",
                propertyId, startDate, endDate, forceRefresh);

        SyncedData data = syncService.getDataWithStatus(credentials, propertyId,
                DateRange.of(startDate, endDate), forceRefresh);

        return ResponseEntity.ok(data);
    }

    /**
     * POST /api/v1/analytics/sync
     *
     * Request body (all optional):
     * {
     *   "propertyIds": ["123", "properties/456"],
     *   "dateRange": {"startDate": "7daysAgo", "endDate": "today"},
     *   "forceRefresh": false,
     *   "enableAutoSync": false,
     *   "autoSyncIntervalSeconds": 120
     * }
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncResponse> sync(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody(required = false) SyncRequest request) {

        String credentials = bearerToken(authorization);
        SyncRequest body = request != null ? request : new SyncRequest();
        DateRange dateRange = body.getDateRange() != null ? body.getDateRange() : DateRange.lastSevenDays();

        List<AnalyticsProperty> properties = selectProperties(syncService.listProperties(credentials),
                body.getPropertyIds());
        if (properties.isEmpty()) {
            throw new NoPropertiesFoundException("No accessible analytics properties found");
        }

        log.info("Sync {} properties: range={}..{}, forceRefresh={}, autoSync={}", properties.size(),
                dateRange.getStartDate(), dateRange.getEndDate(), body.isForceRefresh(), body.isEnableAutoSync());

        Map<String, AnalyticsReport> synced = syncService.batchGetData(credentials, properties, dateRange,
                body.isForceRefresh());

        if (body.isEnableAutoSync()) {
            Duration interval = body.getAutoSyncIntervalSeconds() != null
                    ? Duration.ofSeconds(body.getAutoSyncIntervalSeconds())
                    : null;
            syncService.startAutoSync(credentials, properties, dateRange, interval);
        }

        List<String> propertyIds = properties.stream().map(AnalyticsProperty::getPropertyId).toList();

        return ResponseEntity.ok(SyncResponse.builder()
                .syncedProperties(new ArrayList<>(synced.keySet()))
                .syncedCount(synced.size())
                .totalProperties(properties.size())
                .syncStatus(syncService.getSyncStatus(propertyIds))
                .autoSyncEnabled(body.isEnableAutoSync())
                .dateRange(dateRange)
                .timestamp(Instant.now())
                .build());
    }

    /**
     * GET /api/v1/analytics/sync?propertyIds=123,456
     */
    @GetMapping("/sync")
    public ResponseEntity<SyncStatusResponse> syncStatus(
            @RequestParam(required = false) List<String> propertyIds) {

        return ResponseEntity.ok(SyncStatusResponse.builder()
                .syncStatus(syncService.getSyncStatus(propertyIds))
                .cacheStats(syncService.cacheStats())
                .autoSyncRunning(syncService.isAutoSyncRunning())
                .timestamp(Instant.now())
                .build());
    }

    /**
     * DELETE /api/v1/analytics/sync?propertyIds=123,456&stopAutoSync=true
     *
     * Without propertyIds the whole cache is cleared.
     */
    @DeleteMapping("/sync")
    public ResponseEntity<ClearSyncResponse> clearSync(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) List<String> propertyIds,
            @RequestParam(defaultValue = "false") boolean stopAutoSync) {

        bearerToken(authorization);
        log.info("Clear sync data: propertyIds={}, stopAutoSync={}", propertyIds, stopAutoSync);

        syncService.clearCache(propertyIds);
        if (stopAutoSync) {
            syncService.stopAutoSync();
        }

        return ResponseEntity.ok(ClearSyncResponse.builder()
                .clearedProperties(propertyIds)
                .autoSyncStopped(stopAutoSync)
                .timestamp(Instant.now())
                .build());
    }

    /**
     * POST /api/v1/analytics/optimized
     *
     * Request body:
     * {
     *   "dateRange": {"startDate": "30daysAgo", "endDate": "today"},
     *   "filterCriteria": {"priorities": ["HIGH"], "activeOnly": true, "sortBy": "PRIORITY"},
     *   "maxEntities": 20,
     *   "concurrency": 3,
     *   "minTrafficThreshold": 100,
     *   "useCache": true
     * }
     */
    @PostMapping("/optimized")
    public ResponseEntity<BatchResult> fetchOptimized(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody OptimizedFetchRequest request) {

        String credentials = bearerToken(authorization);
        log.info("Optimized fetch: maxEntities={}, concurrency={}", request.getMaxEntities(), request.getConcurrency());

        BatchResult result = syncService.fetchOptimized(credentials, request.getDateRange(), request.toOptions());

        return ResponseEntity.ok(result);
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static List<AnalyticsProperty> selectProperties(List<AnalyticsProperty> properties, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return properties;
        }
        return properties.stream()
                .filter(property -> ids.contains(property.getPropertyId()) || ids.contains(property.getName()))
                .toList();
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)
                || authorization.substring(BEARER_PREFIX.length()).isBlank()) {
            throw new MissingCredentialsException("No valid access token found. Please re-authenticate.");
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
