package com.analyticssync.infrastructure.upstream;

import com.analyticssync.config.SyncEngineConfig;
import com.analyticssync.config.UpstreamProperties;
import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.MetricHeader;
import com.analyticssync.domain.model.ReportRow;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the analytics reporting backend (GA4 Data and Admin APIs).
 *
 * Every call carries the caller's OAuth access token as a bearer credential.
 * Transient failures (network, timeout, quota) are retried with exponential backoff by the
 * analyticsUpstream retry; the circuit breaker stops hammering a backend that keeps failing.
 */
@Slf4j
@Component
public class GoogleAnalyticsClient implements AnalyticsDataFetcher, PropertyCatalog {

    public static final String UPSTREAM = "analyticsUpstream";

    private static final int PAGE_SIZE = 200;

    private final RestClient restClient;
    private final UpstreamProperties properties;

    public GoogleAnalyticsClient(@Qualifier(SyncEngineConfig.UPSTREAM_REST_CLIENT) RestClient restClient,
                                 UpstreamProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    /**
     * Run a report for one property over the given range with the default dimensions and metrics.
     */
    @Override
    @Retry(name = UPSTREAM)
    @CircuitBreaker(name = UPSTREAM, fallbackMethod = "fetchReportFallback")
    public AnalyticsReport fetchReport(String credentials, String propertyId, DateRange dateRange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dateRanges", List.of(Map.of(
                "startDate", dateRange.getStartDate(),
                "endDate", dateRange.getEndDate())));
        body.put("dimensions", named(properties.getDefaultDimensions()));
        body.put("metrics", named(properties.getDefaultMetrics()));

        try {
            JsonNode response = restClient.post()
                    .uri(properties.getDataApiBaseUrl() + "/properties/{propertyId}:runReport", propertyId)
                    .headers(headers -> headers.setBearerAuth(credentials))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);

            AnalyticsReport report = parseReport(response);
            log.debug("Fetched report for property {}: {} rows", propertyId, report.getRowCount());
            return report;

        } catch (RestClientException e) {
            log.warn("Report request failed for property {}: {}", propertyId, e.getMessage());
            throw UpstreamErrorClassifier.classify(
                    "Failed to fetch analytics data for property " + propertyId, e);
        }
    }

    /**
     * List every property reachable with the credentials, following pagination.
     */
    @Override
    @Retry(name = UPSTREAM)
    @CircuitBreaker(name = UPSTREAM, fallbackMethod = "listPropertiesFallback")
    public List<AnalyticsProperty> listProperties(String credentials) {
        List<AnalyticsProperty> result = new ArrayList<>();
        String pageToken = null;

        try {
            do {
                String token = pageToken;
                JsonNode page = restClient.get()
                        .uri(properties.getAdminApiBaseUrl() + "/accountSummaries", builder -> {
                            builder.queryParam("pageSize", PAGE_SIZE);
                            if (token != null) {
                                builder.queryParam("pageToken", token);
                            }
                            return builder.build();
                        })
                        .headers(headers -> headers.setBearerAuth(credentials))
                        .retrieve()
                        .body(JsonNode.class);

                result.addAll(parseAccountSummaries(page));
                pageToken = page == null ? null : textOrNull(page.path("nextPageToken"));
            } while (pageToken != null && !pageToken.isEmpty());

        } catch (RestClientException e) {
            log.warn("Property listing failed: {}", e.getMessage());
            throw UpstreamErrorClassifier.classify("Failed to list analytics properties", e);
        }

        log.debug("Listed {} analytics properties", result.size());
        return result;
    }

    // Fallback methods (circuit breaker open)

    private AnalyticsReport fetchReportFallback(String credentials, String propertyId, DateRange dateRange,
                                                CallNotPermittedException e) {
        log.warn("Upstream circuit breaker open, rejecting report request for property {}", propertyId);
        throw new UpstreamFetchException(ErrorCategory.DATA_UNAVAILABLE,
                "Analytics backend temporarily unavailable for property " + propertyId, e);
    }

    private List<AnalyticsProperty> listPropertiesFallback(String credentials, CallNotPermittedException e) {
        log.warn("Upstream circuit breaker open, rejecting property listing");
        throw new UpstreamFetchException(ErrorCategory.DATA_UNAVAILABLE,
                "Analytics backend temporarily unavailable", e);
    }

    static AnalyticsReport parseReport(JsonNode root) {
        if (root == null) {
            return AnalyticsReport.builder().build();
        }
        List<String> dimensionHeaders = new ArrayList<>();
        for (JsonNode header : root.path("dimensionHeaders")) {
            dimensionHeaders.add(header.path("name").asText(""));
        }
        List<MetricHeader> metricHeaders = new ArrayList<>();
        for (JsonNode header : root.path("metricHeaders")) {
            metricHeaders.add(MetricHeader.builder()
                    .name(header.path("name").asText(""))
                    .type(header.path("type").asText(""))
                    .build());
        }
        return AnalyticsReport.builder()
                .dimensionHeaders(dimensionHeaders)
                .metricHeaders(metricHeaders)
                .rows(parseRows(root.path("rows")))
                .totals(parseRows(root.path("totals")))
                .maximums(parseRows(root.path("maximums")))
                .minimums(parseRows(root.path("minimums")))
                .rowCount(root.path("rowCount").asLong(0))
                .build();
    }

    static List<AnalyticsProperty> parseAccountSummaries(JsonNode root) {
        List<AnalyticsProperty> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        for (JsonNode account : root.path("accountSummaries")) {
            for (JsonNode summary : account.path("propertySummaries")) {
                String name = summary.path("property").asText("");
                String propertyId = name.startsWith("properties/") ? name.substring("properties/".length()) : name;
                result.add(AnalyticsProperty.builder()
                        .propertyId(propertyId)
                        .name(name)
                        .displayName(summary.path("displayName").asText(propertyId))
                        .propertyType(textOrNull(summary.path("propertyType")))
                        .parent(textOrNull(summary.path("parent")))
                        .build());
            }
        }
        return result;
    }

    private static List<ReportRow> parseRows(JsonNode rows) {
        List<ReportRow> result = new ArrayList<>();
        for (JsonNode row : rows) {
            result.add(ReportRow.builder()
                    .dimensionValues(values(row.path("dimensionValues")))
                    .metricValues(values(row.path("metricValues")))
                    .build());
        }
        return result;
    }

    private static List<String> values(JsonNode values) {
        List<String> result = new ArrayList<>();
        for (JsonNode value : values) {
            result.add(value.path("value").asText(""));
        }
        return result;
    }

    private static List<Map<String, String>> named(List<String> names) {
        return names.stream().map(name -> Map.of("name", name)).toList();
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
