package com.analyticssync.infrastructure.upstream;

import com.analyticssync.config.UpstreamProperties;
import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.DateRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Unit tests for GoogleAnalyticsClient against a mocked HTTP server.
 *
 * Retry and circuit breaking are Spring proxies and are not active here.
 */
class GoogleAnalyticsClientTest {

    private static final DateRange RANGE = DateRange.of("2024-01-01", "2024-01-31");

    private MockRestServiceServer server;
    private GoogleAnalyticsClient client;

    @BeforeEach
    void setUp() {
        UpstreamProperties properties = new UpstreamProperties();
        properties.setDataApiBaseUrl("https://data.test/v1beta");
        properties.setAdminApiBaseUrl("https://admin.test/v1beta");
        properties.setDefaultMetrics(List.of("activeUsers", "sessions"));
        properties.setDefaultDimensions(List.of("date"));

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GoogleAnalyticsClient(builder.build(), properties);
    }

    @Test
    void testFetchReport_SendsReportRequestAndParsesResponse() {
        // Given
        server.expect(requestTo("https://data.test/v1beta/properties/123:runReport"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer token"))
                .andExpect(jsonPath("$.dateRanges[0].startDate").value("2024-01-01"))
                .andExpect(jsonPath("$.dateRanges[0].endDate").value("2024-01-31"))
                .andExpect(jsonPath("$.metrics[0].name").value("activeUsers"))
                .andExpect(jsonPath("$.dimensions[0].name").value("date"))
                .andRespond(withSuccess(new ClassPathResource("upstream/run-report.json"), MediaType.APPLICATION_JSON));

        // When
        AnalyticsReport report = client.fetchReport("token", "123", RANGE);

        // Then
        server.verify();
        assertEquals(List.of("date"), report.getDimensionHeaders());
        assertEquals("TYPE_INTEGER", report.getMetricHeaders().get(0).getType());
        assertEquals(2, report.getRows().size());
        assertEquals(List.of("20240102"), report.getRows().get(1).getDimensionValues());
        assertEquals(2, report.getRowCount());
        assertEquals(120, report.getUsers());
        assertEquals(300, report.getSessions());
    }

    @Test
    void testFetchReport_UnauthorizedIsNotRetryable() {
        // Given
        server.expect(requestTo("https://data.test/v1beta/properties/123:runReport"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        // When
        UpstreamFetchException e = assertThrows(UpstreamFetchException.class,
                () -> client.fetchReport("token", "123", RANGE));

        // Then
        assertEquals(ErrorCategory.AUTHENTICATION, e.getCategory());
        assertFalse(e.isRetryable());
    }

    @Test
    void testFetchReport_QuotaAndServerErrorsAreRetryable() {
        // Given
        server.expect(requestTo("https://data.test/v1beta/properties/1:runReport"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo("https://data.test/v1beta/properties/2:runReport"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo("https://data.test/v1beta/properties/3:runReport"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        // When
        UpstreamFetchException quota = assertThrows(UpstreamFetchException.class,
                () -> client.fetchReport("token", "1", RANGE));
        UpstreamFetchException unavailable = assertThrows(UpstreamFetchException.class,
                () -> client.fetchReport("token", "2", RANGE));
        UpstreamFetchException forbidden = assertThrows(UpstreamFetchException.class,
                () -> client.fetchReport("token", "3", RANGE));

        // Then
        assertEquals(ErrorCategory.RATE_LIMIT, quota.getCategory());
        assertEquals(ErrorCategory.NETWORK, unavailable.getCategory());
        assertEquals(ErrorCategory.PERMISSION, forbidden.getCategory());

        RetryableUpstreamPredicate predicate = new RetryableUpstreamPredicate();
        assertTrue(predicate.test(quota));
        assertTrue(predicate.test(unavailable));
        assertFalse(predicate.test(forbidden));
        assertFalse(predicate.test(new IllegalStateException("not upstream")));
    }

    @Test
    void testListProperties_FollowsPagination() {
        // Given
        server.expect(requestTo("https://admin.test/v1beta/accountSummaries?pageSize=200"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer token"))
                .andRespond(withSuccess(new ClassPathResource("upstream/account-summaries-page1.json"),
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://admin.test/v1beta/accountSummaries?pageSize=200&pageToken=page-2"))
                .andRespond(withSuccess(new ClassPathResource("upstream/account-summaries-page2.json"),
                        MediaType.APPLICATION_JSON));

        // When
        List<AnalyticsProperty> properties = client.listProperties("token");

        // Then
        server.verify();
        assertEquals(List.of("111", "222", "333"),
                properties.stream().map(AnalyticsProperty::getPropertyId).toList());
        AnalyticsProperty first = properties.get(0);
        assertEquals("properties/111", first.getName());
        assertEquals("Acme Shop", first.getDisplayName());
        assertEquals("PROPERTY_TYPE_ORDINARY", first.getPropertyType());
        assertNull(properties.get(1).getPropertyType());
    }

    @Test
    void testClassifier_TimeoutsAndIoFailures() {
        ResourceAccessException timeout = new ResourceAccessException("read timed out",
                new SocketTimeoutException("Read timed out"));
        ResourceAccessException reset = new ResourceAccessException("connection reset",
                new IOException("Connection reset"));

        assertEquals(ErrorCategory.TIMEOUT, UpstreamErrorClassifier.categoryOf(timeout));
        assertEquals(ErrorCategory.NETWORK, UpstreamErrorClassifier.categoryOf(reset));
    }
}
