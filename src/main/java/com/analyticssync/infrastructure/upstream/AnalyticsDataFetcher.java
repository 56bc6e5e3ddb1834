package com.analyticssync.infrastructure.upstream;

import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.DateRange;

/**
 * Upstream report source. Blocking; implementations own their timeouts.
 */
public interface AnalyticsDataFetcher {

    /**
     * @throws UpstreamFetchException on network, auth or quota failures
     */
    AnalyticsReport fetchReport(String credentials, String propertyId, DateRange dateRange);
}
