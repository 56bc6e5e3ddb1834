package com.analyticssync.domain.sync;

import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.DateRange;

/**
 * Callback fired after a successful upstream fetch replaced a cached report.
 */
@FunctionalInterface
public interface DataUpdateListener {

    void onDataUpdated(String propertyId, AnalyticsReport report, DateRange dateRange);
}
