package com.analyticssync.support;

import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.ReportRow;

import java.util.List;

public final class TestReports {

    private TestReports() {
    }

    /**
     * Report whose totals row reads users first and sessions second, with one data row.
     */
    public static AnalyticsReport withUsers(long users) {
        return withUsers(users, users * 2);
    }

    public static AnalyticsReport withUsers(long users, long sessions) {
        ReportRow totals = ReportRow.builder()
                .metricValues(List.of(String.valueOf(users), String.valueOf(sessions)))
                .build();
        ReportRow row = ReportRow.builder()
                .dimensionValues(List.of("20240101"))
                .metricValues(List.of(String.valueOf(users), String.valueOf(sessions)))
                .build();
        return AnalyticsReport.builder()
                .dimensionHeaders(List.of("date"))
                .rows(List.of(row))
                .totals(List.of(totals))
                .rowCount(1)
                .build();
    }
}
