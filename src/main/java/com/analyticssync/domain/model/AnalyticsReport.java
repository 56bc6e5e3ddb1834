package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Report payload returned by the upstream backend for one property and date range.
 *
 * Immutable: cached entries are replaced wholesale on refresh, never patched.
 * By convention the first requested metric is users and the second sessions,
 * which is what {@link #getUsers()} and {@link #getSessions()} read from the totals row.
 */
@Value
@Builder
@Jacksonized
public class AnalyticsReport {

    @Builder.Default
    List<String> dimensionHeaders = List.of();

    @Builder.Default
    List<MetricHeader> metricHeaders = List.of();

    @Builder.Default
    List<ReportRow> rows = List.of();

    @Builder.Default
    List<ReportRow> totals = List.of();

    @Builder.Default
    List<ReportRow> maximums = List.of();

    @Builder.Default
    List<ReportRow> minimums = List.of();

    long rowCount;

    public long getUsers() {
        return totalMetric(0);
    }

    public long getSessions() {
        return totalMetric(1);
    }

    /**
     * Reads a metric from the first totals row; absent or unparseable values count as 0.
     */
    public long totalMetric(int index) {
        if (totals.isEmpty()) {
            return 0;
        }
        List<String> values = totals.get(0).getMetricValues();
        if (values == null || values.size() <= index || values.get(index) == null) {
            return 0;
        }
        try {
            // Ratio metrics come back as decimals ("0.4312")
            return (long) Double.parseDouble(values.get(index));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
