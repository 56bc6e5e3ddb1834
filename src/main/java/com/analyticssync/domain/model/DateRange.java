package com.analyticssync.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reporting window passed through to the upstream backend.
 *
 * Values are kept as the backend understands them ("2024-01-31", "7daysAgo", "today"),
 * so two ranges are equal only when their literal bounds are equal.
 */
@Value
@Builder
@Jacksonized
public class DateRange {

    @NotBlank
    String startDate;

    @NotBlank
    String endDate;

    public static DateRange of(String startDate, String endDate) {
        return new DateRange(startDate, endDate);
    }

    public static DateRange lastSevenDays() {
        return new DateRange("7daysAgo", "today");
    }
}
