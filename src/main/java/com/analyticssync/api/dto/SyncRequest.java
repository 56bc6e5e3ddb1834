package com.analyticssync.api.dto;

import com.analyticssync.domain.model.DateRange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of POST /sync. Every field is optional; an empty body syncs every property for the last 7 days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    /** Matched against property id or resource name. */
    private List<String> propertyIds;

    @Valid
    private DateRange dateRange;

    private boolean forceRefresh;
    private boolean enableAutoSync;

    @Positive
    private Long autoSyncIntervalSeconds;
}
