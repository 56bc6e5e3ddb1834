package com.analyticssync.api.dto;

import com.analyticssync.domain.model.DateRange;
import com.analyticssync.domain.model.FilterCriteria;
import com.analyticssync.domain.model.OptimizedFetchOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /optimized. Omitted limits fall back to the engine defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizedFetchRequest {

    @NotNull
    @Valid
    private DateRange dateRange;

    @Valid
    private FilterCriteria filterCriteria;

    @Positive
    private Integer maxEntities;

    @Positive
    private Integer concurrency;

    @PositiveOrZero
    private Long minTrafficThreshold;

    private Boolean useCache;

    public OptimizedFetchOptions toOptions() {
        return OptimizedFetchOptions.builder()
                .filterCriteria(filterCriteria)
                .maxEntities(maxEntities)
                .concurrency(concurrency)
                .minTrafficThreshold(minTrafficThreshold)
                .useCache(useCache == null || useCache)
                .build();
    }
}
