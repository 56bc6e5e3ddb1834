package com.analyticssync.domain.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Property selection criteria supplied by dashboards or the assistant. Every field is optional.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FilterCriteria {

    List<PropertyPriority> priorities;
    List<String> tags;
    boolean activeOnly;

    @PositiveOrZero
    Integer limit;

    SortBy sortBy;
    String searchQuery;

    public static FilterCriteria none() {
        return FilterCriteria.builder().build();
    }
}
