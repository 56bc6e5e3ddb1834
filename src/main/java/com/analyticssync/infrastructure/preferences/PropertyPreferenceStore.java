package com.analyticssync.infrastructure.preferences;

import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.FilterCriteria;
import com.analyticssync.domain.model.FilterStats;
import com.analyticssync.domain.model.PropertyPreference;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Per-property priority, tag and recency metadata used to narrow fetches.
 */
public interface PropertyPreferenceStore {

    Optional<PropertyPreference> get(String propertyId);

    /**
     * Merge the non-null fields of the update into the existing record (or the defaults).
     */
    PropertyPreference upsert(String propertyId, PropertyPreference update);

    /**
     * No-op for properties without a record.
     */
    void markAccessed(String propertyId, Instant accessedAt);

    /**
     * Create default records for properties that have none; existing records are left alone.
     */
    int bulkImport(Iterable<AnalyticsProperty> properties, PropertyPreference defaults);

    Map<String, FilterCriteria> quickFilters();

    FilterStats stats();

    String exportJson();

    /**
     * Replace all records.
     *
     * @throws IllegalArgumentException if the data is not a valid export
     */
    void importJson(String json);
}
