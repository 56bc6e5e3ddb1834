package com.analyticssync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * User-managed metadata for a property: priority, tags, active flag and last access.
 *
 * Used both as the stored record and as a partial update, where null fields mean "keep".
 * Stored records always have priority, tags and active filled in.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PropertyPreference {

    String propertyId;
    String name;
    String displayName;
    PropertyPriority priority;
    List<String> tags;
    Boolean active;
    Instant lastAccessed;

    /** Minimum users for the property to be worth fetching; informational. */
    Long organicTrafficThreshold;

    @JsonIgnore
    public boolean isEnabled() {
        return !Boolean.FALSE.equals(active);
    }

    @JsonIgnore
    public PropertyPriority priorityOrDefault() {
        return priority != null ? priority : PropertyPriority.MEDIUM;
    }

    @JsonIgnore
    public List<String> tagsOrEmpty() {
        return tags != null ? tags : List.of();
    }
}
