package com.analyticssync.infrastructure.preferences;

import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.FilterCriteria;
import com.analyticssync.domain.model.FilterStats;
import com.analyticssync.domain.model.PropertyPreference;
import com.analyticssync.domain.model.PropertyPriority;
import com.analyticssync.domain.model.SortBy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local preference store. Contents survive only as long as the process;
 * use export/import to carry them across restarts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryPropertyPreferenceStore implements PropertyPreferenceStore {

    private static final TypeReference<Map<String, PropertyPreference>> EXPORT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Map<String, PropertyPreference> preferences = new ConcurrentHashMap<>();

    @Override
    public Optional<PropertyPreference> get(String propertyId) {
        return Optional.ofNullable(preferences.get(propertyId));
    }

    @Override
    public PropertyPreference upsert(String propertyId, PropertyPreference update) {
        return preferences.compute(propertyId, (id, existing) -> merge(id, existing, update));
    }

    @Override
    public void markAccessed(String propertyId, Instant accessedAt) {
        preferences.computeIfPresent(propertyId,
                (id, existing) -> existing.toBuilder().lastAccessed(accessedAt).build());
    }

    @Override
    public int bulkImport(Iterable<AnalyticsProperty> properties, PropertyPreference defaults) {
        int imported = 0;
        for (AnalyticsProperty property : properties) {
            String id = property.getPropertyId();
            PropertyPreference fromProperty = PropertyPreference.builder()
                    .name(property.getName())
                    .displayName(property.getDisplayName())
                    .build();
            PropertyPreference seeded = merge(id, merge(id, null, fromProperty), defaults);
            PropertyPreference previous = preferences.putIfAbsent(id, seeded);
            if (previous == null) {
                imported++;
            }
        }
        log.debug("Bulk imported {} property preferences", imported);
        return imported;
    }

    @Override
    public Map<String, FilterCriteria> quickFilters() {
        Map<String, FilterCriteria> presets = new LinkedHashMap<>();
        presets.put("favorites", FilterCriteria.builder()
                .priorities(List.of(PropertyPriority.HIGH))
                .activeOnly(true)
                .limit(10)
                .sortBy(SortBy.PRIORITY)
                .build());
        presets.put("recent", FilterCriteria.builder()
                .activeOnly(true)
                .limit(15)
                .sortBy(SortBy.LAST_ACCESSED)
                .build());
        presets.put("highPriority", FilterCriteria.builder()
                .priorities(List.of(PropertyPriority.HIGH, PropertyPriority.MEDIUM))
                .activeOnly(true)
                .limit(20)
                .sortBy(SortBy.PRIORITY)
                .build());
        presets.put("all", FilterCriteria.builder()
                .sortBy(SortBy.NAME)
                .build());
        return presets;
    }

    @Override
    public FilterStats stats() {
        Map<PropertyPriority, Integer> byPriority = new EnumMap<>(PropertyPriority.class);
        for (PropertyPriority priority : PropertyPriority.values()) {
            byPriority.put(priority, 0);
        }
        Map<String, Integer> byTags = new TreeMap<>();
        int active = 0;

        for (PropertyPreference preference : preferences.values()) {
            if (preference.isEnabled()) {
                active++;
            }
            byPriority.merge(preference.priorityOrDefault(), 1, Integer::sum);
            for (String tag : preference.tagsOrEmpty()) {
                byTags.merge(tag, 1, Integer::sum);
            }
        }
        return new FilterStats(preferences.size(), active, byPriority, byTags);
    }

    @Override
    public String exportJson() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new TreeMap<>(preferences));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export property preferences", e);
        }
    }

    @Override
    public void importJson(String json) {
        Map<String, PropertyPreference> parsed;
        try {
            parsed = objectMapper.readValue(json, EXPORT_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid filter data format", e);
        }
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid filter data format");
        }
        preferences.clear();
        parsed.forEach((id, preference) -> preferences.put(id, merge(id, null, preference)));
        log.info("Imported {} property preferences", parsed.size());
    }

    private static PropertyPreference merge(String propertyId, PropertyPreference existing, PropertyPreference update) {
        PropertyPreference base = existing != null ? existing : PropertyPreference.builder()
                .propertyId(propertyId)
                .name(propertyId)
                .displayName(propertyId)
                .priority(PropertyPriority.MEDIUM)
                .tags(List.of())
                .active(true)
                .build();
        if (update == null) {
            return base;
        }
        return base.toBuilder()
                .propertyId(propertyId)
                .name(update.getName() != null ? update.getName() : base.getName())
                .displayName(update.getDisplayName() != null ? update.getDisplayName() : base.getDisplayName())
                .priority(update.getPriority() != null ? update.getPriority() : base.getPriority())
                .tags(update.getTags() != null ? List.copyOf(update.getTags()) : base.getTags())
                .active(update.getActive() != null ? update.getActive() : base.getActive())
                .lastAccessed(update.getLastAccessed() != null ? update.getLastAccessed() : base.getLastAccessed())
                .organicTrafficThreshold(update.getOrganicTrafficThreshold() != null
                        ? update.getOrganicTrafficThreshold() : base.getOrganicTrafficThreshold())
                .build();
    }
}
