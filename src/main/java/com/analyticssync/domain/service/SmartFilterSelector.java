package com.analyticssync.domain.service;

import com.analyticssync.domain.model.AnalyticsProperty;
import com.analyticssync.domain.model.FilterCriteria;
import com.analyticssync.domain.model.PropertyPreference;
import com.analyticssync.domain.model.PropertyPriority;
import com.analyticssync.domain.model.SortBy;
import com.analyticssync.infrastructure.preferences.PropertyPreferenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Narrows the property catalog down to a working set worth fetching.
 *
 * Selection Flow:
 * 1. Apply the caller's criteria, if any
 * 2. Still above the cap: take active HIGH priority properties, sorted by priority
 * 3. None of those: take active properties, most recently accessed first
 * 4. Neither tier matched anything: truncate the criteria result to the cap
 *
 * Every sort breaks ties by display name, so the output is deterministic for a given input order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmartFilterSelector {

    private final PropertyPreferenceStore preferenceStore;

    public List<AnalyticsProperty> select(List<AnalyticsProperty> candidates, FilterCriteria criteria, int maxCount) {
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be positive: " + maxCount);
        }
        List<AnalyticsProperty> filtered = criteria != null ? filter(candidates, criteria) : new ArrayList<>(candidates);
        if (filtered.size() <= maxCount) {
            return filtered;
        }

        List<AnalyticsProperty> favorites = filter(candidates, FilterCriteria.builder()
                .priorities(List.of(PropertyPriority.HIGH))
                .activeOnly(true)
                .limit(maxCount)
                .sortBy(SortBy.PRIORITY)
                .build());
        if (!favorites.isEmpty()) {
            log.debug("Selected {} high priority properties out of {}", favorites.size(), candidates.size());
            return favorites;
        }

        List<AnalyticsProperty> recent = filter(candidates, FilterCriteria.builder()
                .activeOnly(true)
                .limit(maxCount)
                .sortBy(SortBy.LAST_ACCESSED)
                .build());
        if (!recent.isEmpty()) {
            log.debug("Selected {} recently accessed properties out of {}", recent.size(), candidates.size());
            return recent;
        }

        return new ArrayList<>(filtered.subList(0, maxCount));
    }

    /**
     * Apply criteria: filters, then sort, then limit.
     *
     * A property without a stored preference only passes when activeOnly is not requested;
     * the other filters do not apply to it.
     */
    public List<AnalyticsProperty> filter(List<AnalyticsProperty> properties, FilterCriteria criteria) {
        List<AnalyticsProperty> result = new ArrayList<>();
        for (AnalyticsProperty property : properties) {
            Optional<PropertyPreference> preference = preferenceStore.get(property.getPropertyId());
            if (preference.isEmpty()) {
                if (!criteria.isActiveOnly()) {
                    result.add(property);
                }
                continue;
            }
            if (matches(preference.get(), criteria)) {
                result.add(property);
            }
        }

        if (criteria.getSortBy() != null) {
            result.sort(comparator(criteria.getSortBy()));
        }
        if (criteria.getLimit() != null && criteria.getLimit() > 0 && result.size() > criteria.getLimit()) {
            result = new ArrayList<>(result.subList(0, criteria.getLimit()));
        }
        return result;
    }

    private static boolean matches(PropertyPreference preference, FilterCriteria criteria) {
        if (criteria.isActiveOnly() && !preference.isEnabled()) {
            return false;
        }
        if (criteria.getPriorities() != null && !criteria.getPriorities().isEmpty()
                && !criteria.getPriorities().contains(preference.priorityOrDefault())) {
            return false;
        }
        if (criteria.getTags() != null && !criteria.getTags().isEmpty()
                && criteria.getTags().stream().noneMatch(preference.tagsOrEmpty()::contains)) {
            return false;
        }
        if (criteria.getSearchQuery() != null && !criteria.getSearchQuery().isBlank()) {
            String query = criteria.getSearchQuery().toLowerCase(Locale.ROOT);
            return contains(preference.getName(), query)
                    || contains(preference.getDisplayName(), query)
                    || preference.tagsOrEmpty().stream().anyMatch(tag -> contains(tag, query));
        }
        return true;
    }

    private Comparator<AnalyticsProperty> comparator(SortBy sortBy) {
        // Preferences are looked up once per sort, not once per comparison
        Map<String, PropertyPreference> snapshot = new HashMap<>();
        Comparator<AnalyticsProperty> byName = Comparator.comparing(
                property -> displayName(property, snapshot), String.CASE_INSENSITIVE_ORDER);

        return switch (sortBy) {
            case PRIORITY -> Comparator.<AnalyticsProperty>comparingInt(
                    property -> -preference(property, snapshot).map(PropertyPreference::priorityOrDefault)
                            .orElse(PropertyPriority.MEDIUM).getRank())
                    .thenComparing(byName);
            case LAST_ACCESSED -> Comparator.<AnalyticsProperty, Instant>comparing(
                    property -> preference(property, snapshot).map(PropertyPreference::getLastAccessed).orElse(null),
                    Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(byName);
            case NAME -> byName;
        };
    }

    private Optional<PropertyPreference> preference(AnalyticsProperty property, Map<String, PropertyPreference> snapshot) {
        if (!snapshot.containsKey(property.getPropertyId())) {
            snapshot.put(property.getPropertyId(), preferenceStore.get(property.getPropertyId()).orElse(null));
        }
        return Optional.ofNullable(snapshot.get(property.getPropertyId()));
    }

    private String displayName(AnalyticsProperty property, Map<String, PropertyPreference> snapshot) {
        String name = preference(property, snapshot)
                .map(PropertyPreference::getDisplayName)
                .orElse(property.getDisplayName());
        return name != null ? name : property.getPropertyId();
    }

    private static boolean contains(String value, String query) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(query);
    }
}
