package com.analyticssync.infrastructure.cache;

import com.analyticssync.config.SyncEngineProperties;
import com.analyticssync.domain.model.CacheKey;
import com.analyticssync.domain.model.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-process, size-bounded store of analytics reports.
 *
 * Storage Strategy:
 * - One entry per (property, start date, end date)
 * - Entries older than the TTL are stale but still returned, so callers can fall back to them
 * - At capacity, inserting a new key evicts the entry with the oldest write time
 *
 * Eviction uses an index ordered by (writtenAt, insertion sequence), so finding the
 * oldest entry is O(log n) instead of a full scan.
 *
 * Hit/miss accounting is left to callers; get() has no side effects.
 */
@Slf4j
@Component
public class CacheStore {

    private final Clock clock;
    private final Duration ttl;
    private final int maxSize;

    private final Map<CacheKey, Slot> entries = new HashMap<>();
    private final TreeMap<Slot, CacheKey> byAge = new TreeMap<>();
    private long sequence;

    @Autowired
    public CacheStore(SyncEngineProperties properties, Clock clock) {
        this(clock, properties.getCacheTtl(), properties.getMaxCacheSize());
    }

    public CacheStore(Clock clock, Duration ttl, int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + maxSize);
        }
        this.clock = clock;
        this.ttl = ttl;
        this.maxSize = maxSize;
    }

    public synchronized Optional<CacheEntry> get(CacheKey key) {
        Slot slot = entries.get(key);
        return slot == null ? Optional.empty() : Optional.of(slot.entry);
    }

    public boolean isFresh(CacheEntry entry) {
        return Duration.between(entry.getWrittenAt(), clock.instant()).compareTo(ttl) < 0;
    }

    /**
     * Store an entry, replacing any previous entry for the same key.
     *
     * Replacing never evicts; only a new key arriving at capacity does.
     */
    public synchronized void put(CacheKey key, CacheEntry entry) {
        Slot previous = entries.remove(key);
        if (previous != null) {
            byAge.remove(previous);
        } else if (entries.size() >= maxSize) {
            evictOldest();
        }

        Slot slot = new Slot(entry.getWrittenAt(), sequence++, entry);
        entries.put(key, slot);
        byAge.put(slot, key);
    }

    /**
     * Remove the given keys, or every entry when keys is null.
     */
    public synchronized void invalidate(Collection<CacheKey> keys) {
        if (keys == null) {
            clear();
            return;
        }
        for (CacheKey key : keys) {
            remove(key);
        }
    }

    /**
     * Remove every date range cached for the given properties.
     */
    public synchronized int invalidateProperties(Collection<String> propertyIds) {
        Set<String> ids = new HashSet<>(propertyIds);
        Set<CacheKey> matching = new HashSet<>();
        for (CacheKey key : entries.keySet()) {
            if (ids.contains(key.getPropertyId())) {
                matching.add(key);
            }
        }
        matching.forEach(this::remove);
        log.debug("Invalidated {} cache entries for properties {}", matching.size(), ids);
        return matching.size();
    }

    public synchronized void clear() {
        entries.clear();
        byAge.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        Instant oldest = byAge.isEmpty() ? null : byAge.firstKey().writtenAt;
        Instant newest = byAge.isEmpty() ? null : byAge.lastKey().writtenAt;
        return new CacheStats(entries.size(), maxSize, oldest, newest);
    }

    private void remove(CacheKey key) {
        Slot slot = entries.remove(key);
        if (slot != null) {
            byAge.remove(slot);
        }
    }

    private void evictOldest() {
        Map.Entry<Slot, CacheKey> oldest = byAge.pollFirstEntry();
        if (oldest != null) {
            entries.remove(oldest.getValue());
            log.debug("Evicted cache entry {} written at {}", oldest.getValue(), oldest.getKey().writtenAt);
        }
    }

    private static final class Slot implements Comparable<Slot> {

        private final Instant writtenAt;
        private final long sequence;
        private final CacheEntry entry;

        private Slot(Instant writtenAt, long sequence, CacheEntry entry) {
            this.writtenAt = writtenAt;
            this.sequence = sequence;
            this.entry = entry;
        }

        @Override
        public int compareTo(Slot other) {
            int byTime = writtenAt.compareTo(other.writtenAt);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
