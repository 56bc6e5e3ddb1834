package com.analyticssync.domain.sync;

import com.analyticssync.domain.model.SyncState;
import com.analyticssync.domain.model.SyncStatus;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest fetch state per property, independent of what is cached.
 *
 * Callers mark SYNCING before an upstream call and exactly one of SUCCESS/ERROR after it.
 * Ordering is not enforced here.
 */
@Component
@RequiredArgsConstructor
public class SyncStatusTracker {

    private final Clock clock;
    private final Map<String, SyncStatus> statuses = new ConcurrentHashMap<>();

    /**
     * @return a claim holding the SYNCING record this call installed and the one it replaced
     */
    public SyncClaim markSyncing(String propertyId) {
        SyncStatus installed = status(propertyId, SyncState.SYNCING, null);
        SyncStatus previous = statuses.put(propertyId, installed);
        return new SyncClaim(propertyId, installed, previous);
    }

    public void markSuccess(String propertyId) {
        update(propertyId, SyncState.SUCCESS, null);
    }

    public void markError(String propertyId, String errorMessage) {
        update(propertyId, SyncState.ERROR, errorMessage);
    }

    /**
     * Put back the status a claim replaced, used when an attempt is abandoned.
     * Only applies while the current record is still the one that claim installed.
     */
    public void restore(SyncClaim claim) {
        statuses.computeIfPresent(claim.getPropertyId(),
                (id, current) -> current == claim.getInstalled() ? claim.getPrevious() : current);
    }

    /**
     * Statuses for the given properties (unknown ids are skipped), or all when ids is null.
     */
    public Map<String, SyncStatus> get(Collection<String> propertyIds) {
        Map<String, SyncStatus> result = new LinkedHashMap<>();
        if (propertyIds == null) {
            result.putAll(statuses);
            return result;
        }
        for (String id : propertyIds) {
            SyncStatus status = statuses.get(id);
            if (status != null) {
                result.put(id, status);
            }
        }
        return result;
    }

    public void clear() {
        statuses.clear();
    }

    private void update(String propertyId, SyncState state, String errorMessage) {
        statuses.put(propertyId, status(propertyId, state, errorMessage));
    }

    private SyncStatus status(String propertyId, SyncState state, String errorMessage) {
        return SyncStatus.builder()
                .propertyId(propertyId)
                .lastSyncAt(clock.instant())
                .state(state)
                .errorMessage(errorMessage)
                .build();
    }

    /**
     * The SYNCING record one attempt installed, with the record it replaced (null if none).
     */
    @Value
    public static class SyncClaim {
        String propertyId;
        SyncStatus installed;
        SyncStatus previous;
    }
}
