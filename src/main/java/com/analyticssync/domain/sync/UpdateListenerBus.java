package com.analyticssync.domain.sync;

import com.analyticssync.domain.model.AnalyticsReport;
import com.analyticssync.domain.model.DateRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Synchronous fan-out of data updates to subscribers.
 *
 * A failing listener is logged and skipped; the fetch that triggered the publish
 * and the remaining listeners are unaffected.
 */
@Slf4j
@Component
public class UpdateListenerBus {

    private final Set<DataUpdateListener> listeners = new CopyOnWriteArraySet<>();

    public void subscribe(DataUpdateListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(DataUpdateListener listener) {
        listeners.remove(listener);
    }

    public void publish(String propertyId, AnalyticsReport report, DateRange dateRange) {
        for (DataUpdateListener listener : listeners) {
            try {
                listener.onDataUpdated(propertyId, report, dateRange);
            } catch (Exception e) {
                log.error("Data update listener failed for property {}: {}", propertyId, e.getMessage(), e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }
}
