package com.analyticssync.domain.service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal shared by the fetches one owner dispatches.
 *
 * Callbacks registered with {@link #onCancel} run exactly once, on the cancelling thread,
 * or immediately if the token is already cancelled.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("This token cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable callback : callbacks) {
                if (callbacks.remove(callback)) {
                    callback.run();
                }
            }
        }
    }

    /**
     * @return deregisters the callback; call it once the guarded work has finished
     */
    public Runnable onCancel(Runnable callback) {
        if (!cancellable) {
            return () -> { };
        }
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }
}
