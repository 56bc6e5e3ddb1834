package com.analyticssync.infrastructure.upstream;

import lombok.Getter;

/**
 * Failure reported by the analytics backend. Opaque to the sync engine apart from its category.
 */
@Getter
public class UpstreamFetchException extends RuntimeException {

    private final ErrorCategory category;

    public UpstreamFetchException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public UpstreamFetchException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public boolean isRetryable() {
        return category.isRetryable();
    }
}
