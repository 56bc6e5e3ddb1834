package com.analyticssync.infrastructure.upstream;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Upstream failure classes. Only transient ones are retried by the caller-side retry policy.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCategory {
    AUTHENTICATION(false),
    PERMISSION(false),
    NETWORK(true),
    TIMEOUT(true),
    RATE_LIMIT(true),
    DATA_UNAVAILABLE(false),
    UNKNOWN(false);

    private final boolean retryable;
}
