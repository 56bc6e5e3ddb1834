package com.analyticssync.infrastructure.upstream;

import java.util.function.Predicate;

/**
 * Referenced from application.yml: decides which failures the analyticsUpstream retry
 * repeats and which ones the circuit breaker records.
 */
public class RetryableUpstreamPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof UpstreamFetchException e && e.isRetryable();
    }
}
