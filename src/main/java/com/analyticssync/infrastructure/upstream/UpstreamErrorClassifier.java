package com.analyticssync.infrastructure.upstream;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Maps HTTP client failures onto {@link ErrorCategory}.
 */
final class UpstreamErrorClassifier {

    private UpstreamErrorClassifier() {
    }

    static UpstreamFetchException classify(String context, RestClientException e) {
        ErrorCategory category = categoryOf(e);
        return new UpstreamFetchException(category, context + ": " + e.getMessage(), e);
    }

    static ErrorCategory categoryOf(RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            return switch (status) {
                case 401 -> ErrorCategory.AUTHENTICATION;
                case 403 -> ErrorCategory.PERMISSION;
                case 404 -> ErrorCategory.DATA_UNAVAILABLE;
                case 429 -> ErrorCategory.RATE_LIMIT;
                default -> status >= 500 ? ErrorCategory.NETWORK : ErrorCategory.UNKNOWN;
            };
        }
        if (e instanceof ResourceAccessException) {
            Throwable cause = e.getCause();
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return ErrorCategory.TIMEOUT;
            }
            return ErrorCategory.NETWORK;
        }
        return ErrorCategory.UNKNOWN;
    }
}
