package com.analyticssync.api.dto;

import lombok.Value;

import java.time.Instant;

/**
 * Error body returned by every endpoint: error (short title), message, HTTP status and timestamp.
 */
@Value
public class ApiError {

    String error;
    String message;
    int statusCode;
    Instant timestamp;

    public static ApiError of(String error, String message, int statusCode) {
        return new ApiError(error, message, statusCode, Instant.now());
    }
}
