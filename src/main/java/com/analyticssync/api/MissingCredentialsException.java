package com.analyticssync.api;

/**
 * Request carried no usable bearer token.
 */
public class MissingCredentialsException extends RuntimeException {

    public MissingCredentialsException(String message) {
        super(message);
    }
}
