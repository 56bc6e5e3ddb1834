package com.analyticssync.api;

public class NoPropertiesFoundException extends RuntimeException {

    public NoPropertiesFoundException(String message) {
        super(message);
    }
}
