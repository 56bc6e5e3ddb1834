package com.analyticssync.domain.model;

import lombok.Value;

@Value
public class FailedFetch {
    String propertyId;
    String error;
}
