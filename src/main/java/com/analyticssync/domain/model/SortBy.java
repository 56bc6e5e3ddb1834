package com.analyticssync.domain.model;

public enum SortBy {
    PRIORITY,
    NAME,
    LAST_ACCESSED
}
