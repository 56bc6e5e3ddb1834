package com.analyticssync.domain.model;

public enum SyncState {
    SYNCING,
    SUCCESS,
    ERROR
}
