package com.analyticssync.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PropertyPriority {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;
}
