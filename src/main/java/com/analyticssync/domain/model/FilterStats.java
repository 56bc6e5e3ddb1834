package com.analyticssync.domain.model;

import lombok.Value;

import java.util.Map;

@Value
public class FilterStats {
    int total;
    int active;
    Map<PropertyPriority, Integer> byPriority;
    Map<String, Integer> byTags;
}
