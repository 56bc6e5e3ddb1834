package com.analyticssync.infrastructure.upstream;

import com.analyticssync.domain.model.AnalyticsProperty;

import java.util.List;

public interface PropertyCatalog {

    List<AnalyticsProperty> listProperties(String credentials);
}
