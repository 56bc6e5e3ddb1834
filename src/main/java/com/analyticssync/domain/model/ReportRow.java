package com.analyticssync.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ReportRow {

    @Builder.Default
    List<String> dimensionValues = List.of();

    @Builder.Default
    List<String> metricValues = List.of();
}
