package com.analyticssync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Analytics backend endpoints and report defaults. Documented in application.yml under app.upstream.
 */
@ConfigurationProperties(prefix = "app.upstream")
@Getter
@Setter
public class UpstreamProperties {

    private String dataApiBaseUrl = "https://analyticsdata.googleapis.com/v1beta";

    private String adminApiBaseUrl = "https://analyticsadmin.googleapis.com/v1beta";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(30);

    /** Requested in this order; users first and sessions second. */
    private List<String> defaultMetrics = new ArrayList<>(List.of(
            "activeUsers", "newUsers", "sessions", "screenPageViews", "bounceRate", "averageSessionDuration"));

    private List<String> defaultDimensions = new ArrayList<>(List.of("date", "country", "deviceCategory"));
}
