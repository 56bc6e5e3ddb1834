package com.analyticssync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Engine wiring: clock, upstream fetch pool, auto-sync scheduler and the upstream HTTP client.
 */
@Configuration
@EnableConfigurationProperties({SyncEngineProperties.class, UpstreamProperties.class})
public class SyncEngineConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";
    public static final String AUTO_SYNC_SCHEDULER = "auto-sync-scheduler";
    public static final String UPSTREAM_REST_CLIENT = "upstream-rest-client";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs upstream calls; waves block on these futures, never on the caller's thread pool. */
    @Bean(name = FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor fetchExecutor(SyncEngineProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getFetchPoolSize());
        e.setMaxPoolSize(properties.getFetchPoolSize());
        e.setThreadNamePrefix("fetch-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }

    @Bean(name = AUTO_SYNC_SCHEDULER)
    public ThreadPoolTaskScheduler autoSyncScheduler(SyncEngineProperties properties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(properties.getSchedulerPoolSize());
        s.setThreadNamePrefix("auto-sync-");
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }

    @Bean(name = UPSTREAM_REST_CLIENT)
    public RestClient upstreamRestClient(RestClient.Builder builder, UpstreamProperties properties) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(properties.getConnectTimeout())
                .withReadTimeout(properties.getReadTimeout());
        return builder
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .build();
    }
}
