package com.powerlevel.tracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(RetryProperties.class)
public class TrackerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Fan-out pool for per-epic remote calls (flush, reconcile, pull).
    @Bean(destroyMethod = "shutdown")
    public ExecutorService syncExecutor(@Value("${tracker.sync.parallelism:4}") int parallelism) {
        return Executors.newFixedThreadPool(Math.max(1, parallelism));
    }
}
