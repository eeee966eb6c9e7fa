package com.fixfleet.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Infrastructure beans shared by the orchestrator components.
 */
@Configuration
public class OrchestratorConfig {

    /** UTC clock; injected everywhere time matters so tests can pin it. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${fixfleet.http.retry.max-attempts:3}")     int maxAttempts,
            @Value("${fixfleet.http.retry.base-delay-ms:1000}") long baseDelayMs,
            @Value("${fixfleet.http.retry.max-jitter-ms:500}")  long maxJitterMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxJitterMs));
    }

    /**
     * Fixed pool for parallel session creation. Bounded so one large wave
     * cannot flood the agent platform.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService sessionCreationExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getCreationConcurrency()));
    }
}
