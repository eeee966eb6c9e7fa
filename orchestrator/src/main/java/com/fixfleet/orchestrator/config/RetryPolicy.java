package com.fixfleet.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform retry rule for outbound HTTP calls (agent platform, GitHub).
 *
 * Attempt n (0-based) waits baseDelay * 2^n plus up to maxJitter before the
 * next try. Only IO errors and the throttling / gateway statuses are retried;
 * any other 4xx means the request itself is wrong.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxJitter) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 502, 503, 504);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofMillis(500));
    }

    /** Same attempt count, no waiting (tests). */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO);
    }

    public boolean isRetryableStatus(int status) {
        return RETRYABLE_STATUSES.contains(status);
    }

    /** Delay after the failed attempt {@code attempt} (0-based). */
    public Duration backoff(int attempt) {
        long base   = baseDelay.toMillis() * (1L << Math.min(attempt, 20));
        long jitter = maxJitter.isZero() ? 0 : ThreadLocalRandom.current().nextLong(maxJitter.toMillis() + 1);
        return Duration.ofMillis(base + jitter);
    }

    /**
     * Send the request, retrying IO errors and retryable statuses.
     *
     * @return the first non-retryable response, or the last response once attempts run out
     * @throws IOException          the last IO error once attempts run out
     * @throws InterruptedException interrupted while sending or backing off
     */
    public HttpResponse<String> send(HttpClient http, HttpRequest request, String opName)
            throws IOException, InterruptedException {
        for (int attempt = 0; ; attempt++) {
            boolean last = attempt + 1 >= maxAttempts;
            try {
                HttpResponse<String> resp = http.send(request, HttpResponse.BodyHandlers.ofString());
                if (!isRetryableStatus(resp.statusCode()) || last) return resp;
                log.warn("{}: HTTP {} (attempt {}/{}), retrying", opName, resp.statusCode(), attempt + 1, maxAttempts);
            } catch (IOException e) {
                if (last) throw e;
                log.warn("{}: {} (attempt {}/{}), retrying", opName, e.getMessage(), attempt + 1, maxAttempts);
            }
            long millis = backoff(attempt).toMillis();
            if (millis > 0) Thread.sleep(millis);
        }
    }
}
