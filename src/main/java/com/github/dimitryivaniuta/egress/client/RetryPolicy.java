package com.github.dimitryivaniuta.egress.client;

import com.github.dimitryivaniuta.egress.error.OutboundCallException;
import com.github.dimitryivaniuta.egress.error.UpstreamRateLimitException;
import com.github.dimitryivaniuta.egress.retry.BackoffPolicy;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Which outbound failures are repeated and how long to wait in between.
 */
public final class RetryPolicy {

    private RetryPolicy() {}

    public static boolean isRetryable(Throwable ex) {
        return ex instanceof OutboundCallException oce && oce.isRetryable();
    }

    /**
     * A server-directed {@code Retry-After} on 429 overrides the computed backoff.
     *
     * @param attempt 1-based retry number
     */
    public static Duration delayFor(int attempt, Throwable failure, BackoffPolicy backoff) {
        if (failure instanceof UpstreamRateLimitException rle && rle.getRetryAfter() != null) {
            return rle.getRetryAfter();
        }
        return backoff.delayFor(attempt);
    }

    /**
     * @param maxRetries retries after the first call; zero disables retrying
     */
    public static Retry newRetry(String name, BackoffPolicy backoff, int maxRetries) {
        IntervalBiFunction<Object> interval = (attempt, outcome) -> outcome.isLeft()
                ? delayFor(attempt, outcome.getLeft(), backoff).toMillis()
                : backoff.delayFor(attempt).toMillis();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalBiFunction(interval)
                .retryOnException(RetryPolicy::isRetryable)
                .failAfterMaxAttempts(false)
                .build();

        return Retry.of("client:" + name, config);
    }

    /**
     * Parses a {@code Retry-After} value given in seconds or as an HTTP date.
     *
     * @return {@code null} when absent or unparseable
     */
    public static Duration parseRetryAfter(String value, Clock clock) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(v)));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration wait = Duration.between(clock.instant(), at.toInstant());
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (DateTimeParseException notDate) {
                return null;
            }
        }
    }
}
