package com.github.dimitryivaniuta.egress.retry;

import com.github.dimitryivaniuta.egress.config.EgressProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff shared by the queue and the clients:
 * {@code min(baseDelay * multiplier^(attempt-1), maxDelay)}.
 */
public record BackoffPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double multiplier) {

    public BackoffPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
    }

    public static BackoffPolicy from(EgressProperties.Retry props) {
        return new BackoffPolicy(
                props.getMaxRetries(),
                props.getBaseDelay(),
                props.getMaxDelay(),
                props.getBackoffMultiplier()
        );
    }

    /**
     * Provider overrides win over the defaults field by field.
     */
    public static BackoffPolicy from(EgressProperties.Retry defaults, EgressProperties.Provider provider) {
        if (provider == null) return from(defaults);
        return new BackoffPolicy(
                provider.getMaxRetries() != null ? provider.getMaxRetries() : defaults.getMaxRetries(),
                provider.getBaseDelay() != null ? provider.getBaseDelay() : defaults.getBaseDelay(),
                provider.getMaxDelay() != null ? provider.getMaxDelay() : defaults.getMaxDelay(),
                provider.getBackoffMultiplier() != null ? provider.getBackoffMultiplier() : defaults.getBackoffMultiplier()
        );
    }

    /**
     * @param attempt 1-based retry number
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double millis = baseDelay.toMillis() * Math.pow(multiplier, exponent);
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public BackoffPolicy withMaxRetries(int maxRetries) {
        return new BackoffPolicy(maxRetries, baseDelay, maxDelay, multiplier);
    }
}
