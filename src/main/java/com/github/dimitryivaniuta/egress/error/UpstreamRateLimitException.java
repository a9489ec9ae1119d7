package com.github.dimitryivaniuta.egress.error;

import java.time.Duration;

/**
 * Upstream answered 429. {@code retryAfter} is the server-directed delay, when the response carried one.
 */
public class UpstreamRateLimitException extends OutboundCallException {

    private final Duration retryAfter;

    public UpstreamRateLimitException(String provider, Duration retryAfter, Throwable cause) {
        super("Upstream " + provider + " rate limit exceeded", provider, 429, cause);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public long getRetryAfterSeconds() {
        return retryAfter == null ? 0L : retryAfter.toSeconds();
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
