package com.github.dimitryivaniuta.egress.error;

import lombok.Getter;

/**
 * Base type for failures of an outbound provider call.
 *
 * <p>{@code status} is the upstream HTTP status, or {@code null} when no response was received.
 */
@Getter
public abstract class OutboundCallException extends RuntimeException {

    private final String provider;
    private final Integer status;

    protected OutboundCallException(String message, String provider, Integer status, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.status = status;
    }

    /**
     * Whether the retry policy may repeat the call that raised this error.
     */
    public abstract boolean isRetryable();
}
