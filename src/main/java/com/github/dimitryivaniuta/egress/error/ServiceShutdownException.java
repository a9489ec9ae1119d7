package com.github.dimitryivaniuta.egress.error;

/**
 * Raised to every outstanding request when a component is destroyed.
 */
public class ServiceShutdownException extends OutboundCallException {

    public ServiceShutdownException(String provider, String message) {
        super(message, provider, null, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
