package com.github.dimitryivaniuta.egress.error;

/**
 * No response was received (connect/read failure, reset, DNS, proxy tunnel).
 */
public class TransientNetworkException extends OutboundCallException {

    public TransientNetworkException(String provider, String message, Throwable cause) {
        super(message, provider, null, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
