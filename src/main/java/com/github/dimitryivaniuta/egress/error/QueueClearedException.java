package com.github.dimitryivaniuta.egress.error;

public class QueueClearedException extends OutboundCallException {

    public QueueClearedException(String provider) {
        super("Queue cleared for " + provider, provider, null, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
