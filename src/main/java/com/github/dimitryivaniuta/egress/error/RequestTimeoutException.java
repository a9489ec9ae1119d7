package com.github.dimitryivaniuta.egress.error;

import java.time.Duration;

public class RequestTimeoutException extends OutboundCallException {

    public RequestTimeoutException(String provider, String requestId, Duration timeout) {
        super("Request " + requestId + " timed out after " + timeout.toMillis() + "ms", provider, null, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
