package com.github.dimitryivaniuta.egress.error;

/**
 * Upstream answered with a 5xx status.
 */
public class UpstreamServerException extends OutboundCallException {

    private final String responseBody;

    public UpstreamServerException(String provider, int status, String responseBody, Throwable cause) {
        super("Upstream " + provider + " failed with HTTP " + status, provider, status, cause);
        this.responseBody = responseBody;
    }

    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
