package com.github.dimitryivaniuta.egress.error;

import java.util.Set;

/**
 * Upstream answered with a 4xx status other than 429.
 * A few statuses describe a transient conflict or lock and stay retryable.
 */
public class UpstreamClientException extends OutboundCallException {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 409, 423, 424);

    private final String responseBody;

    public UpstreamClientException(String provider, int status, String responseBody, Throwable cause) {
        super("Upstream " + provider + " rejected request with HTTP " + status, provider, status, cause);
        this.responseBody = responseBody;
    }

    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public boolean isRetryable() {
        return TRANSIENT_STATUSES.contains(getStatus());
    }
}
