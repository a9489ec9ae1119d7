package com.github.dimitryivaniuta.egress.proxy;

import java.time.Instant;

public record ProxyHealthStatus(
        String endpoint,
        Status status,
        Long responseTime,
        String error,
        Instant lastChecked
) {

    public enum Status {
        HEALTHY,
        UNHEALTHY,
        UNKNOWN
    }

    public static ProxyHealthStatus healthy(ProxyEndpoint endpoint, long responseTime, Instant at) {
        return new ProxyHealthStatus(endpoint.key(), Status.HEALTHY, responseTime, null, at);
    }

    public static ProxyHealthStatus unhealthy(ProxyEndpoint endpoint, String error, Instant at) {
        return new ProxyHealthStatus(endpoint.key(), Status.UNHEALTHY, null, error, at);
    }
}
