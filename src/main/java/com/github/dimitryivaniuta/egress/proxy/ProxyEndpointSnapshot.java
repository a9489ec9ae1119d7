package com.github.dimitryivaniuta.egress.proxy;

import java.time.Instant;

/**
 * Read-only view of an endpoint; credentials are never exposed.
 */
public record ProxyEndpointSnapshot(
        String host,
        int port,
        String country,
        String region,
        boolean healthy,
        Instant lastHealthCheck,
        long responseTime,
        long successCount,
        long failureCount,
        double successRate
) {}
