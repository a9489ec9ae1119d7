package com.github.dimitryivaniuta.egress.proxy;

import java.util.List;

public record ProxyStats(
        int total,
        int healthy,
        int unhealthy,
        long averageResponseTime,
        ProxyEndpointSnapshot currentProxy,
        List<ProxyEndpointSnapshot> endpoints
) {}
