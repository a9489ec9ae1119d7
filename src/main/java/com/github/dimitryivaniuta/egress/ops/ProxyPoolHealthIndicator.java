package com.github.dimitryivaniuta.egress.ops;

import com.github.dimitryivaniuta.egress.proxy.ProxyManager;
import com.github.dimitryivaniuta.egress.proxy.ProxyStats;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("egressProxyPool")
@RequiredArgsConstructor
public class ProxyPoolHealthIndicator implements HealthIndicator {

    private final ProxyManager proxyManager;

    @Override
    public Health health() {
        if (!proxyManager.isEnabled()) {
            return Health.unknown().withDetail("enabled", false).build();
        }
        ProxyStats stats = proxyManager.getProxyStats();
        Health.Builder builder = stats.healthy() > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("total", stats.total())
                .withDetail("healthy", stats.healthy())
                .withDetail("averageResponseTimeMs", stats.averageResponseTime())
                .build();
    }
}
