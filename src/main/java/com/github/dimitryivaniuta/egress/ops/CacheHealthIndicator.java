package com.github.dimitryivaniuta.egress.ops;

import com.github.dimitryivaniuta.egress.cache.CacheHealth;
import com.github.dimitryivaniuta.egress.cache.TieredCacheManager;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Distributed tier down reports OUT_OF_SERVICE rather than DOWN: the local tier keeps serving.
 */
@Component("egressCache")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    private final TieredCacheManager cache;

    @Override
    public Health health() {
        CacheHealth h = cache.healthCheck();
        Health.Builder builder = h.distributed().status() ? Health.up() : Health.outOfService();
        builder.withDetail("distributedResponseTimeMs", h.distributed().responseTime())
                .withDetail("localKeyCount", h.local().keyCount())
                .withDetail("localMemoryUsage", h.local().memoryUsage());
        if (h.distributed().error() != null) {
            builder.withDetail("error", h.distributed().error());
        }
        return builder.build();
    }
}
