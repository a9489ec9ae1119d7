package com.github.dimitryivaniuta.egress.ops;

import com.github.dimitryivaniuta.egress.cache.CacheHealth;
import com.github.dimitryivaniuta.egress.cache.CacheMemoryInfo;
import com.github.dimitryivaniuta.egress.cache.CacheStats;
import com.github.dimitryivaniuta.egress.cache.TieredCacheManager;
import com.github.dimitryivaniuta.egress.client.ClientHealth;
import com.github.dimitryivaniuta.egress.client.ResilientClientFactory;
import com.github.dimitryivaniuta.egress.client.UsageStatus;
import com.github.dimitryivaniuta.egress.proxy.ProxyEndpoint;
import com.github.dimitryivaniuta.egress.proxy.ProxyHealthStatus;
import com.github.dimitryivaniuta.egress.proxy.ProxyManager;
import com.github.dimitryivaniuta.egress.proxy.ProxyStats;
import com.github.dimitryivaniuta.egress.queue.QueueStats;
import com.github.dimitryivaniuta.egress.queue.RateLimitStatus;
import com.github.dimitryivaniuta.egress.queue.RateLimitedRequestQueue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read-mostly operational view of the egress layer. Every endpoint answers with a well-formed
 * body even when a dependency is down.
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ops")
public class EgressOpsController {

    private final ProxyManager proxyManager;
    private final RateLimitedRequestQueue queue;
    private final TieredCacheManager cache;
    private final ResilientClientFactory clientFactory;

    // ---------- DTOs ----------
    public record ProxySummary(boolean enabled, int total, int healthy) {}

    public record OpsHealth(String status, CacheHealth cache, ProxySummary proxies, Map<String, QueueStats> queues) {}

    public record QueueControlResponse(String provider, boolean paused) {}

    public record QueueClearResponse(String provider, int cleared) {}

    public record CacheStatsResponse(CacheStats stats, CacheMemoryInfo memory) {}

    public record TagInvalidationResponse(String tag, int invalidated) {}

    public record RateLimitsResponse(Map<String, RateLimitStatus> queue, Map<String, UsageStatus> clients) {}

    // ---------- endpoints ----------

    @GetMapping("/health")
    public OpsHealth health() {
        CacheHealth cacheHealth = cache.healthCheck();
        ProxyStats proxyStats = proxyManager.getProxyStats();
        ProxySummary proxies = new ProxySummary(proxyManager.isEnabled(), proxyStats.total(), proxyStats.healthy());

        boolean proxiesOk = !proxies.enabled() || proxies.healthy() > 0;
        String status = cacheHealth.isHealthy() && proxiesOk ? "healthy" : "degraded";
        return new OpsHealth(status, cacheHealth, proxies, queue.getQueueStats());
    }

    @GetMapping("/proxies")
    public ProxyStats proxies() {
        return proxyManager.getProxyStats();
    }

    /**
     * Probes one pool endpoint, or the current one when no host is given.
     */
    @PostMapping("/proxies/test")
    public ProxyHealthStatus testProxy(@RequestParam(required = false) String host,
                                       @RequestParam(required = false) @Min(1) @Max(65535) Integer port) {
        if (host == null) {
            ProxyEndpoint current = proxyManager.getSelectedEndpoint()
                    .orElseThrow(() -> new NoSuchElementException("No proxy endpoint available for testing"));
            return proxyManager.testProxyConnectivity(current);
        }
        if (port == null) {
            throw new IllegalArgumentException("port is required when host is given");
        }
        ProxyEndpoint endpoint = proxyManager.findEndpoint(host, port)
                .orElseThrow(() -> new NoSuchElementException("Unknown proxy endpoint " + host + ":" + port));
        return proxyManager.testProxyConnectivity(endpoint);
    }

    @PostMapping("/proxies/rotate")
    public ProxyStats rotate() {
        proxyManager.rotate();
        return proxyManager.getProxyStats();
    }

    @GetMapping("/queues")
    public Map<String, QueueStats> queues() {
        return queue.getQueueStats();
    }

    @GetMapping("/queues/{provider}")
    public QueueStats queue(@PathVariable @NotBlank String provider) {
        return queue.getQueueStats(provider);
    }

    @PostMapping("/queues/{provider}/pause")
    public QueueControlResponse pause(@PathVariable @NotBlank String provider) {
        queue.pauseQueue(provider);
        return new QueueControlResponse(provider, queue.isPaused(provider));
    }

    @PostMapping("/queues/{provider}/resume")
    public QueueControlResponse resume(@PathVariable @NotBlank String provider) {
        queue.resumeQueue(provider);
        return new QueueControlResponse(provider, queue.isPaused(provider));
    }

    @PostMapping("/queues/{provider}/clear")
    public QueueClearResponse clear(@PathVariable @NotBlank String provider) {
        return new QueueClearResponse(provider, queue.clearQueue(provider));
    }

    @GetMapping("/cache/stats")
    public CacheStatsResponse cacheStats() {
        return new CacheStatsResponse(cache.getStats(), cache.getMemoryInfo());
    }

    @DeleteMapping("/cache/tags/{tag}")
    public TagInvalidationResponse invalidateTag(@PathVariable @NotBlank String tag) {
        return new TagInvalidationResponse(tag, cache.invalidateByTag(tag));
    }

    @GetMapping("/clients/health")
    public Map<String, ClientHealth> clientsHealth() {
        return clientFactory.healthCheck();
    }

    @GetMapping("/rate-limits")
    public RateLimitsResponse rateLimits() {
        return new RateLimitsResponse(queue.getRateLimitStatus(), clientFactory.getRateLimitStatus());
    }
}
