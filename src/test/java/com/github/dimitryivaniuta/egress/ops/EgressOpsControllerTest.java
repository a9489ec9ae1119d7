package com.github.dimitryivaniuta.egress.ops;

import com.github.dimitryivaniuta.egress.cache.CacheHealth;
import com.github.dimitryivaniuta.egress.cache.CacheMemoryInfo;
import com.github.dimitryivaniuta.egress.cache.CacheStats;
import com.github.dimitryivaniuta.egress.cache.TieredCacheManager;
import com.github.dimitryivaniuta.egress.client.ClientHealth;
import com.github.dimitryivaniuta.egress.client.ResilientClientFactory;
import com.github.dimitryivaniuta.egress.proxy.ProxyEndpoint;
import com.github.dimitryivaniuta.egress.proxy.ProxyHealthStatus;
import com.github.dimitryivaniuta.egress.proxy.ProxyManager;
import com.github.dimitryivaniuta.egress.proxy.ProxyStats;
import com.github.dimitryivaniuta.egress.queue.QueueStats;
import com.github.dimitryivaniuta.egress.queue.RateLimitConfig;
import com.github.dimitryivaniuta.egress.queue.RateLimitStatus;
import com.github.dimitryivaniuta.egress.queue.RateLimitedRequestQueue;
import com.github.dimitryivaniuta.egress.web.RequestContextKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EgressOpsController.class)
class EgressOpsControllerTest {

    @Autowired MockMvc mvc;

    @MockBean ProxyManager proxyManager;
    @MockBean RateLimitedRequestQueue queue;
    @MockBean TieredCacheManager cache;
    @MockBean ResilientClientFactory clientFactory;

    private static final CacheHealth.Local LOCAL_OK = new CacheHealth.Local(true, 3, 120);

    @BeforeEach
    void defaults() {
        when(proxyManager.getProxyStats()).thenReturn(new ProxyStats(0, 0, 0, 0, null, List.of()));
        when(proxyManager.isEnabled()).thenReturn(false);
        when(queue.getQueueStats()).thenReturn(Map.of());
        when(cache.healthCheck()).thenReturn(new CacheHealth(new CacheHealth.Distributed(true, 2, null), LOCAL_OK));
    }

    @Test
    void healthIsHealthyWhenCacheIsUpAndProxyPoolDisabled() throws Exception {
        mvc.perform(get("/api/ops/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.cache.distributed.status").value(true))
                .andExpect(jsonPath("$.cache.local.keyCount").value(3))
                .andExpect(jsonPath("$.proxies.enabled").value(false));
    }

    @Test
    void healthIsDegradedWhenDistributedCacheIsDown() throws Exception {
        when(cache.healthCheck()).thenReturn(
                new CacheHealth(new CacheHealth.Distributed(false, 2000, "Connection refused"), LOCAL_OK));

        mvc.perform(get("/api/ops/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.cache.distributed.error").value("Connection refused"));
    }

    @Test
    void healthIsDegradedWhenEnabledPoolHasNoHealthyProxy() throws Exception {
        when(proxyManager.isEnabled()).thenReturn(true);
        when(proxyManager.getProxyStats()).thenReturn(new ProxyStats(5, 0, 5, 0, null, List.of()));

        mvc.perform(get("/api/ops/health"))
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.proxies.total").value(5));
    }

    @Test
    void queueStatsForProvider() throws Exception {
        when(queue.getQueueStats("odds")).thenReturn(new QueueStats(4, 1, 10, 2, 12, 35.5, 120.0, false));

        mvc.perform(get("/api/ops/queues/odds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(4))
                .andExpect(jsonPath("$.processing").value(1))
                .andExpect(jsonPath("$.totalProcessed").value(12))
                .andExpect(jsonPath("$.averageWaitTime").value(35.5));
    }

    @Test
    void pauseResumeAndClearQueue() throws Exception {
        when(queue.isPaused("odds")).thenReturn(true);
        mvc.perform(post("/api/ops/queues/odds/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.provider").value("odds"))
                .andExpect(jsonPath("$.paused").value(true));
        verify(queue).pauseQueue("odds");

        when(queue.isPaused("odds")).thenReturn(false);
        mvc.perform(post("/api/ops/queues/odds/resume"))
                .andExpect(jsonPath("$.paused").value(false));
        verify(queue).resumeQueue("odds");

        when(queue.clearQueue("odds")).thenReturn(3);
        mvc.perform(post("/api/ops/queues/odds/clear"))
                .andExpect(jsonPath("$.cleared").value(3));
    }

    @Test
    void cacheStatsAndTagInvalidation() throws Exception {
        when(cache.getStats()).thenReturn(new CacheStats(3, 1, 4, 0, 75.0, 512, 4));
        when(cache.getMemoryInfo()).thenReturn(new CacheMemoryInfo(
                new CacheMemoryInfo.Distributed(1024, 2048, 1.1), new CacheMemoryInfo.Local(512, 4)));
        when(cache.invalidateByTag("odds")).thenReturn(2);

        mvc.perform(get("/api/ops/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.hitRate").value(75.0))
                .andExpect(jsonPath("$.memory.distributed.used").value(1024));

        mvc.perform(delete("/api/ops/cache/tags/odds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tag").value("odds"))
                .andExpect(jsonPath("$.invalidated").value(2));
    }

    @Test
    void testProxyByHostAndPort() throws Exception {
        ProxyEndpoint endpoint = new ProxyEndpoint("proxy.test", 8001, "u", "p", "US", null);
        when(proxyManager.findEndpoint("proxy.test", 8001)).thenReturn(Optional.of(endpoint));
        when(proxyManager.testProxyConnectivity(endpoint)).thenReturn(
                ProxyHealthStatus.healthy(endpoint, 87, Instant.parse("2024-05-01T10:00:00Z")));

        mvc.perform(post("/api/ops/proxies/test").param("host", "proxy.test").param("port", "8001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoint").value("proxy.test:8001"))
                .andExpect(jsonPath("$.status").value("HEALTHY"))
                .andExpect(jsonPath("$.responseTime").value(87));
    }

    @Test
    void unknownProxyIs404WithCorrelationId() throws Exception {
        when(proxyManager.findEndpoint(anyString(), anyInt())).thenReturn(Optional.empty());

        mvc.perform(post("/api/ops/proxies/test")
                        .param("host", "nowhere")
                        .param("port", "9999")
                        .header(RequestContextKeys.CORRELATION_ID_HEADER, "corr-123"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(RequestContextKeys.CORRELATION_ID_HEADER, "corr-123"))
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.correlationId").value("corr-123"))
                .andExpect(jsonPath("$.path").value("/api/ops/proxies/test"));
    }

    @Test
    void hostWithoutPortIsRejected() throws Exception {
        mvc.perform(post("/api/ops/proxies/test").param("host", "proxy.test"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verify(proxyManager, never()).testProxyConnectivity(any(ProxyEndpoint.class));
    }

    @Test
    void portOutOfRangeIsRejected() throws Exception {
        mvc.perform(post("/api/ops/proxies/test").param("host", "proxy.test").param("port", "70000"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unsafeCorrelationIdIsReplaced() throws Exception {
        mvc.perform(get("/api/ops/queues").header(RequestContextKeys.CORRELATION_ID_HEADER, "bad id\r\nX-Evil: 1"))
                .andExpect(status().isOk())
                .andExpect(header().string(RequestContextKeys.CORRELATION_ID_HEADER,
                        matchesPattern("[0-9a-f-]{36}")));
    }

    @Test
    void rateLimitsCombineQueueAndClientViews() throws Exception {
        when(queue.getRateLimitStatus()).thenReturn(Map.of(
                "odds", new RateLimitStatus(12, 300, 2, new RateLimitConfig(30, 1000, 5), true)));
        when(clientFactory.getRateLimitStatus()).thenReturn(Map.of());
        when(clientFactory.healthCheck()).thenReturn(Map.of("odds", new ClientHealth(true, 40, null)));

        mvc.perform(get("/api/ops/rate-limits"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queue.odds.requestsInLastMinute").value(12))
                .andExpect(jsonPath("$.queue.odds.limits.requestsPerMinute").value(30));

        mvc.perform(get("/api/ops/clients/health"))
                .andExpect(jsonPath("$.odds.status").value(true))
                .andExpect(jsonPath("$.odds.responseTime").value(40));
    }
}
