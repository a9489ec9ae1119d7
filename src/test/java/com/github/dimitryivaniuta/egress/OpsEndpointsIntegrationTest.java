package com.github.dimitryivaniuta.egress;

import com.github.dimitryivaniuta.egress.cache.CacheOptions;
import com.github.dimitryivaniuta.egress.cache.TieredCacheManager;
import com.github.dimitryivaniuta.egress.infra.BaseIntegrationTest;
import com.github.dimitryivaniuta.egress.queue.RateLimitedRequestQueue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
class OpsEndpointsIntegrationTest extends BaseIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired TieredCacheManager cache;
    @Autowired RateLimitedRequestQueue queue;

    @Test
    void opsHealthIsHealthyWithRedisUpAndNoProxyPool() throws Exception {
        mvc.perform(get("/api/ops/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.cache.distributed.status").value(true))
                .andExpect(jsonPath("$.proxies.enabled").value(false));
    }

    @Test
    void actuatorHealthIncludesEgressIndicators() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.egressCache.status").value("UP"))
                .andExpect(jsonPath("$.components.egressProxyPool.status").value("UNKNOWN"));
    }

    @Test
    void pausedQueueHoldsRequestsUntilCleared() throws Exception {
        mvc.perform(post("/api/ops/queues/upstream/pause"))
                .andExpect(jsonPath("$.paused").value(true));
        queue.enqueue("upstream", "/anything");

        mvc.perform(get("/api/ops/queues/upstream"))
                .andExpect(jsonPath("$.pending").value(1))
                .andExpect(jsonPath("$.paused").value(true));

        mvc.perform(post("/api/ops/queues/upstream/clear"))
                .andExpect(jsonPath("$.cleared").value(1));
        mvc.perform(post("/api/ops/queues/upstream/resume"))
                .andExpect(jsonPath("$.paused").value(false));
    }

    @Test
    void tagInvalidationThroughTheApi() throws Exception {
        cache.set("a", "1", CacheOptions.builder().tag("odds").build());

        mvc.perform(delete("/api/ops/cache/tags/odds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(1));

        mvc.perform(get("/api/ops/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.sets").isNumber())
                .andExpect(jsonPath("$.memory.distributed.used").isNumber());
    }

    @Test
    void unreachableProviderIsReportedDown() throws Exception {
        mvc.perform(get("/api/ops/clients/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upstream.status").value(false))
                .andExpect(jsonPath("$.upstream.error").isNotEmpty());
    }

    @Test
    void prometheusEndpointIsExposed() throws Exception {
        mvc.perform(get("/actuator/prometheus"))
                .andExpect(status().isOk());
    }
}
