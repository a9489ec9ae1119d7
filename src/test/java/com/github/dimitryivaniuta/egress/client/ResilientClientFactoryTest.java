package com.github.dimitryivaniuta.egress.client;

import com.github.dimitryivaniuta.egress.config.EgressProperties;
import com.github.dimitryivaniuta.egress.error.TransientNetworkException;
import com.github.dimitryivaniuta.egress.error.UpstreamClientException;
import com.github.dimitryivaniuta.egress.error.UpstreamRateLimitException;
import com.github.dimitryivaniuta.egress.error.UpstreamServerException;
import com.github.dimitryivaniuta.egress.metrics.EgressMetrics;
import com.github.dimitryivaniuta.egress.proxy.ProxyHealthStatus;
import com.github.dimitryivaniuta.egress.proxy.ProxyManager;
import com.github.dimitryivaniuta.egress.queue.EnqueueOptions;
import com.github.dimitryivaniuta.egress.queue.RateLimitedRequestQueue;
import com.github.dimitryivaniuta.egress.retry.BackoffPolicy;
import com.github.dimitryivaniuta.egress.web.RequestContextKeys;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpMethod;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientClientFactoryTest {

    private WireMockServer upstream;
    private ThreadPoolTaskScheduler scheduler;
    private SimpleMeterRegistry registry;
    private EgressProperties props;
    private ResilientClientFactory factory;
    private RateLimitedRequestQueue queue;

    @BeforeEach
    void setUp() {
        upstream = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        upstream.start();

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        registry = new SimpleMeterRegistry();
        EgressMetrics metrics = new EgressMetrics(registry);
        Clock clock = Clock.systemUTC();

        props = new EgressProperties();
        props.getRetry().setMaxRetries(2);
        props.getRetry().setBaseDelay(Duration.ofMillis(10));
        props.getRetry().setMaxDelay(Duration.ofMillis(50));
        props.getClient().setWorkerThreads(2);

        EgressProperties.Provider odds = new EgressProperties.Provider();
        odds.setBaseUrl(upstream.baseUrl());
        odds.setTimeout(Duration.ofSeconds(2));
        odds.getHeaders().put("X-Api-Key", "test-key");
        props.getProviders().put("odds", odds);

        ProxyManager proxies = new ProxyManager(props.getProxy(),
                endpoint -> ProxyHealthStatus.unhealthy(endpoint, "unused", clock.instant()),
                null, metrics, clock);

        factory = new ResilientClientFactory(props, proxies, metrics, clock);
        queue = new RateLimitedRequestQueue(props.getQueue(), props.getRetry(), scheduler, metrics, clock);
        factory.bindQueue(queue);
        factory.start();
    }

    @AfterEach
    void tearDown() {
        queue.destroy();
        factory.destroy();
        scheduler.shutdown();
        upstream.stop();
        MDC.clear();
    }

    private ResilientClient odds() {
        return factory.getClient("odds").orElseThrow();
    }

    @Test
    void configuredProvidersAreCreatedOnStart() {
        assertThat(factory.getClient("odds")).isPresent();
        assertThat(factory.getClient("unknown")).isEmpty();
        assertThat(odds().getOptions().backoff().maxRetries()).isEqualTo(2);
    }

    @Test
    void retriesServerErrorThenSucceeds() {
        upstream.stubFor(get(urlPathEqualTo("/odds")).inScenario("flaky")
                .whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("recovered"));
        upstream.stubFor(get(urlPathEqualTo("/odds")).inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(okJson("{\"match\":\"ARS-CHE\",\"home\":2.1}")));

        Map<?, ?> body = odds().get("/odds", Map.of("sport", "soccer"), Map.of(), Map.class);

        assertThat(body.get("match")).isEqualTo("ARS-CHE");
        upstream.verify(2, getRequestedFor(urlPathEqualTo("/odds")).withQueryParam("sport", equalTo("soccer")));
        assertThat(registry.get("egress_client_retry_attempts_total").tag("provider", "odds").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void persistentServerErrorExhaustsRetries() {
        upstream.stubFor(get(urlPathEqualTo("/odds")).willReturn(aResponse().withStatus(500).withBody("down")));

        assertThatThrownBy(() -> odds().get("/odds", null, null, Map.class))
                .isInstanceOfSatisfying(UpstreamServerException.class, ex -> {
                    assertThat(ex.getStatus()).isEqualTo(500);
                    assertThat(ex.getProvider()).isEqualTo("odds");
                    assertThat(ex.getResponseBody()).isEqualTo("down");
                });

        upstream.verify(3, getRequestedFor(urlPathEqualTo("/odds")));
        assertThat(registry.get("egress_client_retry_exhausted_total").tag("provider", "odds").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void clientErrorIsNotRetried() {
        upstream.stubFor(get(urlPathEqualTo("/fixtures/9")).willReturn(aResponse().withStatus(404)));

        assertThatThrownBy(() -> odds().get("/fixtures/9", null, null, Map.class))
                .isInstanceOfSatisfying(UpstreamClientException.class,
                        ex -> assertThat(ex.getStatus()).isEqualTo(404));

        upstream.verify(1, getRequestedFor(urlPathEqualTo("/fixtures/9")));
    }

    @Test
    void rateLimitedResponseHonoursRetryAfter() {
        upstream.stubFor(get(urlPathEqualTo("/odds")).inScenario("limited")
                .whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "0"))
                .willSetStateTo("open"));
        upstream.stubFor(get(urlPathEqualTo("/odds")).inScenario("limited")
                .whenScenarioStateIs("open")
                .willReturn(okJson("{\"ok\":true}")));

        Map<?, ?> body = odds().get("/odds", null, null, Map.class);

        assertThat(body.get("ok")).isEqualTo(true);
        upstream.verify(2, getRequestedFor(urlPathEqualTo("/odds")));
    }

    @Test
    void rateLimitedResponseCarriesRetryAfterWhenExhausted() {
        upstream.stubFor(get(urlPathEqualTo("/odds"))
                .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "0")));

        assertThatThrownBy(() -> odds().get("/odds", null, null, Map.class))
                .isInstanceOfSatisfying(UpstreamRateLimitException.class,
                        ex -> assertThat(ex.getRetryAfter()).isEqualTo(Duration.ZERO));
    }

    @Test
    void sendsDefaultConfiguredAndCorrelationHeaders() {
        upstream.stubFor(get(urlPathEqualTo("/odds")).willReturn(okJson("{}")));
        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, "corr-42");

        odds().get("/odds", null, Map.of("X-Trace", "t1"), Map.class);

        upstream.verify(getRequestedFor(urlPathEqualTo("/odds"))
                .withHeader("User-Agent", equalTo("Egress-Toolkit/1.0"))
                .withHeader("X-Api-Key", equalTo("test-key"))
                .withHeader("X-Trace", equalTo("t1"))
                .withHeader(RequestContextKeys.CORRELATION_ID_HEADER, equalTo("corr-42")));
    }

    @Test
    void postsJsonBody() {
        upstream.stubFor(post(urlPathEqualTo("/bets")).willReturn(okJson("{\"accepted\":true}")));

        Map<?, ?> result = odds().exchange(OutboundRequest.builder()
                .method(HttpMethod.POST)
                .path("/bets")
                .body(Map.of("stake", 10))
                .build(), Map.class);

        assertThat(result.get("accepted")).isEqualTo(true);
        upstream.verify(postRequestedFor(urlPathEqualTo("/bets")).withRequestBody(equalToJson("{\"stake\":10}")));
    }

    @Test
    void queryStringInPathIsKept() {
        upstream.stubFor(get(urlPathEqualTo("/odds")).willReturn(okJson("{}")));

        odds().get("/odds?region=uk", Map.of("market", "h2h"), null, Map.class);

        upstream.verify(getRequestedFor(urlPathEqualTo("/odds"))
                .withQueryParam("region", equalTo("uk"))
                .withQueryParam("market", equalTo("h2h")));
    }

    @Test
    void queuedRequestIsExecutedAndCompletesTheFuture() throws Exception {
        upstream.stubFor(get(urlPathEqualTo("/scores")).willReturn(okJson("{\"home\":1,\"away\":0}")));

        CompletableFuture<Object> future = queue.enqueue("odds", "/scores",
                EnqueueOptions.builder().params(Map.of("live", true)).build());
        queue.processQueues();

        assertThat(future.get(5, TimeUnit.SECONDS))
                .isEqualTo(Map.of("home", 1, "away", 0));
        upstream.verify(getRequestedFor(urlPathEqualTo("/scores")).withQueryParam("live", equalTo("true")));
        assertThat(queue.getQueueStats("odds").completed()).isEqualTo(1);
    }

    @Test
    void queuedRequestMakesOneAttemptPerAdmission() {
        upstream.stubFor(get(urlPathEqualTo("/scores")).willReturn(aResponse().withStatus(503)));

        CompletableFuture<Object> future = queue.enqueue("odds", "/scores",
                EnqueueOptions.builder().maxRetries(1).build());
        queue.processQueues();

        assertThat(future).failsWithin(Duration.ofSeconds(5))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(UpstreamServerException.class);
        upstream.verify(1, getRequestedFor(urlPathEqualTo("/scores")));
    }

    @Test
    void queuedRequestForUnknownProviderFails() {
        CompletableFuture<Object> future = queue.enqueue("nobody", "/x",
                EnqueueOptions.builder().maxRetries(1).build());
        queue.processQueues();

        assertThat(future).failsWithin(Duration.ofSeconds(5))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void healthCheckReportsEachClient() {
        upstream.stubFor(get(urlPathEqualTo("/health")).willReturn(aResponse().withStatus(200)));
        factory.createClient("offline", ClientOptions.builder()
                .baseUrl("http://localhost:1")
                .timeout(Duration.ofMillis(500))
                .build());

        Map<String, ClientHealth> health = factory.healthCheck();

        assertThat(health).containsOnlyKeys("odds", "offline");
        assertThat(health.get("odds").status()).isTrue();
        assertThat(health.get("odds").error()).isNull();
        assertThat(health.get("offline").status()).isFalse();
        assertThat(health.get("offline").error()).isNotBlank();
    }

    @Test
    void healthCheckUsesItsOwnShorterResponseTimeout() {
        props.getClient().setHealthTimeout(Duration.ofMillis(200));
        ResilientClient slow = factory.createClient("slow", ClientOptions.builder()
                .baseUrl(upstream.baseUrl())
                .timeout(Duration.ofSeconds(2))
                .build());
        upstream.stubFor(get(urlPathEqualTo("/health")).willReturn(aResponse().withStatus(200).withFixedDelay(600)));
        upstream.stubFor(get(urlPathEqualTo("/odds")).willReturn(okJson("{\"ok\":true}").withFixedDelay(600)));

        Map<?, ?> body = slow.get("/odds", null, null, Map.class);

        assertThat(body.get("ok")).isEqualTo(true);
        assertThat(factory.healthCheck().get("slow").status()).isFalse();
    }

    @Test
    void responseSlowerThanTheClientTimeoutFails() {
        ResilientClient impatient = factory.createClient("impatient", ClientOptions.builder()
                .baseUrl(upstream.baseUrl())
                .timeout(Duration.ofMillis(200))
                .backoff(new BackoffPolicy(0, Duration.ofMillis(10), Duration.ofMillis(10), 1.0))
                .build());
        upstream.stubFor(get(urlPathEqualTo("/odds")).willReturn(okJson("{}").withFixedDelay(1000)));

        assertThatThrownBy(() -> impatient.get("/odds", null, null, Map.class))
                .isInstanceOf(TransientNetworkException.class);
    }

    @Test
    void usageBudgetIsTrackedPerClient() {
        upstream.stubFor(get(urlPathEqualTo("/odds")).willReturn(okJson("{}")));
        ResilientClient limited = factory.createClient("limited", ClientOptions.builder()
                .baseUrl(upstream.baseUrl())
                .usageLimit(new UsageLimit(1, 100, 1000))
                .backoff(new BackoffPolicy(0, Duration.ofMillis(10), Duration.ofMillis(10), 1.0))
                .build());

        limited.get("/odds", null, null, Map.class);

        UsageStatus status = limited.usageStatus().orElseThrow();
        assertThat(status.requestsThisMinute()).isEqualTo(1);
        assertThat(status.canMakeRequest()).isFalse();
        assertThat(factory.getRateLimitStatus()).containsOnlyKeys("limited");
        assertThat(odds().usageStatus()).isEmpty();
    }

    @Test
    void recreatingAClientReplacesThePreviousOne() {
        ResilientClient first = odds();

        ResilientClient second = factory.createClient("odds", ClientOptions.builder()
                .baseUrl(upstream.baseUrl())
                .build());

        assertThat(second).isNotSameAs(first);
        assertThat(factory.getClient("odds")).containsSame(second);
    }
}
