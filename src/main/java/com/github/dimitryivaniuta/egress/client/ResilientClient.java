package com.github.dimitryivaniuta.egress.client;

import com.github.dimitryivaniuta.egress.error.OutboundCallException;
import com.github.dimitryivaniuta.egress.error.ServiceShutdownException;
import com.github.dimitryivaniuta.egress.error.TransientNetworkException;
import com.github.dimitryivaniuta.egress.error.UpstreamClientException;
import com.github.dimitryivaniuta.egress.error.UpstreamRateLimitException;
import com.github.dimitryivaniuta.egress.error.UpstreamServerException;
import com.github.dimitryivaniuta.egress.metrics.EgressMetrics;
import com.github.dimitryivaniuta.egress.proxy.ProxyAgent;
import com.github.dimitryivaniuta.egress.proxy.ProxyManager;
import com.github.dimitryivaniuta.egress.proxy.ProxyRoutePlanner;
import io.github.resilience4j.retry.Retry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * HTTP client of one upstream provider.
 *
 * <p>{@link #exchange} is the direct path: it waits for the provider's usage budget, routes through
 * the current proxy when configured, and retries per {@link RetryPolicy}. {@link #executeOnce} is the
 * queued path: the queue already decided admission and owns retries, so it makes a single attempt.
 */
@Slf4j
public class ResilientClient implements Closeable {

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    @Getter
    private final String name;
    @Getter
    private final ClientOptions options;
    private final RestClient api;
    private final RestClient health;
    private final CloseableHttpClient httpClient;
    private final ProxyRoutePlanner routePlanner;
    private final ProxyManager proxyManager;
    private final ProviderUsageTracker usageTracker;
    private final Retry retry;
    private final String healthPath;
    private final EgressMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    ResilientClient(String name,
                    ClientOptions options,
                    RestClient api,
                    RestClient health,
                    CloseableHttpClient httpClient,
                    ProxyRoutePlanner routePlanner,
                    ProxyManager proxyManager,
                    ProviderUsageTracker usageTracker,
                    Retry retry,
                    String healthPath,
                    EgressMetrics metrics,
                    Clock clock,
                    Sleeper sleeper) {
        this.name = name;
        this.options = options;
        this.api = api;
        this.health = health;
        this.httpClient = httpClient;
        this.routePlanner = routePlanner;
        this.proxyManager = proxyManager;
        this.usageTracker = usageTracker;
        this.retry = retry;
        this.healthPath = healthPath;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T> T get(String path, Map<String, ?> params, Map<String, String> headers, Class<T> type) {
        OutboundRequest.OutboundRequestBuilder request = OutboundRequest.builder().path(path);
        if (params != null) params.forEach(request::param);
        if (headers != null) request.headers(headers);
        return exchange(request.build(), type);
    }

    public <T> T exchange(OutboundRequest request, Class<T> type) {
        awaitUsageBudget();

        int[] attempt = {0};
        long start = System.nanoTime();
        try {
            return Retry.decorateSupplier(retry, () -> {
                if (attempt[0]++ > 0 && metrics != null) metrics.retryAttempt(name);
                return attempt(request, type);
            }).get();
        } catch (OutboundCallException ex) {
            if (ex.isRetryable() && attempt[0] > 1 && metrics != null) metrics.retryExhausted(name);
            throw ex;
        } finally {
            if (metrics != null) metrics.recordDuration("egress_client_call_duration_seconds", name, System.nanoTime() - start);
        }
    }

    public <T> T executeOnce(OutboundRequest request, Class<T> type) {
        return attempt(request, type);
    }

    public Optional<UsageStatus> usageStatus() {
        return usageTracker == null ? Optional.empty() : Optional.of(usageTracker.status());
    }

    /**
     * Lightweight GET of the provider's health path, no retry.
     */
    public ClientHealth healthCheck() {
        long start = System.nanoTime();
        try {
            withRoute(() -> health.get().uri(healthPath).retrieve().toBodilessEntity());
            return ClientHealth.up(elapsedMillis(start));
        } catch (RuntimeException ex) {
            String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return ClientHealth.down(elapsedMillis(start), error);
        }
    }

    private <T> T attempt(OutboundRequest request, Class<T> type) {
        T result = withRoute(() -> {
            RestClient.RequestBodySpec spec = api.method(request.method())
                    .uri(builder -> uri(builder, request))
                    .headers(h -> request.headers().forEach(h::set));
            if (request.body() != null) spec.body(request.body());
            return spec.retrieve().body(type);
        });
        if (usageTracker != null) usageTracker.record();
        return result;
    }

    /**
     * Runs the call through the current proxy when this client uses one and reports the outcome
     * back to the pool.
     */
    private <T> T withRoute(Supplier<T> call) {
        Optional<ProxyAgent> agent = options.useProxy() && proxyManager != null
                ? proxyManager.getProxyAgent()
                : Optional.empty();

        if (agent.isEmpty()) {
            return translate(call);
        }

        try (ProxyRoutePlanner.Pin ignored = routePlanner.pin(agent.get())) {
            T result = translate(call);
            proxyManager.markProxySuccess(agent.get().endpoint());
            return result;
        } catch (OutboundCallException ex) {
            // an HTTP status means the proxy itself delivered the call
            if (ex.getStatus() == null) {
                proxyManager.markProxyFailure(agent.get().endpoint());
            } else {
                proxyManager.markProxySuccess(agent.get().endpoint());
            }
            throw ex;
        }
    }

    private <T> T translate(Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException ex) {
            throw mapResponseError(ex);
        } catch (ResourceAccessException ex) {
            throw new TransientNetworkException(name, "No response from " + name + ": " + ex.getMessage(), ex);
        }
    }

    OutboundCallException mapResponseError(RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        if (status == 429) {
            HttpHeaders headers = ex.getResponseHeaders();
            String retryAfter = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
            return new UpstreamRateLimitException(name, RetryPolicy.parseRetryAfter(retryAfter, clock), ex);
        }
        if (status >= 500) {
            return new UpstreamServerException(name, status, ex.getResponseBodyAsString(), ex);
        }
        return new UpstreamClientException(name, status, ex.getResponseBodyAsString(), ex);
    }

    private void awaitUsageBudget() {
        if (usageTracker == null) return;
        Duration wait = usageTracker.waitTime();
        while (!wait.isZero() && !wait.isNegative()) {
            log.warn("Usage budget of {} exhausted, waiting {} ms", name, wait.toMillis());
            if (metrics != null) metrics.usageWait(name, wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ServiceShutdownException(name, "Interrupted while waiting for usage budget of " + name);
            }
            wait = usageTracker.waitTime();
        }
    }

    private static URI uri(UriBuilder builder, OutboundRequest request) {
        String path = request.path() == null ? "" : request.path();
        int query = path.indexOf('?');
        if (query >= 0) {
            builder.path(path.substring(0, query)).query(path.substring(query + 1));
        } else {
            builder.path(path);
        }
        request.params().forEach((key, value) -> {
            if (value != null) builder.queryParam(key, value);
        });
        return builder.build();
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
