package com.github.dimitryivaniuta.egress.client;

import com.github.dimitryivaniuta.egress.config.EgressProperties;
import com.github.dimitryivaniuta.egress.metrics.EgressMetrics;
import com.github.dimitryivaniuta.egress.proxy.ProxyCredentialsProvider;
import com.github.dimitryivaniuta.egress.proxy.ProxyManager;
import com.github.dimitryivaniuta.egress.proxy.ProxyRoutePlanner;
import com.github.dimitryivaniuta.egress.queue.QueuedRequest;
import com.github.dimitryivaniuta.egress.queue.QueuedRequestExecutor;
import com.github.dimitryivaniuta.egress.queue.RateLimitedRequestQueue;
import com.github.dimitryivaniuta.egress.retry.BackoffPolicy;
import com.github.dimitryivaniuta.egress.web.RequestContextKeys;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds and owns the per-provider {@link ResilientClient}s and executes queued requests on them.
 *
 * <p>Queued work is admitted by the {@link RateLimitedRequestQueue} alone: a queued call skips the
 * client's usage wait and makes a single attempt, while still counting towards the client's usage.
 */
@Slf4j
public class ResilientClientFactory implements QueuedRequestExecutor {

    private static final int MAX_CONNECTIONS_PER_CLIENT = 50;

    private final EgressProperties props;
    private final ProxyManager proxyManager;
    private final EgressMetrics metrics;
    private final Clock clock;

    private final Map<String, ResilientClient> clients = new ConcurrentHashMap<>();

    private volatile RateLimitedRequestQueue queue;
    private volatile ExecutorService workers;

    public ResilientClientFactory(EgressProperties props,
                                  ProxyManager proxyManager,
                                  EgressMetrics metrics,
                                  Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.proxyManager = proxyManager;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers this factory as the executor of the queue's admitted requests.
     */
    public void bindQueue(RateLimitedRequestQueue queue) {
        this.queue = queue;
        queue.setExecutor(this);
    }

    public synchronized void start() {
        if (workers == null) {
            workers = Executors.newFixedThreadPool(
                    Math.max(1, props.getClient().getWorkerThreads()),
                    new CustomizableThreadFactory("egress-worker-"));
        }
        props.getProviders().forEach((name, provider) ->
                createClient(name, ClientOptions.from(provider, props.getRetry())));
    }

    public ResilientClient createClient(String name, ClientOptions options) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(options, "options must not be null");

        ResilientClient client = build(name, options);
        ResilientClient previous = clients.put(name, client);
        if (previous != null) closeQuietly(previous);

        log.info("Created client {} for {} (proxy: {})", name, options.baseUrl(), options.useProxy());
        return client;
    }

    public Optional<ResilientClient> getClient(String name) {
        return Optional.ofNullable(clients.get(name));
    }

    public Map<String, ClientHealth> healthCheck() {
        Map<String, ClientHealth> results = new TreeMap<>();
        clients.forEach((name, client) -> results.put(name, client.healthCheck()));
        return results;
    }

    public Map<String, UsageStatus> getRateLimitStatus() {
        Map<String, UsageStatus> results = new TreeMap<>();
        clients.forEach((name, client) -> client.usageStatus().ifPresent(status -> results.put(name, status)));
        return results;
    }

    /**
     * Runs an admitted request on the worker pool and reports the outcome to the queue.
     */
    @Override
    public void execute(QueuedRequest request) {
        RateLimitedRequestQueue target = Objects.requireNonNull(queue, "no queue bound to the client factory");
        ExecutorService pool = workers;
        if (pool == null) {
            throw new IllegalStateException("Client factory is not started");
        }

        ResilientClient client = clients.get(request.getProvider());
        if (client == null) {
            target.failRequest(request.getId(),
                    new IllegalStateException("No client registered for provider " + request.getProvider()));
            return;
        }

        OutboundRequest outbound = OutboundRequest.builder()
                .path(request.getEndpoint())
                .params(request.getParams())
                .headers(request.getHeaders())
                .build();

        pool.execute(() -> {
            MDC.put(RequestContextKeys.PROVIDER_MDC_KEY, request.getProvider());
            MDC.put(RequestContextKeys.REQUEST_ID_MDC_KEY, request.getId());
            try {
                Object result = client.executeOnce(outbound, Object.class);
                target.completeRequest(request.getId(), result);
            } catch (RuntimeException ex) {
                log.debug("Queued request {} failed: {}", request.getId(), ex.getMessage());
                target.failRequest(request.getId(), ex);
            } finally {
                MDC.remove(RequestContextKeys.PROVIDER_MDC_KEY);
                MDC.remove(RequestContextKeys.REQUEST_ID_MDC_KEY);
            }
        });
    }

    public synchronized void destroy() {
        if (workers != null) {
            workers.shutdownNow();
            workers = null;
        }
        clients.values().forEach(this::closeQuietly);
        clients.clear();
        log.info("Client factory destroyed");
    }

    private ResilientClient build(String name, ClientOptions options) {
        EgressProperties.Client defaults = props.getClient();
        Duration timeout = options.timeout() == null ? defaults.getDefaultTimeout() : options.timeout();
        Timeout t = Timeout.ofMilliseconds(timeout.toMillis());

        ProxyRoutePlanner routePlanner = new ProxyRoutePlanner();
        PoolingHttpClientConnectionManager connections = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(MAX_CONNECTIONS_PER_CLIENT)
                .setMaxConnPerRoute(MAX_CONNECTIONS_PER_CLIENT)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(t)
                        .setSocketTimeout(t)
                        .build())
                .build();

        // the api client owns the pool; the health client borrows it with a shorter response timeout
        CloseableHttpClient httpClient = httpClient(routePlanner, connections, timeout).build();
        CloseableHttpClient healthClient = httpClient(routePlanner, connections, defaults.getHealthTimeout())
                .setConnectionManagerShared(true)
                .build();

        HttpComponentsClientHttpRequestFactory apiFactory = new HttpComponentsClientHttpRequestFactory(httpClient);
        HttpComponentsClientHttpRequestFactory healthFactory = new HttpComponentsClientHttpRequestFactory(healthClient);

        BackoffPolicy backoff = options.backoff() == null ? BackoffPolicy.from(props.getRetry()) : options.backoff();
        ProviderUsageTracker tracker = options.usageLimit() == null
                ? null
                : new ProviderUsageTracker(name, options.usageLimit());

        return new ResilientClient(
                name,
                options,
                restClient(options, apiFactory),
                restClient(options, healthFactory),
                httpClient,
                routePlanner,
                proxyManager,
                tracker,
                RetryPolicy.newRetry(name, backoff, backoff.maxRetries()),
                defaults.getHealthPath(),
                metrics,
                clock,
                duration -> Thread.sleep(duration.toMillis())
        );
    }

    private HttpClientBuilder httpClient(ProxyRoutePlanner routePlanner,
                                         PoolingHttpClientConnectionManager connections,
                                         Duration responseTimeout) {
        HttpClientBuilder http = HttpClients.custom()
                .setRoutePlanner(routePlanner)
                .setConnectionManager(connections)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
                        .build())
                .disableAutomaticRetries();
        if (proxyManager != null && proxyManager.isEnabled()) {
            http.setDefaultCredentialsProvider(new ProxyCredentialsProvider(proxyManager));
        }
        return http;
    }

    private RestClient restClient(ClientOptions options, HttpComponentsClientHttpRequestFactory requestFactory) {
        return RestClient.builder()
                .baseUrl(options.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeaders(h -> {
                    h.set(HttpHeaders.USER_AGENT, props.getClient().getUserAgent());
                    h.setAccept(List.of(MediaType.APPLICATION_JSON));
                    options.headers().forEach(h::set);
                })
                .requestInterceptor(correlationIdInterceptor())
                .build();
    }

    private static ClientHttpRequestInterceptor correlationIdInterceptor() {
        return (request, body, execution) -> {
            String correlationId = MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY);
            if (correlationId != null && !request.getHeaders().containsKey(RequestContextKeys.CORRELATION_ID_HEADER)) {
                request.getHeaders().set(RequestContextKeys.CORRELATION_ID_HEADER, correlationId);
            }
            return execution.execute(request, body);
        };
    }

    private void closeQuietly(ResilientClient client) {
        try {
            client.close();
        } catch (IOException ex) {
            log.warn("Failed to close HTTP client {}: {}", client.getName(), ex.getMessage());
        }
    }
}
