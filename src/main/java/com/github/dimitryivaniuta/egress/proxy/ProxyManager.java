package com.github.dimitryivaniuta.egress.proxy;

import com.github.dimitryivaniuta.egress.config.EgressProperties;
import com.github.dimitryivaniuta.egress.metrics.EgressMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the egress proxy pool: health checks, rotation, failover and selection.
 *
 * <p>Selection methods never throw when the pool cannot serve; they return an empty
 * {@link Optional} and callers fall back to a direct connection.
 *
 * <p>Timers are started by {@link #start()} and cancelled by {@link #destroy()}.
 */
@Slf4j
public class ProxyManager {

    private static final double SUCCESS_RATE_MARGIN = 0.1;

    private static final Comparator<ProxyEndpointSnapshot> BEST_FIRST = (a, b) -> {
        if (Math.abs(a.successRate() - b.successRate()) > SUCCESS_RATE_MARGIN) {
            return Double.compare(b.successRate(), a.successRate());
        }
        return Long.compare(a.responseTime(), b.responseTime());
    };

    private final EgressProperties.Proxy props;
    private final ProxyProbe probe;
    private final TaskScheduler scheduler;
    private final EgressMetrics metrics;
    private final Clock clock;

    private volatile List<ProxyEndpoint> endpoints;
    private int currentIndex; // guarded by this

    private ExecutorService probeExecutor;
    private ScheduledFuture<?> healthCheckTask;
    private ScheduledFuture<?> rotationTask;

    public ProxyManager(EgressProperties.Proxy props,
                        ProxyProbe probe,
                        TaskScheduler scheduler,
                        EgressMetrics metrics,
                        Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.endpoints = initializeEndpoints(props);
    }

    private static List<ProxyEndpoint> initializeEndpoints(EgressProperties.Proxy props) {
        if (!props.isEnabled() || props.getPorts() == null) {
            log.info("Proxy pool disabled");
            return List.of();
        }
        List<ProxyEndpoint> pool = props.getPorts().stream()
                .map(port -> new ProxyEndpoint(
                        props.getHost(), port, props.getUsername(), props.getPassword(),
                        props.getCountry(), props.getRegion()))
                .toList();
        log.info("Initialized {} proxy endpoints on {}", pool.size(), props.getHost());
        return pool;
    }

    public synchronized void start() {
        if (endpoints.isEmpty() || scheduler == null) return;

        probeExecutor = Executors.newFixedThreadPool(Math.min(endpoints.size(), 8));

        Duration healthInterval = props.getHealthCheckInterval();
        healthCheckTask = scheduler.scheduleAtFixedRate(
                this::performHealthChecks,
                Instant.now().plus(props.getHealthCheckInitialDelay()),
                healthInterval
        );

        Duration rotationInterval = props.getRotationInterval();
        if (rotationInterval != null && !rotationInterval.isZero() && !rotationInterval.isNegative()) {
            rotationTask = scheduler.scheduleAtFixedRate(
                    this::rotate,
                    Instant.now().plus(rotationInterval),
                    rotationInterval
            );
        }
    }

    public synchronized void destroy() {
        if (healthCheckTask != null) healthCheckTask.cancel(false);
        if (rotationTask != null) rotationTask.cancel(false);
        healthCheckTask = null;
        rotationTask = null;
        if (probeExecutor != null) {
            probeExecutor.shutdownNow();
            probeExecutor = null;
        }
        endpoints = List.of();
        currentIndex = 0;
    }

    /**
     * The endpoint under the rotation pointer, only while it is healthy.
     */
    public Optional<ProxyEndpoint> getCurrentProxy() {
        return getSelectedEndpoint().filter(ProxyEndpoint::isHealthy);
    }

    /**
     * The endpoint under the rotation pointer regardless of its health; for diagnostics.
     */
    public Optional<ProxyEndpoint> getSelectedEndpoint() {
        List<ProxyEndpoint> pool = endpoints;
        if (pool.isEmpty()) return Optional.empty();
        synchronized (this) {
            return Optional.of(pool.get(Math.min(currentIndex, pool.size() - 1)));
        }
    }

    public Optional<ProxyAgent> getProxyAgent() {
        return getCurrentProxy().map(ProxyAgent::of);
    }

    public Optional<ProxyAgent> getGeoSpecificProxy(String country) {
        return getGeoSpecificProxy(country, null);
    }

    /**
     * Healthy endpoint matching the location, otherwise any healthy endpoint. Empty when none is healthy.
     */
    public Optional<ProxyAgent> getGeoSpecificProxy(String country, String region) {
        List<ProxyEndpoint> pool = endpoints;
        if (pool.isEmpty()) return Optional.empty();

        Optional<ProxyEndpoint> target = pool.stream()
                .filter(ProxyEndpoint::isHealthy)
                .filter(p -> country == null || country.equalsIgnoreCase(p.getCountry()))
                .filter(p -> region == null || region.equalsIgnoreCase(p.getRegion()))
                .findFirst();

        if (target.isEmpty()) {
            target = pool.stream().filter(ProxyEndpoint::isHealthy).findFirst();
        }
        return target.map(ProxyAgent::of);
    }

    /**
     * Success rate decides when rates differ by more than {@value #SUCCESS_RATE_MARGIN};
     * otherwise the faster endpoint wins.
     */
    public Optional<ProxyEndpoint> getBestPerformingProxy() {
        return endpoints.stream()
                .filter(ProxyEndpoint::isHealthy)
                .map(ProxyEndpoint::snapshot)
                .sorted(BEST_FIRST)
                .findFirst()
                .flatMap(s -> findEndpoint(s.host(), s.port()));
    }

    public Optional<ProxyEndpoint> findEndpoint(String host, int port) {
        return endpoints.stream()
                .filter(p -> p.getPort() == port && p.getHost().equalsIgnoreCase(host))
                .findFirst();
    }

    public void markProxyFailure(ProxyEndpoint endpoint) {
        boolean flipped = endpoint.recordFailure(props.getMaxFailures());
        if (metrics != null) metrics.proxyFailure(endpoint.key());

        if (flipped) {
            log.warn("Proxy {} marked unhealthy after {} consecutive failures",
                    endpoint.key(), endpoint.getFailureCount());
        }
        if (!endpoint.isHealthy() && isCurrent(endpoint)) {
            rotate();
        }
    }

    public void markProxySuccess(ProxyEndpoint endpoint) {
        if (endpoint.recordSuccess()) {
            log.info("Proxy {} restored to healthy status", endpoint.key());
        }
    }

    /**
     * Advances the current pointer to the next healthy endpoint, wrapping around the pool.
     */
    public synchronized void rotate() {
        List<ProxyEndpoint> pool = endpoints;
        if (pool.isEmpty()) return;

        if (pool.stream().noneMatch(ProxyEndpoint::isHealthy)) {
            log.warn("No healthy proxies available, resetting to first endpoint; callers go direct");
            currentIndex = 0;
            return;
        }

        int attempts = 0;
        do {
            currentIndex = (currentIndex + 1) % pool.size();
            attempts++;
        } while (!pool.get(currentIndex).isHealthy() && attempts < pool.size());

        if (metrics != null) metrics.proxyRotation();
        log.debug("Rotated to proxy {}", pool.get(currentIndex).key());
    }

    /**
     * Probes every endpoint in parallel and applies the results.
     */
    public void performHealthChecks() {
        List<ProxyEndpoint> pool = endpoints;
        if (pool.isEmpty()) return;

        Duration probeDeadline = props.getHealthCheckTimeout().multipliedBy(2);
        List<CompletableFuture<ProxyHealthStatus>> probes = pool.stream()
                .map(endpoint -> probeAsync(endpoint)
                        .orTimeout(probeDeadline.toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(ex -> ProxyHealthStatus.unhealthy(
                                endpoint,
                                ex.getMessage() == null ? "Health check failed" : ex.getMessage(),
                                clock.instant())))
                .toList();

        for (int i = 0; i < pool.size(); i++) {
            pool.get(i).recordHealthCheck(probes.get(i).join(), props.getMaxFailures());
        }

        long healthy = pool.stream().filter(ProxyEndpoint::isHealthy).count();
        log.info("Proxy health check completed: {}/{} healthy", healthy, pool.size());

        getSelectedEndpoint()
                .filter(current -> !current.isHealthy())
                .ifPresent(current -> rotate());
    }

    private CompletableFuture<ProxyHealthStatus> probeAsync(ProxyEndpoint endpoint) {
        ExecutorService executor = probeExecutor;
        if (executor == null) {
            try {
                return CompletableFuture.completedFuture(probe.probe(endpoint));
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            }
        }
        return CompletableFuture.supplyAsync(() -> probe.probe(endpoint), executor);
    }

    public ProxyHealthStatus testProxyConnectivity(ProxyEndpoint endpoint) {
        return probe.probe(endpoint);
    }

    public ProxyHealthStatus testProxyConnectivity() {
        ProxyEndpoint current = getSelectedEndpoint()
                .orElseThrow(() -> new IllegalStateException("No proxy endpoint available for testing"));
        return testProxyConnectivity(current);
    }

    public ProxyStats getProxyStats() {
        List<ProxyEndpointSnapshot> snapshots = endpoints.stream().map(ProxyEndpoint::snapshot).toList();
        List<ProxyEndpointSnapshot> healthy = snapshots.stream().filter(ProxyEndpointSnapshot::healthy).toList();
        double avg = healthy.stream().mapToLong(ProxyEndpointSnapshot::responseTime).average().orElse(0);

        return new ProxyStats(
                snapshots.size(),
                healthy.size(),
                snapshots.size() - healthy.size(),
                Math.round(avg),
                getSelectedEndpoint().map(ProxyEndpoint::snapshot).orElse(null),
                snapshots
        );
    }

    public boolean isEnabled() {
        return !endpoints.isEmpty();
    }

    private boolean isCurrent(ProxyEndpoint endpoint) {
        return getSelectedEndpoint().map(current -> current == endpoint).orElse(false);
    }
}
