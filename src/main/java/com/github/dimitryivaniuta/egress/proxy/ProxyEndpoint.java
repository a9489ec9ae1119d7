package com.github.dimitryivaniuta.egress.proxy;

import lombok.Getter;

import java.time.Instant;

/**
 * One egress proxy of the pool plus its rolling health counters.
 *
 * <p>{@code failureCount} counts consecutive failures since the last success; the endpoint is
 * unhealthy exactly while it is at or above the failure threshold.
 */
public class ProxyEndpoint {

    @Getter
    private final String host;
    @Getter
    private final int port;
    @Getter
    private final String username;
    @Getter
    private final String password;
    @Getter
    private final String country;
    @Getter
    private final String region;

    private boolean healthy = true;
    private Instant lastHealthCheck;
    private long responseTime;
    private long successCount;
    private long failureCount;

    public ProxyEndpoint(String host, int port, String username, String password, String country, String region) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.country = country;
        this.region = region;
    }

    public String key() {
        return host + ":" + port;
    }

    public synchronized boolean isHealthy() {
        return healthy;
    }

    public synchronized long getFailureCount() {
        return failureCount;
    }

    public synchronized long getSuccessCount() {
        return successCount;
    }

    public synchronized long getResponseTime() {
        return responseTime;
    }

    /**
     * @return true when this failure flipped the endpoint to unhealthy
     */
    synchronized boolean recordFailure(int maxFailures) {
        failureCount++;
        if (healthy && failureCount >= maxFailures) {
            healthy = false;
            return true;
        }
        return false;
    }

    /**
     * @return true when this success restored an unhealthy endpoint
     */
    synchronized boolean recordSuccess() {
        successCount++;
        failureCount = 0;
        boolean restored = !healthy;
        healthy = true;
        return restored;
    }

    synchronized void recordHealthCheck(ProxyHealthStatus status, int maxFailures) {
        lastHealthCheck = status.lastChecked();
        if (status.status() == ProxyHealthStatus.Status.HEALTHY) {
            responseTime = status.responseTime() == null ? 0L : status.responseTime();
            recordSuccess();
        } else {
            recordFailure(maxFailures);
        }
    }

    synchronized double successRate() {
        long total = successCount + failureCount;
        return total == 0 ? 0.0 : (double) successCount / total;
    }

    public synchronized ProxyEndpointSnapshot snapshot() {
        return new ProxyEndpointSnapshot(
                host, port, country, region, healthy, lastHealthCheck,
                responseTime, successCount, failureCount, successRate()
        );
    }

    @Override
    public String toString() {
        return "ProxyEndpoint[" + key() + "]";
    }
}
