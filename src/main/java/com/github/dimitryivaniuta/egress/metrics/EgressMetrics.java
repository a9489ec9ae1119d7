package com.github.dimitryivaniuta.egress.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public class EgressMetrics {

    private final MeterRegistry registry;

    public EgressMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Queue ----
    public void queueEnqueued(String provider, String priority) {
        Counter.builder("egress_queue_enqueued_total")
                .tag("provider", provider)
                .tag("priority", priority)
                .register(registry)
                .increment();
    }

    public void queueDispatched(String provider) {
        counter("egress_queue_dispatched_total", provider);
    }

    public void queueThrottled(String provider) {
        counter("egress_queue_throttled_total", provider);
    }

    public void queueCompleted(String provider) {
        counter("egress_queue_completed_total", provider);
    }

    public void queueFailed(String provider) {
        counter("egress_queue_failed_total", provider);
    }

    public void queueRetryScheduled(String provider) {
        counter("egress_queue_retry_scheduled_total", provider);
    }

    public void queueTimedOut(String provider) {
        counter("egress_queue_timeout_total", provider);
    }

    // ---- Client retry ----
    public void retryAttempt(String provider) {
        counter("egress_client_retry_attempts_total", provider);
    }

    public void retryExhausted(String provider) {
        counter("egress_client_retry_exhausted_total", provider);
    }

    public void usageWait(String provider, long millis) {
        Timer.builder("egress_client_usage_wait_seconds")
                .tag("provider", provider)
                .register(registry)
                .record(millis, TimeUnit.MILLISECONDS);
    }

    // ---- Proxy ----
    public void proxyFailure(String endpoint) {
        Counter.builder("egress_proxy_failures_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    public void proxyRotation() {
        Counter.builder("egress_proxy_rotations_total")
                .register(registry)
                .increment();
    }

    // ---- Cache ----
    public void cacheHit(String tier) {
        Counter.builder("egress_cache_hits_total")
                .tag("tier", tier) // local | distributed
                .register(registry)
                .increment();
    }

    public void cacheMiss() {
        Counter.builder("egress_cache_misses_total")
                .register(registry)
                .increment();
    }

    public void cacheStoreError(String operation) {
        Counter.builder("egress_cache_store_errors_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordDuration(String metricName, String provider, long nanos) {
        Timer.builder(metricName)
                .tag("provider", provider)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    private void counter(String name, String provider) {
        Counter.builder(name)
                .tag("provider", provider)
                .register(registry)
                .increment();
    }
}
