package com.github.dimitryivaniuta.egress.queue;

import com.github.dimitryivaniuta.egress.config.EgressProperties;
import com.github.dimitryivaniuta.egress.error.QueueClearedException;
import com.github.dimitryivaniuta.egress.error.RequestTimeoutException;
import com.github.dimitryivaniuta.egress.error.ServiceShutdownException;
import com.github.dimitryivaniuta.egress.metrics.EgressMetrics;
import com.github.dimitryivaniuta.egress.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-provider priority queue with sliding-window admission control, retry with exponential
 * backoff and per-request timeouts.
 *
 * <p>Admitted requests are handed to the registered {@link QueuedRequestExecutor}, which must
 * eventually report back through {@link #completeRequest} or {@link #failRequest}.
 * Priority is strict within a provider; providers are independent of each other.
 */
@Slf4j
public class RateLimitedRequestQueue {

    private final EgressProperties.Queue props;
    private final BackoffPolicy backoff;
    private final TaskScheduler scheduler;
    private final EgressMetrics metrics;
    private final Clock clock;

    private final Map<String, ProviderLane> lanes = new ConcurrentHashMap<>();
    private final Map<String, QueuedRequest> requests = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private volatile QueuedRequestExecutor executor;
    private volatile boolean destroyed;
    private ScheduledFuture<?> tickTask;

    public RateLimitedRequestQueue(EgressProperties.Queue props,
                                   EgressProperties.Retry retry,
                                   TaskScheduler scheduler,
                                   EgressMetrics metrics,
                                   Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.backoff = BackoffPolicy.from(retry);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.metrics = metrics;
        this.clock = clock;
    }

    public void setExecutor(QueuedRequestExecutor executor) {
        this.executor = executor;
    }

    public synchronized void start() {
        if (tickTask != null || destroyed) return;
        tickTask = scheduler.scheduleAtFixedRate(this::processQueues, props.getTickInterval());
        log.info("Request queue started (tick {} ms)", props.getTickInterval().toMillis());
    }

    public CompletableFuture<Object> enqueue(String provider, String endpoint) {
        return enqueue(provider, endpoint, EnqueueOptions.defaults());
    }

    public CompletableFuture<Object> enqueue(String provider, String endpoint, EnqueueOptions options) {
        Objects.requireNonNull(provider, "provider must not be null");
        EnqueueOptions opts = options == null ? EnqueueOptions.defaults() : options;

        QueuedRequest request = new QueuedRequest(
                provider + "-" + UUID.randomUUID(),
                opts.priority() == null ? Priority.MEDIUM : opts.priority(),
                provider,
                endpoint,
                opts.params(),
                opts.headers(),
                opts.maxRetries() == null ? backoff.maxRetries() : Math.max(0, opts.maxRetries()),
                opts.timeout(),
                clock.instant(),
                sequence.incrementAndGet()
        );

        // registration and shutdown are mutually exclusive so destroy() drains every accepted request
        synchronized (this) {
            if (destroyed) {
                return CompletableFuture.failedFuture(
                        new ServiceShutdownException(provider, "Request queue has been shut down"));
            }
            requests.put(request.getId(), request);
            lane(provider).add(request);
            scheduleTimeout(request);
        }

        if (metrics != null) metrics.queueEnqueued(provider, request.getPriority().name());
        log.debug("Enqueued {}", request);
        return request.future();
    }

    /**
     * One scheduling tick: every lane gets at most one admission.
     */
    public void processQueues() {
        QueuedRequestExecutor target = executor;
        if (target == null || destroyed) return;

        Instant now = clock.instant();
        for (ProviderLane lane : lanes.values()) {
            Optional<QueuedRequest> admitted = lane.admitNext(now);
            if (admitted.isEmpty()) {
                if (metrics != null && lane.hasReadyWork(now)) metrics.queueThrottled(lane.provider());
                continue;
            }
            dispatch(target, admitted.get());
        }
    }

    private void dispatch(QueuedRequestExecutor target, QueuedRequest request) {
        if (metrics != null) metrics.queueDispatched(request.getProvider());
        log.debug("Dispatching {}", request);
        try {
            target.execute(request);
        } catch (RuntimeException ex) {
            log.warn("Executor rejected {}: {}", request.getId(), ex.getMessage());
            failRequest(request.getId(), ex);
        }
    }

    public void completeRequest(String id, Object result) {
        QueuedRequest request = requests.get(id);
        if (request == null) {
            log.debug("Ignoring completion of unknown request {}", id);
            return;
        }
        ProviderLane lane = lanes.get(request.getProvider());
        if (lane == null || !lane.complete(request, clock.instant())) {
            log.debug("Ignoring completion of request {} that is not in flight", id);
            return;
        }

        requests.remove(id);
        request.cancelTimeout();
        if (metrics != null) metrics.queueCompleted(request.getProvider());
        request.future().complete(result);
    }

    public void failRequest(String id, Throwable error) {
        QueuedRequest request = requests.get(id);
        if (request == null) {
            log.debug("Ignoring failure of unknown request {}", id);
            return;
        }
        ProviderLane lane = lanes.get(request.getProvider());
        if (lane == null) return;

        switch (lane.fail(request, clock.instant(), backoff)) {
            case RETRY_SCHEDULED -> {
                if (metrics != null) metrics.queueRetryScheduled(request.getProvider());
                log.info("Retrying {} ({}/{}) at {}: {}", id, request.getRetryCount(),
                        request.getMaxRetries(), request.getScheduledAt(), error.getMessage());
            }
            case EXHAUSTED -> {
                requests.remove(id);
                request.cancelTimeout();
                if (metrics != null) metrics.queueFailed(request.getProvider());
                log.warn("Request {} failed after {} attempts: {}", id, request.getRetryCount(), error.getMessage());
                request.future().completeExceptionally(error);
            }
            case NOT_IN_FLIGHT -> log.debug("Ignoring failure of request {} that is not in flight", id);
        }
    }

    private void scheduleTimeout(QueuedRequest request) {
        Duration timeout = request.getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return;

        String id = request.getId();
        request.setTimeoutTask(scheduler.schedule(() -> expire(id), Instant.now().plus(timeout)));
    }

    void expire(String id) {
        QueuedRequest request = requests.get(id);
        if (request == null) return;
        ProviderLane lane = lanes.get(request.getProvider());
        if (lane == null || !lane.expire(request, clock.instant())) return;

        requests.remove(id);
        if (metrics != null) metrics.queueTimedOut(request.getProvider());
        log.warn("Request {} timed out after {} ms", id, request.getTimeout().toMillis());
        request.future().completeExceptionally(
                new RequestTimeoutException(request.getProvider(), id, request.getTimeout()));
    }

    /**
     * Fails every queued (not in-flight) request of the provider with {@link QueueClearedException}.
     *
     * @return number of requests removed
     */
    public int clearQueue(String provider) {
        ProviderLane lane = lanes.get(provider);
        if (lane == null) return 0;

        List<QueuedRequest> cleared = lane.drainQueued();
        for (QueuedRequest request : cleared) {
            requests.remove(request.getId());
            request.cancelTimeout();
            request.future().completeExceptionally(new QueueClearedException(provider));
        }
        log.info("Cleared {} queued requests for {}", cleared.size(), provider);
        return cleared.size();
    }

    public void pauseQueue(String provider) {
        lane(provider).setPaused(true);
        log.info("Queue paused for {}", provider);
    }

    public void resumeQueue(String provider) {
        lane(provider).setPaused(false);
        log.info("Queue resumed for {}", provider);
    }

    public boolean isPaused(String provider) {
        ProviderLane lane = lanes.get(provider);
        return lane != null && lane.isPaused();
    }

    public QueueStats getQueueStats(String provider) {
        ProviderLane lane = lanes.get(provider);
        return lane == null ? QueueStats.empty() : lane.stats();
    }

    public Map<String, QueueStats> getQueueStats() {
        Map<String, QueueStats> all = new TreeMap<>();
        lanes.forEach((provider, lane) -> all.put(provider, lane.stats()));
        return all;
    }

    public Optional<RateLimitStatus> getRateLimitStatus(String provider) {
        ProviderLane lane = lanes.get(provider);
        return lane == null ? Optional.empty() : Optional.of(lane.rateLimitStatus(clock.instant()));
    }

    public Map<String, RateLimitStatus> getRateLimitStatus() {
        Instant now = clock.instant();
        Map<String, RateLimitStatus> all = new TreeMap<>();
        lanes.forEach((provider, lane) -> all.put(provider, lane.rateLimitStatus(now)));
        return all;
    }

    /**
     * Stops scheduling and fails every pending and in-flight request with {@link ServiceShutdownException}.
     */
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            if (tickTask != null) {
                tickTask.cancel(false);
                tickTask = null;
            }
        }

        int rejected = 0;
        for (ProviderLane lane : lanes.values()) {
            for (QueuedRequest request : lane.drainAll()) {
                request.cancelTimeout();
                request.future().completeExceptionally(
                        new ServiceShutdownException(lane.provider(), "Request queue is shutting down"));
                rejected++;
            }
        }
        lanes.clear();
        requests.clear();
        log.info("Request queue destroyed, {} outstanding requests rejected", rejected);
    }

    private ProviderLane lane(String provider) {
        return lanes.computeIfAbsent(provider, p -> new ProviderLane(
                p, RateLimitConfig.from(props.getRateLimits().getOrDefault(p, props.getDefaultRateLimit())),
                clock.millis()));
    }
}
