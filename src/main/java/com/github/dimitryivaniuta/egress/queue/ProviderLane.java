package com.github.dimitryivaniuta.egress.queue;

import com.github.dimitryivaniuta.egress.retry.BackoffPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Queue, in-flight set, admission tracker and counters of one provider.
 * Every method runs under the lane's monitor; futures are completed by the caller outside of it.
 */
class ProviderLane {

    static final Comparator<QueuedRequest> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedRequest r) -> r.getPriority().weight()).reversed()
            .thenComparing(QueuedRequest::getCreatedAt)
            .thenComparingLong(QueuedRequest::getSequence);

    enum FailureOutcome { NOT_IN_FLIGHT, RETRY_SCHEDULED, EXHAUSTED }

    private final String provider;
    private final RateLimitConfig limits;
    private final SlidingWindowRateTracker tracker;

    private final List<QueuedRequest> queued = new ArrayList<>();
    private final Map<String, QueuedRequest> processing = new LinkedHashMap<>();

    private boolean paused;

    private long completed;
    private long failed;
    private long waitSamples;
    private double averageWaitTime;
    private long processingSamples;
    private double averageProcessingTime;

    ProviderLane(String provider, RateLimitConfig limits, long now) {
        this.provider = provider;
        this.limits = limits;
        this.tracker = new SlidingWindowRateTracker(now);
    }

    String provider() {
        return provider;
    }

    synchronized void add(QueuedRequest request) {
        queued.add(request);
    }

    /**
     * Takes the next ready request if the lane is running and admission control allows it.
     * The returned request is already marked in flight and counted against the rate limits.
     */
    synchronized Optional<QueuedRequest> admitNext(Instant now) {
        if (paused) return Optional.empty();

        Optional<QueuedRequest> next = queued.stream()
                .filter(r -> r.isReady(now))
                .min(DISPATCH_ORDER);
        if (next.isEmpty()) return Optional.empty();
        if (!tracker.canAdmit(limits, now.toEpochMilli())) return Optional.empty();

        QueuedRequest request = next.get();
        queued.remove(request);
        processing.put(request.getId(), request);
        request.setExecutedAt(now);
        tracker.record(now.toEpochMilli());

        long waited = Duration.between(request.getCreatedAt(), now).toMillis();
        waitSamples++;
        averageWaitTime += (waited - averageWaitTime) / waitSamples;
        return next;
    }

    synchronized boolean hasReadyWork(Instant now) {
        return !paused && queued.stream().anyMatch(r -> r.isReady(now));
    }

    synchronized boolean complete(QueuedRequest request, Instant now) {
        if (processing.remove(request.getId()) == null) return false;

        request.setCompletedAt(now);
        completed++;
        long took = Duration.between(request.getExecutedAt(), now).toMillis();
        processingSamples++;
        averageProcessingTime += (took - averageProcessingTime) / processingSamples;
        return true;
    }

    synchronized FailureOutcome fail(QueuedRequest request, Instant now, BackoffPolicy backoff) {
        if (processing.remove(request.getId()) == null) return FailureOutcome.NOT_IN_FLIGHT;

        request.setRetryCount(request.getRetryCount() + 1);
        if (request.getRetryCount() < request.getMaxRetries()) {
            request.setScheduledAt(now.plus(backoff.delayFor(request.getRetryCount())));
            queued.add(request);
            return FailureOutcome.RETRY_SCHEDULED;
        }

        request.setCompletedAt(now);
        failed++;
        return FailureOutcome.EXHAUSTED;
    }

    /**
     * Drops a timed-out request wherever it currently is and counts it as failed.
     */
    synchronized boolean expire(QueuedRequest request, Instant now) {
        boolean wasQueued = queued.remove(request);
        boolean wasProcessing = processing.remove(request.getId()) != null;
        if (!wasQueued && !wasProcessing) return false;

        request.setCompletedAt(now);
        failed++;
        return true;
    }

    synchronized List<QueuedRequest> drainQueued() {
        List<QueuedRequest> drained = new ArrayList<>(queued);
        queued.clear();
        return drained;
    }

    synchronized List<QueuedRequest> drainAll() {
        List<QueuedRequest> drained = new ArrayList<>(queued);
        drained.addAll(processing.values());
        queued.clear();
        processing.clear();
        return drained;
    }

    synchronized void setPaused(boolean paused) {
        this.paused = paused;
    }

    synchronized boolean isPaused() {
        return paused;
    }

    synchronized QueueStats stats() {
        return new QueueStats(
                queued.size(),
                processing.size(),
                completed,
                failed,
                completed + failed,
                averageWaitTime,
                averageProcessingTime,
                paused
        );
    }

    synchronized RateLimitStatus rateLimitStatus(Instant now) {
        long millis = now.toEpochMilli();
        return new RateLimitStatus(
                tracker.requestsInLastMinute(millis),
                tracker.requestsInLastHour(millis),
                tracker.burstCount(millis),
                limits,
                tracker.canAdmit(limits, millis)
        );
    }
}
