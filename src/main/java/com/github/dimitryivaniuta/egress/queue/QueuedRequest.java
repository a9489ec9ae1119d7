package com.github.dimitryivaniuta.egress.queue;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A unit of queued work. Mutable state is changed only by the owning {@link ProviderLane}
 * under its monitor; the executor reads it.
 */
@Getter
public class QueuedRequest {

    private final String id;
    private final Priority priority;
    private final String provider;
    private final String endpoint;
    private final Map<String, Object> params;
    private final Map<String, String> headers;
    private final int maxRetries;
    private final Duration timeout;
    private final Instant createdAt;

    /**
     * Enqueue order; breaks ties between requests created in the same millisecond.
     */
    private final long sequence;

    @Getter(AccessLevel.NONE)
    private final CompletableFuture<Object> future = new CompletableFuture<>();

    @Setter(AccessLevel.PACKAGE)
    private int retryCount;
    @Setter(AccessLevel.PACKAGE)
    private Instant scheduledAt;
    @Setter(AccessLevel.PACKAGE)
    private Instant executedAt;
    @Setter(AccessLevel.PACKAGE)
    private Instant completedAt;

    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.PACKAGE)
    private ScheduledFuture<?> timeoutTask;

    QueuedRequest(String id,
                  Priority priority,
                  String provider,
                  String endpoint,
                  Map<String, Object> params,
                  Map<String, String> headers,
                  int maxRetries,
                  Duration timeout,
                  Instant createdAt,
                  long sequence) {
        this.id = id;
        this.priority = priority;
        this.provider = provider;
        this.endpoint = endpoint;
        this.params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.maxRetries = maxRetries;
        this.timeout = timeout;
        this.createdAt = createdAt;
        this.sequence = sequence;
    }

    CompletableFuture<Object> future() {
        return future;
    }

    boolean isReady(Instant now) {
        return scheduledAt == null || !scheduledAt.isAfter(now);
    }

    void cancelTimeout() {
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
    }

    @Override
    public String toString() {
        return "QueuedRequest[" + id + ", " + priority + ", " + provider + " " + endpoint
                + ", retry " + retryCount + "/" + maxRetries + "]";
    }
}
