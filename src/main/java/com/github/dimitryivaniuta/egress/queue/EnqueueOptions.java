package com.github.dimitryivaniuta.egress.queue;

import lombok.Builder;

import java.time.Duration;
import java.util.Map;

/**
 * Per-request queue options. Unset values fall back to: MEDIUM priority, the configured
 * retry budget, no timeout.
 */
@Builder(toBuilder = true)
public record EnqueueOptions(
        Priority priority,
        Map<String, Object> params,
        Map<String, String> headers,
        Integer maxRetries,
        Duration timeout
) {

    public static EnqueueOptions defaults() {
        return EnqueueOptions.builder().build();
    }

    public static EnqueueOptions withPriority(Priority priority) {
        return EnqueueOptions.builder().priority(priority).build();
    }
}
