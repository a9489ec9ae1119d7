package com.github.dimitryivaniuta.egress.queue;

/**
 * Transport side of the queue. Receives every admitted request exactly once per attempt and must
 * eventually report the outcome with {@link RateLimitedRequestQueue#completeRequest} or
 * {@link RateLimitedRequestQueue#failRequest} using {@link QueuedRequest#getId()}.
 *
 * <p>Called on the scheduling thread: implementations should hand the work off and return quickly.
 */
@FunctionalInterface
public interface QueuedRequestExecutor {

    void execute(QueuedRequest request);
}
