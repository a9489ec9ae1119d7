package com.github.dimitryivaniuta.egress.queue;

/**
 * Snapshot of one provider lane. Times are in milliseconds.
 */
public record QueueStats(
        int pending,
        int processing,
        long completed,
        long failed,
        long totalProcessed,
        double averageWaitTime,
        double averageProcessingTime,
        boolean paused
) {

    public static QueueStats empty() {
        return new QueueStats(0, 0, 0, 0, 0, 0.0, 0.0, false);
    }
}
