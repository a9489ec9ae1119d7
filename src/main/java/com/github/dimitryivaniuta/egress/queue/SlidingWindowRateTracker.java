package com.github.dimitryivaniuta.egress.queue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Admission bookkeeping for one provider: timestamps of the last hour plus a 1 s burst counter.
 * Not thread-safe; owned by a {@link ProviderLane} and used under its monitor.
 */
class SlidingWindowRateTracker {

    static final long BURST_WINDOW_MS = 1_000;
    static final long MINUTE_MS = 60_000;
    static final long HOUR_MS = 3_600_000;

    private final Deque<Long> admissions = new ArrayDeque<>();
    private int burstCount;
    private long burstWindowStart;

    SlidingWindowRateTracker(long now) {
        this.burstWindowStart = now;
    }

    boolean canAdmit(RateLimitConfig limits, long now) {
        roll(now);
        if (burstCount >= limits.burstLimit()) return false;
        if (countSince(now - MINUTE_MS) >= limits.requestsPerMinute()) return false;
        return admissions.size() < limits.requestsPerHour();
    }

    void record(long now) {
        roll(now);
        admissions.addLast(now);
        burstCount++;
    }

    int requestsInLastMinute(long now) {
        roll(now);
        return countSince(now - MINUTE_MS);
    }

    int requestsInLastHour(long now) {
        roll(now);
        return admissions.size();
    }

    int burstCount(long now) {
        roll(now);
        return burstCount;
    }

    private void roll(long now) {
        while (!admissions.isEmpty() && now - admissions.peekFirst() >= HOUR_MS) {
            admissions.pollFirst();
        }
        if (now - burstWindowStart >= BURST_WINDOW_MS) {
            burstCount = 0;
            burstWindowStart = now;
        }
    }

    private int countSince(long threshold) {
        int n = 0;
        Iterator<Long> it = admissions.descendingIterator();
        while (it.hasNext() && it.next() > threshold) {
            n++;
        }
        return n;
    }
}
