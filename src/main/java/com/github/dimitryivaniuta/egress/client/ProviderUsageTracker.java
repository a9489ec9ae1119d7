package com.github.dimitryivaniuta.egress.client;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;

import java.time.Duration;

/**
 * Minute, hour and day budgets of one client, each a fixed-window Resilience4j limiter.
 *
 * <p>Only completed calls draw on the budget: {@link #waitTime()} inspects the limiters without
 * taking a permit and {@link #record()} reserves one afterwards. Calls that bypassed the wait
 * (queued work) may run one window into debt, which delays later direct calls.
 */
public class ProviderUsageTracker {

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final UsageLimit limits;
    private final AtomicRateLimiter minute;
    private final AtomicRateLimiter hour;
    private final AtomicRateLimiter day;

    public ProviderUsageTracker(String name, UsageLimit limits) {
        this(name, limits, MINUTE, HOUR, DAY);
    }

    ProviderUsageTracker(String name, UsageLimit limits, Duration minuteWindow, Duration hourWindow, Duration dayWindow) {
        this.limits = limits;
        this.minute = window(name + ":minute", limits.requestsPerMinute(), minuteWindow);
        this.hour = window(name + ":hour", limits.requestsPerHour(), hourWindow);
        this.day = window(name + ":day", limits.requestsPerDay(), dayWindow);
    }

    private static AtomicRateLimiter window(String name, int limit, Duration period) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(limit)
                .limitRefreshPeriod(period)
                .timeoutDuration(period)
                .build();
        return new AtomicRateLimiter(name, config);
    }

    /**
     * Time until the next call fits every budget; {@link Duration#ZERO} when it fits now.
     */
    public Duration waitTime() {
        long nanos = Math.max(nanosToWait(minute), Math.max(nanosToWait(hour), nanosToWait(day)));
        return Duration.ofNanos(nanos);
    }

    public void record() {
        minute.reservePermission();
        hour.reservePermission();
        day.reservePermission();
    }

    public UsageStatus status() {
        Duration wait = waitTime();
        return new UsageStatus(
                used(minute, limits.requestsPerMinute()),
                used(hour, limits.requestsPerHour()),
                used(day, limits.requestsPerDay()),
                limits,
                wait,
                wait.isZero());
    }

    private static long nanosToWait(AtomicRateLimiter limiter) {
        return Math.max(0, limiter.getDetailedMetrics().getNanosToWait());
    }

    private static int used(AtomicRateLimiter limiter, int limit) {
        return Math.max(0, limit - limiter.getMetrics().getAvailablePermissions());
    }
}
