package com.github.dimitryivaniuta.egress.queue;

public record RateLimitStatus(
        int requestsInLastMinute,
        int requestsInLastHour,
        int burstCount,
        RateLimitConfig limits,
        boolean canMakeRequest
) {}
