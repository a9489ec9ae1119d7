package com.github.dimitryivaniuta.egress.queue;

import com.github.dimitryivaniuta.egress.config.EgressProperties;

public record RateLimitConfig(int requestsPerMinute, int requestsPerHour, int burstLimit) {

    public static RateLimitConfig from(EgressProperties.RateLimit props) {
        return new RateLimitConfig(
                Math.max(1, props.getRequestsPerMinute()),
                Math.max(1, props.getRequestsPerHour()),
                Math.max(1, props.getBurstLimit())
        );
    }
}
