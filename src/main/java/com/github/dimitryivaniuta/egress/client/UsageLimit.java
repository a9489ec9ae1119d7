package com.github.dimitryivaniuta.egress.client;

import com.github.dimitryivaniuta.egress.config.EgressProperties;

public record UsageLimit(int requestsPerMinute, int requestsPerHour, int requestsPerDay) {

    public static UsageLimit from(EgressProperties.UsageLimit props) {
        if (props == null) return null;
        return new UsageLimit(
                Math.max(1, props.getRequestsPerMinute()),
                Math.max(1, props.getRequestsPerHour()),
                Math.max(1, props.getRequestsPerDay())
        );
    }
}
