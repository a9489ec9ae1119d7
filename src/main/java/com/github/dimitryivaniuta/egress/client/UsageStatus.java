package com.github.dimitryivaniuta.egress.client;

import java.time.Duration;

/**
 * @param waitTime time until the next direct call fits every budget
 */
public record UsageStatus(
        int requestsThisMinute,
        int requestsThisHour,
        int requestsToday,
        UsageLimit limits,
        Duration waitTime,
        boolean canMakeRequest
) {}
