package com.github.dimitryivaniuta.egress.cache;

import com.fasterxml.jackson.annotation.JsonInclude;

public record CacheHealth(Distributed distributed, Local local) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Distributed(boolean status, long responseTime, String error) {}

    public record Local(boolean status, long keyCount, long memoryUsage) {}

    public boolean isHealthy() {
        return distributed.status() && local.status();
    }
}
