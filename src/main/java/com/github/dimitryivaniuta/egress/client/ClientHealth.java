package com.github.dimitryivaniuta.egress.client;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientHealth(boolean status, long responseTime, String error) {

    static ClientHealth up(long responseTime) {
        return new ClientHealth(true, responseTime, null);
    }

    static ClientHealth down(long responseTime, String error) {
        return new ClientHealth(false, responseTime, error);
    }
}
