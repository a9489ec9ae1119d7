package com.github.dimitryivaniuta.egress.client;

import lombok.Builder;
import lombok.Singular;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * One provider call. {@code path} is resolved against the client's base URL.
 */
@Builder(toBuilder = true)
public record OutboundRequest(
        HttpMethod method,
        String path,
        @Singular Map<String, Object> params,
        @Singular Map<String, String> headers,
        Object body
) {

    public OutboundRequest {
        method = method == null ? HttpMethod.GET : method;
        params = params == null ? Map.of() : params;
        headers = headers == null ? Map.of() : headers;
    }

    public static OutboundRequest get(String path) {
        return OutboundRequest.builder().path(path).build();
    }
}
