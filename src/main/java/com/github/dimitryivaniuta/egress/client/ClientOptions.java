package com.github.dimitryivaniuta.egress.client;

import com.github.dimitryivaniuta.egress.config.EgressProperties;
import com.github.dimitryivaniuta.egress.retry.BackoffPolicy;
import lombok.Builder;
import lombok.Singular;

import java.time.Duration;
import java.util.Map;

/**
 * @param usageLimit budget for direct calls; {@code null} leaves the client unthrottled
 * @param backoff    {@code null} uses {@code egress.retry}
 */
@Builder(toBuilder = true)
public record ClientOptions(
        String baseUrl,
        Duration timeout,
        boolean useProxy,
        @Singular Map<String, String> headers,
        UsageLimit usageLimit,
        BackoffPolicy backoff
) {

    public ClientOptions {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ClientOptions from(EgressProperties.Provider provider, EgressProperties.Retry retryDefaults) {
        return new ClientOptions(
                provider.getBaseUrl(),
                provider.getTimeout(),
                provider.isUseProxy(),
                provider.getHeaders(),
                UsageLimit.from(provider.getRateLimit()),
                BackoffPolicy.from(retryDefaults, provider)
        );
    }
}
