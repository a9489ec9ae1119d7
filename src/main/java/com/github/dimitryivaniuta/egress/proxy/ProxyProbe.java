package com.github.dimitryivaniuta.egress.proxy;

/**
 * Sends one short-timeout request through the given proxy and reports the outcome.
 * Implementations must not throw; failures are reported as {@link ProxyHealthStatus.Status#UNHEALTHY}.
 */
@FunctionalInterface
public interface ProxyProbe {

    ProxyHealthStatus probe(ProxyEndpoint endpoint);
}
