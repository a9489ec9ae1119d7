package com.github.dimitryivaniuta.egress.proxy;

import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.Credentials;
import org.apache.hc.client5.http.auth.CredentialsProvider;
import org.apache.hc.core5.http.protocol.HttpContext;

/**
 * Answers proxy authentication challenges with the credentials of the matching pool endpoint.
 */
public class ProxyCredentialsProvider implements CredentialsProvider {

    private final ProxyManager proxyManager;

    public ProxyCredentialsProvider(ProxyManager proxyManager) {
        this.proxyManager = proxyManager;
    }

    @Override
    public Credentials getCredentials(AuthScope authScope, HttpContext context) {
        if (authScope == null || authScope.getHost() == null) return null;
        return proxyManager.findEndpoint(authScope.getHost(), authScope.getPort())
                .map(ProxyAgent::of)
                .map(ProxyAgent::credentials)
                .orElse(null);
    }
}
