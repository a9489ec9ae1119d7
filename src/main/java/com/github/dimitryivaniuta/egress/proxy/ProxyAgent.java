package com.github.dimitryivaniuta.egress.proxy;

import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.core5.http.HttpHost;

/**
 * Transport-level handle for routing a call through one proxy endpoint.
 */
public record ProxyAgent(ProxyEndpoint endpoint, HttpHost host, UsernamePasswordCredentials credentials) {

    public static ProxyAgent of(ProxyEndpoint endpoint) {
        UsernamePasswordCredentials creds = (endpoint.getUsername() == null || endpoint.getUsername().isBlank())
                ? null
                : new UsernamePasswordCredentials(endpoint.getUsername(), passwordChars(endpoint));
        return new ProxyAgent(endpoint, new HttpHost("http", endpoint.getHost(), endpoint.getPort()), creds);
    }

    private static char[] passwordChars(ProxyEndpoint endpoint) {
        return endpoint.getPassword() == null ? new char[0] : endpoint.getPassword().toCharArray();
    }

    @Override
    public String toString() {
        // keep credentials out of logs
        return "ProxyAgent[" + endpoint.key() + "]";
    }
}
