package com.github.dimitryivaniuta.egress.proxy;

import org.apache.hc.client5.http.impl.DefaultSchemePortResolver;
import org.apache.hc.client5.http.impl.routing.DefaultRoutePlanner;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.protocol.HttpContext;

/**
 * Routes a call through the proxy pinned on the calling thread, or directly when none is pinned.
 *
 * <p>Classic HttpClient executes on the caller's thread, so a pin covers exactly one logical call.
 */
public class ProxyRoutePlanner extends DefaultRoutePlanner {

    private final ThreadLocal<ProxyAgent> pinned = new ThreadLocal<>();

    public ProxyRoutePlanner() {
        super(DefaultSchemePortResolver.INSTANCE);
    }

    public Pin pin(ProxyAgent agent) {
        pinned.set(agent);
        return pinned::remove;
    }

    @Override
    protected HttpHost determineProxy(HttpHost target, HttpContext context) {
        ProxyAgent agent = pinned.get();
        return agent == null ? null : agent.host();
    }

    @FunctionalInterface
    public interface Pin extends AutoCloseable {
        @Override
        void close();
    }
}
