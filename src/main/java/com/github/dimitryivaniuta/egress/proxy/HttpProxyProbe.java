package com.github.dimitryivaniuta.egress.proxy;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.time.Clock;
import java.time.Duration;

/**
 * Probes a proxy by fetching a small public URL through it.
 */
@Slf4j
public class HttpProxyProbe implements ProxyProbe {

    private final String probeUrl;
    private final Duration timeout;
    private final String userAgent;
    private final Clock clock;

    public HttpProxyProbe(String probeUrl, Duration timeout, String userAgent, Clock clock) {
        this.probeUrl = probeUrl;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.clock = clock;
    }

    @Override
    public ProxyHealthStatus probe(ProxyEndpoint endpoint) {
        ProxyAgent agent = ProxyAgent.of(endpoint);
        Timeout t = Timeout.ofMilliseconds(timeout.toMillis());

        BasicCredentialsProvider credentials = new BasicCredentialsProvider();
        if (agent.credentials() != null) {
            credentials.setCredentials(new AuthScope(agent.host()), agent.credentials());
        }

        long start = System.nanoTime();
        try (CloseableHttpClient client = HttpClients.custom()
                .setProxy(agent.host())
                .setDefaultCredentialsProvider(credentials)
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(t)
                                .setSocketTimeout(t)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(t)
                        .setResponseTimeout(t)
                        .build())
                .build()) {

            HttpGet get = new HttpGet(probeUrl);
            get.setHeader("User-Agent", userAgent);

            int status = client.execute(get, response -> {
                EntityUtils.consume(response.getEntity());
                return response.getCode();
            });
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            if (status == 200) {
                return ProxyHealthStatus.healthy(endpoint, elapsedMs, clock.instant());
            }
            return ProxyHealthStatus.unhealthy(endpoint, "HTTP " + status, clock.instant());
        } catch (Exception ex) {
            log.debug("Proxy probe through {} failed: {}", endpoint.key(), ex.getMessage());
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return ProxyHealthStatus.unhealthy(endpoint, message, clock.instant());
        }
    }
}
