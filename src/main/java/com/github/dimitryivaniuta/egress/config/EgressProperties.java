package com.github.dimitryivaniuta.egress.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "egress")
public class EgressProperties {

    private Proxy proxy = new Proxy();
    private Queue queue = new Queue();
    private Retry retry = new Retry();
    private Cache cache = new Cache();
    private Client client = new Client();

    /**
     * Upstream providers created at startup, keyed by client name.
     */
    private Map<String, Provider> providers = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Proxy {
        private boolean enabled = false;
        private String host = "isp.oxylabs.io";
        private List<Integer> ports = List.of(8001, 8002, 8003, 8004, 8005);
        private String username = "";
        private String password = "";
        private String country = "US";
        private String region;
        private Duration rotationInterval = Duration.ofMinutes(5);
        private Duration healthCheckInterval = Duration.ofSeconds(60);
        private Duration healthCheckInitialDelay = Duration.ofSeconds(1);
        private String healthCheckUrl = "https://httpbin.org/ip";
        private Duration healthCheckTimeout = Duration.ofSeconds(10);
        private int maxFailures = 3;
    }

    @Getter
    @Setter
    public static class Queue {
        private Duration tickInterval = Duration.ofMillis(100);

        /**
         * Applied to providers without an entry in {@link #rateLimits}.
         */
        private RateLimit defaultRateLimit = new RateLimit();
        private Map<String, RateLimit> rateLimits = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int requestsPerMinute = 60;
        private int requestsPerHour = 1000;
        private int burstLimit = 5;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Cache {
        private int maxLocalEntries = 1000;
        private int maxLocalValueSize = 1024 * 1024;
        private Duration defaultTtl = Duration.ofMinutes(5);

        /**
         * TTL given to entries promoted from the distributed tier (capped by their remaining TTL there).
         */
        private Duration localTtl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Client {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private String userAgent = "Egress-Toolkit/1.0";
        private int workerThreads = 8;
        private String healthPath = "/health";
        private Duration healthTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Provider {
        private String baseUrl;
        private Duration timeout;
        private boolean useProxy = false;
        private Map<String, String> headers = new LinkedHashMap<>();

        /**
         * Usage budget for direct calls; none when absent.
         */
        private UsageLimit rateLimit;

        /**
         * Overrides of {@code egress.retry}; unset fields inherit the defaults.
         */
        private Integer maxRetries;
        private Duration baseDelay;
        private Duration maxDelay;
        private Double backoffMultiplier;
    }

    @Getter
    @Setter
    public static class UsageLimit {
        private int requestsPerMinute = 60;
        private int requestsPerHour = 1000;
        private int requestsPerDay = 10_000;
    }
}
