package com.github.dimitryivaniuta.egress.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.egress.cache.DistributedStore;
import com.github.dimitryivaniuta.egress.cache.RedisDistributedStore;
import com.github.dimitryivaniuta.egress.cache.TieredCacheManager;
import com.github.dimitryivaniuta.egress.client.ResilientClientFactory;
import com.github.dimitryivaniuta.egress.metrics.EgressMetrics;
import com.github.dimitryivaniuta.egress.proxy.HttpProxyProbe;
import com.github.dimitryivaniuta.egress.proxy.ProxyManager;
import com.github.dimitryivaniuta.egress.proxy.ProxyProbe;
import com.github.dimitryivaniuta.egress.queue.RateLimitedRequestQueue;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Wires the egress components. Each one is a plain object with an explicit start/destroy
 * lifecycle driven by the context.
 */
@Configuration
@EnableConfigurationProperties(EgressProperties.class)
public class EgressConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "egressTaskScheduler")
    public ThreadPoolTaskScheduler egressTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("egress-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public EgressMetrics egressMetrics(MeterRegistry registry) {
        return new EgressMetrics(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProxyProbe proxyProbe(EgressProperties props, Clock clock) {
        EgressProperties.Proxy proxy = props.getProxy();
        return new HttpProxyProbe(proxy.getHealthCheckUrl(), proxy.getHealthCheckTimeout(),
                props.getClient().getUserAgent(), clock);
    }

    @Bean(initMethod = "start", destroyMethod = "destroy")
    public ProxyManager proxyManager(EgressProperties props,
                                     ProxyProbe proxyProbe,
                                     TaskScheduler egressTaskScheduler,
                                     EgressMetrics metrics,
                                     Clock clock) {
        return new ProxyManager(props.getProxy(), proxyProbe, egressTaskScheduler, metrics, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "destroy")
    public RateLimitedRequestQueue rateLimitedRequestQueue(EgressProperties props,
                                                           TaskScheduler egressTaskScheduler,
                                                           EgressMetrics metrics,
                                                           Clock clock) {
        return new RateLimitedRequestQueue(props.getQueue(), props.getRetry(), egressTaskScheduler, metrics, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "destroy")
    public ResilientClientFactory resilientClientFactory(EgressProperties props,
                                                         ProxyManager proxyManager,
                                                         RateLimitedRequestQueue queue,
                                                         EgressMetrics metrics,
                                                         Clock clock) {
        ResilientClientFactory factory = new ResilientClientFactory(props, proxyManager, metrics, clock);
        factory.bindQueue(queue);
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public DistributedStore distributedStore(StringRedisTemplate redisTemplate) {
        return new RedisDistributedStore(redisTemplate);
    }

    @Bean(destroyMethod = "destroy")
    public TieredCacheManager tieredCacheManager(EgressProperties props,
                                                 DistributedStore store,
                                                 ObjectMapper objectMapper,
                                                 EgressMetrics metrics,
                                                 Clock clock) {
        return new TieredCacheManager(props.getCache(), store, objectMapper, metrics, clock);
    }
}
