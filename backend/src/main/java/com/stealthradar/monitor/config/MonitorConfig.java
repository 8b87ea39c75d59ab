package com.stealthradar.monitor.config;

import com.stealthradar.common.RetryPolicy;
import com.stealthradar.monitor.adapter.EvmRpcClient;
import com.stealthradar.monitor.adapter.RpcEndpointRotator;
import com.stealthradar.monitor.adapter.WebClientEvmRpcClient;
import com.stealthradar.monitor.event.ProcessedEventSet;
import com.stealthradar.monitor.notify.NotificationClient;
import com.stealthradar.monitor.notify.WebClientNotificationClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the monitor's adapters from {@code stealthradar.*}: one rotator per enabled chain with URLs, the shared
 * EVM RPC limiter, getLogs retry policy, dedup set and notification client.
 */
@Configuration
@EnableConfigurationProperties({ MonitorProperties.class, LogFetchProperties.class, EvmRpcProperties.class, NotificationProperties.class })
public class MonitorConfig {

    @Bean(name = "evmRotatorsByChain")
    public Map<String, RpcEndpointRotator> evmRotatorsByChain(MonitorProperties properties) {
        Map<String, RpcEndpointRotator> rotators = new LinkedHashMap<>();
        properties.getChains().forEach((name, chain) -> {
            if (chain != null && chain.isEnabled() && !chain.getUrls().isEmpty()) {
                rotators.put(name, new RpcEndpointRotator(name, chain.getUrls()));
            }
        });
        return rotators;
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, EvmRpcProperties evmRpcProperties) {
        return new WebClientEvmRpcClient(webClientBuilder, evmRpcProperties.getRequestTimeout());
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(EvmRpcProperties evmRpcProperties) {
        int rps = Math.max(1, evmRpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, evmRpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean(name = "logFetchRetryPolicy")
    public RetryPolicy logFetchRetryPolicy(LogFetchProperties properties) {
        return new RetryPolicy(properties.getBaseRetryDelay(), properties.getMaxAttempts());
    }

    @Bean
    public ProcessedEventSet processedEventSet(MonitorProperties properties) {
        return new ProcessedEventSet(properties.getDedupCeiling());
    }

    @Bean
    public NotificationClient notificationClient(WebClient.Builder webClientBuilder, NotificationProperties properties) {
        return new WebClientNotificationClient(webClientBuilder.clone(), properties);
    }
}
