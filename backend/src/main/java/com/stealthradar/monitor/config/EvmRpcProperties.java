package com.stealthradar.monitor.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * EVM RPC throttling and endpoint cool-down settings.
 */
@ConfigurationProperties(prefix = "stealthradar.monitor.evm-rpc")
@NoArgsConstructor
@Getter
@Setter
public class EvmRpcProperties {

    /** Global EVM RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 25;

    /** How long local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /** Time to skip an endpoint after rate-limit errors (HTTP 429 / -32005). */
    private long endpointCooldownMs = 60_000;

    private Duration requestTimeout = Duration.ofSeconds(15);
}
