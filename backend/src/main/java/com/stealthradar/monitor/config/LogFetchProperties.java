package com.stealthradar.monitor.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Per-call eth_getLogs retry budget. Attempt N failing waits N * baseRetryDelay.
 */
@ConfigurationProperties(prefix = "stealthradar.monitor.fetch")
@NoArgsConstructor
@Getter
@Setter
public class LogFetchProperties {

    /** Total attempts including the first call. */
    private int maxAttempts = 3;

    private Duration baseRetryDelay = Duration.ofSeconds(1);
}
