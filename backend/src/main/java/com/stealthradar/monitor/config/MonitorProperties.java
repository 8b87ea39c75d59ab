package com.stealthradar.monitor.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stealth monitor scheduling, dedup and per-chain config. Key of {@code chains} is the stable chain name
 * (e.g. mainnet, base) used in state keys, logs and status output.
 */
@ConfigurationProperties(prefix = "stealthradar.monitor")
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    /** Start all loops once the application is ready. */
    private boolean autoStart = true;

    /** Wait between scans of a healthy chain. */
    private Duration baseScanInterval = Duration.ofHours(1);

    /** Backoff ceiling for a failing chain. */
    private Duration maxScanInterval = Duration.ofHours(2);

    /** Consecutive failed cycles after which a chain loop is disabled. */
    private int maxFailureCount = 5;

    /** Blocks per eth_getLogs window. */
    private int maxBlockRange = 50;

    /** Blocks behind head to start from when no progress was persisted. */
    private long startBlockOffset = 5;

    /** TTL of the persisted last-processed block. */
    private Duration progressTtl = Duration.ofHours(24);

    private Duration userRefreshInterval = Duration.ofHours(2);

    private Duration dedupCleanupInterval = Duration.ofMinutes(10);

    /** Max identities kept in the dedup set after a cleanup cycle. */
    private int dedupCeiling = 10_000;

    /** How long stop() waits for in-flight cycles. */
    private Duration stopTimeout = Duration.ofSeconds(30);

    /** ERC-5564 announcer (same address on every supported chain). */
    private String announcerAddress = "0x55649E01B5Df198D18D95b5cc5051630cfD45564";

    /** ERC-6538 registry (same address on every supported chain). */
    private String registryAddress = "0x6538E6bf4B0eBd30A8Ea093027Ac2422ce5d6538";

    private Map<String, ChainEntry> chains = new LinkedHashMap<>();

    public void setChains(Map<String, ChainEntry> chains) {
        this.chains = chains != null ? chains : new LinkedHashMap<>();
    }

    /** Per-chain window size, falling back to the global {@link #maxBlockRange}. */
    public int maxBlockRangeFor(String chain) {
        ChainEntry entry = chains.get(chain);
        if (entry != null && entry.getMaxBlockRange() != null && entry.getMaxBlockRange() > 0) {
            return entry.getMaxBlockRange();
        }
        return Math.max(1, maxBlockRange);
    }

    /**
     * One chain: numeric chain id, RPC URLs (round-robin), optional window override.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private long chainId;
        private List<String> urls = new ArrayList<>();
        private Integer maxBlockRange;
        private boolean enabled = true;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
