package com.stealthradar.monitor.state;

import java.time.Duration;
import java.util.Optional;

/**
 * External key/value state: per-chain progress and per-user notification counters.
 * All operations throw {@link StateStoreException} when the store is unavailable.
 */
public interface StateStore {

    Optional<String> get(String key);

    /**
     * @param ttl time to live, or null to keep the key until overwritten
     */
    void set(String key, String value, Duration ttl);

    /**
     * Atomically increments a counter, creating it with the given TTL on first increment.
     *
     * @return the counter value after the increment
     */
    long increment(String key, Duration ttl);

    /**
     * @return current counter value, 0 when absent or expired
     */
    long getCounter(String key);
}
