package com.stealthradar.monitor.state;

import com.stealthradar.monitor.config.MonitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persisted last-processed block per chain. Unreadable or corrupt state reads as absent; write failures are
 * logged and left to the next successful write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainProgressStore {

    private final StateStore stateStore;
    private final MonitorProperties monitorProperties;

    public OptionalLong load(String chain) {
        Optional<String> raw;
        try {
            raw = stateStore.get(key(chain));
        } catch (RuntimeException e) {
            log.warn("Could not load {} progress, starting near head: {}", chain, e.getMessage());
            return OptionalLong.empty();
        }
        if (raw.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            long block = Long.parseLong(raw.get().trim());
            if (block < 0) {
                log.warn("Ignoring negative persisted {} progress: {}", chain, block);
                return OptionalLong.empty();
            }
            return OptionalLong.of(block);
        } catch (NumberFormatException e) {
            log.warn("Ignoring corrupt persisted {} progress: '{}'", chain, raw.get());
            return OptionalLong.empty();
        }
    }

    /**
     * @return true if the write succeeded
     */
    public boolean save(String chain, long lastProcessedBlock) {
        try {
            stateStore.set(key(chain), Long.toString(lastProcessedBlock), monitorProperties.getProgressTtl());
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to save {} progress at block {}: {}", chain, lastProcessedBlock, e.getMessage());
            return false;
        }
    }

    static String key(String chain) {
        return "stealth-monitor:" + chain + ":last-block";
    }
}
