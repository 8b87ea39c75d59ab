package com.stealthradar.monitor.event;

import com.stealthradar.domain.ChainDescriptor;
import com.stealthradar.domain.EventIdentity;
import com.stealthradar.monitor.adapter.RawLog;
import com.stealthradar.monitor.event.ProcessingResult.SkipReason;
import com.stealthradar.monitor.event.ProcessingResult.Skipped;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Turns raw logs into stealth events at most once per identity. The identity is recorded before decoding,
 * so a log that fails to decode is not retried either.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventProcessor {

    private final ProcessedEventSet processedEvents;
    private final StealthEventDecoder decoder;
    private final Clock clock;

    public ProcessingResult process(RawLog rawLog, ChainDescriptor chain) {
        if (rawLog.transactionHash() == null || rawLog.transactionHash().isBlank()) {
            log.warn("{}: skipping log without transaction hash at block {}", chain.name(), rawLog.blockNumber());
            return new Skipped(null, SkipReason.MALFORMED, "missing transaction hash");
        }
        EventIdentity identity = new EventIdentity(chain.chainId(), rawLog.transactionHash(), rawLog.logIndex());
        if (!processedEvents.add(identity)) {
            log.debug("{}: already processed {}", chain.name(), identity);
            return new Skipped(identity, SkipReason.DUPLICATE, "already processed");
        }
        ProcessingResult result = decoder.decode(rawLog, chain, identity, clock.instant());
        if (result instanceof Skipped skipped) {
            log.warn("{}: skipping undecodable log {} ({}): {}", chain.name(), identity, skipped.reason(), skipped.detail());
        }
        return result;
    }

    /**
     * Dedup maintenance, run periodically by the monitor.
     */
    public int cleanupProcessedEvents() {
        int before = processedEvents.size();
        int evicted = processedEvents.cleanup();
        if (evicted > 0) {
            log.info("Cleaned up processed events ({} -> {})", before, before - evicted);
        }
        return evicted;
    }

    public int processedEventCount() {
        return processedEvents.size();
    }
}
