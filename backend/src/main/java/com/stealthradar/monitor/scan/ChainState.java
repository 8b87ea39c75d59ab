package com.stealthradar.monitor.scan;

import com.stealthradar.domain.ChainDescriptor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Scan progress and backoff state of one chain. Written only by that chain's own loop; other threads read it
 * for status reporting.
 */
@Getter
public class ChainState {

    public enum Status {
        IDLE,
        SCANNING,
        DISABLED,
        STOPPED
    }

    private final ChainDescriptor chain;
    private final Duration baseInterval;
    private final Duration maxInterval;

    /** Null until initialized from persisted progress or the chain head. */
    private volatile Long lastProcessedBlock;
    private volatile Duration scanInterval;
    private volatile int consecutiveFailures;
    private volatile Instant nextScanTime;
    private volatile Status status = Status.IDLE;

    public ChainState(ChainDescriptor chain, Duration baseInterval, Duration maxInterval, Instant now) {
        this.chain = chain;
        this.baseInterval = baseInterval;
        this.maxInterval = maxInterval.compareTo(baseInterval) < 0 ? baseInterval : maxInterval;
        this.scanInterval = baseInterval;
        this.nextScanTime = now;
    }

    public String getName() {
        return chain.name();
    }

    public boolean isInitialized() {
        return lastProcessedBlock != null;
    }

    void initialize(long block) {
        if (lastProcessedBlock == null) {
            lastProcessedBlock = Math.max(0, block);
        }
    }

    /**
     * Never moves progress backwards.
     */
    void advanceTo(long block) {
        Long current = lastProcessedBlock;
        if (current == null || block > current) {
            lastProcessedBlock = block;
        }
    }

    void markScanning() {
        status = Status.SCANNING;
    }

    void recordSuccess(Instant now) {
        consecutiveFailures = 0;
        scanInterval = baseInterval;
        status = Status.IDLE;
        nextScanTime = now.plus(scanInterval);
    }

    /**
     * @return true if the chain has now reached {@code maxFailureCount} and is disabled
     */
    boolean recordFailure(Instant now, int maxFailureCount) {
        consecutiveFailures++;
        scanInterval = backoffInterval(baseInterval, maxInterval, consecutiveFailures);
        nextScanTime = now.plus(scanInterval);
        if (consecutiveFailures >= maxFailureCount) {
            status = Status.DISABLED;
            return true;
        }
        status = Status.IDLE;
        return false;
    }

    void markStopped() {
        if (status != Status.DISABLED) {
            status = Status.STOPPED;
        }
    }

    public boolean isDisabled() {
        return status == Status.DISABLED;
    }

    /**
     * {@code min(base * 2^failures, max)}, saturating instead of overflowing.
     */
    static Duration backoffInterval(Duration base, Duration max, int failures) {
        if (failures <= 0) {
            return base;
        }
        long baseMs = base.toMillis();
        long maxMs = max.toMillis();
        int shift = Math.min(failures, 62);
        if (baseMs > (maxMs >> shift)) {
            return max;
        }
        return Duration.ofMillis(Math.min(baseMs << shift, maxMs));
    }
}
