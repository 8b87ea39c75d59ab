package com.stealthradar.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot for observability. Nothing in the monitor decides anything from it.
 */
public record MonitorStatus(
        boolean running,
        List<ChainStatus> chains,
        int monitoredUserCount,
        int dedupSetSize
) {

    /**
     * {@code lastProcessedBlock} is null until the chain is initialized.
     */
    public record ChainStatus(
            String name,
            long chainId,
            Long lastProcessedBlock,
            Duration scanInterval,
            int consecutiveFailures,
            Instant nextScanTime,
            String state,
            boolean disabled
    ) {
    }
}
