package com.stealthradar.api.dto;

import com.stealthradar.monitor.MonitorStatus;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/monitor/status response. {@code scanIntervalSeconds} is the chain's current (possibly backed-off) wait.
 */
public record MonitorStatusResponse(
        boolean running,
        List<ChainStatusResponse> chains,
        int monitoredUserCount,
        int dedupSetSize
) {

    public record ChainStatusResponse(
            String name,
            long chainId,
            Long lastProcessedBlock,
            long scanIntervalSeconds,
            int consecutiveFailures,
            Instant nextScanTime,
            String state,
            boolean enabled
    ) {
    }

    public static MonitorStatusResponse from(MonitorStatus status) {
        List<ChainStatusResponse> chains = status.chains().stream()
                .map(c -> new ChainStatusResponse(
                        c.name(),
                        c.chainId(),
                        c.lastProcessedBlock(),
                        c.scanInterval().toSeconds(),
                        c.consecutiveFailures(),
                        c.nextScanTime(),
                        c.state(),
                        !c.disabled()))
                .toList();
        return new MonitorStatusResponse(status.running(), chains, status.monitoredUserCount(), status.dedupSetSize());
    }
}
