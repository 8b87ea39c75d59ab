package com.stealthradar.monitor.scan;

import com.stealthradar.domain.ChainDescriptor;
import com.stealthradar.domain.MonitoredUser;
import com.stealthradar.monitor.adapter.ChainClient;
import com.stealthradar.monitor.adapter.RawLog;
import com.stealthradar.monitor.config.MonitorProperties;
import com.stealthradar.monitor.event.EventProcessor;
import com.stealthradar.monitor.event.ProcessingResult;
import com.stealthradar.monitor.event.StealthContracts;
import com.stealthradar.monitor.fetch.LogFetcher;
import com.stealthradar.monitor.notify.NotificationDispatcher;
import com.stealthradar.monitor.state.ChainProgressStore;
import com.stealthradar.monitor.user.UserRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.BooleanSupplier;

/**
 * One scan cycle of one chain: read the head, walk {@code (lastProcessedBlock, head]} in windows, decode and
 * dispatch each window's events, then commit the window. A failure propagates after committing every window
 * that completed before it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainScanCycle {

    static final long CATCH_UP_LOG_THRESHOLD = 100;

    private static final Comparator<RawLog> CHAIN_ORDER =
            Comparator.comparingLong(RawLog::blockNumber).thenComparingLong(RawLog::logIndex);

    private final ChainClient chainClient;
    private final LogFetcher logFetcher;
    private final EventProcessor eventProcessor;
    private final NotificationDispatcher notificationDispatcher;
    private final UserRegistry userRegistry;
    private final ChainProgressStore progressStore;
    private final MonitorProperties monitorProperties;

    public record CycleResult(long fromBlock, long toBlock, int windows, int events, int notifications) {

        static CycleResult upToDate(long head) {
            return new CycleResult(head + 1, head, 0, 0, 0);
        }
    }

    /**
     * Restores progress from the store, falling back to a few blocks behind the head. Leaves the state
     * uninitialized if the head cannot be read; the first cycle retries then.
     */
    public void initialize(ChainState state) {
        if (state.isInitialized()) {
            return;
        }
        OptionalLong persisted = progressStore.load(state.getName());
        if (persisted.isPresent()) {
            state.initialize(persisted.getAsLong());
            log.info("{}: resuming from persisted block {}", state.getName(), persisted.getAsLong());
            return;
        }
        try {
            initializeFromHead(state, chainClient.currentBlockHeight(state.getName()));
        } catch (RuntimeException e) {
            log.warn("{}: could not read chain head at start, deferring to first scan: {}", state.getName(), e.getMessage());
        }
    }

    public CycleResult run(ChainState state, BooleanSupplier running) {
        String chain = state.getName();
        long head = chainClient.currentBlockHeight(chain);
        if (!state.isInitialized()) {
            initializeFromHead(state, head);
        }
        long fromBlock = state.getLastProcessedBlock() + 1;
        if (fromBlock > head) {
            log.debug("{}: up to date at block {}", chain, head);
            return CycleResult.upToDate(head);
        }
        long behind = head - fromBlock + 1;
        boolean catchingUp = behind > CATCH_UP_LOG_THRESHOLD;
        if (catchingUp) {
            log.info("{}: catching up {} blocks ({} -> {})", chain, behind, fromBlock, head);
        }

        int windowSize = monitorProperties.maxBlockRangeFor(chain);
        int windows = 0;
        int events = 0;
        int notifications = 0;
        long windowStart = fromBlock;
        while (windowStart <= head && running.getAsBoolean()) {
            long windowEnd = Math.min(head, windowStart + windowSize - 1);
            if (catchingUp) {
                log.info("{}: scanning blocks {}-{} of {}", chain, windowStart, windowEnd, head);
            }
            WindowResult window = scanWindow(state.getChain(), windowStart, windowEnd);
            state.advanceTo(windowEnd);
            progressStore.save(chain, windowEnd);
            windows++;
            events += window.events();
            notifications += window.notifications();
            windowStart = windowEnd + 1;
        }
        if (events > 0) {
            log.info("{}: processed {} stealth events in blocks {}-{}, sent {} notifications",
                    chain, events, fromBlock, windowStart - 1, notifications);
        }
        return new CycleResult(fromBlock, windowStart - 1, windows, events, notifications);
    }

    private WindowResult scanWindow(ChainDescriptor chain, long fromBlock, long toBlock) {
        List<RawLog> logs = new ArrayList<>(logFetcher.fetch(chain.name(),
                monitorProperties.getAnnouncerAddress(), StealthContracts.ANNOUNCEMENT_TOPIC, fromBlock, toBlock));
        logs.addAll(logFetcher.fetch(chain.name(),
                monitorProperties.getRegistryAddress(), StealthContracts.STEALTH_META_ADDRESS_SET_TOPIC, fromBlock, toBlock));
        logs.sort(CHAIN_ORDER);

        int events = 0;
        int notifications = 0;
        List<MonitoredUser> users = logs.isEmpty() ? List.of() : userRegistry.all();
        for (RawLog rawLog : logs) {
            if (eventProcessor.process(rawLog, chain) instanceof ProcessingResult.Processed processed) {
                events++;
                notifications += notificationDispatcher.dispatch(processed.event(), users);
            }
        }
        return new WindowResult(events, notifications);
    }

    private void initializeFromHead(ChainState state, long head) {
        long start = Math.max(0, head - monitorProperties.getStartBlockOffset());
        state.initialize(start);
        log.info("{}: no persisted progress, starting at block {} (head {})", state.getName(), start, head);
    }

    private record WindowResult(int events, int notifications) {
    }
}
