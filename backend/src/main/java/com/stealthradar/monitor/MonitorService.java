package com.stealthradar.monitor;

import com.stealthradar.domain.ChainDescriptor;
import com.stealthradar.monitor.config.MonitorProperties;
import com.stealthradar.monitor.event.EventProcessor;
import com.stealthradar.monitor.scan.ChainScanCycle;
import com.stealthradar.monitor.scan.ChainScanScheduler;
import com.stealthradar.monitor.scan.ChainState;
import com.stealthradar.monitor.user.UserRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle of the stealth monitor: one scan loop per enabled chain plus the user-refresh and dedup-cleanup loops.
 * All loops share one running flag; stop() clears it, cancels pending runs and waits for in-flight cycles.
 */
@Slf4j
@Service
public class MonitorService {

    private final MonitorProperties monitorProperties;
    private final ChainScanCycle chainScanCycle;
    private final EventProcessor eventProcessor;
    private final UserRegistry userRegistry;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private volatile List<ChainScanScheduler> chainLoops = List.of();
    private final List<ScheduledFuture<?>> maintenanceLoops = new ArrayList<>();

    public MonitorService(
            MonitorProperties monitorProperties,
            ChainScanCycle chainScanCycle,
            EventProcessor eventProcessor,
            UserRegistry userRegistry,
            @Qualifier("monitorScheduler") TaskScheduler taskScheduler,
            Clock clock
    ) {
        this.monitorProperties = monitorProperties;
        this.chainScanCycle = chainScanCycle;
        this.eventProcessor = eventProcessor;
        this.userRegistry = userRegistry;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (monitorProperties.isAutoStart()) {
            start();
        } else {
            log.info("Stealth monitor auto-start disabled");
        }
    }

    /**
     * No-op if already running.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (!running.compareAndSet(false, true)) {
                log.debug("Stealth monitor already running");
                return;
            }
            try {
                doStart();
            } catch (RuntimeException e) {
                running.set(false);
                cancelAll();
                throw e;
            }
        }
    }

    private void doStart() {
        Instant now = clock.instant();
        List<ChainScanScheduler> loops = new ArrayList<>();
        for (Map.Entry<String, MonitorProperties.ChainEntry> entry : monitorProperties.getChains().entrySet()) {
            MonitorProperties.ChainEntry chain = entry.getValue();
            if (!chain.isEnabled()) {
                log.info("{}: disabled in configuration", entry.getKey());
                continue;
            }
            ChainState state = new ChainState(new ChainDescriptor(entry.getKey(), chain.getChainId()),
                    monitorProperties.getBaseScanInterval(), monitorProperties.getMaxScanInterval(), now);
            chainScanCycle.initialize(state);
            loops.add(new ChainScanScheduler(state, chainScanCycle, taskScheduler, running::get,
                    monitorProperties.getMaxFailureCount(), clock));
        }
        userRegistry.refresh();

        chainLoops = List.copyOf(loops);
        chainLoops.forEach(ChainScanScheduler::start);
        maintenanceLoops.add(taskScheduler.scheduleWithFixedDelay(this::refreshUsers,
                now.plus(monitorProperties.getUserRefreshInterval()), monitorProperties.getUserRefreshInterval()));
        maintenanceLoops.add(taskScheduler.scheduleWithFixedDelay(this::cleanupProcessedEvents,
                now.plus(monitorProperties.getDedupCleanupInterval()), monitorProperties.getDedupCleanupInterval()));
        log.info("Stealth monitor started: {} chains, {} users", chainLoops.size(), userRegistry.size());
    }

    /**
     * Waits up to {@code stopTimeout} for in-flight cycles. No-op if not running.
     */
    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            cancelAll();
            long deadline = System.nanoTime() + monitorProperties.getStopTimeout().toNanos();
            for (ChainScanScheduler loop : chainLoops) {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                try {
                    if (!loop.awaitIdle(remaining)) {
                        log.warn("{}: cycle still in flight after stop timeout", loop.getState().getName());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for {} to stop", loop.getState().getName());
                    break;
                }
            }
            log.info("Stealth monitor stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public MonitorStatus status() {
        List<MonitorStatus.ChainStatus> chains = new ArrayList<>();
        for (ChainScanScheduler loop : chainLoops) {
            ChainState s = loop.getState();
            chains.add(new MonitorStatus.ChainStatus(
                    s.getName(),
                    s.getChain().chainId(),
                    s.getLastProcessedBlock(),
                    s.getScanInterval(),
                    s.getConsecutiveFailures(),
                    s.getNextScanTime(),
                    s.getStatus().name(),
                    s.isDisabled()
            ));
        }
        return new MonitorStatus(running.get(), List.copyOf(chains), userRegistry.size(), eventProcessor.processedEventCount());
    }

    void refreshUsers() {
        if (running.get()) {
            userRegistry.refresh();
        }
    }

    void cleanupProcessedEvents() {
        if (running.get()) {
            eventProcessor.cleanupProcessedEvents();
        }
    }

    List<ChainScanScheduler> chainLoops() {
        return chainLoops;
    }

    private void cancelAll() {
        chainLoops.forEach(ChainScanScheduler::stop);
        maintenanceLoops.forEach(f -> f.cancel(false));
        maintenanceLoops.clear();
    }
}
