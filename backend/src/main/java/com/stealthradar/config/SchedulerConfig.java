package com.stealthradar.config;

import com.stealthradar.monitor.config.MonitorProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler pool for the monitor: one thread per enabled chain loop plus one each for user refresh and dedup
 * cleanup, so a stalled RPC on one chain never holds back another.
 */
@Configuration
public class SchedulerConfig {

    public static final String MONITOR_SCHEDULER = "monitorScheduler";

    static final int MAINTENANCE_THREADS = 2;

    @Bean(name = MONITOR_SCHEDULER)
    public ThreadPoolTaskScheduler monitorScheduler(MonitorProperties monitorProperties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(poolSizeFor(monitorProperties));
        s.setThreadNamePrefix("monitor-scheduler-");
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static int poolSizeFor(MonitorProperties monitorProperties) {
        long enabledChains = monitorProperties.getChains().values().stream()
                .filter(MonitorProperties.ChainEntry::isEnabled)
                .count();
        return (int) enabledChains + MAINTENANCE_THREADS;
    }
}
