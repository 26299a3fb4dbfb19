package com.example.reelreply.monitoring;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.domain.MonitoringScheduleConfig;
import com.example.reelreply.stats.MonitoringStatisticsTracker;
import com.example.reelreply.stats.StatisticsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Restores persisted statistics and schedule settings at startup and resumes monitoring
 * when the operator left it enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonitoringBootstrap {

    private final MonitoringScheduler scheduler;
    private final MonitoringStatisticsTracker statisticsTracker;
    private final StatisticsStore statisticsStore;
    private final AutoReplyProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void resumeMonitoring() {
        statisticsTracker.reload();
        MonitoringScheduleConfig config = statisticsStore.loadScheduleConfig(scheduler.getInterval());
        scheduler.restoreInterval(config.interval());

        if (!config.enabled()) {
            log.info("Monitoring is disabled; not scheduling");
            return;
        }
        if (!properties.getMonitoring().isResumeOnStartup()) {
            log.info("Monitoring was enabled but resume-on-startup is off; not scheduling");
            return;
        }
        log.info("Resuming monitoring with interval {}", MonitoringScheduler.describe(scheduler.getInterval()));
        scheduler.start(scheduler.getInterval());
    }
}
