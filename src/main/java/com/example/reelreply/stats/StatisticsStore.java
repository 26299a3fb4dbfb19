package com.example.reelreply.stats;

import com.example.reelreply.domain.MonitoringScheduleConfig;
import com.example.reelreply.domain.MonitoringStatistics;

import java.time.Duration;
import java.time.Instant;

/**
 * Durable storage for monitoring statistics and schedule settings.
 * Every call is expected to be durable on return and safe to repeat.
 */
public interface StatisticsStore {

    MonitoringStatistics loadStatistics();

    MonitoringScheduleConfig loadScheduleConfig(Duration defaultInterval);

    /** Counts one completed check at {@code at} and clears the last error. */
    void persistCheck(Instant at);

    void persistReplyIncrement();

    void persistError(String error, Instant at);

    void persistEnabledFlag(boolean enabled);

    void persistInterval(Duration interval);
}
