package com.example.reelreply.stats;

import com.example.reelreply.domain.MonitoringState;
import com.example.reelreply.domain.MonitoringStatistics;
import com.example.reelreply.monitoring.MonitoringErrorType;
import com.example.reelreply.monitoring.event.MonitoringErrorEvent;
import com.example.reelreply.monitoring.event.MonitoringStatisticsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Owns the live {@link MonitoringStatistics}.
 *
 * Each mutation is persisted through the {@link StatisticsStore} and applied in memory
 * under one lock, so cycles racing each other never lose an increment. Observers are
 * notified after the lock is released.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonitoringStatisticsTracker {

    private final StatisticsStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Object lock = new Object();
    private MonitoringStatistics current = MonitoringStatistics.initial();
    private boolean loaded;

    /**
     * Replace the in-memory counters with the persisted ones, keeping the running flag.
     */
    public MonitoringStatistics reload() {
        MonitoringStatistics snapshot;
        synchronized (lock) {
            current = store.loadStatistics().withRunning(current.running());
            loaded = true;
            snapshot = current;
        }
        log.debug("Loaded statistics: checks={}, replies={}", snapshot.totalChecks(), snapshot.totalReplies());
        publish(snapshot);
        return snapshot;
    }

    /** Count one completed check and clear any recorded error. */
    public MonitoringStatistics recordCheck() {
        Instant now = clock.instant();
        MonitoringStatistics snapshot;
        synchronized (lock) {
            ensureLoaded();
            store.persistCheck(now);
            current = current.withCheck(now);
            snapshot = current;
        }
        publish(snapshot);
        return snapshot;
    }

    public MonitoringStatistics recordReply() {
        MonitoringStatistics snapshot;
        synchronized (lock) {
            ensureLoaded();
            store.persistReplyIncrement();
            current = current.withReply();
            snapshot = current;
        }
        publish(snapshot);
        return snapshot;
    }

    /** Overwrite the last error. Counters are left untouched. */
    public MonitoringStatistics recordError(MonitoringErrorType type, String error) {
        String message = truncate(error);
        Instant now = clock.instant();
        MonitoringStatistics snapshot;
        synchronized (lock) {
            ensureLoaded();
            store.persistError(message, now);
            current = current.withError(message, now);
            snapshot = current;
        }
        publish(snapshot);
        eventPublisher.publishEvent(new MonitoringErrorEvent(type, message, now));
        return snapshot;
    }

    static String truncate(String message) {
        if (message == null || message.length() <= MonitoringState.LAST_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MonitoringState.LAST_ERROR_LENGTH - 3) + "...";
    }

    /** Running flag in memory, operator intent in storage. */
    public MonitoringStatistics markRunning(boolean running) {
        MonitoringStatistics snapshot;
        synchronized (lock) {
            ensureLoaded();
            store.persistEnabledFlag(running);
            current = current.withRunning(running);
            snapshot = current;
        }
        publish(snapshot);
        return snapshot;
    }

    public MonitoringStatistics snapshot() {
        synchronized (lock) {
            ensureLoaded();
            return current;
        }
    }

    private void ensureLoaded() {
        if (!loaded) {
            current = store.loadStatistics().withRunning(current.running());
            loaded = true;
        }
    }

    private void publish(MonitoringStatistics snapshot) {
        eventPublisher.publishEvent(new MonitoringStatisticsChangedEvent(snapshot));
    }
}
