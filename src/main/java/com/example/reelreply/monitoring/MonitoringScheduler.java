package com.example.reelreply.monitoring;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.stats.MonitoringStatisticsTracker;
import com.example.reelreply.stats.StatisticsStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the monitoring lifecycle: STOPPED → RUNNING → STOPPED.
 *
 * A fixed-rate timer fires ticks measured from the previous tick, and each tick hands a cycle
 * to the monitoring executor, so an overrunning cycle never delays the next tick. Changing the
 * interval cancels the timer and arms a new one. Every cycle passes a gate that checks the
 * scheduler is still in the run that queued it; after {@link #stop()} returns no new cycle
 * passes that gate, while one already past it runs to completion.
 */
@Slf4j
@Service
public class MonitoringScheduler {

    static final Duration MIN_INTERVAL_FLOOR = Duration.ofSeconds(60);

    private final MonitoringCycleExecutor cycleExecutor;
    private final MonitoringStatisticsTracker statisticsTracker;
    private final StatisticsStore statisticsStore;
    private final TaskScheduler taskScheduler;
    private final Executor monitoringExecutor;
    private final Clock clock;
    private final Duration minInterval;

    private final Object lifecycleLock = new Object();
    private SchedulerState state = SchedulerState.STOPPED;
    private Duration interval;
    private ScheduledFuture<?> timer;
    private long runId;

    public MonitoringScheduler(MonitoringCycleExecutor cycleExecutor,
                               MonitoringStatisticsTracker statisticsTracker,
                               StatisticsStore statisticsStore,
                               @Qualifier("monitoringTaskScheduler") TaskScheduler taskScheduler,
                               @Qualifier("monitoringExecutor") Executor monitoringExecutor,
                               AutoReplyProperties properties,
                               Clock clock) {
        this.cycleExecutor = cycleExecutor;
        this.statisticsTracker = statisticsTracker;
        this.statisticsStore = statisticsStore;
        this.taskScheduler = taskScheduler;
        this.monitoringExecutor = monitoringExecutor;
        this.clock = clock;

        Duration configuredMin = Duration.ofSeconds(properties.getMonitoring().getMinIntervalSeconds());
        this.minInterval = configuredMin.compareTo(MIN_INTERVAL_FLOOR) < 0 ? MIN_INTERVAL_FLOOR : configuredMin;
        Duration configuredDefault = Duration.ofSeconds(properties.getMonitoring().getDefaultIntervalSeconds());
        this.interval = configuredDefault.compareTo(minInterval) < 0 ? minInterval : configuredDefault;
    }

    public boolean start() {
        return start(getInterval());
    }

    /**
     * Start monitoring and run one cycle right away on the calling thread.
     *
     * @return true if already running; otherwise whether the first cycle succeeded. A failed first
     * cycle still leaves the scheduler running.
     */
    public boolean start(Duration requestedInterval) {
        long run;
        synchronized (lifecycleLock) {
            if (state == SchedulerState.RUNNING) {
                log.info("Monitoring is already running");
                return true;
            }
            if (!isAcceptable(requestedInterval)) {
                log.warn("Refusing to start with interval {} (minimum {})",
                        describe(requestedInterval), describe(minInterval));
                return false;
            }
            interval = requestedInterval;
            statisticsStore.persistInterval(interval);
            statisticsTracker.reload();
            statisticsTracker.markRunning(true);
            state = SchedulerState.RUNNING;
            run = ++runId;
            armTimer(run);
        }
        log.info("Monitoring started (interval: {})", describe(interval));

        return runIfCurrent(run, "startup")
                .map(CycleResult::success)
                .orElse(false);
    }

    /**
     * Cancel the timer and mark monitoring disabled. Calling it while stopped does nothing.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (state == SchedulerState.STOPPED) {
                log.debug("Monitoring is not running");
                return;
            }
            state = SchedulerState.STOPPED;
            runId++;
            cancelTimer();
            statisticsTracker.markRunning(false);
        }
        log.info("Monitoring stopped");
    }

    /**
     * Change the interval. Rejected without side effects below the minimum. While running, the
     * timer is re-armed so the new interval applies from now on.
     */
    public boolean setInterval(Duration newInterval) {
        if (!isAcceptable(newInterval)) {
            log.warn("Interval {} too short (minimum {})", describe(newInterval), describe(minInterval));
            return false;
        }
        synchronized (lifecycleLock) {
            interval = newInterval;
            statisticsStore.persistInterval(newInterval);
            if (state == SchedulerState.RUNNING) {
                cancelTimer();
                armTimer(runId);
            }
        }
        log.info("Monitoring interval set to {}", describe(newInterval));
        return true;
    }

    /**
     * Run one cycle now, outside the timer.
     *
     * @return the cycle result, or empty when monitoring is stopped
     */
    public Optional<CycleResult> triggerNow() {
        long run;
        synchronized (lifecycleLock) {
            if (state != SchedulerState.RUNNING) {
                log.warn("Cannot trigger a monitoring cycle while monitoring is stopped");
                return Optional.empty();
            }
            run = runId;
        }
        return runIfCurrent(run, "manual");
    }

    /** Adopt a persisted interval at boot without touching storage. */
    void restoreInterval(Duration persisted) {
        if (!isAcceptable(persisted)) {
            log.warn("Ignoring persisted interval {} (minimum {})", describe(persisted), describe(minInterval));
            return;
        }
        synchronized (lifecycleLock) {
            interval = persisted;
        }
    }

    public SchedulerState getState() {
        synchronized (lifecycleLock) {
            return state;
        }
    }

    public boolean isRunning() {
        return getState() == SchedulerState.RUNNING;
    }

    public Duration getInterval() {
        synchronized (lifecycleLock) {
            return interval;
        }
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    /** Stops the timer on shutdown but keeps the persisted intent, so the next boot resumes. */
    @PreDestroy
    public void shutdown() {
        synchronized (lifecycleLock) {
            state = SchedulerState.STOPPED;
            runId++;
            cancelTimer();
        }
    }

    private void armTimer(long run) {
        timer = taskScheduler.scheduleAtFixedRate(() -> onTick(run), clock.instant().plus(interval), interval);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    // Must never throw: an exception escaping a fixed-rate task cancels all later ticks.
    private void onTick(long run) {
        if (!isCurrent(run)) {
            return;
        }
        try {
            monitoringExecutor.execute(() -> runIfCurrent(run, "scheduled"));
        } catch (RejectedExecutionException e) {
            log.warn("Monitoring executor saturated, dropping this tick: {}", e.getMessage());
        }
    }

    private Optional<CycleResult> runIfCurrent(long run, String trigger) {
        if (!isCurrent(run)) {
            log.debug("Skipping {} cycle: monitoring was stopped", trigger);
            return Optional.empty();
        }
        try {
            return Optional.of(cycleExecutor.runCycle(trigger));
        } catch (RuntimeException e) {
            log.error("Monitoring cycle ({}) crashed: {}", trigger, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private boolean isCurrent(long run) {
        synchronized (lifecycleLock) {
            return state == SchedulerState.RUNNING && runId == run;
        }
    }

    private boolean isAcceptable(Duration candidate) {
        return candidate != null && candidate.compareTo(minInterval) >= 0;
    }

    static String describe(Duration duration) {
        if (duration == null) {
            return "none";
        }
        long seconds = duration.toSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m";
        }
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        return minutes > 0 ? hours + "h " + minutes + "m" : hours + "h";
    }
}
