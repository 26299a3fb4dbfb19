package com.example.reelreply.monitoring;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.stats.InMemoryStatisticsStore;
import com.example.reelreply.stats.MonitoringStatisticsTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private MonitoringCycleExecutor cycleExecutor;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> timer;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryStatisticsStore statisticsStore;
    private MonitoringStatisticsTracker tracker;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        statisticsStore = new InMemoryStatisticsStore();
        tracker = new MonitoringStatisticsTracker(statisticsStore, eventPublisher, clock);
        lenient().doReturn(timer).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        lenient().when(cycleExecutor.runCycle(anyString())).thenAnswer(inv -> result(inv.getArgument(0), true));
    }

    private MonitoringScheduler scheduler(Executor monitoringExecutor) {
        return new MonitoringScheduler(cycleExecutor, tracker, statisticsStore, taskScheduler,
                monitoringExecutor, new AutoReplyProperties(), clock);
    }

    private MonitoringScheduler scheduler() {
        return scheduler(Runnable::run);
    }

    private static CycleResult result(String trigger, boolean success) {
        return new CycleResult(trigger, NOW, Duration.ZERO, success, 1, 0, 0, 0, 0, 0, 0, 0, 1,
                success ? null : MonitoringErrorType.AUTHENTICATION,
                success ? null : "Invalid access token. Please check your credentials in Settings.");
    }

    private Runnable capturedTick() {
        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, atLeastOnce()).scheduleAtFixedRate(tick.capture(), any(Instant.class), any(Duration.class));
        return tick.getValue();
    }

    @Test
    void startRunsFirstCycleAndArmsTimer() {
        MonitoringScheduler scheduler = scheduler();

        assertTrue(scheduler.start(Duration.ofMinutes(5)));

        assertEquals(SchedulerState.RUNNING, scheduler.getState());
        verify(cycleExecutor).runCycle("startup");
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(NOW.plus(Duration.ofMinutes(5))), eq(Duration.ofMinutes(5)));
        assertTrue(statisticsStore.isEnabled());
        assertEquals(Duration.ofMinutes(5), statisticsStore.getInterval());
        assertTrue(tracker.snapshot().running());
    }

    @Test
    void startWithoutIntervalUsesDefault() {
        MonitoringScheduler scheduler = scheduler();

        scheduler.start();

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(300)));
    }

    @Test
    void startWhileRunningKeepsSingleTimer() {
        MonitoringScheduler scheduler = scheduler();
        scheduler.start(Duration.ofMinutes(5));

        assertTrue(scheduler.start(Duration.ofMinutes(10)));

        verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        verify(cycleExecutor, times(1)).runCycle(anyString());
        assertEquals(Duration.ofMinutes(5), scheduler.getInterval());

        capturedTick().run();
        verify(cycleExecutor, times(1)).runCycle("scheduled");
    }

    @Test
    void failedFirstCycleStillLeavesMonitoringRunning() {
        when(cycleExecutor.runCycle("startup")).thenReturn(result("startup", false));
        MonitoringScheduler scheduler = scheduler();

        assertFalse(scheduler.start(Duration.ofMinutes(5)));

        assertTrue(scheduler.isRunning());
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    void crashingCycleDoesNotEscape() {
        when(cycleExecutor.runCycle("startup")).thenThrow(new IllegalStateException("bug"));
        MonitoringScheduler scheduler = scheduler();

        assertFalse(scheduler.start(Duration.ofMinutes(5)));
        assertTrue(scheduler.isRunning());
    }

    @Test
    void startBelowMinimumIsRejected() {
        MonitoringScheduler scheduler = scheduler();

        assertFalse(scheduler.start(Duration.ofSeconds(30)));

        assertEquals(SchedulerState.STOPPED, scheduler.getState());
        verifyNoInteractions(taskScheduler, cycleExecutor);
        assertFalse(statisticsStore.isEnabled());
    }

    @Test
    void stopIsIdempotent() {
        MonitoringScheduler scheduler = scheduler();
        scheduler.start(Duration.ofMinutes(5));

        scheduler.stop();
        scheduler.stop();

        assertEquals(SchedulerState.STOPPED, scheduler.getState());
        verify(timer, times(1)).cancel(false);
        assertFalse(statisticsStore.isEnabled());
        assertFalse(tracker.snapshot().running());
    }

    @Test
    void stopWithoutStartDoesNothing() {
        MonitoringScheduler scheduler = scheduler();

        scheduler.stop();

        assertEquals(SchedulerState.STOPPED, scheduler.getState());
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void tickAfterStopDoesNotRunCycle() {
        MonitoringScheduler scheduler = scheduler();
        scheduler.start(Duration.ofMinutes(5));
        Runnable tick = capturedTick();

        scheduler.stop();
        tick.run();

        verify(cycleExecutor, never()).runCycle("scheduled");
    }

    @Test
    void queuedCycleDoesNotBeginAfterStop() {
        List<Runnable> queued = new ArrayList<>();
        MonitoringScheduler scheduler = scheduler(queued::add);
        scheduler.start(Duration.ofMinutes(5));
        Runnable tick = capturedTick();

        tick.run();
        tick.run();
        assertEquals(2, queued.size());

        scheduler.stop();
        queued.forEach(Runnable::run);

        verify(cycleExecutor, never()).runCycle("scheduled");
    }

    @Test
    void ticksDoNotWaitForRunningCycle() {
        List<Runnable> queued = new ArrayList<>();
        MonitoringScheduler scheduler = scheduler(queued::add);
        scheduler.start(Duration.ofMinutes(5));
        Runnable tick = capturedTick();

        tick.run();
        tick.run();
        queued.forEach(Runnable::run);

        verify(cycleExecutor, times(2)).runCycle("scheduled");
    }

    @Test
    void saturatedExecutorDropsTick() {
        MonitoringScheduler scheduler = scheduler(task -> {
            throw new RejectedExecutionException("full");
        });
        scheduler.start(Duration.ofMinutes(5));

        assertDoesNotThrow(() -> capturedTick().run());
        verify(cycleExecutor, never()).runCycle("scheduled");
    }

    @Test
    void intervalBelowMinimumIsRejected() {
        MonitoringScheduler scheduler = scheduler();

        assertFalse(scheduler.setInterval(Duration.ofSeconds(30)));
        assertEquals(Duration.ofSeconds(300), scheduler.getInterval());
        assertNull(statisticsStore.getInterval());

        assertTrue(scheduler.setInterval(Duration.ofSeconds(60)));
        assertEquals(Duration.ofSeconds(60), scheduler.getInterval());
        assertEquals(Duration.ofSeconds(60), statisticsStore.getInterval());
    }

    @Test
    void configuredMinimumCannotGoBelowFloor() {
        AutoReplyProperties properties = new AutoReplyProperties();
        properties.getMonitoring().setMinIntervalSeconds(10);
        properties.getMonitoring().setDefaultIntervalSeconds(20);
        MonitoringScheduler scheduler = new MonitoringScheduler(cycleExecutor, tracker, statisticsStore,
                taskScheduler, Runnable::run, properties, clock);

        assertEquals(Duration.ofSeconds(60), scheduler.getMinInterval());
        assertEquals(Duration.ofSeconds(60), scheduler.getInterval());
        assertFalse(scheduler.setInterval(Duration.ofSeconds(59)));
    }

    @Test
    void intervalChangeWhileRunningRearmsTimer() {
        MonitoringScheduler scheduler = scheduler();
        scheduler.start(Duration.ofMinutes(5));

        assertTrue(scheduler.setInterval(Duration.ofMinutes(2)));

        verify(timer).cancel(false);
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class),
                eq(NOW.plus(Duration.ofMinutes(2))), eq(Duration.ofMinutes(2)));
        verify(taskScheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertTrue(scheduler.isRunning());

        capturedTick().run();
        verify(cycleExecutor).runCycle("scheduled");
    }

    @Test
    void intervalChangeWhileStoppedOnlyStoresValue() {
        MonitoringScheduler scheduler = scheduler();

        assertTrue(scheduler.setInterval(Duration.ofMinutes(15)));

        verifyNoInteractions(taskScheduler);
        assertEquals(Duration.ofMinutes(15), scheduler.getInterval());
    }

    @Test
    void triggerWhileStoppedReturnsEmpty() {
        MonitoringScheduler scheduler = scheduler();

        assertTrue(scheduler.triggerNow().isEmpty());
        verifyNoInteractions(cycleExecutor);
    }

    @Test
    void triggerWhileRunningRunsCycle() {
        MonitoringScheduler scheduler = scheduler();
        scheduler.start(Duration.ofMinutes(5));

        assertEquals("manual", scheduler.triggerNow().orElseThrow().trigger());
        verify(cycleExecutor).runCycle("manual");
    }

    @Test
    void restoredIntervalIsNotPersisted() {
        MonitoringScheduler scheduler = scheduler();

        scheduler.restoreInterval(Duration.ofMinutes(20));
        scheduler.restoreInterval(Duration.ofSeconds(5));

        assertEquals(Duration.ofMinutes(20), scheduler.getInterval());
        assertNull(statisticsStore.getInterval());
    }

    @Test
    void shutdownKeepsEnabledFlag() {
        MonitoringScheduler scheduler = scheduler();
        scheduler.start(Duration.ofMinutes(5));

        scheduler.shutdown();

        assertFalse(scheduler.isRunning());
        assertTrue(statisticsStore.isEnabled());
        verify(timer).cancel(false);
    }

    @Test
    void describesIntervals() {
        assertEquals("45s", MonitoringScheduler.describe(Duration.ofSeconds(45)));
        assertEquals("5m", MonitoringScheduler.describe(Duration.ofMinutes(5)));
        assertEquals("1h", MonitoringScheduler.describe(Duration.ofHours(1)));
        assertEquals("1h 30m", MonitoringScheduler.describe(Duration.ofMinutes(90)));
    }
}
