package com.example.reelreply.stats;

import com.example.reelreply.domain.MonitoringState;
import com.example.reelreply.domain.MonitoringStatistics;
import com.example.reelreply.monitoring.MonitoringErrorType;
import com.example.reelreply.monitoring.event.MonitoringErrorEvent;
import com.example.reelreply.monitoring.event.MonitoringStatisticsChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringStatisticsTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryStatisticsStore store;
    private MonitoringStatisticsTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryStatisticsStore(
                new MonitoringStatistics(false, NOW.minusSeconds(600), 10, 4, null, null));
        tracker = new MonitoringStatisticsTracker(store, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void persistedCountersAreLoadedLazily() {
        MonitoringStatistics snapshot = tracker.snapshot();

        assertEquals(10, snapshot.totalChecks());
        assertEquals(4, snapshot.totalReplies());
        assertEquals(0.4, snapshot.averageRepliesPerCheck(), 1e-9);
    }

    @Test
    void checkIncrementsAndClearsError() {
        tracker.recordError(MonitoringErrorType.RATE_LIMIT, "API rate limit exceeded. Monitoring will retry later.");
        assertNotNull(tracker.snapshot().lastError());

        MonitoringStatistics after = tracker.recordCheck();

        assertEquals(11, after.totalChecks());
        assertEquals(NOW, after.lastCheckAt());
        assertNull(after.lastError());
        assertNull(after.lastErrorAt());
        assertEquals(after.totalChecks(), store.loadStatistics().totalChecks());
        assertNull(store.loadStatistics().lastError());
    }

    @Test
    void errorLeavesCountersUntouched() {
        MonitoringStatistics after = tracker.recordError(MonitoringErrorType.AUTHENTICATION, "bad token");

        assertEquals(10, after.totalChecks());
        assertEquals(4, after.totalReplies());
        assertEquals("bad token", after.lastError());
        assertEquals(NOW, after.lastErrorAt());

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        assertInstanceOf(MonitoringStatisticsChangedEvent.class, events.getAllValues().get(0));
        MonitoringErrorEvent error = assertInstanceOf(MonitoringErrorEvent.class, events.getAllValues().get(1));
        assertEquals(MonitoringErrorType.AUTHENTICATION, error.type());
        assertEquals("bad token", error.message());
    }

    @Test
    void errorIsOverwrittenByLaterError() {
        tracker.recordError(MonitoringErrorType.AUTHENTICATION, "first");
        tracker.recordError(MonitoringErrorType.UNCLASSIFIED, "second");

        assertEquals("second", tracker.snapshot().lastError());
        assertEquals("second", store.loadStatistics().lastError());
    }

    @Test
    void runningFlagSurvivesReload() {
        tracker.markRunning(true);
        assertTrue(store.isEnabled());

        MonitoringStatistics reloaded = tracker.reload();

        assertTrue(reloaded.running());
        assertEquals(10, reloaded.totalChecks());
    }

    @Test
    void stoppingClearsPersistedIntent() {
        tracker.markRunning(true);
        tracker.markRunning(false);

        assertFalse(store.isEnabled());
        assertFalse(tracker.snapshot().running());
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.recordReply();
                        tracker.recordCheck();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        long expected = (long) threads * perThread;
        assertEquals(10 + expected, tracker.snapshot().totalChecks());
        assertEquals(4 + expected, tracker.snapshot().totalReplies());
        assertEquals(10 + expected, store.loadStatistics().totalChecks());
        assertEquals(4 + expected, store.loadStatistics().totalReplies());
    }

    @Test
    void oversizedErrorIsTruncatedToColumnLength() {
        String huge = "Monitoring failed: HTTP 502: " + "x".repeat(5000);

        MonitoringStatistics after = tracker.recordError(MonitoringErrorType.UNCLASSIFIED, huge);

        assertEquals(MonitoringState.LAST_ERROR_LENGTH, after.lastError().length());
        assertTrue(after.lastError().startsWith("Monitoring failed: HTTP 502: "));
        assertTrue(after.lastError().endsWith("..."));
        assertEquals(after.lastError(), store.loadStatistics().lastError());
    }
}
