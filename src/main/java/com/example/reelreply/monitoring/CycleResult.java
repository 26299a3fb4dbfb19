package com.example.reelreply.monitoring;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of one monitoring cycle.
 *
 * @param trigger   what started the cycle: startup, scheduled or manual
 * @param itemsFetched reels returned by the platform, with or without a rule
 * @param apiCalls  content API requests issued, including failed ones
 * @param errorType set only when {@code success} is false
 */
public record CycleResult(String trigger,
                          Instant startedAt,
                          Duration duration,
                          boolean success,
                          int enabledRules,
                          int itemsFetched,
                          int itemsProcessed,
                          int itemFailures,
                          int commentsScanned,
                          int repliesSent,
                          int replyFailures,
                          int privateMessagesSent,
                          int apiCalls,
                          MonitoringErrorType errorType,
                          String errorMessage) {
}
