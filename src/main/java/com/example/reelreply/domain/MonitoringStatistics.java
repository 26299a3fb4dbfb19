package com.example.reelreply.domain;

import java.time.Instant;

/**
 * Point-in-time view of the monitoring counters and the most recent error.
 */
public record MonitoringStatistics(boolean running,
                                   Instant lastCheckAt,
                                   long totalChecks,
                                   long totalReplies,
                                   String lastError,
                                   Instant lastErrorAt) {

    public static MonitoringStatistics initial() {
        return new MonitoringStatistics(false, null, 0, 0, null, null);
    }

    public MonitoringStatistics withRunning(boolean running) {
        return new MonitoringStatistics(running, lastCheckAt, totalChecks, totalReplies, lastError, lastErrorAt);
    }

    public MonitoringStatistics withCheck(Instant at) {
        return new MonitoringStatistics(running, at, totalChecks + 1, totalReplies, null, null);
    }

    public MonitoringStatistics withReply() {
        return new MonitoringStatistics(running, lastCheckAt, totalChecks, totalReplies + 1, lastError, lastErrorAt);
    }

    public MonitoringStatistics withError(String error, Instant at) {
        return new MonitoringStatistics(running, lastCheckAt, totalChecks, totalReplies, error, at);
    }

    public double averageRepliesPerCheck() {
        return totalChecks == 0 ? 0.0 : (double) totalReplies / totalChecks;
    }
}
