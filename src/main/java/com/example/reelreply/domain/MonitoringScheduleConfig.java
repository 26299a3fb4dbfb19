package com.example.reelreply.domain;

import java.time.Duration;

/**
 * Persisted operator intent: how often to check and whether monitoring should be on.
 */
public record MonitoringScheduleConfig(Duration interval, boolean enabled) {
}
