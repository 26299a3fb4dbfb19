package com.example.reelreply.monitoring.event;

import com.example.reelreply.monitoring.MonitoringErrorType;

import java.time.Instant;

public record MonitoringErrorEvent(MonitoringErrorType type, String message, Instant occurredAt) {
}
