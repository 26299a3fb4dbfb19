package com.example.reelreply.monitoring.event;

import com.example.reelreply.monitoring.CycleResult;

public record MonitoringCycleCompletedEvent(CycleResult result) {
}
