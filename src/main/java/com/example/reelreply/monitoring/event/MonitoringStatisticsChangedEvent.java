package com.example.reelreply.monitoring.event;

import com.example.reelreply.domain.MonitoringStatistics;

public record MonitoringStatisticsChangedEvent(MonitoringStatistics statistics) {
}
