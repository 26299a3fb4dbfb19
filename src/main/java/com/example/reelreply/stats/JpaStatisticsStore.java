package com.example.reelreply.stats;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.domain.MonitoringScheduleConfig;
import com.example.reelreply.domain.MonitoringState;
import com.example.reelreply.domain.MonitoringStatistics;
import com.example.reelreply.repository.MonitoringStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Statistics store backed by the {@code monitoring_state} table, one row per scope.
 */
@Slf4j
@Component
public class JpaStatisticsStore implements StatisticsStore {

    private final MonitoringStateRepository repository;
    private final String scope;

    public JpaStatisticsStore(MonitoringStateRepository repository, AutoReplyProperties properties) {
        this.repository = repository;
        this.scope = properties.getMonitoring().getScope();
    }

    @Override
    public MonitoringStatistics loadStatistics() {
        return repository.findById(scope)
                .map(MonitoringState::toStatistics)
                .orElseGet(MonitoringStatistics::initial);
    }

    @Override
    public MonitoringScheduleConfig loadScheduleConfig(Duration defaultInterval) {
        return repository.findById(scope)
                .map(state -> new MonitoringScheduleConfig(
                        state.getIntervalSeconds() != null
                                ? Duration.ofSeconds(state.getIntervalSeconds()) : defaultInterval,
                        state.isEnabled()))
                .orElseGet(() -> new MonitoringScheduleConfig(defaultInterval, false));
    }

    @Override
    public void persistCheck(Instant at) {
        ensureState();
        repository.recordCheck(scope, at);
    }

    @Override
    public void persistReplyIncrement() {
        ensureState();
        repository.incrementReplies(scope);
    }

    @Override
    public void persistError(String error, Instant at) {
        ensureState();
        repository.recordError(scope, error, at);
    }

    @Override
    public void persistEnabledFlag(boolean enabled) {
        ensureState();
        repository.updateEnabled(scope, enabled);
    }

    @Override
    public void persistInterval(Duration interval) {
        ensureState();
        repository.updateInterval(scope, interval.toSeconds());
    }

    private synchronized void ensureState() {
        if (!repository.existsById(scope)) {
            repository.save(MonitoringState.builder().scope(scope).build());
            log.info("Created monitoring state for scope '{}'", scope);
        }
    }
}
