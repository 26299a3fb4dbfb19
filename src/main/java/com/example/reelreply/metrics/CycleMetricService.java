package com.example.reelreply.metrics;

import com.example.reelreply.config.AutoReplyProperties;
import com.example.reelreply.domain.CycleMetric;
import com.example.reelreply.monitoring.CycleResult;
import com.example.reelreply.monitoring.event.MonitoringCycleCompletedEvent;
import com.example.reelreply.repository.CycleMetricRepository;
import com.example.reelreply.repository.CycleMetricTotals;
import com.example.reelreply.repository.ReplyRuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Keeps one history row per monitoring cycle and answers the dashboard queries over it.
 * "Reels active" is always the current number of enabled rules, not a stored value.
 */
@Slf4j
@Service
public class CycleMetricService {

    static final int MAX_SUMMARY_ROWS = 1000;

    private final CycleMetricRepository metricRepository;
    private final ReplyRuleRepository ruleRepository;
    private final String scope;

    public CycleMetricService(CycleMetricRepository metricRepository,
                              ReplyRuleRepository ruleRepository,
                              AutoReplyProperties properties) {
        this.metricRepository = metricRepository;
        this.ruleRepository = ruleRepository;
        this.scope = properties.getMonitoring().getScope();
    }

    @EventListener
    public void onCycleCompleted(MonitoringCycleCompletedEvent event) {
        CycleResult result = event.result();
        try {
            metricRepository.save(CycleMetric.builder()
                    .scope(scope)
                    .trigger(result.trigger())
                    .startedAt(result.startedAt())
                    .durationMillis(result.duration().toMillis())
                    .success(result.success())
                    .enabledRules(result.enabledRules())
                    .itemsFetched(result.itemsFetched())
                    .itemsProcessed(result.itemsProcessed())
                    .itemFailures(result.itemFailures())
                    .commentsScanned(result.commentsScanned())
                    .repliesSent(result.repliesSent())
                    .replyFailures(result.replyFailures())
                    .privateMessagesSent(result.privateMessagesSent())
                    .apiCalls(result.apiCalls())
                    .errorType(result.errorType() != null ? result.errorType().name() : null)
                    .build());
        } catch (DataAccessException e) {
            log.error("Failed to store metrics for {} cycle: {}", result.trigger(), e.getMessage(), e);
        }
    }

    /**
     * Most recent cycles first.
     */
    public List<CycleSummary> summary(int limit) {
        int rows = Math.max(1, Math.min(limit, MAX_SUMMARY_ROWS));
        long reelsActive = ruleRepository.countByEnabled(true);
        return metricRepository.findByScopeOrderByIdDesc(scope, PageRequest.of(0, rows)).stream()
                .map(metric -> CycleSummary.of(metric, reelsActive))
                .toList();
    }

    public CycleAggregate aggregate() {
        CycleMetricTotals totals = metricRepository.totalsByScope(scope);
        return new CycleAggregate(
                totals.getCycles(),
                ruleRepository.countByEnabled(true),
                totals.getCommentsScanned(),
                totals.getRepliesSent(),
                totals.getPrivateMessagesSent(),
                totals.getApiCalls());
    }

    public int deleteHistory() {
        int deleted = metricRepository.deleteByScope(scope);
        log.info("Deleted {} cycle metric rows for scope {}", deleted, scope);
        return deleted;
    }

    public record CycleSummary(Long id,
                               String trigger,
                               Instant startedAt,
                               double durationSeconds,
                               boolean success,
                               int reelsScanned,
                               int reelsProcessed,
                               long reelsActive,
                               int commentsScanned,
                               int repliesSent,
                               int privateMessagesSent,
                               int apiCalls,
                               String errorType) {

        static CycleSummary of(CycleMetric metric, long reelsActive) {
            return new CycleSummary(metric.getId(), metric.getTrigger(), metric.getStartedAt(),
                    metric.getDurationMillis() / 1000.0, metric.isSuccess(), metric.getItemsFetched(),
                    metric.getItemsProcessed(), reelsActive, metric.getCommentsScanned(),
                    metric.getRepliesSent(), metric.getPrivateMessagesSent(), metric.getApiCalls(),
                    metric.getErrorType());
        }
    }

    public record CycleAggregate(long cycles,
                                 long reelsActive,
                                 long commentsScanned,
                                 long repliesSent,
                                 long privateMessagesSent,
                                 long apiCalls) {
    }
}
