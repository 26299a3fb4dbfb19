package com.example.reelreply.monitoring.event;

import com.example.reelreply.monitoring.CycleResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs monitoring events. Subscribes like any other observer.
 */
@Slf4j
@Component
public class MonitoringEventLogger {

    @EventListener
    public void onCycleCompleted(MonitoringCycleCompletedEvent event) {
        CycleResult r = event.result();
        if (r.success()) {
            log.info("Monitoring cycle complete ({}): rules={} reels={} reelFailures={} comments={} replies={} "
                            + "replyFailures={} private={} apiCalls={} duration={}ms",
                    r.trigger(), r.enabledRules(), r.itemsProcessed(), r.itemFailures(), r.commentsScanned(),
                    r.repliesSent(), r.replyFailures(), r.privateMessagesSent(), r.apiCalls(), r.duration().toMillis());
        } else {
            log.info("Monitoring cycle aborted ({}) after {}ms: {}",
                    r.trigger(), r.duration().toMillis(), r.errorMessage());
        }
    }

    @EventListener
    public void onError(MonitoringErrorEvent event) {
        switch (event.type()) {
            case AUTHENTICATION -> log.error("Authentication problem, operator action required: {}", event.message());
            case RATE_LIMIT -> log.warn("{}", event.message());
            case UNCLASSIFIED -> log.error("{}", event.message());
        }
    }

    @EventListener
    public void onStatisticsChanged(MonitoringStatisticsChangedEvent event) {
        log.debug("Statistics: running={} checks={} replies={} lastCheck={}",
                event.statistics().running(), event.statistics().totalChecks(),
                event.statistics().totalReplies(), event.statistics().lastCheckAt());
    }
}
