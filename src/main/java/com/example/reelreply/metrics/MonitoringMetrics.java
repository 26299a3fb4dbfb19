package com.example.reelreply.metrics;

import com.example.reelreply.monitoring.CycleResult;
import com.example.reelreply.monitoring.event.MonitoringCycleCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Publishes per-cycle Micrometer metrics.
 */
@Component
@RequiredArgsConstructor
public class MonitoringMetrics {

    private final MeterRegistry meterRegistry;

    @EventListener
    public void onCycleCompleted(MonitoringCycleCompletedEvent event) {
        CycleResult result = event.result();

        Timer.builder("reelreply.cycle.duration")
                .tag("trigger", result.trigger())
                .tag("success", String.valueOf(result.success()))
                .register(meterRegistry)
                .record(result.duration());

        increment("reelreply.cycle.items", result.itemsProcessed());
        increment("reelreply.cycle.comments", result.commentsScanned());
        increment("reelreply.cycle.replies", result.repliesSent());
        increment("reelreply.cycle.private_messages", result.privateMessagesSent());
        increment("reelreply.cycle.api_calls", result.apiCalls());

        if (!result.success()) {
            Counter.builder("reelreply.cycle.failures")
                    .tag("type", result.errorType().name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    private void increment(String name, int amount) {
        Counter.builder(name).register(meterRegistry).increment(amount);
    }
}
