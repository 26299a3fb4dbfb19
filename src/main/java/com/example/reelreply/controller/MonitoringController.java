package com.example.reelreply.controller;

import com.example.reelreply.credential.AccessTokenHolder;
import com.example.reelreply.domain.MonitoringStatistics;
import com.example.reelreply.monitoring.CycleResult;
import com.example.reelreply.monitoring.MonitoringScheduler;
import com.example.reelreply.stats.MonitoringStatisticsTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Monitoring REST API Controller.
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringController {

    private final MonitoringScheduler scheduler;
    private final MonitoringStatisticsTracker statisticsTracker;
    private final AccessTokenHolder tokenHolder;

    /**
     * Current statistics and schedule.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        MonitoringStatistics stats = statisticsTracker.snapshot();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("isRunning", scheduler.isRunning());
        status.put("intervalSeconds", scheduler.getInterval().toSeconds());
        status.put("lastCheckAt", stats.lastCheckAt());
        status.put("totalChecks", stats.totalChecks());
        status.put("totalReplies", stats.totalReplies());
        status.put("averageRepliesPerCheck", stats.averageRepliesPerCheck());
        status.put("lastError", stats.lastError());
        status.put("lastErrorAt", stats.lastErrorAt());
        return ResponseEntity.ok(status);
    }

    /**
     * Start monitoring. Runs the first cycle before responding.
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody(required = false) Map<String, Object> request) {
        Object seconds = request == null ? null : request.get("intervalSeconds");
        if (seconds != null && !(seconds instanceof Number)) {
            throw new IllegalArgumentException("intervalSeconds must be a number");
        }
        Duration interval = seconds != null
                ? Duration.ofSeconds(((Number) seconds).longValue())
                : scheduler.getInterval();
        if (interval.compareTo(scheduler.getMinInterval()) < 0) {
            throw new IllegalArgumentException("Interval must be at least " + scheduler.getMinInterval().toSeconds() + " seconds");
        }
        boolean cycleSucceeded = scheduler.start(interval);
        return ResponseEntity.ok(Map.of(
                "started", scheduler.isRunning(),
                "cycleSucceeded", cycleSucceeded
        ));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        scheduler.stop();
        return ResponseEntity.ok(Map.of("started", false));
    }

    /**
     * Change the polling interval; applies immediately while running.
     */
    @PutMapping("/interval")
    public ResponseEntity<Map<String, Object>> setInterval(@RequestBody Map<String, Object> request) {
        Object seconds = request.get("intervalSeconds");
        if (!(seconds instanceof Number number)) {
            throw new IllegalArgumentException("intervalSeconds is required");
        }
        if (!scheduler.setInterval(Duration.ofSeconds(number.longValue()))) {
            throw new IllegalArgumentException("Interval must be at least " + scheduler.getMinInterval().toSeconds() + " seconds");
        }
        return ResponseEntity.ok(Map.of("intervalSeconds", scheduler.getInterval().toSeconds()));
    }

    /**
     * Run one cycle out of band.
     */
    @PostMapping("/trigger")
    public ResponseEntity<CycleResult> trigger() {
        return scheduler.triggerNow()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new IllegalStateException("Monitoring is not running"));
    }

    /**
     * Replace the access token (and optionally the page id) used for the content API.
     */
    @PutMapping("/credential")
    public ResponseEntity<Map<String, Object>> updateCredential(@RequestBody Map<String, String> request) {
        tokenHolder.update(request.get("accessToken"), request.get("pageId"));
        return ResponseEntity.ok(Map.of(
                "pageId", tokenHolder.getPageId() != null ? tokenHolder.getPageId() : "",
                "credentialAvailable", tokenHolder.hasUsableToken()
        ));
    }
}
