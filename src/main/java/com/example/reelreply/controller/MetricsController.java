package com.example.reelreply.controller;

import com.example.reelreply.metrics.CycleMetricService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Per-cycle monitoring history.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final CycleMetricService metricService;

    @GetMapping("/summary")
    public ResponseEntity<List<CycleMetricService.CycleSummary>> summary(
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(metricService.summary(limit));
    }

    @GetMapping("/aggregate")
    public ResponseEntity<CycleMetricService.CycleAggregate> aggregate() {
        return ResponseEntity.ok(metricService.aggregate());
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Integer>> deleteHistory() {
        return ResponseEntity.ok(Map.of("deleted", metricService.deleteHistory()));
    }
}
