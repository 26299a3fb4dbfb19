package com.example.reelreply.controller;

import com.example.reelreply.domain.Rule;
import com.example.reelreply.rules.RuleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Reply rule REST API Controller.
 */
@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
public class RuleController {

    private final RuleService ruleService;

    @GetMapping
    public ResponseEntity<List<Rule>> listRules() {
        return ResponseEntity.ok(ruleService.findAll());
    }

    @GetMapping("/{targetId}")
    public ResponseEntity<Rule> getRule(@PathVariable String targetId) {
        return ruleService.find(targetId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Create or update the rule for a reel.
     */
    @PutMapping("/{targetId}")
    public ResponseEntity<Rule> saveRule(@PathVariable String targetId,
                                         @RequestBody RuleService.RuleUpdateRequest request) {
        return ResponseEntity.ok(ruleService.save(targetId, request));
    }

    @PatchMapping("/{targetId}/toggle")
    public ResponseEntity<Rule> toggleRule(@PathVariable String targetId) {
        return ResponseEntity.ok(ruleService.toggle(targetId));
    }

    @DeleteMapping("/{targetId}")
    public ResponseEntity<Map<String, String>> deleteRule(@PathVariable String targetId) {
        if (!ruleService.delete(targetId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "targetId", targetId));
    }
}
