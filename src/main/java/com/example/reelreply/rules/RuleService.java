package com.example.reelreply.rules;

import com.example.reelreply.domain.ReplyRule;
import com.example.reelreply.domain.Rule;
import com.example.reelreply.repository.ReplyRuleRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-facing rule management, and the {@link RuleStore} the engine loads from.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleService implements RuleStore {

    private final ReplyRuleRepository ruleRepository;

    @Override
    @Transactional(readOnly = true)
    public Map<String, Rule> loadRules() {
        Map<String, Rule> rules = new LinkedHashMap<>();
        ruleRepository.findAll().forEach(rule -> rules.put(rule.getTargetId(), rule.toRule()));
        return rules;
    }

    @Transactional(readOnly = true)
    public List<Rule> findAll() {
        return ruleRepository.findAll().stream()
                .map(ReplyRule::toRule)
                .sorted(Comparator.comparing(Rule::targetId))
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Rule> find(String targetId) {
        return ruleRepository.findById(targetId).map(ReplyRule::toRule);
    }

    /**
     * Create or replace the rule for a reel. Enabled rules without reply text are refused.
     */
    @Transactional
    public Rule save(String targetId, RuleUpdateRequest request) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Rule target id must not be blank");
        }
        ReplyRule rule = ruleRepository.findById(targetId)
                .orElseGet(() -> ReplyRule.builder().targetId(targetId).build());

        if (request.getKeywords() != null) rule.setKeywords(cleanKeywords(request.getKeywords()));
        if (request.getReplyText() != null) rule.setReplyText(request.getReplyText());
        if (request.getPrivateReplyText() != null) {
            rule.setPrivateReplyText(request.getPrivateReplyText().isBlank() ? null : request.getPrivateReplyText());
        }
        if (request.getEnabled() != null) rule.setEnabled(request.getEnabled());

        Rule candidate = rule.toRule();
        if (!candidate.isValid()) {
            throw new IllegalArgumentException("Enabled rule for " + targetId + " needs reply text");
        }

        ruleRepository.save(rule);
        log.info("Saved rule for reel {} (enabled={}, keywords={})",
                targetId, rule.isEnabled(), rule.getKeywords().size());
        return rule.toRule();
    }

    @Transactional
    public Rule toggle(String targetId) {
        ReplyRule rule = ruleRepository.findById(targetId)
                .orElseThrow(() -> new IllegalArgumentException("Rule not found: " + targetId));
        rule.setEnabled(!rule.isEnabled());
        if (!rule.toRule().isValid()) {
            throw new IllegalArgumentException("Enabled rule for " + targetId + " needs reply text");
        }
        ruleRepository.save(rule);
        log.info("Rule for reel {} {}", targetId, rule.isEnabled() ? "enabled" : "disabled");
        return rule.toRule();
    }

    @Transactional
    public boolean delete(String targetId) {
        if (!ruleRepository.existsById(targetId)) {
            return false;
        }
        ruleRepository.deleteById(targetId);
        log.info("Deleted rule for reel {}", targetId);
        return true;
    }

    private static List<String> cleanKeywords(List<String> keywords) {
        List<String> cleaned = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                cleaned.add(keyword.trim());
            }
        }
        return cleaned;
    }

    /** DTO for create/update requests. Null fields are left unchanged. */
    @Data
    public static class RuleUpdateRequest {
        private List<String> keywords;
        private String replyText;
        private String privateReplyText;
        private Boolean enabled;
    }
}
