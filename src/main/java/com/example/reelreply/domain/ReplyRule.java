package com.example.reelreply.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent reply rule, keyed by the reel it applies to.
 * The engine never reads this entity directly; it loads {@link Rule} snapshots.
 */
@Entity
@Table(name = "reply_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplyRule {

    /** Reel id the rule is bound to. */
    @Id
    @Column(name = "target_id")
    private String targetId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reply_rule_keywords", joinColumns = @JoinColumn(name = "target_id"))
    @OrderColumn(name = "position")
    @Column(name = "keyword", length = 512)
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Column(name = "reply_text", length = 4096)
    private String replyText;

    @Column(name = "private_reply_text", length = 4096)
    private String privateReplyText;

    private boolean enabled;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public Rule toRule() {
        return new Rule(targetId, keywords, replyText, privateReplyText, enabled);
    }
}
