package com.example.reelreply.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * History row written after every monitoring cycle, successful or not.
 */
@Entity
@Table(name = "monitoring_cycle_metrics", indexes = @Index(name = "idx_cycle_metrics_scope", columnList = "scope"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String scope;

    @Column(name = "cycle_trigger")
    private String trigger;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "duration_millis")
    private long durationMillis;

    private boolean success;

    @Column(name = "enabled_rules")
    private int enabledRules;

    @Column(name = "items_fetched")
    private int itemsFetched;

    @Column(name = "items_processed")
    private int itemsProcessed;

    @Column(name = "item_failures")
    private int itemFailures;

    @Column(name = "comments_scanned")
    private int commentsScanned;

    @Column(name = "replies_sent")
    private int repliesSent;

    @Column(name = "reply_failures")
    private int replyFailures;

    @Column(name = "private_messages_sent")
    private int privateMessagesSent;

    @Column(name = "api_calls")
    private int apiCalls;

    @Column(name = "error_type")
    private String errorType;
}
