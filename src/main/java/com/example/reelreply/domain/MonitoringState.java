package com.example.reelreply.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per configuration scope holding the counters, last error and schedule settings.
 */
@Entity
@Table(name = "monitoring_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringState {

    public static final int LAST_ERROR_LENGTH = 2048;

    @Id
    private String scope;

    private boolean enabled;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    @Column(name = "last_check_at")
    private Instant lastCheckAt;

    @Column(name = "total_checks")
    @Builder.Default
    private long totalChecks = 0;

    @Column(name = "total_replies")
    @Builder.Default
    private long totalReplies = 0;

    @Column(name = "last_error", length = LAST_ERROR_LENGTH)
    private String lastError;

    @Column(name = "last_error_at")
    private Instant lastErrorAt;

    public MonitoringStatistics toStatistics() {
        return new MonitoringStatistics(false, lastCheckAt, totalChecks, totalReplies, lastError, lastErrorAt);
    }
}
