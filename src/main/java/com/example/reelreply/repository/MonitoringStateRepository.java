package com.example.reelreply.repository;

import com.example.reelreply.domain.MonitoringState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Counter updates are single UPDATE statements so concurrent writers never lose increments.
 */
@Repository
public interface MonitoringStateRepository extends JpaRepository<MonitoringState, String> {

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update MonitoringState s set s.totalChecks = s.totalChecks + 1, s.lastCheckAt = :at, "
            + "s.lastError = null, s.lastErrorAt = null where s.scope = :scope")
    int recordCheck(@Param("scope") String scope, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update MonitoringState s set s.totalReplies = s.totalReplies + 1 where s.scope = :scope")
    int incrementReplies(@Param("scope") String scope);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update MonitoringState s set s.lastError = :error, s.lastErrorAt = :at where s.scope = :scope")
    int recordError(@Param("scope") String scope, @Param("error") String error, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update MonitoringState s set s.enabled = :enabled where s.scope = :scope")
    int updateEnabled(@Param("scope") String scope, @Param("enabled") boolean enabled);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update MonitoringState s set s.intervalSeconds = :seconds where s.scope = :scope")
    int updateInterval(@Param("scope") String scope, @Param("seconds") long seconds);
}
