package com.example.reelreply.repository;

import com.example.reelreply.domain.CycleMetric;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface CycleMetricRepository extends JpaRepository<CycleMetric, Long> {

    List<CycleMetric> findByScopeOrderByIdDesc(String scope, Pageable pageable);

    @Query("select count(m) as cycles, "
            + "coalesce(sum(m.commentsScanned), 0) as commentsScanned, "
            + "coalesce(sum(m.repliesSent), 0) as repliesSent, "
            + "coalesce(sum(m.privateMessagesSent), 0) as privateMessagesSent, "
            + "coalesce(sum(m.apiCalls), 0) as apiCalls "
            + "from CycleMetric m where m.scope = :scope")
    CycleMetricTotals totalsByScope(@Param("scope") String scope);

    @Transactional
    @Modifying
    @Query("delete from CycleMetric m where m.scope = :scope")
    int deleteByScope(@Param("scope") String scope);
}
