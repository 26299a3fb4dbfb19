package com.example.reelreply.repository;

import com.example.reelreply.domain.ReplyRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReplyRuleRepository extends JpaRepository<ReplyRule, String> {

    long countByEnabled(boolean enabled);
}
