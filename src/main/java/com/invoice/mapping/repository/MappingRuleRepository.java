package com.invoice.mapping.repository;

import com.invoice.mapping.entity.MappingRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MappingRuleRepository extends JpaRepository<MappingRule, Long> {

    List<MappingRule> findByForwarderCodeIsNullAndActiveTrue();

    // Forwarder-specific rules plus universal ones; ordering is applied by the mapper
    @Query("""
        SELECT r FROM MappingRule r
        WHERE r.active = true
          AND (r.forwarderCode = :forwarderCode OR r.forwarderCode IS NULL)
    """)
    List<MappingRule> findActiveForForwarder(@Param("forwarderCode") String forwarderCode);
}
