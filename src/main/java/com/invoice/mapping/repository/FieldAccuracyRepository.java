package com.invoice.mapping.repository;

import com.invoice.mapping.entity.FieldAccuracy;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FieldAccuracyRepository extends JpaRepository<FieldAccuracy, Long> {

    List<FieldAccuracy> findByForwarderCode(String forwarderCode);

    List<FieldAccuracy> findByForwarderCodeIsNull();
}
