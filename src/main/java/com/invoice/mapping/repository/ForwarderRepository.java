package com.invoice.mapping.repository;

import com.invoice.mapping.entity.Forwarder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ForwarderRepository extends JpaRepository<Forwarder, Long> {

    Optional<Forwarder> findByCode(String code);

    List<Forwarder> findByStatusOrderByPriorityDesc(Forwarder.ForwarderStatus status);
}
