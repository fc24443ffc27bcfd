package com.golden.controlplane.repository;

import com.golden.controlplane.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {
    List<AuditEvent> findByEventTypeAndActionOrderByCreatedAtDesc(String eventType, String action);
}
