package com.forum.websocket.repository;

import com.forum.websocket.domain.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Audit Logs
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    List<AuditLog> findByEventType(String eventType);

    List<AuditLog> findByEntityIdOrderByTimestampDesc(String entityId);
}
