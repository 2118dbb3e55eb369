package com.forum.websocket.repository;

import com.forum.websocket.domain.EntityKind;
import com.forum.websocket.domain.VoteDirection;
import com.forum.websocket.domain.VoteRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for per-user vote records
 */
@Repository
public interface VoteRecordRepository extends JpaRepository<VoteRecord, String> {

    Optional<VoteRecord> findByEntityKindAndEntityIdAndUserId(EntityKind entityKind, String entityId, String userId);

    List<VoteRecord> findByEntityKindAndEntityId(EntityKind entityKind, String entityId);

    long countByEntityKindAndEntityIdAndDirection(EntityKind entityKind, String entityId, VoteDirection direction);
}
