package com.forum.websocket.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single user's current direction on one entity.
 */
@Entity
@Table(name = "vote_records",
    uniqueConstraints = @UniqueConstraint(name = "uk_vote_entity_user",
            columnNames = {"entity_kind", "entity_id", "user_id"}),
    indexes = @Index(name = "idx_vote_entity", columnList = "entity_kind,entity_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind", nullable = false, length = 20)
    private EntityKind entityKind;

    @Column(name = "entity_id", nullable = false, length = 100)
    private String entityId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private VoteDirection direction;

    @Column(nullable = false)
    private Instant votedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        votedAt = Instant.now();
    }
}
