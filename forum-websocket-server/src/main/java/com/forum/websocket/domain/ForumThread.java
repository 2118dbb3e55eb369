package com.forum.websocket.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Discussion thread. Created and edited by the thread CRUD flow; this service
 * only reads it and maintains its vote and comment counters.
 */
@Entity
@Table(name = "forum_threads", indexes = {
    @Index(name = "idx_thread_owner", columnList = "ownerId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForumThread implements Votable {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String ownerId;

    @Column(nullable = false, length = 100)
    private String title;

    @Column(nullable = false)
    private boolean locked;

    @Column(nullable = false)
    private int upvoteCount;

    @Column(nullable = false)
    private int downvoteCount;

    @Column(nullable = false)
    private int commentsCount;

    @Version
    private Long version;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @Override
    public EntityKind kind() {
        return EntityKind.THREAD;
    }

    @Override
    public String threadId() {
        return id;
    }

    @Override
    public String displayTitle() {
        return title;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
