package com.forum.websocket.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "comments", indexes = {
    @Index(name = "idx_comment_thread_created", columnList = "threadId,createdAt"),
    @Index(name = "idx_comment_owner", columnList = "ownerId"),
    @Index(name = "idx_comment_parent", columnList = "parentId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Comment implements Votable {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String threadId;

    @Column(nullable = false, length = 100)
    private String ownerId;

    /** Null for top-level comments. */
    @Column(length = 100)
    private String parentId;

    @Column(nullable = false, length = 1000)
    private String body;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "comment_mentions", joinColumns = @JoinColumn(name = "comment_id"))
    @Column(name = "user_id", length = 100)
    @Builder.Default
    private Set<String> mentions = new LinkedHashSet<>();

    @Column(nullable = false)
    private int upvoteCount;

    @Column(nullable = false)
    private int downvoteCount;

    @Version
    private Long version;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @Override
    public EntityKind kind() {
        return EntityKind.COMMENT;
    }

    @Override
    public String threadId() {
        return threadId;
    }

    @Override
    public String displayTitle() {
        return body;
    }

    public boolean isTopLevel() {
        return parentId == null;
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
