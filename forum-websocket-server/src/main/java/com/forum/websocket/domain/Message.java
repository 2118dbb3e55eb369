package com.forum.websocket.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Direct message between two users. Never physically removed; a participant
 * hides it by adding a deletion mark, and once both have done so it is inert.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_message_pair_created", columnList = "senderId,receiverId,createdAt"),
    @Index(name = "idx_message_receiver_state", columnList = "receiverId,deliveryState")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final int CONTENT_MAX_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 100)
    private String senderId;

    @Column(nullable = false, length = 100)
    private String receiverId;

    @Column(nullable = false, length = CONTENT_MAX_LENGTH)
    private String content;

    @Column(length = 100)
    private String threadId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private MessageType messageType = MessageType.TEXT;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private DeliveryState deliveryState = DeliveryState.SENT;

    private Instant readAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_deletion_marks", joinColumns = @JoinColumn(name = "message_id"))
    @Column(name = "user_id", length = 100)
    @Builder.Default
    private Set<String> deletedBy = new LinkedHashSet<>();

    @Column(nullable = false)
    private boolean deleted;

    @Version
    private Long version;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public boolean isParticipant(String userId) {
        return senderId.equals(userId) || receiverId.equals(userId);
    }

    public boolean isRead() {
        return deliveryState == DeliveryState.READ;
    }

    public void markRead(Instant at) {
        if (deliveryState != DeliveryState.READ) {
            deliveryState = DeliveryState.READ;
            readAt = at;
        }
    }

    /**
     * Hides the message for {@code userId}; the message becomes inert once
     * both participants have marked it.
     */
    public void markDeletedBy(String userId) {
        deletedBy.add(userId);
        if (deletedBy.contains(senderId) && deletedBy.contains(receiverId)) {
            deleted = true;
        }
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

    public enum MessageType {
        TEXT, FILE, IMAGE;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Returns null for unknown values so callers can report a validation error.
         */
        @JsonCreator
        public static MessageType fromWireName(String value) {
            if (value == null) {
                return null;
            }
            for (MessageType type : values()) {
                if (type.getWireName().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
            return null;
        }
    }

    public enum DeliveryState {
        SENT, READ;

        @JsonValue
        public String getWireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
