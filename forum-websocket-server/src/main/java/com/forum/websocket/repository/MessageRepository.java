package com.forum.websocket.repository;

import com.forum.websocket.domain.Message;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for direct messages. Every read excludes messages that are
 * fully deleted or hidden by the reading user.
 */
@Repository
public interface MessageRepository extends JpaRepository<Message, String> {

    Optional<Message> findByIdAndReceiverId(String id, String receiverId);

    /**
     * Messages exchanged between two users, newest first
     */
    @Query(value = "SELECT m FROM Message m " +
           "WHERE ((m.senderId = :userId AND m.receiverId = :otherId) " +
           "    OR (m.senderId = :otherId AND m.receiverId = :userId)) " +
           "AND m.deleted = false " +
           "AND :userId NOT MEMBER OF m.deletedBy " +
           "ORDER BY m.createdAt DESC",
           countQuery = "SELECT COUNT(m) FROM Message m " +
           "WHERE ((m.senderId = :userId AND m.receiverId = :otherId) " +
           "    OR (m.senderId = :otherId AND m.receiverId = :userId)) " +
           "AND m.deleted = false " +
           "AND :userId NOT MEMBER OF m.deletedBy")
    Page<Message> findConversation(@Param("userId") String userId,
                                   @Param("otherId") String otherId,
                                   Pageable pageable);

    /**
     * Every visible message involving a user, newest first
     */
    @Query("SELECT m FROM Message m " +
           "WHERE (m.senderId = :userId OR m.receiverId = :userId) " +
           "AND m.deleted = false " +
           "AND :userId NOT MEMBER OF m.deletedBy " +
           "ORDER BY m.createdAt DESC")
    List<Message> findVisibleForUser(@Param("userId") String userId);

    @Query("SELECT COUNT(m) FROM Message m " +
           "WHERE m.receiverId = :userId " +
           "AND m.deliveryState = :state " +
           "AND m.deleted = false " +
           "AND :userId NOT MEMBER OF m.deletedBy")
    long countByReceiverInState(@Param("userId") String userId, @Param("state") Message.DeliveryState state);

    default long countUnread(String userId) {
        return countByReceiverInState(userId, Message.DeliveryState.SENT);
    }

    /**
     * Mark every unread message from sender to receiver as read. Bumps the
     * version so a copy loaded before the update cannot write it back.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Message m " +
           "SET m.deliveryState = :read, m.readAt = :now, m.version = m.version + 1 " +
           "WHERE m.senderId = :senderId " +
           "AND m.receiverId = :receiverId " +
           "AND m.deliveryState = :unread")
    int updateDeliveryState(@Param("senderId") String senderId,
                            @Param("receiverId") String receiverId,
                            @Param("unread") Message.DeliveryState unread,
                            @Param("read") Message.DeliveryState read,
                            @Param("now") Instant now);

    default int markConversationRead(String senderId, String receiverId, Instant now) {
        return updateDeliveryState(senderId, receiverId,
                Message.DeliveryState.SENT, Message.DeliveryState.READ, now);
    }
}
