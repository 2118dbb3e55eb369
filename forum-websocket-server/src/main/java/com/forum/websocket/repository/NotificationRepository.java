package com.forum.websocket.repository;

import com.forum.websocket.domain.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for Notifications
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, String> {

    Page<Notification> findByRecipientUserIdOrderByCreatedAtDesc(String recipientUserId, Pageable pageable);

    Page<Notification> findByRecipientUserIdAndReadFalseOrderByCreatedAtDesc(String recipientUserId, Pageable pageable);

    Optional<Notification> findByIdAndRecipientUserId(String id, String recipientUserId);

    long countByRecipientUserIdAndReadFalse(String recipientUserId);

    /**
     * Mark every unread notification of a user as read
     */
    @Modifying
    @Transactional
    @Query("UPDATE Notification n " +
           "SET n.read = true, n.readAt = :now " +
           "WHERE n.recipientUserId = :userId AND n.read = false")
    int markAllRead(@Param("userId") String userId, @Param("now") Instant now);

    /**
     * Delete notifications past the retention window (cleanup job)
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM Notification n WHERE n.createdAt < :threshold")
    int deleteByCreatedAtBefore(@Param("threshold") Instant threshold);
}
