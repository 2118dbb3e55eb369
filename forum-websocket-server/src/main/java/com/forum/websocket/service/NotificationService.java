package com.forum.websocket.service;

import com.forum.websocket.domain.Notification;
import com.forum.websocket.domain.WebSocketMessage;
import com.forum.websocket.domain.event.DomainEvent;
import com.forum.websocket.exception.NotFoundException;
import com.forum.websocket.infrastructure.RealtimeDeliveryChannel;
import com.forum.websocket.model.NotificationView;
import com.forum.websocket.model.PageResponse;
import com.forum.websocket.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Notification read surface, plus the emit-then-push step shared by the
 * event sources.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final NotificationRepository notificationRepository;
    private final NotificationEmitter notificationEmitter;
    private final RealtimeDeliveryChannel deliveryChannel;

    /**
     * Emit notifications for an event and push each to its recipient's live
     * sessions. Emission errors propagate; the push never throws.
     */
    public List<Notification> publish(DomainEvent event) {
        List<Notification> created = notificationEmitter.emit(event);
        for (Notification notification : created) {
            deliveryChannel.push(notification.getRecipientUserId(),
                    WebSocketMessage.notification(NotificationView.from(notification)));
        }
        return created;
    }

    public PageResponse<NotificationView> getNotifications(String userId, int page, int limit, boolean unreadOnly) {
        int safePage = Math.max(page, 1);
        int safeLimit = limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        PageRequest pageable = PageRequest.of(safePage - 1, safeLimit);

        Page<Notification> result = unreadOnly
                ? notificationRepository.findByRecipientUserIdAndReadFalseOrderByCreatedAtDesc(userId, pageable)
                : notificationRepository.findByRecipientUserIdOrderByCreatedAtDesc(userId, pageable);

        List<NotificationView> views = result.getContent().stream()
                .map(NotificationView::from)
                .collect(Collectors.toList());
        return PageResponse.of(views, safePage, safeLimit, result.getTotalElements());
    }

    public long getUnreadCount(String userId) {
        return notificationRepository.countByRecipientUserIdAndReadFalse(userId);
    }

    public NotificationView markAsRead(String notificationId, String userId) {
        Notification notification = notificationRepository.findByIdAndRecipientUserId(notificationId, userId)
                .orElseThrow(() -> new NotFoundException("Notification not found"));

        if (!notification.isRead()) {
            notification.setRead(true);
            notification.setReadAt(Instant.now());
            notification = notificationRepository.save(notification);
        }
        return NotificationView.from(notification);
    }

    public int markAllAsRead(String userId) {
        int updated = notificationRepository.markAllRead(userId, Instant.now());
        log.debug("Notifications marked read: userId={}, count={}", userId, updated);
        return updated;
    }
}
