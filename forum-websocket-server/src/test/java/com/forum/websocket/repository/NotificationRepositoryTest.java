package com.forum.websocket.repository;

import com.forum.websocket.domain.Notification;
import com.forum.websocket.domain.NotificationType;
import com.forum.websocket.exception.NotFoundException;
import com.forum.websocket.infrastructure.RealtimeDeliveryChannel;
import com.forum.websocket.model.NotificationView;
import com.forum.websocket.model.PageResponse;
import com.forum.websocket.service.NotificationEmitter;
import com.forum.websocket.service.NotificationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class NotificationRepositoryTest {

    private static final Instant BASE = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private NotificationRepository notificationRepository;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notificationRepository,
                mock(NotificationEmitter.class), mock(RealtimeDeliveryChannel.class));
    }

    @AfterEach
    void tearDown() {
        notificationRepository.deleteAll();
    }

    private Notification store(String recipient, String title, int minute, boolean read) {
        return notificationRepository.save(Notification.builder()
                .recipientUserId(recipient)
                .type(NotificationType.THREAD_REPLY)
                .title(title)
                .body("Someone replied")
                .read(read)
                .createdAt(BASE.plus(minute, ChronoUnit.MINUTES))
                .build());
    }

    @Test
    void listingIsNewestFirstAndCanFilterUnread() {
        store("owner", "oldest", 0, true);
        store("owner", "middle", 1, false);
        store("owner", "newest", 2, false);
        store("someone-else", "other", 3, false);

        PageResponse<NotificationView> all = notificationService.getNotifications("owner", 1, 2, false);
        PageResponse<NotificationView> unread = notificationService.getNotifications("owner", 1, 20, true);

        assertThat(all.getTotal()).isEqualTo(3);
        assertThat(all.getData()).extracting(NotificationView::getTitle).containsExactly("newest", "middle");
        assertThat(unread.getData()).extracting(NotificationView::getTitle).containsExactly("newest", "middle");
        assertThat(notificationService.getUnreadCount("owner")).isEqualTo(2);
    }

    @Test
    void markingOneReadPersists() {
        Notification notification = store("owner", "reply", 0, false);

        NotificationView view = notificationService.markAsRead(notification.getId(), "owner");

        assertThat(view.isRead()).isTrue();
        Notification stored = notificationRepository.findById(notification.getId()).orElseThrow();
        assertThat(stored.isRead()).isTrue();
        assertThat(stored.getReadAt()).isNotNull();
        assertThat(notificationService.getUnreadCount("owner")).isZero();
    }

    @Test
    void othersCannotMarkYourNotification() {
        Notification notification = store("owner", "reply", 0, false);

        assertThatThrownBy(() -> notificationService.markAsRead(notification.getId(), "intruder"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Notification not found");
        assertThat(notificationRepository.findById(notification.getId()).orElseThrow().isRead()).isFalse();
    }

    @Test
    void markAllReadCountsOnlyTheCallersUnread() {
        store("owner", "a", 0, false);
        store("owner", "b", 1, false);
        store("owner", "c", 2, true);
        store("someone-else", "d", 3, false);

        assertThat(notificationService.markAllAsRead("owner")).isEqualTo(2);

        assertThat(notificationService.getUnreadCount("owner")).isZero();
        assertThat(notificationService.getUnreadCount("someone-else")).isEqualTo(1);
        assertThat(notificationRepository.findByRecipientUserIdOrderByCreatedAtDesc(
                "owner", PageRequest.of(0, 10)).getContent())
                .allSatisfy(n -> assertThat(n.getReadAt()).isNotNull());
        assertThat(notificationService.markAllAsRead("owner")).isZero();
    }
}
