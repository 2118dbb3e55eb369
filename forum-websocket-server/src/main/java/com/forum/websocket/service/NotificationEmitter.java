package com.forum.websocket.service;

import com.forum.websocket.domain.EntityKind;
import com.forum.websocket.domain.Notification;
import com.forum.websocket.domain.NotificationContext;
import com.forum.websocket.domain.NotificationType;
import com.forum.websocket.domain.UserAccount;
import com.forum.websocket.domain.event.AnnouncementEvent;
import com.forum.websocket.domain.event.CommentedEvent;
import com.forum.websocket.domain.event.DomainEvent;
import com.forum.websocket.domain.event.MentionedEvent;
import com.forum.websocket.domain.event.MessageSentEvent;
import com.forum.websocket.domain.event.UpvotedEvent;
import com.forum.websocket.repository.NotificationRepository;
import com.forum.websocket.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Notification Emitter
 *
 * Turns a domain event into zero or more stored notifications. Decides who is
 * told, checks the recipient's preferences at emission time and writes the
 * records. Never pushes; delivery is the caller's concern.
 */
@Service
@Slf4j
public class NotificationEmitter {

    private static final String ELLIPSIS = "...";

    private final NotificationRepository notificationRepository;
    private final UserAccountRepository userAccountRepository;
    private final MetricsService metricsService;
    private final EventPublisher eventPublisher;

    public NotificationEmitter(NotificationRepository notificationRepository,
                               UserAccountRepository userAccountRepository,
                               MetricsService metricsService,
                               @Autowired(required = false) EventPublisher eventPublisher) {
        this.notificationRepository = notificationRepository;
        this.userAccountRepository = userAccountRepository;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * @return the notifications written, empty when nobody is to be told
     */
    public List<Notification> emit(DomainEvent event) {
        List<Notification> drafts;
        if (event instanceof UpvotedEvent upvoted) {
            drafts = onUpvoted(upvoted);
        } else if (event instanceof CommentedEvent commented) {
            drafts = onCommented(commented);
        } else if (event instanceof MentionedEvent mentioned) {
            drafts = onMentioned(mentioned);
        } else if (event instanceof MessageSentEvent messageSent) {
            drafts = onMessageSent(messageSent);
        } else if (event instanceof AnnouncementEvent announcement) {
            drafts = onAnnouncement(announcement);
        } else {
            throw new IllegalArgumentException("Unsupported event: " + event.getClass().getName());
        }

        if (drafts.isEmpty()) {
            return List.of();
        }

        List<Notification> saved = notificationRepository.saveAll(drafts);
        for (Notification notification : saved) {
            metricsService.recordNotificationEmitted(notification.getType().getWireName());
            log.debug("Notification emitted: id={}, type={}, recipient={}",
                    notification.getId(), notification.getType(), notification.getRecipientUserId());
            publishCreated(notification);
        }
        return saved;
    }

    private List<Notification> onUpvoted(UpvotedEvent event) {
        if (isSelfAction(event.getActorId(), event.getOwnerId())) {
            return List.of();
        }

        boolean thread = event.getEntityKind() == EntityKind.THREAD;
        Notification notification = thread
                ? draft(event.getOwnerId(), NotificationType.THREAD_UPVOTE,
                        "Your thread received an upvote",
                        "Someone upvoted your thread \"" + event.getEntityTitle() + "\"",
                        NotificationContext.builder()
                                .threadId(event.getThreadId())
                                .fromUserId(event.getActorId())
                                .actionUrl(threadLink(event.getThreadId()))
                                .build())
                : draft(event.getOwnerId(), NotificationType.COMMENT_UPVOTE,
                        "Your comment received an upvote",
                        "Someone upvoted your comment",
                        NotificationContext.builder()
                                .threadId(event.getThreadId())
                                .commentId(event.getEntityId())
                                .fromUserId(event.getActorId())
                                .actionUrl(commentLink(event.getThreadId(), event.getEntityId()))
                                .build());
        return List.of(notification);
    }

    /**
     * Top-level comments tell the thread owner; replies tell the parent
     * comment's owner and, if someone else, the thread owner too.
     */
    private List<Notification> onCommented(CommentedEvent event) {
        List<Notification> drafts = new ArrayList<>(2);

        if (event.isNested() && !isSelfAction(event.getActorId(), event.getParentOwnerId())) {
            drafts.add(draft(event.getParentOwnerId(), NotificationType.COMMENT_REPLY,
                    "Reply to your comment",
                    event.getActorName() + " replied to your comment",
                    commentContext(event)));
        }

        boolean threadOwnerAlreadyTold = event.isNested()
                && Objects.equals(event.getThreadOwnerId(), event.getParentOwnerId());
        if (!threadOwnerAlreadyTold && !isSelfAction(event.getActorId(), event.getThreadOwnerId())) {
            drafts.add(draft(event.getThreadOwnerId(), NotificationType.THREAD_REPLY,
                    "New comment on your thread",
                    event.getActorName() + " commented on your thread \"" + event.getThreadTitle() + "\"",
                    commentContext(event)));
        }
        return drafts;
    }

    private NotificationContext commentContext(CommentedEvent event) {
        return NotificationContext.builder()
                .threadId(event.getThreadId())
                .commentId(event.getCommentId())
                .fromUserId(event.getActorId())
                .actionUrl(commentLink(event.getThreadId(), event.getCommentId()))
                .build();
    }

    private List<Notification> onMentioned(MentionedEvent event) {
        Set<String> candidates = new LinkedHashSet<>(event.getMentionedUserIds());
        candidates.removeIf(id -> id == null || id.isBlank());
        if (event.getActorId() != null) {
            candidates.remove(event.getActorId());
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        Map<String, UserAccount> known = userAccountRepository.findAllById(candidates).stream()
                .collect(Collectors.toMap(UserAccount::getId, Function.identity()));

        boolean inComment = event.getCommentId() != null;
        List<Notification> drafts = new ArrayList<>();
        for (String userId : candidates) {
            if (!known.containsKey(userId)) {
                log.debug("Skipping mention of unknown user: userId={}", userId);
                continue;
            }
            NotificationContext context = NotificationContext.builder()
                    .threadId(event.getThreadId())
                    .commentId(event.getCommentId())
                    .fromUserId(event.getActorId())
                    .actionUrl(inComment
                            ? commentLink(event.getThreadId(), event.getCommentId())
                            : threadLink(event.getThreadId()))
                    .build();
            drafts.add(inComment
                    ? draft(userId, NotificationType.COMMENT_MENTION,
                            "You were mentioned in a comment",
                            event.getActorName() + " mentioned you in a comment on \"" + event.getThreadTitle() + "\"",
                            context)
                    : draft(userId, NotificationType.THREAD_MENTION,
                            "You were mentioned in a thread",
                            event.getActorName() + " mentioned you in \"" + event.getThreadTitle() + "\"",
                            context));
        }
        return drafts;
    }

    private List<Notification> onMessageSent(MessageSentEvent event) {
        if (isSelfAction(event.getSenderId(), event.getReceiverId())) {
            return List.of();
        }

        Optional<UserAccount> receiver = userAccountRepository.findById(event.getReceiverId());
        if (receiver.isEmpty()) {
            log.debug("Message receiver not found, no notification: receiverId={}", event.getReceiverId());
            return List.of();
        }
        if (!receiver.get().preferences().isChat()) {
            metricsService.recordNotificationSuppressed("chat_disabled");
            return List.of();
        }

        return List.of(draft(event.getReceiverId(), NotificationType.NEW_MESSAGE,
                "New message",
                event.getSenderName() + " sent you a message",
                NotificationContext.builder()
                        .messageId(event.getMessageId())
                        .fromUserId(event.getSenderId())
                        .actionUrl(chatLink(event.getSenderUsername()))
                        .build()));
    }

    private List<Notification> onAnnouncement(AnnouncementEvent event) {
        if (event.getType() != NotificationType.SYSTEM && event.getType() != NotificationType.NEWSLETTER) {
            throw new IllegalArgumentException("Announcements must be system or newsletter, got " + event.getType());
        }

        Optional<UserAccount> recipient = userAccountRepository.findById(event.getRecipientId());
        if (recipient.isEmpty()) {
            log.debug("Announcement recipient not found: recipientId={}", event.getRecipientId());
            return List.of();
        }
        if (event.getType() == NotificationType.NEWSLETTER && !recipient.get().preferences().isNewsletter()) {
            metricsService.recordNotificationSuppressed("newsletter_disabled");
            return List.of();
        }

        return List.of(draft(event.getRecipientId(), event.getType(),
                event.getTitle(),
                event.getBody(),
                NotificationContext.builder()
                        .actionUrl(event.getActionUrl())
                        .build()));
    }

    private boolean isSelfAction(String actorId, String recipientId) {
        boolean self = actorId != null && actorId.equals(recipientId);
        if (self) {
            metricsService.recordNotificationSuppressed("self_action");
        }
        return self;
    }

    private Notification draft(String recipientId, NotificationType type, String title, String body,
                               NotificationContext context) {
        return Notification.builder()
                .recipientUserId(recipientId)
                .type(type)
                .title(truncate(title, Notification.TITLE_MAX_LENGTH))
                .body(truncate(body, Notification.BODY_MAX_LENGTH))
                .context(context)
                .read(false)
                .emailSent(false)
                .build();
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    static String threadLink(String threadId) {
        return "/threads/" + threadId;
    }

    static String commentLink(String threadId, String commentId) {
        return "/threads/" + threadId + "#comment-" + commentId;
    }

    static String chatLink(String username) {
        return "/chat?user=" + URLEncoder.encode(username == null ? "" : username, StandardCharsets.UTF_8);
    }

    private void publishCreated(Notification notification) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishNotificationCreated(notification);
        } catch (Exception e) {
            log.warn("Failed to publish notification event: id={}", notification.getId(), e);
        }
    }
}
