package com.forum.websocket.service;

import com.forum.websocket.domain.Message;
import com.forum.websocket.domain.SendMessageRequest;
import com.forum.websocket.domain.UserAccount;
import com.forum.websocket.domain.WebSocketMessage;
import com.forum.websocket.domain.event.MessageSentEvent;
import com.forum.websocket.exception.ForbiddenException;
import com.forum.websocket.exception.InvalidArgumentException;
import com.forum.websocket.exception.NotFoundException;
import com.forum.websocket.infrastructure.RealtimeDeliveryChannel;
import com.forum.websocket.model.ConversationView;
import com.forum.websocket.model.MessageView;
import com.forum.websocket.model.PageResponse;
import com.forum.websocket.model.UserSummary;
import com.forum.websocket.repository.MessageRepository;
import com.forum.websocket.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct message pipeline.
 *
 * Sending is validate, persist, notify, push. Only the first two decide the
 * outcome; the notification and the push are attempted once and their
 * failures are logged without touching the stored message.
 */
@Service
@Slf4j
public class MessageService {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private static final int UPDATE_ATTEMPTS = 3;

    private final MessageRepository messageRepository;
    private final UserAccountRepository userAccountRepository;
    private final MessageRequestValidator validator;
    private final MessageAssembler assembler;
    private final NotificationService notificationService;
    private final RealtimeDeliveryChannel deliveryChannel;
    private final MetricsService metricsService;
    private final EventPublisher eventPublisher;

    public MessageService(MessageRepository messageRepository,
                          UserAccountRepository userAccountRepository,
                          MessageRequestValidator validator,
                          MessageAssembler assembler,
                          NotificationService notificationService,
                          RealtimeDeliveryChannel deliveryChannel,
                          MetricsService metricsService,
                          @Autowired(required = false) EventPublisher eventPublisher) {
        this.messageRepository = messageRepository;
        this.userAccountRepository = userAccountRepository;
        this.validator = validator;
        this.assembler = assembler;
        this.notificationService = notificationService;
        this.deliveryChannel = deliveryChannel;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Send a direct message.
     *
     * @return the stored message, populated with both participants
     * @throws InvalidArgumentException if the payload is invalid
     * @throws NotFoundException        if the receiver does not exist
     * @throws ForbiddenException       if the receiver has disabled chat messages
     */
    public MessageView sendMessage(String senderId, SendMessageRequest request) {
        validator.validate(request);

        UserAccount receiver = userAccountRepository.findById(request.getReceiverId())
                .orElseThrow(() -> new NotFoundException("Receiver not found"));
        if (!receiver.preferences().isChat()) {
            throw new ForbiddenException("User has disabled messages");
        }

        Message.MessageType messageType = request.getMessageType() != null
                ? Message.MessageType.fromWireName(request.getMessageType())
                : Message.MessageType.TEXT;

        Message message = messageRepository.save(Message.builder()
                .senderId(senderId)
                .receiverId(receiver.getId())
                .content(request.getContent().trim())
                .threadId(blankToNull(request.getThreadId()))
                .messageType(messageType)
                .build());

        metricsService.recordMessageSent();
        log.info("Message sent: messageId={}, senderId={}, receiverId={}",
                message.getId(), senderId, receiver.getId());

        UserSummary sender = assembler.summary(senderId);
        Map<String, UserSummary> participants = new HashMap<>();
        participants.put(senderId, sender);
        participants.put(receiver.getId(), UserSummary.from(receiver));
        MessageView view = assembler.toView(message, participants);

        notifyReceiver(message, sender);
        pushToReceiver(view, sender);
        publish(message);

        return view;
    }

    private void notifyReceiver(Message message, UserSummary sender) {
        try {
            notificationService.publish(MessageSentEvent.builder()
                    .receiverId(message.getReceiverId())
                    .senderId(message.getSenderId())
                    .senderName(sender.getName())
                    .senderUsername(sender.getUsername())
                    .messageId(message.getId())
                    .build());
        } catch (Exception e) {
            log.warn("Message stored but notification failed: messageId={}, receiverId={}",
                    message.getId(), message.getReceiverId(), e);
            metricsService.recordError("NOTIFICATION_FAILED", "MessageService");
        }
    }

    private void pushToReceiver(MessageView view, UserSummary sender) {
        try {
            deliveryChannel.push(view.getReceiver().getId(), WebSocketMessage.newMessage(view, sender));
        } catch (Exception e) {
            log.warn("Message stored but push failed: messageId={}", view.getId(), e);
        }
    }

    private void publish(Message message) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishMessageSent(message);
        } catch (Exception e) {
            log.warn("Failed to publish message event: messageId={}", message.getId(), e);
        }
    }

    /**
     * One entry per conversation partner, most recent conversation first
     */
    public List<ConversationView> getConversations(String userId) {
        List<Message> messages = messageRepository.findVisibleForUser(userId);

        // Messages arrive newest first, so the first one seen per partner is the last message
        Map<String, Message> lastByPartner = new LinkedHashMap<>();
        Map<String, Long> unreadByPartner = new LinkedHashMap<>();
        for (Message message : messages) {
            String partnerId = message.getSenderId().equals(userId) ? message.getReceiverId() : message.getSenderId();
            lastByPartner.putIfAbsent(partnerId, message);
            if (message.getReceiverId().equals(userId) && !message.isRead()) {
                unreadByPartner.merge(partnerId, 1L, Long::sum);
            }
        }

        List<String> userIds = new ArrayList<>(lastByPartner.keySet());
        userIds.add(userId);
        Map<String, UserSummary> users = assembler.summaries(userIds);

        List<ConversationView> conversations = new ArrayList<>(lastByPartner.size());
        lastByPartner.forEach((partnerId, last) -> {
            UserSummary partner = users.get(partnerId);
            if (partner == null) {
                return;
            }
            conversations.add(ConversationView.builder()
                    .user(partner)
                    .lastMessage(assembler.toView(last, users))
                    .unreadCount(unreadByPartner.getOrDefault(partnerId, 0L))
                    .build());
        });
        return conversations;
    }

    /**
     * A page of the conversation with another user, oldest first within the
     * page. Marks everything the other user sent to the caller as read.
     */
    public PageResponse<MessageView> getMessages(String currentUserId, String otherUserId, int page, int limit) {
        if (!userAccountRepository.existsById(otherUserId)) {
            throw new NotFoundException("User not found");
        }

        int safePage = Math.max(page, 1);
        int safeLimit = limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);

        Page<Message> result = messageRepository.findConversation(currentUserId, otherUserId,
                PageRequest.of(safePage - 1, safeLimit));

        int marked = messageRepository.markConversationRead(otherUserId, currentUserId, Instant.now());
        if (marked > 0) {
            log.debug("Marked messages read: count={}, senderId={}, receiverId={}", marked, otherUserId, currentUserId);
            publishRead(currentUserId, null, marked);
        }

        List<Message> ordered = new ArrayList<>(result.getContent());
        Collections.reverse(ordered);

        return PageResponse.of(assembler.toViews(ordered), safePage, safeLimit, result.getTotalElements());
    }

    public void markAsRead(String messageId, String userId) {
        Message message = messageRepository.findByIdAndReceiverId(messageId, userId)
                .orElseThrow(() -> new NotFoundException("Message not found"));

        if (!message.isRead()) {
            message.markRead(Instant.now());
            messageRepository.save(message);
            publishRead(userId, messageId, 1);
        }
    }

    /**
     * Hide a message for one participant. Retries against a fresh copy when
     * the row changed underneath, e.g. the receiver read the conversation.
     */
    public void deleteMessage(String messageId, String userId) {
        for (int attempt = 1; ; attempt++) {
            Message message = messageRepository.findById(messageId)
                    .orElseThrow(() -> new NotFoundException("Message not found"));

            if (!message.isParticipant(userId)) {
                throw new ForbiddenException("Not authorized to delete this message");
            }

            message.markDeletedBy(userId);
            try {
                messageRepository.save(message);
                log.info("Message deleted: messageId={}, userId={}, fullyDeleted={}",
                        messageId, userId, message.isDeleted());
                return;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Message changed during delete, retrying: messageId={}, attempt={}", messageId, attempt);
            }
        }
    }

    public long getUnreadCount(String userId) {
        return messageRepository.countUnread(userId);
    }

    private void publishRead(String userId, String messageId, int count) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishMessageRead(userId, messageId, count);
        } catch (Exception e) {
            log.warn("Failed to publish read event: userId={}", userId, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
