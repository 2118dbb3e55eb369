package com.forum.websocket.service;

import com.forum.websocket.domain.Message;
import com.forum.websocket.domain.UserAccount;
import com.forum.websocket.model.MessageView;
import com.forum.websocket.model.UserSummary;
import com.forum.websocket.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the populated message shape shared by the REST reads and the
 * realtime push, so both always carry the same representation.
 */
@Component
@RequiredArgsConstructor
public class MessageAssembler {

    private final UserAccountRepository userAccountRepository;

    public MessageView toView(Message message) {
        return toViews(List.of(message)).get(0);
    }

    /**
     * Participants are loaded in one query for the whole batch
     */
    public List<MessageView> toViews(List<Message> messages) {
        Set<String> userIds = new HashSet<>();
        for (Message message : messages) {
            userIds.add(message.getSenderId());
            userIds.add(message.getReceiverId());
        }
        Map<String, UserSummary> users = summaries(userIds);

        return messages.stream()
                .map(message -> toView(message, users))
                .collect(Collectors.toList());
    }

    public Map<String, UserSummary> summaries(Collection<String> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        return userAccountRepository.findAllById(userIds).stream()
                .collect(Collectors.toMap(UserAccount::getId, UserSummary::from, (a, b) -> a));
    }

    public UserSummary summary(String userId) {
        return userAccountRepository.findById(userId)
                .map(UserSummary::from)
                .orElseGet(() -> UserSummary.unknown(userId));
    }

    public MessageView toView(Message message, Map<String, UserSummary> users) {
        return MessageView.builder()
                .id(message.getId())
                .sender(resolve(users, message.getSenderId()))
                .receiver(resolve(users, message.getReceiverId()))
                .content(message.getContent())
                .threadId(message.getThreadId())
                .messageType(message.getMessageType())
                .deliveryState(message.getDeliveryState())
                .read(message.isRead())
                .readAt(message.getReadAt())
                .createdAt(message.getCreatedAt())
                .build();
    }

    private static UserSummary resolve(Map<String, UserSummary> users, String userId) {
        UserSummary summary = users.get(userId);
        return summary != null ? summary : UserSummary.unknown(userId);
    }
}
