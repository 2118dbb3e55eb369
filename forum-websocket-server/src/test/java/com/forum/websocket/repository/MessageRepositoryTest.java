package com.forum.websocket.repository;

import com.forum.websocket.domain.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Each call commits on its own, so bulk updates and entity saves interleave
 * the way concurrent requests do.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class MessageRepositoryTest {

    private static final Instant BASE = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private MessageRepository messageRepository;

    @AfterEach
    void tearDown() {
        messageRepository.deleteAll();
    }

    private Message store(String senderId, String receiverId, String content, int minute) {
        return messageRepository.save(Message.builder()
                .senderId(senderId)
                .receiverId(receiverId)
                .content(content)
                .createdAt(BASE.plus(minute, ChronoUnit.MINUTES))
                .build());
    }

    @Test
    void staleCopyCannotUndoBulkReadMark() {
        Message stored = store("alice", "bob", "hello", 0);
        Message loaded = messageRepository.findById(stored.getId()).orElseThrow();

        assertThat(messageRepository.markConversationRead("alice", "bob", BASE.plusSeconds(60))).isEqualTo(1);

        loaded.markDeletedBy("alice");
        assertThatThrownBy(() -> messageRepository.save(loaded))
                .isInstanceOf(OptimisticLockingFailureException.class);

        Message fresh = messageRepository.findById(stored.getId()).orElseThrow();
        assertThat(fresh.isRead()).isTrue();
        assertThat(fresh.getReadAt()).isEqualTo(BASE.plusSeconds(60));
        assertThat(fresh.getDeletedBy()).isEmpty();
        assertThat(messageRepository.countUnread("bob")).isZero();
    }

    @Test
    void bulkReadMarkTouchesOneDirectionOnly() {
        store("alice", "bob", "one", 0);
        store("alice", "bob", "two", 1);
        store("bob", "alice", "reply", 2);
        store("carol", "bob", "unrelated", 3);

        int marked = messageRepository.markConversationRead("alice", "bob", BASE.plusSeconds(600));

        assertThat(marked).isEqualTo(2);
        assertThat(messageRepository.countUnread("bob")).isEqualTo(1);
        assertThat(messageRepository.countUnread("alice")).isEqualTo(1);
        assertThat(messageRepository.markConversationRead("alice", "bob", BASE.plusSeconds(900))).isZero();
    }

    @Test
    void conversationPagesNewestFirst() {
        store("alice", "bob", "first", 0);
        store("bob", "alice", "second", 1);
        store("alice", "bob", "third", 2);
        store("alice", "carol", "elsewhere", 3);

        Page<Message> firstPage = messageRepository.findConversation("bob", "alice", PageRequest.of(0, 2));
        Page<Message> secondPage = messageRepository.findConversation("bob", "alice", PageRequest.of(1, 2));

        assertThat(firstPage.getTotalElements()).isEqualTo(3);
        assertThat(firstPage.getContent()).extracting(Message::getContent).containsExactly("third", "second");
        assertThat(secondPage.getContent()).extracting(Message::getContent).containsExactly("first");
    }

    @Test
    void hiddenMessagesStayVisibleToTheOtherParticipant() {
        Message hidden = store("alice", "bob", "oops", 0);
        store("alice", "bob", "kept", 1);
        hidden.markDeletedBy("bob");
        messageRepository.save(hidden);

        assertThat(messageRepository.findConversation("bob", "alice", PageRequest.of(0, 10)).getContent())
                .extracting(Message::getContent).containsExactly("kept");
        assertThat(messageRepository.findConversation("alice", "bob", PageRequest.of(0, 10)).getContent())
                .extracting(Message::getContent).containsExactly("kept", "oops");
        assertThat(messageRepository.countUnread("bob")).isEqualTo(1);
        assertThat(messageRepository.findVisibleForUser("bob")).hasSize(1);
        assertThat(messageRepository.findVisibleForUser("alice")).hasSize(2);
    }

    @Test
    void messageDeletedByBothIsGoneForEveryone() {
        Message message = store("alice", "bob", "bye", 0);
        message.markDeletedBy("alice");
        message = messageRepository.save(message);
        message.markDeletedBy("bob");
        messageRepository.save(message);

        assertThat(messageRepository.findById(message.getId()).orElseThrow().isDeleted()).isTrue();
        assertThat(messageRepository.findConversation("alice", "bob", PageRequest.of(0, 10))).isEmpty();
        assertThat(messageRepository.findConversation("bob", "alice", PageRequest.of(0, 10))).isEmpty();
        assertThat(messageRepository.countUnread("bob")).isZero();
    }

    @Test
    void receiverLookupIgnoresSender() {
        Message message = store("alice", "bob", "hello", 0);

        assertThat(messageRepository.findByIdAndReceiverId(message.getId(), "bob")).isPresent();
        assertThat(messageRepository.findByIdAndReceiverId(message.getId(), "alice")).isEmpty();
    }
}
