package com.forum.websocket.service;

import com.forum.websocket.domain.EntityKind;
import com.forum.websocket.domain.NotificationHint;
import com.forum.websocket.domain.VoteDirection;
import com.forum.websocket.domain.VoteOutcome;
import com.forum.websocket.domain.VoteTransition;
import com.forum.websocket.domain.event.DomainEvent;
import com.forum.websocket.domain.event.UpvotedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VoteServiceTest {

    @Mock
    private VoteLedger voteLedger;

    @Mock
    private NotificationService notificationService;

    @Mock
    private EventPublisher eventPublisher;

    private VoteService voteService;

    @BeforeEach
    void setUp() {
        voteService = new VoteService(voteLedger, notificationService, eventPublisher);
    }

    private static VoteOutcome outcome(NotificationHint hint) {
        return VoteOutcome.builder()
                .entityKind(EntityKind.THREAD)
                .entityId("t1")
                .threadId("t1")
                .ownerId("owner")
                .entityTitle("Release notes")
                .action(VoteTransition.Action.CAST)
                .upvoteCount(5)
                .downvoteCount(1)
                .notificationHint(hint)
                .build();
    }

    @Test
    void notifiesOwnerWhenLedgerAsks() {
        when(voteLedger.applyVote(EntityKind.THREAD, "t1", "voter", VoteDirection.UP))
                .thenReturn(outcome(NotificationHint.EMIT_UPVOTE));

        VoteOutcome result = voteService.vote(EntityKind.THREAD, "t1", "voter", VoteDirection.UP);

        assertThat(result.getUpvoteCount()).isEqualTo(5);
        ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
        verify(notificationService).publish(event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(UpvotedEvent.class, upvoted -> {
            assertThat(upvoted.getOwnerId()).isEqualTo("owner");
            assertThat(upvoted.getActorId()).isEqualTo("voter");
            assertThat(upvoted.getEntityTitle()).isEqualTo("Release notes");
        });
        verify(eventPublisher).publishVoteApplied(result, "voter");
    }

    @Test
    void staysQuietWithoutHint() {
        when(voteLedger.applyVote(EntityKind.THREAD, "t1", "voter", VoteDirection.DOWN))
                .thenReturn(outcome(NotificationHint.NONE));

        voteService.vote(EntityKind.THREAD, "t1", "voter", VoteDirection.DOWN);

        verifyNoInteractions(notificationService);
    }

    @Test
    void notificationFailureKeepsTheCounters() {
        when(voteLedger.applyVote(EntityKind.THREAD, "t1", "voter", VoteDirection.UP))
                .thenReturn(outcome(NotificationHint.EMIT_UPVOTE));
        when(notificationService.publish(any())).thenThrow(new IllegalStateException("down"));

        VoteOutcome result = voteService.vote(EntityKind.THREAD, "t1", "voter", VoteDirection.UP);

        assertThat(result.getUpvoteCount()).isEqualTo(5);
        assertThat(result.getDownvoteCount()).isEqualTo(1);
    }

    @Test
    void worksWithoutEventPublisher() {
        VoteService withoutKafka = new VoteService(voteLedger, notificationService, null);
        when(voteLedger.applyVote(EntityKind.COMMENT, "c1", "voter", VoteDirection.DOWN))
                .thenReturn(outcome(NotificationHint.NONE));

        assertThat(withoutKafka.vote(EntityKind.COMMENT, "c1", "voter", VoteDirection.DOWN)).isNotNull();
    }
}
