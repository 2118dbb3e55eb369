package com.forum.websocket.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoteTransitionTest {

    @Test
    void firstUpvoteCastsAndIncrementsUpvotes() {
        VoteTransition transition = VoteTransition.of(null, VoteDirection.UP);

        assertThat(transition.getAction()).isEqualTo(VoteTransition.Action.CAST);
        assertThat(transition.getUpvoteDelta()).isEqualTo(1);
        assertThat(transition.getDownvoteDelta()).isZero();
    }

    @Test
    void sameDirectionAgainRetracts() {
        VoteTransition transition = VoteTransition.of(VoteDirection.DOWN, VoteDirection.DOWN);

        assertThat(transition.getAction()).isEqualTo(VoteTransition.Action.RETRACT);
        assertThat(transition.getUpvoteDelta()).isZero();
        assertThat(transition.getDownvoteDelta()).isEqualTo(-1);
    }

    @Test
    void oppositeDirectionFlipsBothCounters() {
        VoteTransition transition = VoteTransition.of(VoteDirection.UP, VoteDirection.DOWN);

        assertThat(transition.getAction()).isEqualTo(VoteTransition.Action.FLIP);
        assertThat(transition.getUpvoteDelta()).isEqualTo(-1);
        assertThat(transition.getDownvoteDelta()).isEqualTo(1);
    }

    @Test
    void applyToMovesCountersOnEntity() {
        ForumThread thread = ForumThread.builder().upvoteCount(3).downvoteCount(2).build();

        VoteTransition.of(VoteDirection.DOWN, VoteDirection.UP).applyTo(thread);

        assertThat(thread.getUpvoteCount()).isEqualTo(4);
        assertThat(thread.getDownvoteCount()).isEqualTo(1);
    }

    @Test
    void onlyFreshUpvoteByAnotherUserAsksForNotification() {
        assertThat(VoteTransition.of(null, VoteDirection.UP).notificationHint("voter", "owner"))
                .isEqualTo(NotificationHint.EMIT_UPVOTE);
        assertThat(VoteTransition.of(null, VoteDirection.UP).notificationHint("owner", "owner"))
                .isEqualTo(NotificationHint.NONE);
        assertThat(VoteTransition.of(null, VoteDirection.DOWN).notificationHint("voter", "owner"))
                .isEqualTo(NotificationHint.NONE);
        assertThat(VoteTransition.of(VoteDirection.DOWN, VoteDirection.UP).notificationHint("voter", "owner"))
                .isEqualTo(NotificationHint.NONE);
        assertThat(VoteTransition.of(VoteDirection.UP, VoteDirection.UP).notificationHint("voter", "owner"))
                .isEqualTo(NotificationHint.NONE);
    }

    @Test
    void requestedDirectionIsRequired() {
        assertThatThrownBy(() -> VoteTransition.of(VoteDirection.UP, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
