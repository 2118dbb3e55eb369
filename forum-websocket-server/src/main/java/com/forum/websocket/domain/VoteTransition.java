package com.forum.websocket.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Pure vote-state machine: given a user's prior direction on an entity (or
 * none) and the requested direction, yields the change to apply to the vote
 * record and to both counters.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class VoteTransition {

    public enum Action {
        /** First vote by this user: insert record. */
        CAST,
        /** Same direction again: remove record. */
        RETRACT,
        /** Opposite direction: update record in place. */
        FLIP
    }

    private final Action action;
    private final VoteDirection direction;
    private final int upvoteDelta;
    private final int downvoteDelta;

    public static VoteTransition of(VoteDirection prior, VoteDirection requested) {
        if (requested == null) {
            throw new IllegalArgumentException("requested direction is required");
        }
        if (prior == null) {
            return new VoteTransition(Action.CAST, requested,
                    requested == VoteDirection.UP ? 1 : 0,
                    requested == VoteDirection.DOWN ? 1 : 0);
        }
        if (prior == requested) {
            return new VoteTransition(Action.RETRACT, requested,
                    requested == VoteDirection.UP ? -1 : 0,
                    requested == VoteDirection.DOWN ? -1 : 0);
        }
        return new VoteTransition(Action.FLIP, requested,
                requested == VoteDirection.UP ? 1 : -1,
                requested == VoteDirection.DOWN ? 1 : -1);
    }

    /**
     * Only a first-time upvote by someone other than the owner notifies.
     * Retractions, flips and downvotes never do.
     */
    public NotificationHint notificationHint(String voterId, String ownerId) {
        if (action == Action.CAST && direction == VoteDirection.UP && !voterId.equals(ownerId)) {
            return NotificationHint.EMIT_UPVOTE;
        }
        return NotificationHint.NONE;
    }

    public void applyTo(Votable entity) {
        entity.setUpvoteCount(entity.getUpvoteCount() + upvoteDelta);
        entity.setDownvoteCount(entity.getDownvoteCount() + downvoteDelta);
    }
}
