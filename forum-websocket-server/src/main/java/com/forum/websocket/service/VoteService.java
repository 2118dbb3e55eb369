package com.forum.websocket.service;

import com.forum.websocket.domain.EntityKind;
import com.forum.websocket.domain.VoteDirection;
import com.forum.websocket.domain.VoteOutcome;
import com.forum.websocket.domain.event.UpvotedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs a vote through the ledger and, when the ledger says so, tells the
 * owner. The counters returned are authoritative whether or not the
 * notification step succeeds.
 */
@Service
@Slf4j
public class VoteService {

    private final VoteLedger voteLedger;
    private final NotificationService notificationService;
    private final EventPublisher eventPublisher;

    public VoteService(VoteLedger voteLedger,
                       NotificationService notificationService,
                       @Autowired(required = false) EventPublisher eventPublisher) {
        this.voteLedger = voteLedger;
        this.notificationService = notificationService;
        this.eventPublisher = eventPublisher;
    }

    public VoteOutcome vote(EntityKind kind, String entityId, String userId, VoteDirection direction) {
        VoteOutcome outcome = voteLedger.applyVote(kind, entityId, userId, direction);

        if (outcome.shouldNotify()) {
            try {
                notificationService.publish(UpvotedEvent.builder()
                        .entityKind(kind)
                        .entityId(entityId)
                        .threadId(outcome.getThreadId())
                        .ownerId(outcome.getOwnerId())
                        .actorId(userId)
                        .entityTitle(outcome.getEntityTitle())
                        .build());
            } catch (Exception e) {
                log.warn("Vote applied but upvote notification failed: kind={}, entityId={}", kind, entityId, e);
            }
        }

        if (eventPublisher != null) {
            try {
                eventPublisher.publishVoteApplied(outcome, userId);
            } catch (Exception e) {
                log.warn("Failed to publish vote event: kind={}, entityId={}", kind, entityId, e);
            }
        }
        return outcome;
    }
}
