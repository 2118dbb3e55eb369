package com.forum.websocket.service;

import com.forum.websocket.domain.Comment;
import com.forum.websocket.domain.EntityKind;
import com.forum.websocket.domain.ForumThread;
import com.forum.websocket.domain.Votable;
import com.forum.websocket.domain.VoteDirection;
import com.forum.websocket.domain.VoteOutcome;
import com.forum.websocket.domain.VoteRecord;
import com.forum.websocket.domain.VoteTransition;
import com.forum.websocket.exception.ConflictException;
import com.forum.websocket.exception.InvalidArgumentException;
import com.forum.websocket.exception.NotFoundException;
import com.forum.websocket.repository.CommentRepository;
import com.forum.websocket.repository.ForumThreadRepository;
import com.forum.websocket.repository.VoteRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Vote Ledger
 *
 * Owns the per-user vote records and the cached counters on threads and
 * comments. Every attempt runs in its own transaction and writes the counters
 * through the entity's version column, so two voters racing on the same
 * entity cannot lose an update: the loser is rolled back and retried against
 * fresh state.
 */
@Service
@Slf4j
public class VoteLedger {

    private final ForumThreadRepository threadRepository;
    private final CommentRepository commentRepository;
    private final VoteRecordRepository voteRecordRepository;
    private final TransactionTemplate transactionTemplate;
    private final MetricsService metricsService;
    private final int maxAttempts;
    private final long backoffMs;

    public VoteLedger(ForumThreadRepository threadRepository,
                      CommentRepository commentRepository,
                      VoteRecordRepository voteRecordRepository,
                      PlatformTransactionManager transactionManager,
                      MetricsService metricsService,
                      @Value("${forum.vote.max-attempts:10}") int maxAttempts,
                      @Value("${forum.vote.backoff-ms:15}") long backoffMs) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
        this.voteRecordRepository = voteRecordRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metricsService = metricsService;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    /**
     * Apply a user's vote to a thread or comment.
     *
     * @return the counters as committed, plus whether the caller should notify the owner
     * @throws NotFoundException        if the entity does not exist
     * @throws InvalidArgumentException if no direction is given
     * @throws ConflictException        if concurrent writers kept winning until attempts ran out
     */
    public VoteOutcome applyVote(EntityKind kind, String entityId, String userId, VoteDirection direction) {
        if (direction == null) {
            throw new InvalidArgumentException("Vote type is required");
        }

        for (int attempt = 1; ; attempt++) {
            try {
                VoteOutcome outcome = transactionTemplate.execute(
                        status -> applyOnce(kind, entityId, userId, direction));

                metricsService.recordVote(kind.name(), outcome.getAction().name());
                log.info("Vote applied: kind={}, entityId={}, userId={}, action={}, up={}, down={}",
                        kind, entityId, userId, outcome.getAction(),
                        outcome.getUpvoteCount(), outcome.getDownvoteCount());
                return outcome;

            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                if (attempt >= maxAttempts) {
                    metricsService.recordVoteConflict(kind.name());
                    throw new ConflictException(
                            "Vote could not be applied due to concurrent updates, please retry", e);
                }
                metricsService.recordVoteRetry(kind.name());
                log.debug("Vote attempt {} lost a race: kind={}, entityId={}, userId={}",
                        attempt, kind, entityId, userId);
                backoff(attempt);
            }
        }
    }

    private VoteOutcome applyOnce(EntityKind kind, String entityId, String userId, VoteDirection direction) {
        Votable entity = load(kind, entityId);

        Optional<VoteRecord> prior = voteRecordRepository
                .findByEntityKindAndEntityIdAndUserId(kind, entityId, userId);
        VoteTransition transition = VoteTransition.of(
                prior.map(VoteRecord::getDirection).orElse(null), direction);

        switch (transition.getAction()) {
            case CAST -> voteRecordRepository.save(VoteRecord.builder()
                    .entityKind(kind)
                    .entityId(entityId)
                    .userId(userId)
                    .direction(direction)
                    .build());
            case RETRACT -> voteRecordRepository.delete(prior.get());
            case FLIP -> {
                VoteRecord record = prior.get();
                record.setDirection(direction);
                voteRecordRepository.save(record);
            }
        }

        transition.applyTo(entity);
        store(entity);

        return VoteOutcome.builder()
                .entityKind(kind)
                .entityId(entityId)
                .threadId(entity.threadId())
                .ownerId(entity.getOwnerId())
                .entityTitle(entity.displayTitle())
                .action(transition.getAction())
                .upvoteCount(entity.getUpvoteCount())
                .downvoteCount(entity.getDownvoteCount())
                .notificationHint(transition.notificationHint(userId, entity.getOwnerId()))
                .build();
    }

    private Votable load(EntityKind kind, String entityId) {
        Optional<? extends Votable> entity = switch (kind) {
            case THREAD -> threadRepository.findById(entityId);
            case COMMENT -> commentRepository.findById(entityId);
        };
        return entity.orElseThrow(() -> new NotFoundException(kind.getDisplayName() + " not found"));
    }

    /**
     * Flush immediately so a stale version surfaces inside this attempt.
     */
    private void store(Votable entity) {
        switch (entity.kind()) {
            case THREAD -> threadRepository.saveAndFlush((ForumThread) entity);
            case COMMENT -> commentRepository.saveAndFlush((Comment) entity);
        }
    }

    private void backoff(int attempt) {
        if (backoffMs == 0) {
            return;
        }
        long delay = backoffMs * attempt + ThreadLocalRandom.current().nextLong(backoffMs + 1);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Interrupted while retrying vote", e);
        }
    }
}
