package com.forum.websocket.service;

import com.forum.websocket.domain.Comment;
import com.forum.websocket.domain.CreateCommentRequest;
import com.forum.websocket.domain.ForumThread;
import com.forum.websocket.domain.UserAccount;
import com.forum.websocket.domain.event.CommentedEvent;
import com.forum.websocket.domain.event.MentionedEvent;
import com.forum.websocket.exception.ConflictException;
import com.forum.websocket.exception.ForbiddenException;
import com.forum.websocket.exception.InvalidArgumentException;
import com.forum.websocket.exception.NotFoundException;
import com.forum.websocket.model.CommentView;
import com.forum.websocket.model.UserSummary;
import com.forum.websocket.repository.CommentRepository;
import com.forum.websocket.repository.ForumThreadRepository;
import com.forum.websocket.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Posting comments. The comment row and the thread's comment counter are
 * written in one transaction, retried as a unit when another writer bumps
 * the thread first. Reply and mention notifications follow the commit on a
 * best-effort basis.
 */
@Service
@Slf4j
public class CommentService {

    public static final int BODY_MAX_LENGTH = 1000;

    private static final Pattern MENTION_PATTERN = Pattern.compile("@([A-Za-z0-9_]{3,30})");

    private final ForumThreadRepository threadRepository;
    private final CommentRepository commentRepository;
    private final UserAccountRepository userAccountRepository;
    private final NotificationService notificationService;
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public CommentService(ForumThreadRepository threadRepository,
                          CommentRepository commentRepository,
                          UserAccountRepository userAccountRepository,
                          NotificationService notificationService,
                          PlatformTransactionManager transactionManager,
                          @Value("${forum.vote.max-attempts:10}") int maxAttempts) {
        this.threadRepository = threadRepository;
        this.commentRepository = commentRepository;
        this.userAccountRepository = userAccountRepository;
        this.notificationService = notificationService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public CommentView postComment(String userId, CreateCommentRequest request) {
        validate(request);

        ForumThread thread = threadRepository.findById(request.getThreadId())
                .orElseThrow(() -> new NotFoundException("Thread not found"));
        if (thread.isLocked()) {
            throw new ForbiddenException("Thread is locked");
        }

        Comment parent = null;
        if (request.getParentId() != null && !request.getParentId().isBlank()) {
            parent = commentRepository.findById(request.getParentId())
                    .orElseThrow(() -> new NotFoundException("Parent comment not found"));
            if (!thread.getId().equals(parent.getThreadId())) {
                throw new InvalidArgumentException("Parent comment belongs to another thread");
            }
        }

        UserAccount author = userAccountRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));

        Set<String> mentions = resolveMentions(request);

        String parentId = parent != null ? parent.getId() : null;
        String body = request.getBody().trim();
        Comment comment = storeComment(thread.getId(), () -> Comment.builder()
                .threadId(thread.getId())
                .ownerId(userId)
                .parentId(parentId)
                .body(body)
                .mentions(new LinkedHashSet<>(mentions))
                .build());
        log.info("Comment posted: commentId={}, threadId={}, userId={}, nested={}",
                comment.getId(), thread.getId(), userId, parent != null);

        notifyReply(thread, parent, comment, author);
        notifyMentions(thread, comment, author);

        return CommentView.from(comment, UserSummary.from(author));
    }

    private void validate(CreateCommentRequest request) {
        if (request == null || request.getThreadId() == null || request.getThreadId().isBlank()) {
            throw new InvalidArgumentException("Thread ID is required");
        }
        String body = request.getBody();
        if (body == null || body.trim().isEmpty()) {
            throw new InvalidArgumentException("Comment body is required");
        }
        if (body.trim().length() > BODY_MAX_LENGTH) {
            throw new InvalidArgumentException("Comment cannot exceed " + BODY_MAX_LENGTH + " characters");
        }
    }

    /**
     * Explicit mention ids plus any {@code @username} in the body that names an existing user
     */
    Set<String> resolveMentions(CreateCommentRequest request) {
        Set<String> ids = new LinkedHashSet<>();
        if (request.getMentions() != null) {
            request.getMentions().stream()
                    .filter(id -> id != null && !id.isBlank())
                    .forEach(ids::add);
        }

        List<String> usernames = new ArrayList<>();
        Matcher matcher = MENTION_PATTERN.matcher(request.getBody());
        while (matcher.find()) {
            usernames.add(matcher.group(1));
        }
        if (!usernames.isEmpty()) {
            userAccountRepository.findByUsernameIn(usernames)
                    .forEach(user -> ids.add(user.getId()));
        }
        return ids;
    }

    /**
     * Save the comment and bump the thread counter together
     *
     * @throws ConflictException if the thread kept changing until attempts ran out;
     *                           nothing is stored in that case
     */
    private Comment storeComment(String threadId, Supplier<Comment> draft) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> {
                    ForumThread thread = threadRepository.findById(threadId)
                            .orElseThrow(() -> new NotFoundException("Thread not found"));
                    Comment saved = commentRepository.save(draft.get());
                    thread.setCommentsCount(thread.getCommentsCount() + 1);
                    threadRepository.saveAndFlush(thread);
                    return saved;
                });
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    throw new ConflictException("Thread was modified concurrently, please retry", e);
                }
                log.debug("Retrying comment write: threadId={}, attempt={}", threadId, attempt);
            }
        }
    }

    private void notifyReply(ForumThread thread, Comment parent, Comment comment, UserAccount author) {
        try {
            notificationService.publish(CommentedEvent.builder()
                    .threadOwnerId(thread.getOwnerId())
                    .parentOwnerId(parent != null ? parent.getOwnerId() : null)
                    .actorId(author.getId())
                    .actorName(author.getName())
                    .threadId(thread.getId())
                    .commentId(comment.getId())
                    .threadTitle(thread.getTitle())
                    .build());
        } catch (Exception e) {
            log.warn("Comment stored but reply notification failed: commentId={}", comment.getId(), e);
        }
    }

    private void notifyMentions(ForumThread thread, Comment comment, UserAccount author) {
        if (comment.getMentions().isEmpty()) {
            return;
        }
        try {
            notificationService.publish(MentionedEvent.builder()
                    .mentionedUserIds(new ArrayList<>(comment.getMentions()))
                    .actorId(author.getId())
                    .actorName(author.getName())
                    .threadId(thread.getId())
                    .commentId(comment.getId())
                    .threadTitle(thread.getTitle())
                    .build());
        } catch (Exception e) {
            log.warn("Comment stored but mention notification failed: commentId={}", comment.getId(), e);
        }
    }
}
