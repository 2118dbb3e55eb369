package com.forum.websocket.service;

import com.forum.websocket.domain.Comment;
import com.forum.websocket.domain.CreateCommentRequest;
import com.forum.websocket.domain.ForumThread;
import com.forum.websocket.domain.UserAccount;
import com.forum.websocket.domain.event.CommentedEvent;
import com.forum.websocket.domain.event.DomainEvent;
import com.forum.websocket.domain.event.MentionedEvent;
import com.forum.websocket.exception.ConflictException;
import com.forum.websocket.exception.ForbiddenException;
import com.forum.websocket.exception.InvalidArgumentException;
import com.forum.websocket.exception.NotFoundException;
import com.forum.websocket.model.CommentView;
import com.forum.websocket.repository.CommentRepository;
import com.forum.websocket.repository.ForumThreadRepository;
import com.forum.websocket.repository.UserAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommentServiceTest {

    @Mock
    private ForumThreadRepository threadRepository;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private NotificationService notificationService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private CommentService commentService;

    private final ForumThread thread = ForumThread.builder()
            .id("t1").ownerId("owner").title("Release notes").build();
    private final UserAccount author = UserAccount.builder()
            .id("author").username("author").name("Author").build();

    @BeforeEach
    void setUp() {
        commentService = new CommentService(threadRepository, commentRepository, userAccountRepository,
                notificationService, transactionManager, 3);
    }

    private void stubCommentSave() {
        when(commentRepository.save(any(Comment.class))).thenAnswer(invocation -> {
            Comment comment = invocation.getArgument(0);
            comment.setId("c1");
            return comment;
        });
    }

    @Test
    void topLevelCommentNotifiesThreadOwnerAndBumpsCounter() {
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));
        when(userAccountRepository.findById("author")).thenReturn(Optional.of(author));
        stubCommentSave();

        CommentView view = commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").body(" Looks good ").build());

        assertThat(view.getId()).isEqualTo("c1");
        assertThat(thread.getCommentsCount()).isEqualTo(1);
        verify(threadRepository).saveAndFlush(thread);

        ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
        verify(notificationService).publish(event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(CommentedEvent.class, commented -> {
            assertThat(commented.getThreadOwnerId()).isEqualTo("owner");
            assertThat(commented.isNested()).isFalse();
        });
    }

    @Test
    void replyCarriesParentOwner() {
        Comment parent = Comment.builder().id("p1").threadId("t1").ownerId("parentOwner").body("first").build();
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));
        when(commentRepository.findById("p1")).thenReturn(Optional.of(parent));
        when(userAccountRepository.findById("author")).thenReturn(Optional.of(author));
        stubCommentSave();

        commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").parentId("p1").body("agreed").build());

        ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
        verify(notificationService).publish(event.capture());
        assertThat(((CommentedEvent) event.getValue()).getParentOwnerId()).isEqualTo("parentOwner");
    }

    @Test
    void mentionsByUsernameAndIdBecomeOneEvent() {
        UserAccount bob = UserAccount.builder().id("u-bob").username("bob_smith").name("Bob").build();
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));
        when(userAccountRepository.findById("author")).thenReturn(Optional.of(author));
        when(userAccountRepository.findByUsernameIn(anyList())).thenReturn(List.of(bob));
        stubCommentSave();

        commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").body("cc @bob_smith").mentions(List.of("u-carol", "u-bob")).build());

        ArgumentCaptor<DomainEvent> events = ArgumentCaptor.forClass(DomainEvent.class);
        verify(notificationService, times(2)).publish(events.capture());
        assertThat(events.getAllValues().get(1)).isInstanceOfSatisfying(MentionedEvent.class, mentioned ->
                assertThat(mentioned.getMentionedUserIds()).containsExactly("u-carol", "u-bob"));
    }

    @Test
    void lockedThreadRejectsComments() {
        thread.setLocked(true);
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));

        assertThatThrownBy(() -> commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").body("hello").build()))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Thread is locked");
        verify(commentRepository, never()).save(any(Comment.class));
    }

    @Test
    void missingParentIsNotFound() {
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));
        when(commentRepository.findById("gone")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").parentId("gone").body("hello").build()))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Parent comment not found");
    }

    @Test
    void bodyIsValidated() {
        assertThatThrownBy(() -> commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").body("  ").build()))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessage("Comment body is required");
        assertThatThrownBy(() -> commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").body("x".repeat(1001)).build()))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessage("Comment cannot exceed 1000 characters");
    }

    @Test
    void counterUpdateRetriesAfterConcurrentWrite() {
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));
        when(userAccountRepository.findById("author")).thenReturn(Optional.of(author));
        stubCommentSave();
        when(threadRepository.saveAndFlush(thread))
                .thenThrow(new ObjectOptimisticLockingFailureException(ForumThread.class, "t1"))
                .thenReturn(thread);

        commentService.postComment("author", CreateCommentRequest.builder().threadId("t1").body("hello").build());

        verify(threadRepository, times(2)).saveAndFlush(thread);
    }

    @Test
    void counterConflictsUntilAttemptsRunOutRollBackEveryWrite() {
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));
        when(userAccountRepository.findById("author")).thenReturn(Optional.of(author));
        stubCommentSave();
        when(threadRepository.saveAndFlush(thread))
                .thenThrow(new ObjectOptimisticLockingFailureException(ForumThread.class, "t1"));

        assertThatThrownBy(() -> commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").body("hello").build()))
                .isInstanceOf(ConflictException.class)
                .hasCauseInstanceOf(ObjectOptimisticLockingFailureException.class);

        verify(commentRepository, times(3)).save(any(Comment.class));
        verify(transactionManager, times(3)).rollback(isNull());
        verify(transactionManager, never()).commit(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    void parentFromAnotherThreadIsRejected() {
        Comment foreign = Comment.builder().id("p9").threadId("t2").ownerId("someone").body("elsewhere").build();
        when(threadRepository.findById("t1")).thenReturn(Optional.of(thread));
        when(commentRepository.findById("p9")).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> commentService.postComment("author", CreateCommentRequest.builder()
                .threadId("t1").parentId("p9").body("hello").build()))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessage("Parent comment belongs to another thread");
        verify(commentRepository, never()).save(any(Comment.class));
        verifyNoInteractions(notificationService);
    }
}
