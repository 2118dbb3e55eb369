package com.forum.websocket.model;

import com.forum.websocket.domain.Comment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentView {
    private String id;
    private String threadId;
    private String parentId;
    private UserSummary author;
    private String body;
    private List<String> mentions;
    private int upvoteCount;
    private int downvoteCount;
    private Instant createdAt;

    public static CommentView from(Comment comment, UserSummary author) {
        return CommentView.builder()
                .id(comment.getId())
                .threadId(comment.getThreadId())
                .parentId(comment.getParentId())
                .author(author)
                .body(comment.getBody())
                .mentions(new ArrayList<>(comment.getMentions()))
                .upvoteCount(comment.getUpvoteCount())
                .downvoteCount(comment.getDownvoteCount())
                .createdAt(comment.getCreatedAt())
                .build();
    }
}
