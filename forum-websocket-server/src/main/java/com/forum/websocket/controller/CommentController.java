package com.forum.websocket.controller;

import com.forum.websocket.domain.CreateCommentRequest;
import com.forum.websocket.model.CommentView;
import com.forum.websocket.service.CommentService;
import com.forum.websocket.service.CurrentUserResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/comments")
@RequiredArgsConstructor
public class CommentController {

    private final CommentService commentService;
    private final CurrentUserResolver currentUserResolver;

    /**
     * Post a comment or a reply
     * POST /api/comments
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CommentView createComment(@RequestBody CreateCommentRequest request,
                                     @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return commentService.postComment(currentUserResolver.resolve(authorization), request);
    }
}
