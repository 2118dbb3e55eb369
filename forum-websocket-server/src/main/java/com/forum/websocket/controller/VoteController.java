package com.forum.websocket.controller;

import com.forum.websocket.domain.EntityKind;
import com.forum.websocket.domain.VoteDirection;
import com.forum.websocket.domain.VoteOutcome;
import com.forum.websocket.domain.VoteRequest;
import com.forum.websocket.exception.InvalidArgumentException;
import com.forum.websocket.model.VoteResponse;
import com.forum.websocket.service.CurrentUserResolver;
import com.forum.websocket.service.VoteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class VoteController {

    private final VoteService voteService;
    private final CurrentUserResolver currentUserResolver;

    /**
     * Vote on a thread or comment
     * POST /api/threads/{id}/vote, POST /api/comments/{id}/vote
     */
    @PostMapping("/{kind:threads|comments}/{id}/vote")
    public VoteResponse vote(@PathVariable String kind,
                             @PathVariable String id,
                             @RequestBody(required = false) VoteRequest request,
                             @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        String userId = currentUserResolver.resolve(authorization);
        if (request == null) {
            throw new InvalidArgumentException("Vote type is required");
        }

        VoteOutcome outcome = voteService.vote(
                EntityKind.fromPathSegment(kind), id, userId, VoteDirection.parse(request.getDirection()));
        return VoteResponse.from(outcome);
    }
}
