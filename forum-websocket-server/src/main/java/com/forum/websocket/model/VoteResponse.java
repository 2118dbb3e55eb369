package com.forum.websocket.model;

import com.forum.websocket.domain.VoteOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteResponse {
    private int upvoteCount;
    private int downvoteCount;

    public static VoteResponse from(VoteOutcome outcome) {
        return new VoteResponse(outcome.getUpvoteCount(), outcome.getDownvoteCount());
    }
}
