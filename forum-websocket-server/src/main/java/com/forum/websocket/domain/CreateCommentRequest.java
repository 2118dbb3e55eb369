package com.forum.websocket.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCommentRequest {
    private String threadId;
    private String body;
    private String parentId;
    @Builder.Default
    private List<String> mentions = new ArrayList<>();
}
