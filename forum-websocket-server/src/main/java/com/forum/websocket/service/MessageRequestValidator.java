package com.forum.websocket.service;

import com.forum.websocket.domain.Message;
import com.forum.websocket.domain.SendMessageRequest;
import com.forum.websocket.exception.InvalidArgumentException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload checks for an outgoing direct message. Looks at the request only;
 * receiver existence and preferences are checked by the pipeline.
 */
@Component
public class MessageRequestValidator {

    /**
     * @throws InvalidArgumentException listing every problem found, joined with "; "
     */
    public void validate(SendMessageRequest request) {
        List<String> problems = findProblems(request);
        if (!problems.isEmpty()) {
            throw new InvalidArgumentException(String.join("; ", problems));
        }
    }

    List<String> findProblems(SendMessageRequest request) {
        List<String> problems = new ArrayList<>();
        if (request == null) {
            problems.add("Message payload is required");
            return problems;
        }

        if (request.getReceiverId() == null || request.getReceiverId().isBlank()) {
            problems.add("Receiver ID is required");
        }

        String content = request.getContent();
        if (content == null || content.trim().isEmpty()) {
            problems.add("Message content is required");
        } else if (content.trim().length() > Message.CONTENT_MAX_LENGTH) {
            problems.add("Message cannot exceed " + Message.CONTENT_MAX_LENGTH + " characters");
        }

        if (request.getMessageType() != null && Message.MessageType.fromWireName(request.getMessageType()) == null) {
            problems.add("Invalid message type: " + request.getMessageType());
        }
        return problems;
    }
}
