package com.forum.websocket.controller;

import com.forum.websocket.domain.SendMessageRequest;
import com.forum.websocket.model.ConversationView;
import com.forum.websocket.model.MessageView;
import com.forum.websocket.model.PageResponse;
import com.forum.websocket.service.CurrentUserResolver;
import com.forum.websocket.service.MessageService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;
    private final CurrentUserResolver currentUserResolver;

    /**
     * Conversation list
     * GET /api/messages/conversations
     */
    @GetMapping("/conversations")
    public List<ConversationView> getConversations(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return messageService.getConversations(currentUserResolver.resolve(authorization));
    }

    /**
     * GET /api/messages/unread/count
     */
    @GetMapping("/unread/count")
    public Map<String, Long> getUnreadCount(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return Map.of("count", messageService.getUnreadCount(currentUserResolver.resolve(authorization)));
    }

    /**
     * Messages with another user, marks theirs as read
     * GET /api/messages/{userId}?page=1&limit=50
     */
    @GetMapping("/{userId}")
    public PageResponse<MessageView> getMessages(@PathVariable String userId,
                                                 @RequestParam(defaultValue = "1") int page,
                                                 @RequestParam(defaultValue = "50") int limit,
                                                 @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return messageService.getMessages(currentUserResolver.resolve(authorization), userId, page, limit);
    }

    /**
     * Send message
     * POST /api/messages
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MessageView sendMessage(@RequestBody SendMessageRequest request,
                                   @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return messageService.sendMessage(currentUserResolver.resolve(authorization), request);
    }

    /**
     * PUT /api/messages/{id}/read
     */
    @PutMapping("/{id}/read")
    public Map<String, String> markAsRead(@PathVariable String id,
                                          @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        messageService.markAsRead(id, currentUserResolver.resolve(authorization));
        return Map.of("message", "Message marked as read");
    }

    /**
     * Hide a message for the caller; removed for good once both sides have
     * DELETE /api/messages/{id}
     */
    @DeleteMapping("/{id}")
    public Map<String, String> deleteMessage(@PathVariable String id,
                                             @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        messageService.deleteMessage(id, currentUserResolver.resolve(authorization));
        return Map.of("message", "Message deleted successfully");
    }
}
