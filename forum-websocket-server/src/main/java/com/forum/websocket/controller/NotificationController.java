package com.forum.websocket.controller;

import com.forum.websocket.model.NotificationView;
import com.forum.websocket.model.PageResponse;
import com.forum.websocket.service.CurrentUserResolver;
import com.forum.websocket.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;
    private final CurrentUserResolver currentUserResolver;

    /**
     * GET /api/notifications?page=1&limit=20&unreadOnly=false
     */
    @GetMapping
    public PageResponse<NotificationView> getNotifications(@RequestParam(defaultValue = "1") int page,
                                                           @RequestParam(defaultValue = "20") int limit,
                                                           @RequestParam(defaultValue = "false") boolean unreadOnly,
                                                           @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return notificationService.getNotifications(currentUserResolver.resolve(authorization), page, limit, unreadOnly);
    }

    @GetMapping("/unread/count")
    public Map<String, Long> getUnreadCount(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return Map.of("count", notificationService.getUnreadCount(currentUserResolver.resolve(authorization)));
    }

    @PutMapping("/{id}/read")
    public NotificationView markAsRead(@PathVariable String id,
                                       @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return notificationService.markAsRead(id, currentUserResolver.resolve(authorization));
    }

    @PutMapping("/read-all")
    public Map<String, Integer> markAllAsRead(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return Map.of("updated", notificationService.markAllAsRead(currentUserResolver.resolve(authorization)));
    }
}
