package com.forum.websocket.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forum.websocket.domain.WebSocketMessage;
import com.forum.websocket.service.MetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RealtimeDeliveryChannelTest {

    private SessionManager sessionManager;
    private MetricsService metricsService;
    private RealtimeDeliveryChannel channel;

    @BeforeEach
    void setUp() {
        sessionManager = new SessionManager(1000, 64 * 1024, 5);
        metricsService = new MetricsService();
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        channel = new RealtimeDeliveryChannel(sessionManager, objectMapper, metricsService, null);
    }

    @AfterEach
    void tearDown() {
        sessionManager.shutdown();
    }

    private static WebSocketSession socket(String id, boolean open) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(open);
        return session;
    }

    @Test
    void pushReachesEverySessionOfTheUser() throws Exception {
        WebSocketSession first = socket("s1", true);
        WebSocketSession second = socket("s2", true);
        WebSocketSession other = socket("s3", true);
        sessionManager.registerSession(first, "alice");
        sessionManager.registerSession(second, "alice");
        sessionManager.registerSession(other, "bob");

        int delivered = channel.push("alice", WebSocketMessage.pong());

        assertThat(delivered).isEqualTo(2);
        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(first).sendMessage(sent.capture());
        assertThat(sent.getValue().getPayload()).contains("\"type\"");
        verify(second).sendMessage(any(TextMessage.class));
        verify(other, never()).sendMessage(any());
    }

    @Test
    void offlineUserIsNotAnError() {
        assertThat(channel.push("nobody", WebSocketMessage.pong())).isZero();
        assertThat(metricsService.getCounterValue("realtime.push.offline")).isEqualTo(1);
    }

    @Test
    void failingSessionIsDroppedWithoutAffectingOthers() throws Exception {
        WebSocketSession broken = socket("s1", true);
        WebSocketSession healthy = socket("s2", true);
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());
        sessionManager.registerSession(broken, "alice");
        sessionManager.registerSession(healthy, "alice");

        int delivered = channel.push("alice", WebSocketMessage.pong());

        assertThat(delivered).isEqualTo(1);
        assertThat(sessionManager.getSession("s1")).isEmpty();
        assertThat(sessionManager.getSession("s2")).isPresent();
    }

    @Test
    void closedSessionIsUnregisteredOnPush() throws Exception {
        WebSocketSession closed = socket("s1", false);
        sessionManager.registerSession(closed, "alice");

        assertThat(channel.push("alice", WebSocketMessage.pong())).isZero();
        assertThat(sessionManager.isOnline("alice")).isFalse();
        verify(closed, never()).sendMessage(any());
    }

    @Test
    void roomPushGoesToRoomMembersOnly() throws Exception {
        WebSocketSession member = socket("s1", true);
        WebSocketSession outsider = socket("s2", true);
        sessionManager.registerSession(member, "alice");
        sessionManager.registerSession(outsider, "bob");
        sessionManager.joinRoom("s1", "thread-1");

        assertThat(channel.pushToRoom("thread-1", WebSocketMessage.roomJoined("thread-1"))).isEqualTo(1);
        verify(outsider, never()).sendMessage(any());
    }
}
