package com.forum.websocket.infrastructure;

import com.forum.websocket.domain.WebSocketSessionWrapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        sessionManager = new SessionManager(1000, 64 * 1024, 5);
    }

    @AfterEach
    void tearDown() {
        sessionManager.shutdown();
    }

    private static WebSocketSession socket(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Test
    void userMayHoldSeveralSessions() {
        sessionManager.registerSession(socket("s1"), "alice");
        sessionManager.registerSession(socket("s2"), "alice");
        sessionManager.registerSession(socket("s3"), "bob");

        assertThat(sessionManager.getUserSessions("alice"))
                .extracting(WebSocketSessionWrapper::getSessionId)
                .containsExactlyInAnyOrder("s1", "s2");
        assertThat(sessionManager.getActiveSessionCount()).isEqualTo(3);
        assertThat(sessionManager.getOnlineUserCount()).isEqualTo(2);
    }

    @Test
    void unregisterRemovesFromEveryIndexAndIsIdempotent() {
        sessionManager.registerSession(socket("s1"), "alice");
        sessionManager.joinRoom("s1", "thread-1");

        sessionManager.unregisterSession("s1");
        sessionManager.unregisterSession("s1");

        assertThat(sessionManager.isOnline("alice")).isFalse();
        assertThat(sessionManager.getRoomSessions("thread-1")).isEmpty();
        assertThat(sessionManager.getSession("s1")).isEmpty();
    }

    @Test
    void roomsTrackMembership() {
        sessionManager.registerSession(socket("s1"), "alice");
        sessionManager.registerSession(socket("s2"), "bob");

        assertThat(sessionManager.joinRoom("s1", "thread-1")).isTrue();
        assertThat(sessionManager.joinRoom("s2", "thread-1")).isTrue();
        assertThat(sessionManager.leaveRoom("s2", "thread-1")).isTrue();
        assertThat(sessionManager.leaveRoom("s2", "thread-1")).isFalse();
        assertThat(sessionManager.joinRoom("unknown", "thread-1")).isFalse();

        assertThat(sessionManager.getRoomSessions("thread-1"))
                .extracting(WebSocketSessionWrapper::getUserId)
                .containsExactly("alice");
    }

    @Test
    void offlineUserHasNoSessions() {
        assertThat(sessionManager.getUserSessions("nobody")).isEmpty();
        assertThat(sessionManager.isOnline("nobody")).isFalse();
        assertThat(sessionManager.getUserId("nope")).isNull();
    }

    @Test
    void idleSessionsAreEvictedAndClosed() throws Exception {
        WebSocketSession stale = socket("s1");
        WebSocketSessionWrapper wrapper = sessionManager.registerSession(stale, "alice");
        sessionManager.registerSession(socket("s2"), "bob");
        wrapper.setLastHeartbeat(Instant.now().minusSeconds(3600));

        int evicted = sessionManager.evictIdleSessions();

        assertThat(evicted).isEqualTo(1);
        assertThat(sessionManager.isOnline("alice")).isFalse();
        assertThat(sessionManager.isOnline("bob")).isTrue();
        verify(stale).close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    @Test
    void heartbeatKeepsSessionAlive() {
        WebSocketSessionWrapper wrapper = sessionManager.registerSession(socket("s1"), "alice");
        wrapper.setLastHeartbeat(Instant.now().minusSeconds(3600));

        sessionManager.updateHeartbeat("s1");

        assertThat(sessionManager.evictIdleSessions()).isZero();
    }

    @Test
    void joinRacingWithUnregisterLeavesNoRoomEntry() {
        WebSocketSessionWrapper wrapper = sessionManager.registerSession(socket("s1"), "alice");
        // the session goes away after joinRoom looked it up but before the room index is written
        Set<String> rooms = ConcurrentHashMap.newKeySet();
        wrapper.setRooms(new AbstractSet<>() {
            @Override
            public boolean add(String roomId) {
                sessionManager.unregisterSession("s1");
                return rooms.add(roomId);
            }

            @Override
            public Iterator<String> iterator() {
                return rooms.iterator();
            }

            @Override
            public int size() {
                return rooms.size();
            }
        });

        assertThat(sessionManager.joinRoom("s1", "thread-1")).isFalse();
        assertThat(sessionManager.getOccupiedRoomCount()).isZero();
        assertThat(sessionManager.getActiveSessionCount()).isZero();
    }

    @Test
    void leavingLastMemberFreesTheRoom() {
        sessionManager.registerSession(socket("s1"), "alice");
        sessionManager.joinRoom("s1", "thread-1");
        assertThat(sessionManager.getOccupiedRoomCount()).isEqualTo(1);

        sessionManager.leaveRoom("s1", "thread-1");

        assertThat(sessionManager.getOccupiedRoomCount()).isZero();
    }
}
