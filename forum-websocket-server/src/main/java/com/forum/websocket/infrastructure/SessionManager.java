package com.forum.websocket.infrastructure;

import com.forum.websocket.domain.WebSocketSessionWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process-local registry of live WebSocket sessions.
 *
 * A user may hold any number of sessions (tabs, devices); rooms group
 * sessions independently of their users. All indexes are concurrent maps and
 * may be mutated from any thread.
 */
@Component
@Slf4j
public class SessionManager {

    private final ConcurrentHashMap<String, WebSocketSessionWrapper> activeSessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> userSessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> roomSessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final Duration sessionTimeout;

    public SessionManager(@Value("${realtime.send-time-limit-ms:5000}") int sendTimeLimitMs,
                          @Value("${realtime.buffer-size-limit:524288}") int bufferSizeLimit,
                          @Value("${realtime.session-timeout-minutes:5}") long sessionTimeoutMinutes) {
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
        this.sessionTimeout = Duration.ofMinutes(sessionTimeoutMinutes);
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "session-heartbeat");
            thread.setDaemon(true);
            return thread;
        });

        cleanupExecutor.scheduleAtFixedRate(this::evictIdleSessions, 30, 30, TimeUnit.SECONDS);
    }

    /**
     * Register a freshly opened session for a user.
     *
     * Sends go through a {@link ConcurrentWebSocketSessionDecorator}, so a slow
     * client overflows its own buffer instead of blocking the pushing thread.
     */
    public WebSocketSessionWrapper registerSession(WebSocketSession wsSession, String userId) {
        WebSocketSession guarded = new ConcurrentWebSocketSessionDecorator(wsSession, sendTimeLimitMs, bufferSizeLimit);

        Instant now = Instant.now();
        WebSocketSessionWrapper wrapper = WebSocketSessionWrapper.builder()
                .sessionId(wsSession.getId())
                .wsSession(guarded)
                .userId(userId)
                .connectedAt(now)
                .lastHeartbeat(now)
                .build();

        activeSessions.put(wrapper.getSessionId(), wrapper);
        addToIndex(userSessions, userId, wrapper.getSessionId());

        log.info("Session registered: sessionId={}, userId={}, total={}",
                wrapper.getSessionId(), userId, activeSessions.size());
        return wrapper;
    }

    /**
     * Remove a session from every index. Safe to call more than once.
     */
    public void unregisterSession(String sessionId) {
        WebSocketSessionWrapper wrapper = activeSessions.remove(sessionId);
        if (wrapper == null) {
            return;
        }

        removeFromIndex(userSessions, wrapper.getUserId(), sessionId);
        for (String roomId : wrapper.getRooms()) {
            removeFromIndex(roomSessions, roomId, sessionId);
        }

        log.info("Session unregistered: sessionId={}, userId={}, duration={}s",
                sessionId, wrapper.getUserId(),
                Duration.between(wrapper.getConnectedAt(), Instant.now()).getSeconds());
    }

    public boolean joinRoom(String sessionId, String roomId) {
        WebSocketSessionWrapper wrapper = activeSessions.get(sessionId);
        if (wrapper == null) {
            return false;
        }
        wrapper.getRooms().add(roomId);
        addToIndex(roomSessions, roomId, sessionId);
        if (!activeSessions.containsKey(sessionId)) {
            // unregistered while joining; its cleanup may have missed this room
            removeFromIndex(roomSessions, roomId, sessionId);
            return false;
        }
        log.debug("Session joined room: sessionId={}, roomId={}", sessionId, roomId);
        return true;
    }

    public boolean leaveRoom(String sessionId, String roomId) {
        WebSocketSessionWrapper wrapper = activeSessions.get(sessionId);
        if (wrapper == null || !wrapper.getRooms().remove(roomId)) {
            return false;
        }
        removeFromIndex(roomSessions, roomId, sessionId);
        log.debug("Session left room: sessionId={}, roomId={}", sessionId, roomId);
        return true;
    }

    // Mutate inside compute so an emptied set is never removed under a concurrent add
    private static void addToIndex(ConcurrentHashMap<String, Set<String>> index, String key, String sessionId) {
        index.compute(key, (k, ids) -> {
            Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
            set.add(sessionId);
            return set;
        });
    }

    private static void removeFromIndex(ConcurrentHashMap<String, Set<String>> index, String key, String sessionId) {
        index.computeIfPresent(key, (k, ids) -> {
            ids.remove(sessionId);
            return ids.isEmpty() ? null : ids;
        });
    }

    public Optional<WebSocketSessionWrapper> getSession(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    public String getUserId(String sessionId) {
        WebSocketSessionWrapper wrapper = activeSessions.get(sessionId);
        return wrapper != null ? wrapper.getUserId() : null;
    }

    /**
     * Snapshot of a user's live sessions; empty when the user is offline
     */
    public List<WebSocketSessionWrapper> getUserSessions(String userId) {
        return resolve(userSessions.get(userId));
    }

    public List<WebSocketSessionWrapper> getRoomSessions(String roomId) {
        return resolve(roomSessions.get(roomId));
    }

    private List<WebSocketSessionWrapper> resolve(Set<String> sessionIds) {
        if (sessionIds == null) {
            return List.of();
        }
        List<WebSocketSessionWrapper> result = new ArrayList<>(sessionIds.size());
        for (String sessionId : sessionIds) {
            WebSocketSessionWrapper wrapper = activeSessions.get(sessionId);
            if (wrapper != null) {
                result.add(wrapper);
            }
        }
        return result;
    }

    public boolean isOnline(String userId) {
        return userSessions.containsKey(userId);
    }

    public void updateHeartbeat(String sessionId) {
        WebSocketSessionWrapper wrapper = activeSessions.get(sessionId);
        if (wrapper != null) {
            wrapper.setLastHeartbeat(Instant.now());
        }
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    public int getOnlineUserCount() {
        return userSessions.size();
    }

    public int getOccupiedRoomCount() {
        return roomSessions.size();
    }

    /**
     * Drop sessions whose last heartbeat is older than the configured timeout.
     *
     * @return number of sessions evicted
     */
    public int evictIdleSessions() {
        Instant cutoff = Instant.now().minus(sessionTimeout);
        int evicted = 0;

        for (WebSocketSessionWrapper wrapper : activeSessions.values()) {
            if (!wrapper.getLastHeartbeat().isBefore(cutoff)) {
                continue;
            }
            log.warn("Session timed out: sessionId={}, userId={}, lastHeartbeat={}",
                    wrapper.getSessionId(), wrapper.getUserId(), wrapper.getLastHeartbeat());
            unregisterSession(wrapper.getSessionId());
            closeQuietly(wrapper);
            evicted++;
        }
        return evicted;
    }

    private void closeQuietly(WebSocketSessionWrapper wrapper) {
        try {
            if (wrapper.getWsSession().isOpen()) {
                wrapper.getWsSession().close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        } catch (IOException e) {
            log.debug("Error closing idle session: sessionId={}", wrapper.getSessionId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SessionManager...");
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
