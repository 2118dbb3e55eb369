package com.forum.websocket.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lightweight distributed lock on Redis SET NX.
 *
 * Used to keep cluster-wide housekeeping jobs to a single node per run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SimpleDistributedLockService {

    private static final String LOCK_PREFIX = "lock:";

    private final StringRedisTemplate redisTemplate;

    /**
     * @return lock token if acquired, null otherwise
     */
    public String tryLock(String key, Duration timeout) {
        String lockKey = LOCK_PREFIX + key;
        String lockValue = UUID.randomUUID().toString();

        try {
            Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(lockKey, lockValue, timeout);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("🔒 Lock acquired: key={}, token={}", key, lockValue);
                return lockValue;
            }
            log.debug("⏳ Lock not available: key={}", key);
            return null;
        } catch (Exception e) {
            log.error("❌ Error acquiring lock: key={}", key, e);
            return null;
        }
    }

    /**
     * Release a lock, only if the token still owns it
     */
    public boolean unlock(String key, String token) {
        if (token == null) {
            log.warn("⚠️ Cannot unlock: null token for key={}", key);
            return false;
        }

        String lockKey = LOCK_PREFIX + key;

        try {
            String currentValue = redisTemplate.opsForValue().get(lockKey);
            if (token.equals(currentValue)) {
                redisTemplate.delete(lockKey);
                log.debug("🔓 Lock released: key={}", key);
                return true;
            }
            log.warn("⚠️ Lock token mismatch: key={}, expected={}, actual={}",
                     key, token, currentValue);
            return false;
        } catch (Exception e) {
            log.error("❌ Error releasing lock: key={}", key, e);
            return false;
        }
    }

    /**
     * Run the operation while holding the lock.
     *
     * @return the operation result, or null if the lock was held elsewhere
     */
    public <T> T executeWithLock(String key, Duration timeout, Supplier<T> operation) {
        String token = tryLock(key, timeout);
        if (token == null) {
            log.debug("Skipping locked operation: key={}", key);
            return null;
        }

        try {
            return operation.get();
        } finally {
            unlock(key, token);
        }
    }
}
