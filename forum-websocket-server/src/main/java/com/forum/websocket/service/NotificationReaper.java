package com.forum.websocket.service;

import com.forum.websocket.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Purges notifications past the retention window. Runs on every node; the
 * Redis lock keeps a single node doing the work per run.
 */
@Component
@Slf4j
public class NotificationReaper {

    private static final String LOCK_KEY = "notification-reaper";

    private final NotificationRepository notificationRepository;
    private final SimpleDistributedLockService lockService;
    private final Duration retention;

    public NotificationReaper(NotificationRepository notificationRepository,
                              SimpleDistributedLockService lockService,
                              @Value("${forum.notification.retention-days:30}") long retentionDays) {
        this.notificationRepository = notificationRepository;
        this.lockService = lockService;
        this.retention = Duration.ofDays(retentionDays);
    }

    @Scheduled(fixedDelayString = "${forum.notification.purge-interval-ms:3600000}",
               initialDelayString = "${forum.notification.purge-interval-ms:3600000}")
    public void purgeExpired() {
        Integer purged = lockService.executeWithLock(LOCK_KEY, Duration.ofMinutes(10), this::purgeNow);
        if (purged != null && purged > 0) {
            log.info("Purged expired notifications: count={}, retentionDays={}", purged, retention.toDays());
        }
    }

    public int purgeNow() {
        Instant threshold = Instant.now().minus(retention);
        return notificationRepository.deleteByCreatedAtBefore(threshold);
    }
}
