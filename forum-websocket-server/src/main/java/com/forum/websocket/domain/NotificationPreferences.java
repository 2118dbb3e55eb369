package com.forum.websocket.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferences {

    @Column(name = "pref_newsletter", nullable = false)
    @Builder.Default
    private boolean newsletter = true;

    @Column(name = "pref_chat", nullable = false)
    @Builder.Default
    private boolean chat = true;

    @Column(name = "pref_replies", nullable = false)
    @Builder.Default
    private boolean replies = true;

    @Column(name = "pref_mentions", nullable = false)
    @Builder.Default
    private boolean mentions = true;

    public static NotificationPreferences defaults() {
        return NotificationPreferences.builder().build();
    }
}
