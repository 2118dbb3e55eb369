package com.forum.websocket.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read model of a forum user. Owned by the user service; this service reads
 * identity for display and the notification preferences at emission time.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_username", columnList = "username", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 50)
    private String username;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(length = 255)
    private String image;

    @Column(length = 255)
    private String email;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Embedded
    @Builder.Default
    private NotificationPreferences notificationPrefs = NotificationPreferences.defaults();

    public NotificationPreferences preferences() {
        return notificationPrefs != null ? notificationPrefs : NotificationPreferences.defaults();
    }
}
