package com.forum.websocket.model;

import com.forum.websocket.domain.UserAccount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Minimal public identity attached to messages and conversations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSummary {
    private String id;
    private String username;
    private String name;
    private String image;

    public static UserSummary from(UserAccount user) {
        return UserSummary.builder()
                .id(user.getId())
                .username(user.getUsername())
                .name(user.getName())
                .image(user.getImage())
                .build();
    }

    /** Placeholder for a referenced user that no longer exists. */
    public static UserSummary unknown(String userId) {
        return UserSummary.builder()
                .id(userId)
                .username("unknown")
                .name("Unknown user")
                .build();
    }
}
