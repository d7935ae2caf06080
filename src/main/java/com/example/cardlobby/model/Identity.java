package com.example.cardlobby.model;

import java.util.Objects;

/**
 * Authenticated caller established at handshake time.
 * {@code service} marks the server's own identity used by out-of-band fallback calls.
 */
public record Identity(String userId, String username, boolean service) {

    public Identity {
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) throw new IllegalArgumentException("userId must not be blank");
        username = (username == null || username.isBlank()) ? userId : username.trim();
    }

    public static Identity player(String userId, String username) {
        return new Identity(userId, username, false);
    }

    public static Identity service(String name) {
        return new Identity(name, name, true);
    }
}
