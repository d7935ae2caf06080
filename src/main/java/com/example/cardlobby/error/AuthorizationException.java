package com.example.cardlobby.error;

import java.util.Map;

/** A non-host attempted a host-only action. */
public class AuthorizationException extends LobbyException {

    public AuthorizationException(String message) {
        super("NOT_AUTHORIZED", message, null, null);
    }

    public AuthorizationException(String message, Map<String, Object> details) {
        super("NOT_AUTHORIZED", message, details, null);
    }
}
