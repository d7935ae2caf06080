package com.example.cardlobby.error;

import java.util.Map;

/** Bad or missing identity. */
public class AuthenticationException extends LobbyException {

    public AuthenticationException(String message) {
        super("AUTHENTICATION_FAILED", message, null, null);
    }

    public AuthenticationException(String message, Map<String, Object> details) {
        super("AUTHENTICATION_FAILED", message, details, null);
    }
}
