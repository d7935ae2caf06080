package com.example.cardlobby.error;

import java.util.Map;

/** Missing gameId or malformed payload. */
public class ValidationException extends LobbyException {

    public ValidationException(String message) {
        super("VALIDATION_FAILED", message, null, null);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super("VALIDATION_FAILED", message, details, null);
    }
}
