package com.example.cardlobby.error;

import java.util.Map;

/** Room is full or has too few players. */
public class CapacityException extends LobbyException {

    public CapacityException(String message) {
        super("CAPACITY", message, null, null);
    }

    public CapacityException(String message, Map<String, Object> details) {
        super("CAPACITY", message, details, null);
    }
}
