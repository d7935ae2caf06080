package com.example.cardlobby.error;

import java.util.Map;

/** Action is not valid for the room's current status. */
public class StateException extends LobbyException {

    public StateException(String message) {
        super("INVALID_STATE", message, null, null);
    }

    public StateException(String message, Map<String, Object> details) {
        super("INVALID_STATE", message, details, null);
    }
}
