package com.example.cardlobby.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every failure the lobby reports to a client.
 * The code is stable and machine readable; details carry counts/names for client display.
 */
public abstract class LobbyException extends RuntimeException {

    private final String code;
    private final Map<String, Object> details;

    protected LobbyException(String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = (details == null || details.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
