package com.example.cardlobby.error;

import java.util.Map;

/** Live delivery retries and the HTTP fallback were both exhausted. */
public class DeliveryException extends LobbyException {

    public DeliveryException(String message, String eventName, Throwable cause) {
        super("DELIVERY_FAILED", message, Map.of("event", eventName), cause);
    }
}
