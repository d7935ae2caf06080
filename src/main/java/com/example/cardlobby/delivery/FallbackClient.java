package com.example.cardlobby.delivery;

import com.example.cardlobby.error.DeliveryException;

import java.util.Map;

/**
 * Out-of-band equivalent of a critical real-time event.
 * Implementations must bound every call with connect/read timeouts.
 */
public interface FallbackClient {

    /** @throws DeliveryException when the equivalent call failed or no equivalent exists */
    void execute(String eventName, Map<String, Object> payload);
}
