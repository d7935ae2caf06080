package com.example.cardlobby.delivery;

import java.io.IOException;
import java.util.Map;

/** Live real-time channel. Implementations must be safe for concurrent use. */
public interface EventTransport {

    /**
     * Sends one event frame.
     *
     * @throws UnknownConnectionException if a connection target is not registered
     * @throws IOException if any send failed
     */
    void deliver(EventTarget target, String eventName, Map<String, Object> payload) throws IOException;
}
