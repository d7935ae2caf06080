package com.example.cardlobby.handler;

import com.example.cardlobby.delivery.EventTarget;
import com.example.cardlobby.delivery.EventTransport;
import com.example.cardlobby.delivery.UnknownConnectionException;
import com.example.cardlobby.presence.ClientConnection;
import com.example.cardlobby.presence.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes {@code {"event": ..., "data": ...}} frames to registered connections. */
public class WebSocketEventTransport implements EventTransport {

    private final ConnectionRegistry registry;
    private final ObjectMapper mapper;

    public WebSocketEventTransport(ConnectionRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    @Override
    public void deliver(EventTarget target, String eventName, Map<String, Object> payload) throws IOException {
        String frame = frame(eventName, payload);

        if (target.kind() == EventTarget.Kind.CONNECTION) {
            ClientConnection c = registry.connection(target.id())
                    .orElseThrow(() -> new UnknownConnectionException(target.id()));
            c.send(frame);
            return;
        }

        List<ClientConnection> members = registry.connectionsInRoom(target.id());
        int failed = 0;
        IOException last = null;
        for (ClientConnection c : members) {
            try {
                c.send(frame);
            } catch (IOException | IllegalStateException e) {
                failed++;
                last = (e instanceof IOException io) ? io : new IOException(e);
            }
        }
        if (failed > 0) {
            throw new IOException(failed + "/" + members.size() + " sends of " + eventName + " to " + target + " failed", last);
        }
    }

    String frame(String eventName, Map<String, Object> payload) throws JsonProcessingException {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", eventName);
        frame.put("data", payload == null ? Map.of() : payload);
        return mapper.writeValueAsString(frame);
    }
}
