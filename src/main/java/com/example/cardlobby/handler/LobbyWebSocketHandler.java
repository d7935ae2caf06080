package com.example.cardlobby.handler;

import com.example.cardlobby.delivery.DeliveryReliabilityLayer;
import com.example.cardlobby.delivery.EmitOptions;
import com.example.cardlobby.delivery.EventTarget;
import com.example.cardlobby.delivery.LobbyEvents;
import com.example.cardlobby.error.AuthenticationException;
import com.example.cardlobby.error.LobbyException;
import com.example.cardlobby.error.ValidationException;
import com.example.cardlobby.model.Identity;
import com.example.cardlobby.presence.ClientConnection;
import com.example.cardlobby.presence.PresenceService;
import com.example.cardlobby.session.RoomSessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for the lobby endpoint.
 * - Authenticates the handshake by its {@code token} query parameter
 * - Dispatches {@code {"event","data"}} frames to the room session store
 * - Replies "pong" to heartbeats (JSON {@code ping} or a bare "ping" text)
 * - On close: presence decides whether this was a real disconnect
 */
public class LobbyWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(LobbyWebSocketHandler.class);

    public static final int CLOSE_UNAUTHORIZED = 4401;

    private final PresenceService presence;
    private final RoomSessionStore store;
    private final DeliveryReliabilityLayer delivery;
    private final ObjectMapper mapper;

    /** Per WebSocket session → (identity, connection) */
    private final Map<String, Conn> bySession = new ConcurrentHashMap<>();

    public LobbyWebSocketHandler(PresenceService presence, RoomSessionStore store,
                                 DeliveryReliabilityLayer delivery, ObjectMapper mapper) {
        this.presence = presence;
        this.store = store;
        this.delivery = delivery;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        Identity identity;
        try {
            identity = presence.authenticate(parseQuery(session.getUri()).get("token"));
        } catch (AuthenticationException e) {
            log.warn("WS REJECT sid={} uri={}: {}", session.getId(), safeUri(session), e.getMessage());
            rejectAndClose(session, e);
            return;
        }

        ClientConnection connection = new WebSocketClientConnection(session);
        bySession.put(session.getId(), new Conn(identity, connection));
        log.info("WS OPEN user={} name={} sid={}", identity.userId(), identity.username(), session.getId());

        try {
            presence.onConnect(identity, connection);
        } catch (RuntimeException e) {
            log.error("WS afterConnectionEstablished failed (sid={}, user={})", session.getId(), identity.userId(), e);
            bySession.remove(session.getId());
            presence.onDisconnect(session.getId());
            connection.close(CloseStatus.SERVER_ERROR.getCode(), "Server error");
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
        Conn c = bySession.get(session.getId());
        if (c == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }
        String payload = message.getPayload();

        // bare heartbeat
        if ("ping".equals(payload)) {
            try {
                c.connection().send("pong");
            } catch (Exception e) {
                log.debug("WS pong send failed (user={}): {}", c.identity().userId(), e.toString());
            }
            return;
        }

        String event = null;
        try {
            JsonNode root = mapper.readTree(payload);
            event = text(root, "event");
            JsonNode data = root.path("data");
            if (event == null) throw new ValidationException("Frame has no event name");
            dispatch(c, event, data);
        } catch (JsonProcessingException e) {
            sendError(c, event, new ValidationException("Malformed frame"));
        } catch (LobbyException e) {
            log.debug("WS {} rejected for user={}: {} {}", event, c.identity().userId(), e.getCode(), e.getMessage());
            sendError(c, event, e);
        } catch (RuntimeException e) {
            log.error("WS {} failed for user={}", event, c.identity().userId(), e);
            Map<String, Object> err = new LinkedHashMap<>();
            err.put("event", event);
            err.put("code", "INTERNAL_ERROR");
            err.put("message", "Unexpected server error");
            err.put("details", Map.of());
            send(c, LobbyEvents.ERROR, err);
        }
    }

    private void dispatch(Conn c, String event, JsonNode data) {
        String userId = c.identity().userId();
        String claimed = text(data, "userId");
        if (claimed != null && !claimed.equals(userId)) {
            log.warn("WS {} from user={} carried userId={}; ignoring it", event, userId, claimed);
        }

        switch (event) {
            case LobbyEvents.JOIN_ROOM -> store.joinRoom(requireGameId(data), c.identity(), c.connection().id());
            case LobbyEvents.LEAVE_ROOM -> store.leaveRoom(requireGameId(data), userId);
            case LobbyEvents.SET_READY -> {
                JsonNode ready = data.get("isReady");
                if (ready == null || !ready.isBoolean()) throw new ValidationException("isReady must be a boolean");
                store.setReady(requireGameId(data), userId, ready.asBoolean());
            }
            case LobbyEvents.FORM_TEAMS -> store.formTeams(requireGameId(data), userId);
            case LobbyEvents.START_GAME -> store.startGame(requireGameId(data), userId);
            case LobbyEvents.CONFIRM_DELIVERY -> {
                String eventId = text(data, "eventId");
                if (eventId == null) throw new ValidationException("eventId is required");
                delivery.confirmEventDelivery(eventId);
            }
            case LobbyEvents.PING -> {
                Map<String, Object> pong = new LinkedHashMap<>();
                pong.put("timestamp", System.currentTimeMillis());
                send(c, LobbyEvents.PONG, pong);
            }
            default -> throw new ValidationException("Unknown event: " + event, Map.of("event", event));
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", session.getId(), safeUri(session), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        Conn c = bySession.remove(session.getId());
        if (c == null) {
            log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE user={} sid={} code={} reason={}",
                c.identity().userId(), session.getId(), status.getCode(), status.getReason());
        try {
            presence.onDisconnect(session.getId());
        } catch (RuntimeException e) {
            log.error("WS afterConnectionClosed handling failed (user={})", c.identity().userId(), e);
        }
    }

    /* ---------------- helpers ---------------- */

    private void sendError(Conn c, String event, LobbyException e) {
        Map<String, Object> err = new LinkedHashMap<>();
        err.put("event", event);
        err.put("code", e.getCode());
        err.put("message", e.getMessage());
        err.put("details", e.getDetails());
        send(c, LobbyEvents.ERROR, err);
    }

    private void send(Conn c, String event, Map<String, Object> payload) {
        delivery.emit(EventTarget.connection(c.connection().id()), event, payload, EmitOptions.once());
    }

    private void rejectAndClose(WebSocketSession session, AuthenticationException e) {
        try {
            Map<String, Object> err = new LinkedHashMap<>();
            err.put("code", e.getCode());
            err.put("message", e.getMessage());
            Map<String, Object> frame = new LinkedHashMap<>();
            frame.put("event", LobbyEvents.ERROR);
            frame.put("data", err);
            if (session.isOpen()) session.sendMessage(new TextMessage(mapper.writeValueAsString(frame)));
        } catch (Exception ex) {
            log.debug("WS reject frame not sent sid={}: {}", session.getId(), ex.toString());
        }
        try {
            session.close(new CloseStatus(CLOSE_UNAUTHORIZED, "Unauthorized"));
        } catch (Exception ex) {
            log.debug("WS close after reject failed sid={}: {}", session.getId(), ex.toString());
        }
    }

    private static String requireGameId(JsonNode data) {
        String gameId = text(data, "gameId");
        if (gameId == null) throw new ValidationException("gameId is required");
        return gameId;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new ConcurrentHashMap<>();
        if (uri == null || uri.getRawQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (Exception e) { return "n/a"; }
    }

    /** Small immutable connection record. */
    private record Conn(Identity identity, ClientConnection connection) {
        Conn {
            Objects.requireNonNull(identity, "identity");
            Objects.requireNonNull(connection, "connection");
        }
    }
}
