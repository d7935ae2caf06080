package com.example.cardlobby.handler;

import com.example.cardlobby.delivery.LobbyEvents;
import com.example.cardlobby.support.LobbyFixture;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Frame handling of the lobby endpoint over mocked WebSocket sessions, with the real
 * transport, delivery layer and room store behind it.
 */
class LobbyWebSocketHandlerTest {

    private static final String G = "g1";

    private final ObjectMapper mapper = new ObjectMapper();
    private LobbyFixture fx;
    private LobbyWebSocketHandler handler;
    private final Map<String, List<String>> sentBySession = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        fx = new LobbyFixture(Duration.ofMinutes(5), registry -> new WebSocketEventTransport(registry, mapper));
        handler = new LobbyWebSocketHandler(fx.presence, fx.store, fx.delivery, mapper);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private WebSocketSession session(String id, String token) throws Exception {
        WebSocketSession s = mock(WebSocketSession.class);
        List<String> sent = new CopyOnWriteArrayList<>();
        sentBySession.put(id, sent);
        when(s.getId()).thenReturn(id);
        when(s.getUri()).thenReturn(URI.create("ws://localhost/lobby?token=" + token));
        when(s.isOpen()).thenReturn(true);
        doAnswer(inv -> {
            sent.add(((TextMessage) inv.getArgument(0)).getPayload());
            return null;
        }).when(s).sendMessage(any());
        return s;
    }

    private WebSocketSession connect(String sessionId, String userId) throws Exception {
        WebSocketSession s = session(sessionId, fx.token(userId));
        handler.afterConnectionEstablished(s);
        return s;
    }

    private void send(WebSocketSession s, String event, String dataJson) throws Exception {
        handler.handleTextMessage(s, new TextMessage("{\"event\":\"" + event + "\",\"data\":" + dataJson + "}"));
    }

    private List<JsonNode> frames(String sessionId, String event) throws Exception {
        List<JsonNode> out = new ArrayList<>();
        for (String raw : sentBySession.get(sessionId)) {
            if (!raw.startsWith("{")) continue;
            JsonNode n = mapper.readTree(raw);
            if (event.equals(n.path("event").asText())) out.add(n.path("data"));
        }
        return out;
    }

    @Test
    @DisplayName("a handshake without a valid token gets an error frame and close code 4401")
    void invalidToken_isRejected() throws Exception {
        WebSocketSession s = session("s1", "garbage");
        handler.afterConnectionEstablished(s);

        assertEquals(1, frames("s1", LobbyEvents.ERROR).size());
        verify(s).close(new CloseStatus(LobbyWebSocketHandler.CLOSE_UNAUTHORIZED, "Unauthorized"));
        assertEquals(0, fx.registry.connectionCount());
    }

    @Test
    void joinRoom_sendsSnapshot_andBroadcastsToMembers() throws Exception {
        WebSocketSession alice = connect("s-alice", "alice");
        send(alice, LobbyEvents.JOIN_ROOM, "{\"gameId\":\"g1\"}");
        WebSocketSession bob = connect("s-bob", "bob");
        send(bob, LobbyEvents.JOIN_ROOM, "{\"gameId\":\"g1\"}");

        JsonNode snapshot = frames("s-bob", LobbyEvents.ROOM_JOINED).get(0);
        assertEquals("alice", snapshot.path("hostId").asText());
        assertEquals(2, snapshot.path("players").size());
        assertTrue(snapshot.hasNonNull("_eventId"));

        List<JsonNode> joined = frames("s-alice", LobbyEvents.PLAYER_JOINED);
        assertEquals("bob", joined.get(joined.size() - 1).path("player").path("userId").asText());
    }

    @Test
    @DisplayName("a userId claimed in the frame is ignored in favour of the handshake identity")
    void setReady_usesHandshakeIdentity() throws Exception {
        WebSocketSession alice = connect("s-alice", "alice");
        send(alice, LobbyEvents.JOIN_ROOM, "{\"gameId\":\"g1\"}");
        WebSocketSession bob = connect("s-bob", "bob");
        send(bob, LobbyEvents.JOIN_ROOM, "{\"gameId\":\"g1\"}");

        send(alice, LobbyEvents.SET_READY, "{\"gameId\":\"g1\",\"userId\":\"bob\",\"isReady\":true}");

        assertTrue(fx.store.snapshot(G).orElseThrow().player("alice").ready());
        assertFalse(fx.store.snapshot(G).orElseThrow().player("bob").ready());
        JsonNode changed = frames("s-bob", LobbyEvents.PLAYER_READY_CHANGED).get(0);
        assertEquals("alice", changed.path("playerId").asText());
        assertEquals(1, changed.path("readyCount").asInt());
    }

    @Test
    void rejectedAction_returnsErrorFrameWithCode() throws Exception {
        WebSocketSession alice = connect("s-alice", "alice");
        send(alice, LobbyEvents.JOIN_ROOM, "{\"gameId\":\"g1\"}");

        send(alice, LobbyEvents.START_GAME, "{\"gameId\":\"g1\"}");
        JsonNode error = frames("s-alice", LobbyEvents.ERROR).get(0);
        assertEquals(LobbyEvents.START_GAME, error.path("event").asText());
        assertEquals("INVALID_STATE", error.path("code").asText());
        assertEquals(1, error.path("details").path("connectedPlayers").asInt());
    }

    @Test
    void malformedOrUnknownFrames_areAnsweredWithValidationErrors() throws Exception {
        WebSocketSession alice = connect("s-alice", "alice");

        handler.handleTextMessage(alice, new TextMessage("{broken"));
        send(alice, "teleport", "{}");
        send(alice, LobbyEvents.SET_READY, "{\"gameId\":\"g1\"}");

        List<JsonNode> errors = frames("s-alice", LobbyEvents.ERROR);
        assertEquals(3, errors.size());
        errors.forEach(e -> assertEquals("VALIDATION_FAILED", e.path("code").asText()));
        assertEquals("Malformed frame", errors.get(0).path("message").asText());
        assertEquals("isReady must be a boolean", errors.get(2).path("message").asText());
    }

    @Test
    void heartbeats_areAnswered() throws Exception {
        WebSocketSession alice = connect("s-alice", "alice");

        handler.handleTextMessage(alice, new TextMessage("ping"));
        send(alice, LobbyEvents.PING, "{}");

        assertTrue(sentBySession.get("s-alice").contains("pong"));
        assertEquals(1, frames("s-alice", LobbyEvents.PONG).size());
    }

    @Test
    void confirmDelivery_ofUnknownEvent_isSilent() throws Exception {
        WebSocketSession alice = connect("s-alice", "alice");
        send(alice, LobbyEvents.CONFIRM_DELIVERY, "{\"eventId\":\"evt_1_unknown00\"}");
        assertTrue(frames("s-alice", LobbyEvents.ERROR).isEmpty());
    }

    @Test
    void close_marksMemberDisconnected() throws Exception {
        WebSocketSession alice = connect("s-alice", "alice");
        send(alice, LobbyEvents.JOIN_ROOM, "{\"gameId\":\"g1\"}");
        WebSocketSession bob = connect("s-bob", "bob");
        send(bob, LobbyEvents.JOIN_ROOM, "{\"gameId\":\"g1\"}");

        handler.afterConnectionClosed(bob, CloseStatus.GOING_AWAY);

        assertFalse(fx.store.snapshot(G).orElseThrow().player("bob").connected());
        JsonNode notice = frames("s-alice", LobbyEvents.PLAYER_DISCONNECTED).get(0);
        assertEquals("bob", notice.path("playerId").asText());
        assertEquals(300_000L, notice.path("reconnectTimeoutMs").asLong());
    }

    @Test
    void parseQuery_decodesParameters() {
        Map<String, String> q = LobbyWebSocketHandler.parseQuery(URI.create("ws://h/lobby?token=a%2Bb&x=1"));
        assertEquals("a+b", q.get("token"));
        assertEquals("1", q.get("x"));
        assertTrue(LobbyWebSocketHandler.parseQuery(null).isEmpty());
    }
}
