package com.example.cardlobby.presence;

import com.example.cardlobby.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identity ↔ connection map plus room subscriptions of each connection.
 * Leaf component: knows nothing about room state, only who is reachable where.
 */
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    public static final int CLOSE_SUPERSEDED = 4409;

    private final Authenticator authenticator;

    // --- in-memory state ---
    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();      // connectionId -> connection
    private final Map<String, Identity> identityByConnection = new ConcurrentHashMap<>();    // connectionId -> identity
    private final Map<String, String> currentConnectionByUser = new ConcurrentHashMap<>();   // userId -> connectionId
    private final Map<String, Set<String>> roomsByConnection = new ConcurrentHashMap<>();    // connectionId -> gameIds

    public ConnectionRegistry(Authenticator authenticator) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    }

    public Identity authenticate(String credential) {
        return authenticator.authenticate(credential);
    }

    // ========================================================================
    //  REGISTRATION
    // ========================================================================

    /**
     * Records identity ↔ connection. If the identity already had a live connection it is
     * superseded: its room subscriptions move to the new connection and it is closed.
     *
     * @return the superseded connection, or null
     */
    public ClientConnection register(Identity identity, ClientConnection connection) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(connection, "connection");

        connections.put(connection.id(), connection);
        identityByConnection.put(connection.id(), identity);
        roomsByConnection.putIfAbsent(connection.id(), ConcurrentHashMap.newKeySet());

        String previousId = currentConnectionByUser.put(identity.userId(), connection.id());
        if (previousId == null || previousId.equals(connection.id())) return null;

        ClientConnection previous = connections.remove(previousId);
        identityByConnection.remove(previousId);
        Set<String> carried = roomsByConnection.remove(previousId);
        if (carried != null) roomsByConnection.get(connection.id()).addAll(carried);

        if (previous != null) {
            log.info("Connection {} of user {} superseded by {}", previousId, identity.userId(), connection.id());
            try {
                previous.close(CLOSE_SUPERSEDED, "Superseded by a newer connection");
            } catch (RuntimeException e) {
                log.warn("Closing superseded connection {} failed: {}", previousId, e.toString());
            }
        }
        return previous;
    }

    /**
     * Forgets the connection.
     *
     * @return the identity if this was the identity's current connection (a real disconnect),
     *         empty if the connection was unknown or had already been superseded
     */
    public Optional<Identity> unregister(String connectionId) {
        if (connectionId == null) return Optional.empty();
        connections.remove(connectionId);
        roomsByConnection.remove(connectionId);
        Identity identity = identityByConnection.remove(connectionId);
        if (identity == null) return Optional.empty();

        boolean wasCurrent = currentConnectionByUser.remove(identity.userId(), connectionId);
        return wasCurrent ? Optional.of(identity) : Optional.empty();
    }

    // ========================================================================
    //  LOOKUPS
    // ========================================================================

    public Optional<ClientConnection> connection(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<ClientConnection> connectionOf(String userId) {
        if (userId == null) return Optional.empty();
        String id = currentConnectionByUser.get(userId);
        return (id == null) ? Optional.empty() : connection(id);
    }

    public Optional<Identity> identityOf(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(identityByConnection.get(connectionId));
    }

    public boolean isOnline(String userId) {
        return connectionOf(userId).map(ClientConnection::isOpen).orElse(false);
    }

    // ========================================================================
    //  ROOM SUBSCRIPTIONS
    // ========================================================================

    public void subscribe(String connectionId, String gameId) {
        Set<String> rooms = roomsByConnection.get(connectionId);
        if (rooms != null && gameId != null) rooms.add(gameId);
    }

    public void unsubscribe(String connectionId, String gameId) {
        Set<String> rooms = roomsByConnection.get(connectionId);
        if (rooms != null) rooms.remove(gameId);
    }

    /** Drops every subscription to the room (teardown). */
    public void unsubscribeAll(String gameId) {
        for (Set<String> rooms : roomsByConnection.values()) rooms.remove(gameId);
    }

    /** Open connections subscribed to the room. Closed ones are pruned on the way. */
    public List<ClientConnection> connectionsInRoom(String gameId) {
        List<ClientConnection> out = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : roomsByConnection.entrySet()) {
            if (!e.getValue().contains(gameId)) continue;
            ClientConnection c = connections.get(e.getKey());
            if (c == null) continue;
            if (c.isOpen()) {
                out.add(c);
            } else {
                e.getValue().remove(gameId);
            }
        }
        return out;
    }

    public int connectionCount() {
        return connections.size();
    }
}
