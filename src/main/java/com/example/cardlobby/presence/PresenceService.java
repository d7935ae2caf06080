package com.example.cardlobby.presence;

import com.example.cardlobby.model.Identity;
import com.example.cardlobby.session.RoomSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection lifecycle of an identity across all rooms it occupies.
 * Eviction timing and room state live in {@link RoomSessionStore}.
 */
public class PresenceService {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private final ConnectionRegistry registry;
    private final RoomSessionStore store;

    public PresenceService(ConnectionRegistry registry, RoomSessionStore store) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.store = Objects.requireNonNull(store, "store");
    }

    public Identity authenticate(String credential) {
        return registry.authenticate(credential);
    }

    /**
     * Registers the connection (superseding an older one of the same identity) and
     * rebinds the identity in every room it is already a member of.
     *
     * @return the rooms the identity was rebound to
     */
    public List<String> onConnect(Identity identity, ClientConnection connection) {
        ClientConnection superseded = registry.register(identity, connection);
        if (superseded != null) {
            log.info("User {} reconnected on {} (replacing {})", identity.userId(), connection.id(), superseded.id());
        }
        return onReconnect(identity, connection);
    }

    /** Restores membership of an already registered connection in the identity's rooms. */
    public List<String> onReconnect(Identity identity, ClientConnection connection) {
        List<String> rebound = new ArrayList<>();
        for (String gameId : store.roomsOf(identity.userId())) {
            if (store.reconnect(gameId, identity, connection.id())) rebound.add(gameId);
        }
        if (!rebound.isEmpty()) log.debug("User {} rebound to rooms {}", identity.userId(), rebound);
        return rebound;
    }

    /**
     * Forgets the connection. Only the identity's current connection counts as a disconnect;
     * closing a superseded one changes nothing.
     */
    public Optional<Identity> onDisconnect(String connectionId) {
        Optional<Identity> identity = registry.unregister(connectionId);
        if (identity.isEmpty()) {
            log.debug("Connection {} closed (superseded or unknown)", connectionId);
            return identity;
        }
        String userId = identity.get().userId();
        for (String gameId : store.roomsOf(userId)) {
            store.markDisconnected(gameId, userId, connectionId);
        }
        return identity;
    }

    public boolean isOnline(String userId) {
        return registry.isOnline(userId);
    }
}
