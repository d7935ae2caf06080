package com.example.cardlobby.presence;

import com.example.cardlobby.model.Identity;
import com.example.cardlobby.support.FakeConnection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry(mock(Authenticator.class));
    private final Identity alice = Identity.player("alice", "Alice");

    @Test
    void newConnection_supersedesOld_andCarriesSubscriptions() {
        FakeConnection first = new FakeConnection("c1");
        FakeConnection second = new FakeConnection("c2");

        assertNull(registry.register(alice, first));
        registry.subscribe("c1", "g1");

        assertSame(first, registry.register(alice, second));
        assertFalse(first.isOpen());
        assertEquals(ConnectionRegistry.CLOSE_SUPERSEDED, first.closeCode());

        assertEquals(List.of(second), registry.connectionsInRoom("g1"));
        assertSame(second, registry.connectionOf("alice").orElseThrow());
        assertEquals(1, registry.connectionCount());
    }

    @Test
    void unregister_ofSupersededConnection_isNotADisconnect() {
        registry.register(alice, new FakeConnection("c1"));
        registry.register(alice, new FakeConnection("c2"));

        assertTrue(registry.unregister("c1").isEmpty(), "late close of the old socket");
        assertTrue(registry.isOnline("alice"));

        assertEquals(Optional.of(alice), registry.unregister("c2"));
        assertFalse(registry.isOnline("alice"));
        assertTrue(registry.unregister("unknown").isEmpty());
    }

    @Test
    void connectionsInRoom_prunesClosedConnections() {
        FakeConnection a = new FakeConnection("c1");
        FakeConnection b = new FakeConnection("c2");
        registry.register(alice, a);
        registry.register(Identity.player("bob", "Bob"), b);
        registry.subscribe("c1", "g1");
        registry.subscribe("c2", "g1");
        registry.subscribe("c2", "g2");

        b.close(1000, "bye");
        assertEquals(List.of(a), registry.connectionsInRoom("g1"));

        registry.unsubscribeAll("g1");
        assertTrue(registry.connectionsInRoom("g1").isEmpty());
    }

    @Test
    void identityLookup_followsRegistration() {
        registry.register(alice, new FakeConnection("c1"));
        assertEquals(Optional.of(alice), registry.identityOf("c1"));
        assertTrue(registry.identityOf(null).isEmpty());
        assertTrue(registry.connection("nope").isEmpty());
    }
}
