package com.example.cardlobby.support;

import com.example.cardlobby.delivery.DeliveryReliabilityLayer;
import com.example.cardlobby.delivery.EmitOptions;
import com.example.cardlobby.delivery.EventTransport;
import com.example.cardlobby.delivery.FallbackClient;
import com.example.cardlobby.model.Identity;
import com.example.cardlobby.persistence.InMemoryPersistentRooms;
import com.example.cardlobby.presence.ConnectionRegistry;
import com.example.cardlobby.presence.PresenceService;
import com.example.cardlobby.presence.TokenAuthenticator;
import com.example.cardlobby.session.RoomSessionStore;
import com.example.cardlobby.timer.KeyedTimers;

import java.time.Duration;
import java.util.Random;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;

/**
 * Wires the lobby core the way LobbyConfig does, with in-memory persistence, a recording
 * transport and a clock under test control. Events are delivered on the calling thread.
 */
public class LobbyFixture implements AutoCloseable {

    public static final String SECRET = "fixture-secret-0123456789abcdefghijkl";

    public final MutableClock clock = MutableClock.atEpoch();
    public final TokenAuthenticator authenticator = new TokenAuthenticator(SECRET, clock);
    public final ConnectionRegistry registry = new ConnectionRegistry(authenticator);
    public final InMemoryPersistentRooms persistence = spy(new InMemoryPersistentRooms());
    public final KeyedTimers timers = new KeyedTimers();
    public final RecordingTransport transport = new RecordingTransport();
    public final FallbackClient fallback = mock(FallbackClient.class);
    public final InlineScheduler scheduler = new InlineScheduler();
    public final DeliveryReliabilityLayer delivery;
    public final RoomSessionStore store;
    public final PresenceService presence;

    public LobbyFixture() {
        this(Duration.ofMinutes(5));
    }

    public LobbyFixture(Duration evictionTimeout) {
        this(evictionTimeout, null);
    }

    /** @param transportFactory builds the real transport over the registry; null records instead */
    public LobbyFixture(Duration evictionTimeout, Function<ConnectionRegistry, EventTransport> transportFactory) {
        EventTransport live = (transportFactory == null) ? transport : transportFactory.apply(registry);
        delivery = new DeliveryReliabilityLayer(live, fallback, scheduler,
                EmitOptions.DEFAULTS.withMaxRetries(1), Duration.ofMinutes(5), clock);
        store = new RoomSessionStore(registry, persistence, timers, delivery, clock,
                evictionTimeout, Duration.ofSeconds(30), new Random(42));
        presence = new PresenceService(registry, store);
    }

    public static String connId(String userId) {
        return "conn-" + userId;
    }

    public static Identity identity(String userId) {
        return Identity.player(userId, Character.toUpperCase(userId.charAt(0)) + userId.substring(1));
    }

    /** Registers a connection for the user and joins the room over it. */
    public FakeConnection join(String gameId, String userId) {
        FakeConnection c = new FakeConnection(connId(userId));
        registry.register(identity(userId), c);
        store.joinRoom(gameId, identity(userId), c.id());
        return c;
    }

    public String token(String userId) {
        return authenticator.issue(identity(userId), Duration.ofHours(1));
    }

    public String serviceToken() {
        return authenticator.issue(Identity.service("lobby-service"), Duration.ofHours(1));
    }

    public static void awaitTrue(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met within " + timeout);
            Thread.sleep(10);
        }
    }

    @Override
    public void close() {
        timers.shutdown();
        delivery.shutdown();
        scheduler.shutdownNow();
    }
}
