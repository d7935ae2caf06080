package com.example.cardlobby.session;

import com.example.cardlobby.delivery.EventTarget;
import com.example.cardlobby.delivery.LobbyEvents;
import com.example.cardlobby.error.AuthorizationException;
import com.example.cardlobby.error.CapacityException;
import com.example.cardlobby.error.PersistenceException;
import com.example.cardlobby.error.RoomNotFoundException;
import com.example.cardlobby.error.StateException;
import com.example.cardlobby.error.ValidationException;
import com.example.cardlobby.model.PlayerStateView;
import com.example.cardlobby.model.RoomStateView;
import com.example.cardlobby.model.RoomStatus;
import com.example.cardlobby.model.TeamAssignment;
import com.example.cardlobby.model.Teams;
import com.example.cardlobby.support.LobbyFixture;
import com.example.cardlobby.support.RecordingTransport.Sent;
import com.example.cardlobby.timer.TimerKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.cardlobby.support.LobbyFixture.connId;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * RoomSessionStore against in-memory persistence and a recording transport.
 * Scope: join/leave, readiness, teams, start, presence timers and persistence drift.
 */
class RoomSessionStoreTest {

    private static final String G = "g1";

    private final LobbyFixture fx = new LobbyFixture();
    private final RoomSessionStore store = fx.store;

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private void joinAll(String... userIds) {
        for (String id : userIds) {
            fx.join(G, id);
            fx.clock.advance(Duration.ofSeconds(1));
        }
    }

    private void readyAll(String... userIds) {
        for (String id : userIds) store.setReady(G, id, true);
    }

    private RoomStateView live() {
        return store.snapshot(G).orElseThrow();
    }

    @Nested
    @DisplayName("join / leave")
    class JoinLeave {

        @Test
        @DisplayName("first join creates the room, makes the joiner host and persists it")
        void firstJoin_createsRoom() {
            fx.join(G, "alice");

            RoomStateView v = live();
            assertEquals("alice", v.hostId());
            assertEquals(RoomStatus.WAITING, v.status());
            assertTrue(store.isDbSynced(G));

            RoomStateView stored = fx.persistence.findById(G).orElseThrow();
            assertEquals("alice", stored.hostId());
            assertNotNull(stored.player("alice"));

            Sent joined = fx.transport.last(LobbyEvents.PLAYER_JOINED);
            assertEquals(EventTarget.room(G), joined.target());
            Sent snapshot = fx.transport.last(LobbyEvents.ROOM_JOINED);
            assertEquals(EventTarget.connection(connId("alice")), snapshot.target());
            assertEquals(true, snapshot.payload().get("dbSynced"));
            assertEquals(4, snapshot.payload().get("maxPlayers"));
            assertNotNull(snapshot.payload().get("_eventId"));
        }

        @Test
        @DisplayName("a fifth player is refused with a capacity error")
        void fifthPlayer_isRefused() {
            joinAll("a", "b", "c", "d");
            assertThrows(CapacityException.class, () -> fx.join(G, "e"));
            assertEquals(4, live().playerCount());
            assertNull(live().player("e"));
        }

        @Test
        @DisplayName("joining again reactivates the member instead of duplicating it")
        void rejoin_isIdempotent() {
            joinAll("a", "b");
            store.setReady(G, "b", true);
            fx.join(G, "b");

            assertEquals(2, live().playerCount());
            assertTrue(live().player("b").ready());
            assertEquals(1, fx.transport.events(LobbyEvents.PLAYER_JOINED).stream()
                    .filter(s -> "b".equals(((Map<?, ?>) s.payload().get("player")).get("userId"))).count());
        }

        @Test
        @DisplayName("host leaving hands the room to the earliest remaining joiner")
        void hostLeaves_transfersHost() {
            joinAll("a", "b", "c");
            store.leaveRoom(G, "a");

            assertEquals("b", live().hostId());
            assertEquals("b", fx.persistence.findById(G).orElseThrow().hostId());
            Sent left = fx.transport.last(LobbyEvents.PLAYER_LEFT);
            assertEquals(true, left.payload().get("hostTransferred"));
            Sent transferred = fx.transport.last(LobbyEvents.HOST_TRANSFERRED);
            assertEquals("a", transferred.payload().get("previousHostId"));
            assertEquals("b", transferred.payload().get("newHostId"));
        }

        @Test
        @DisplayName("last member leaving tears the room down")
        void lastLeave_tearsDown() {
            joinAll("a");
            store.leaveRoom(G, "a");
            assertEquals(0, store.roomCount());
            assertThrows(RoomNotFoundException.class, () -> store.readiness(G));
        }

        @Test
        void leave_ofUnknownMember_isIgnored() {
            joinAll("a");
            long before = live().version();
            store.leaveRoom(G, "stranger");
            assertEquals(before, live().version());
        }

        @Test
        @DisplayName("hydration seeds persisted members as disconnected with eviction timers")
        void hydration_restoresPersistedRoster() {
            Map<String, PlayerStateView> players = new LinkedHashMap<>();
            Instant t = fx.clock.instant().minusSeconds(60);
            players.put("bob", new PlayerStateView("bob", "Bob", true, null, true, t));
            players.put("carol", new PlayerStateView("carol", "Carol", false, null, true, t.plusSeconds(1)));
            fx.persistence.put(new RoomStateView(G, RoomStatus.WAITING, "bob", players, 7));

            fx.join(G, "alice");

            RoomStateView v = live();
            assertEquals(3, v.playerCount());
            assertEquals("bob", v.hostId());
            assertTrue(v.player("bob").ready());
            assertFalse(v.player("bob").connected());
            assertTrue(v.player("alice").connected());
            assertTrue(fx.timers.isScheduled(TimerKey.eviction(G, "carol")));
        }
    }

    @Nested
    @DisplayName("concurrent joins")
    class ConcurrentJoins {

        private List<Future<?>> raceJoins(List<String> userIds, ExecutorService pool) {
            CyclicBarrier start = new CyclicBarrier(userIds.size());
            List<Future<?>> results = new ArrayList<>();
            for (String id : userIds) {
                results.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    fx.join(G, id);
                    return null;
                }));
            }
            return results;
        }

        @Test
        @DisplayName("eight racing joiners: exactly four get in, the rest are refused for capacity")
        void racingJoins_neverExceedCapacity() throws Exception {
            List<String> ids = List.of("p0", "p1", "p2", "p3", "p4", "p5", "p6", "p7");
            ExecutorService pool = Executors.newFixedThreadPool(ids.size());
            int joined = 0;
            int refused = 0;
            try {
                for (Future<?> f : raceJoins(ids, pool)) {
                    try {
                        f.get(10, TimeUnit.SECONDS);
                        joined++;
                    } catch (ExecutionException e) {
                        assertInstanceOf(CapacityException.class, e.getCause());
                        refused++;
                    }
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(4, joined);
            assertEquals(4, refused);
            assertEquals(4, live().playerCount());
            assertEquals(4, fx.persistence.findById(G).orElseThrow().playerCount());
            assertTrue(live().players().containsKey(live().hostId()));
        }

        @Test
        @DisplayName("racing first joiners all see the persisted host; the record is loaded once")
        void racingFirstJoins_hydrateOnce() throws Exception {
            Map<String, PlayerStateView> players = new LinkedHashMap<>();
            players.put("host", new PlayerStateView("host", "Host", false, null, true, fx.clock.instant().minusSeconds(30)));
            fx.persistence.put(new RoomStateView(G, RoomStatus.WAITING, "host", players, 1));

            List<String> ids = List.of("u1", "u2", "u3");
            ExecutorService pool = Executors.newFixedThreadPool(ids.size());
            try {
                for (Future<?> f : raceJoins(ids, pool)) f.get(10, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            assertEquals("host", live().hostId());
            assertEquals(4, live().playerCount());
            verify(fx.persistence, times(1)).findById(G);
            for (String id : ids) {
                Sent snapshot = fx.transport.events(LobbyEvents.ROOM_JOINED).stream()
                        .filter(e -> e.target().equals(EventTarget.connection(connId(id))))
                        .findFirst().orElseThrow();
                assertEquals("host", snapshot.payload().get("hostId"));
            }
        }
    }

    @Nested
    @DisplayName("ready / teams / start")
    class ReadyTeamsStart {

        @Test
        @DisplayName("4 players: teams are required, then start moves the room to playing")
        void fourPlayers_needTeamsToStart() {
            joinAll("a", "b", "c", "d");
            readyAll("a", "b", "c", "d");

            Readiness r = store.readiness(G);
            assertTrue(r.allReady());
            assertFalse(r.canStart());
            assertEquals("Teams must be formed for 4-player games", r.reason());

            StateException noTeams = assertThrows(StateException.class, () -> store.startGame(G, "a"));
            assertEquals("Teams must be formed for 4-player games", noTeams.getMessage());

            Teams teams = store.formTeams(G, "a");
            assertEquals(2, teams.team1().size());
            assertEquals(2, teams.team2().size());
            assertTrue(teams.partitions(live().players().keySet()));
            assertTrue(store.readiness(G).canStart());

            RoomStateView started = store.startGame(G, "a");
            assertEquals(RoomStatus.PLAYING, started.status());
            assertEquals(RoomStatus.PLAYING, fx.persistence.findById(G).orElseThrow().status());

            Sent starting = fx.transport.last(LobbyEvents.GAME_STARTING);
            assertEquals("4-player", starting.payload().get("gameMode"));
            assertEquals("playing", starting.payload().get("roomStatus"));
        }

        @Test
        @DisplayName("2 players start without teams")
        void twoPlayers_startWithoutTeams() {
            joinAll("a", "b");
            readyAll("a", "b");
            assertEquals("Ready to start!", store.readiness(G).reason());

            RoomStateView started = store.startGame(G, "a");
            assertEquals(RoomStatus.PLAYING, started.status());
            assertEquals("2-player", fx.transport.last(LobbyEvents.GAME_STARTING).payload().get("gameMode"));
        }

        @Test
        void start_isRefusedForNonHost_notReady_andSinglePlayer() {
            joinAll("a");
            store.setReady(G, "a", true);
            assertEquals("Need at least 2 connected players",
                    assertThrows(StateException.class, () -> store.startGame(G, "a")).getMessage());

            joinAll("b");
            assertThrows(StateException.class, () -> store.startGame(G, "a"));
            assertEquals("1/2 players ready", store.readiness(G).reason());

            store.setReady(G, "b", true);
            assertThrows(AuthorizationException.class, () -> store.startGame(G, "b"));
            assertEquals(RoomStatus.WAITING, live().status());
        }

        @Test
        void started_room_refusesRosterChanges() {
            joinAll("a", "b");
            readyAll("a", "b");
            store.startGame(G, "a");

            assertThrows(StateException.class, () -> fx.join(G, "c"));
            assertThrows(StateException.class, () -> store.setReady(G, "a", false));
            assertThrows(StateException.class, () -> store.leaveRoom(G, "b"));
            // the service path treats a repeated start as done
            assertEquals(RoomStatus.PLAYING, store.startGame(G, null, true).status());
        }

        @Test
        @DisplayName("a disconnected player cannot change ready state")
        void disconnectedPlayer_cannotSetReady() {
            joinAll("a", "b");
            store.markDisconnected(G, "b", connId("b"));

            StateException e = assertThrows(StateException.class, () -> store.setReady(G, "b", true));
            assertEquals("Disconnected players cannot change ready state", e.getMessage());
        }

        @Test
        void unchangedReady_isANoOp() {
            joinAll("a", "b");
            store.setReady(G, "a", true);
            long version = live().version();
            int broadcasts = fx.transport.events(LobbyEvents.PLAYER_READY_CHANGED).size();

            store.setReady(G, "a", true);

            assertEquals(version, live().version());
            assertEquals(broadcasts, fx.transport.events(LobbyEvents.PLAYER_READY_CHANGED).size());
        }

        @Test
        void formTeams_requiresHostAndTwoPlayers() {
            joinAll("a");
            assertThrows(CapacityException.class, () -> store.formTeams(G, "a"));
            joinAll("b", "c");
            assertThrows(AuthorizationException.class, () -> store.formTeams(G, "b"));

            Teams teams = store.formTeams(G, "a");
            assertEquals(2, teams.team1().size(), "odd rosters put the extra player in team 1");
            assertEquals(1, teams.team2().size());
        }

        @Test
        void applyTeams_validatesPartition_andPersists() {
            joinAll("a", "b", "c", "d");
            assertThrows(ValidationException.class,
                    () -> store.applyTeams(G, "a", List.of("a", "b", "c"), List.of("d")));

            store.applyTeams(G, "a", List.of("a", "c"), List.of("b", "d"));
            assertEquals(TeamAssignment.TEAM_2, fx.persistence.findById(G).orElseThrow().player("d").teamAssignment());
            assertEquals(List.of("a", "c"), live().teams().team1());
        }

        @Test
        void completeGame_schedulesTeardown() {
            joinAll("a", "b");
            readyAll("a", "b");
            assertThrows(StateException.class, () -> store.completeGame(G));
            store.startGame(G, "a");

            assertEquals(RoomStatus.COMPLETED, store.completeGame(G).status());
            assertTrue(fx.timers.isScheduled(TimerKey.teardown(G)));

            store.teardown(G, "completed");
            assertEquals(0, store.roomCount());
            assertFalse(fx.timers.isScheduled(TimerKey.teardown(G)));
        }
    }

    @Nested
    @DisplayName("persistence drift")
    class PersistenceDrift {

        @Test
        @DisplayName("a failed write keeps the live change, warns the initiator and marks the room out of sync")
        void failedWrite_marksOutOfSync() {
            joinAll("a", "b");
            doThrow(new PersistenceException("db down", null))
                    .when(fx.persistence).setPlayerReady(eq(G), eq("a"), anyBoolean());

            Readiness r = store.setReady(G, "a", true);

            assertEquals(1, r.readyCount());
            assertTrue(live().player("a").ready());
            assertFalse(store.isDbSynced(G));
            assertEquals(false, fx.transport.last(LobbyEvents.PLAYER_READY_CHANGED).payload().get("dbSynced"));

            Sent warning = fx.transport.last(LobbyEvents.WARNING);
            assertEquals(EventTarget.connection(connId("a")), warning.target());
            assertEquals("database sync failed", warning.payload().get("message"));
            assertEquals("ready", warning.payload().get("operation"));

            // a later successful write does not clear it; only a full write-back does
            store.setReady(G, "b", true);
            assertFalse(store.isDbSynced(G));
            assertTrue(store.hasUnsavedChanges(G));

            assertFalse(store.markSaved(G, live().version() - 1));
            assertTrue(store.markSaved(G, live().version()));
            assertTrue(store.isDbSynced(G));
            assertFalse(store.hasUnsavedChanges(G));
        }

        @Test
        void drift_isReportedToListeners() {
            List<String> drifted = new ArrayList<>();
            store.addLifecycleListener(new RoomLifecycleListener() {
                @Override
                public void onPersistenceDrift(String gameId) {
                    drifted.add(gameId);
                }
            });
            joinAll("a", "b");
            doThrow(new PersistenceException("db down", null)).when(fx.persistence).formTeams(eq(G), anyList(), anyList());

            store.formTeams(G, "a");
            assertEquals(List.of(G), drifted);
        }
    }

    @Nested
    @DisplayName("presence timers")
    class PresenceTimers {

        @Test
        void disconnect_schedulesEviction_andBroadcastsTimeout() {
            joinAll("a", "b");
            store.markDisconnected(G, "b", connId("b"));

            assertFalse(live().player("b").connected());
            assertTrue(fx.timers.isScheduled(TimerKey.eviction(G, "b")));
            Sent sent = fx.transport.last(LobbyEvents.PLAYER_DISCONNECTED);
            assertEquals(Duration.ofMinutes(5).toMillis(), sent.payload().get("reconnectTimeoutMs"));
        }

        @Test
        void disconnect_fromStaleConnection_isIgnored() {
            joinAll("a", "b");
            store.markDisconnected(G, "b", "some-old-connection");
            assertTrue(live().player("b").connected());
        }

        @Test
        @DisplayName("eviction removes the member and fails the host over")
        void evict_removesMember_andTransfersHost() {
            joinAll("a", "b");
            Instant episode = fx.clock.instant();
            store.markDisconnected(G, "a", connId("a"));

            store.evict(G, "a", episode);

            assertNull(live().player("a"));
            assertEquals("b", live().hostId());
            Sent removed = fx.transport.last(LobbyEvents.PLAYER_REMOVED);
            assertEquals("timeout", removed.payload().get("reason"));
            assertNull(fx.persistence.findById(G).orElseThrow().player("a"));
        }

        @Test
        @DisplayName("an eviction from an earlier disconnect episode does nothing")
        void evict_withStaleEpisode_isIgnored() {
            joinAll("a", "b");
            Instant first = fx.clock.instant();
            store.markDisconnected(G, "b", connId("b"));
            store.reconnect(G, LobbyFixture.identity("b"), "conn-b2");
            fx.clock.advance(Duration.ofSeconds(30));
            store.markDisconnected(G, "b", "conn-b2");

            store.evict(G, "b", first);
            assertNotNull(live().player("b"));
        }

        @Test
        void evictionTimer_firesAfterTimeout() throws Exception {
            try (LobbyFixture quick = new LobbyFixture(Duration.ofMillis(100))) {
                quick.join(G, "a");
                quick.join(G, "b");
                quick.store.markDisconnected(G, "b", connId("b"));

                LobbyFixture.awaitTrue(() -> quick.store.snapshot(G).orElseThrow().player("b") == null,
                        Duration.ofSeconds(3));
                assertEquals(1, quick.store.snapshot(G).orElseThrow().playerCount());
            }
        }

        @Test
        void lastMemberEvicted_tearsRoomDown() {
            joinAll("a");
            Instant episode = fx.clock.instant();
            store.markDisconnected(G, "a", connId("a"));
            store.evict(G, "a", episode);
            assertEquals(0, store.roomCount());
        }
    }
}
