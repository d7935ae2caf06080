package com.example.cardlobby.session;

import com.example.cardlobby.delivery.DeliveryReliabilityLayer;
import com.example.cardlobby.delivery.EventTarget;
import com.example.cardlobby.delivery.LobbyEvents;
import com.example.cardlobby.error.AuthorizationException;
import com.example.cardlobby.error.CapacityException;
import com.example.cardlobby.error.PersistenceException;
import com.example.cardlobby.error.RoomNotFoundException;
import com.example.cardlobby.error.StateException;
import com.example.cardlobby.error.ValidationException;
import com.example.cardlobby.model.*;
import com.example.cardlobby.persistence.PersistentRooms;
import com.example.cardlobby.presence.ConnectionRegistry;
import com.example.cardlobby.timer.KeyedTimers;
import com.example.cardlobby.timer.TimerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Authoritative in-process room state.
 *
 * Every mutation runs inside {@code synchronized (room)}; persistence writes and broadcasts
 * happen after the lock is released. A room is created on first join, hydrated from the
 * persisted record before it becomes visible, and torn down when it empties or after the
 * completion grace period.
 */
public class RoomSessionStore {

    private static final Logger log = LoggerFactory.getLogger(RoomSessionStore.class);

    private final ConnectionRegistry registry;
    private final PersistentRooms persistence;
    private final KeyedTimers timers;
    private final DeliveryReliabilityLayer delivery;
    private final Clock clock;
    private final Duration evictionTimeout;
    private final Duration completionGrace;
    private final Random random;

    /** gameId -> live room */
    private final Map<String, RoomSession> rooms = new ConcurrentHashMap<>();
    private final List<RoomLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public RoomSessionStore(ConnectionRegistry registry,
                            PersistentRooms persistence,
                            KeyedTimers timers,
                            DeliveryReliabilityLayer delivery,
                            Clock clock,
                            Duration evictionTimeout,
                            Duration completionGrace,
                            Random random) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.evictionTimeout = Objects.requireNonNull(evictionTimeout, "evictionTimeout");
        this.completionGrace = Objects.requireNonNull(completionGrace, "completionGrace");
        this.random = (random == null) ? new Random() : random;
    }

    public void addLifecycleListener(RoomLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public Duration getEvictionTimeout() {
        return evictionTimeout;
    }

    // ========================================================================
    //  LOOKUPS
    // ========================================================================

    public Optional<RoomSession> getRoom(String gameId) {
        if (gameId == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(gameId));
    }

    public Optional<RoomStateView> snapshot(String gameId) {
        RoomSession room = (gameId == null) ? null : rooms.get(gameId);
        if (room == null) return Optional.empty();
        synchronized (room) {
            return Optional.of(room.toView());
        }
    }

    /** Live view used by reconciliation; null when the room is not live. */
    public RoomStateView liveView(String gameId) {
        return snapshot(gameId).orElse(null);
    }

    public boolean isDbSynced(String gameId) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return true;
        synchronized (room) {
            return room.isDbSynced();
        }
    }

    /** Marking a room synced has no effect while it still holds unsaved live changes. */
    public void markDbSynced(String gameId, boolean synced) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return;
        synchronized (room) {
            room.setDbSynced(synced && !room.hasUnsavedChanges());
        }
    }

    /** True while live state carries changes whose persistence write failed. */
    public boolean hasUnsavedChanges(String gameId) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return false;
        synchronized (room) {
            return room.hasUnsavedChanges();
        }
    }

    /**
     * Records that the live view at {@code version} has been written back in full.
     * Ignored if the room has been mutated since.
     *
     * @return true if the room is now in sync
     */
    public boolean markSaved(String gameId, long version) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return false;
        synchronized (room) {
            if (room.getVersion() != version) return false;
            room.setUnsavedChanges(false);
            room.setDbSynced(true);
            return true;
        }
    }

    public Readiness readiness(String gameId) {
        RoomSession room = requireRoom(gameId);
        synchronized (room) {
            return Readiness.of(room);
        }
    }

    /** Rooms the user is a member of. */
    public List<String> roomsOf(String userId) {
        List<String> out = new ArrayList<>();
        for (RoomSession room : rooms.values()) {
            synchronized (room) {
                if (room.hasPlayer(userId)) out.add(room.getGameId());
            }
        }
        return out;
    }

    public Set<String> gameIds() {
        return new TreeSet<>(rooms.keySet());
    }

    public int roomCount() {
        return rooms.size();
    }

    // ========================================================================
    //  JOIN / LEAVE
    // ========================================================================

    /**
     * Adds the identity to the room, creating (and hydrating) the room on first use.
     * A member that joins again is reactivated with its previous ready/team state.
     */
    public RoomSession joinRoom(String gameId, Identity identity, String connectionId) {
        String id = requireGameId(gameId);
        Objects.requireNonNull(identity, "identity");
        String userId = identity.userId();

        while (true) {
            boolean[] created = new boolean[1];
            RoomSession room = rooms.computeIfAbsent(id, k -> {
                created[0] = true;
                return hydrate(k);
            });
            if (created[0]) {
                log.info("Room created {} (host={}, players={})", id, room.getHostId(), room.playerCount());
                for (RoomLifecycleListener l : listeners) l.onRoomCreated(id);
            }

            RoomStateView view;
            PlayerStateView joined;
            boolean isNew;
            boolean wasDisconnected = false;
            synchronized (room) {
                if (rooms.get(id) != room) continue; // torn down in between

                PlayerSession existing = room.getPlayer(userId);
                Instant now = clock.instant();
                if (existing != null) {
                    if (room.getStatus() == RoomStatus.COMPLETED) {
                        throw new StateException("Game in room " + id + " is already completed");
                    }
                    wasDisconnected = !existing.isConnected();
                    existing.setUsername(identity.username());
                    existing.markReconnected(connectionId, now);
                    timers.cancel(TimerKey.eviction(id, userId));
                    isNew = false;
                } else {
                    if (!room.getStatus().acceptsRosterChanges()) {
                        throw new StateException("Game in room " + id + " has already started",
                                Map.of("status", room.getStatus().wireName()));
                    }
                    if (room.isFull()) {
                        throw new CapacityException("Room " + id + " is full",
                                Map.of("maxPlayers", RoomSession.MAX_PLAYERS, "playerCount", room.playerCount()));
                    }
                    PlayerSession p = new PlayerSession(userId, identity.username(), now);
                    p.setConnectionId(connectionId);
                    room.addPlayer(p);
                    if (room.getHostId() == null || !room.hasPlayer(room.getHostId())) room.setHostId(userId);
                    isNew = true;
                }
                room.bumpVersion();
                view = room.toView();
                joined = view.player(userId);
            }

            if (connectionId != null) registry.subscribe(connectionId, id);
            log.info("JOIN room={} user={} new={} reconnect={} players={}", id, userId, isNew, wasDisconnected, view.playerCount());

            persist(id, "join", userId, () -> persistence.addPlayer(id, joined, view.hostId()));

            if (isNew) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("gameId", id);
                payload.put("player", RoomPayloads.player(joined));
                payload.put("players", RoomPayloads.players(view));
                payload.put("hostId", view.hostId());
                payload.put("playerCount", view.playerCount());
                broadcast(id, LobbyEvents.PLAYER_JOINED, payload);
            } else if (wasDisconnected) {
                broadcastReconnected(view, joined);
            }
            sendSnapshot(id, connectionId);
            return room;
        }
    }

    /** Removes the member. Unknown members are ignored. */
    public void leaveRoom(String gameId, String userId) {
        RoomSession room = requireRoom(gameId);
        RoomStateView view;
        PlayerSession removed;
        String previousHost;
        String newHost;
        boolean empty;
        synchronized (room) {
            requireLive(room);
            if (!room.hasPlayer(userId)) return;
            requireRosterChanges(room);
            previousHost = room.getHostId();
            removed = room.removePlayer(userId);
            timers.cancel(TimerKey.eviction(gameId, userId));
            newHost = room.assignNewHostIfNecessary();
            room.bumpVersion();
            empty = room.isEmpty();
            if (empty) rooms.remove(gameId, room);
            view = room.toView();
        }

        registry.connectionOf(userId).ifPresent(c -> registry.unsubscribe(c.id(), gameId));
        log.info("LEAVE room={} user={} newHost={} players={}", gameId, userId, newHost, view.playerCount());

        persist(gameId, "leave", null, () -> {
            persistence.removePlayer(gameId, userId);
            if (newHost != null) persistence.updateOwner(gameId, newHost);
        });

        if (empty) {
            afterTeardown(gameId, "empty");
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", gameId);
        payload.put("playerId", userId);
        payload.put("username", removed.getUsername());
        payload.put("newHostId", view.hostId());
        payload.put("hostTransferred", newHost != null);
        payload.put("players", RoomPayloads.players(view));
        payload.put("playerCount", view.playerCount());
        broadcast(gameId, LobbyEvents.PLAYER_LEFT, payload);
        if (newHost != null) broadcastHostTransferred(gameId, previousHost, newHost, "left");
    }

    // ========================================================================
    //  READY / TEAMS / START / COMPLETE
    // ========================================================================

    public Readiness setReady(String gameId, String userId, boolean ready) {
        RoomSession room = requireRoom(gameId);
        Readiness readiness;
        String username;
        synchronized (room) {
            requireLive(room);
            PlayerSession p = requireMember(room, userId);
            requireRosterChanges(room);
            if (!p.isConnected()) {
                throw new StateException("Disconnected players cannot change ready state");
            }
            if (p.isReady() == ready) {
                // repeated request, e.g. an HTTP fallback for a change that already went through
                return Readiness.of(room);
            }
            p.setReady(ready);
            room.bumpVersion();
            readiness = Readiness.of(room);
            username = p.getUsername();
        }
        log.debug("READY room={} user={} ready={} ({}/{})", gameId, userId, ready,
                readiness.readyCount(), readiness.connectedPlayers());

        persist(gameId, "ready", userId, () -> persistence.setPlayerReady(gameId, userId, ready));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", gameId);
        payload.put("playerId", userId);
        payload.put("username", username);
        payload.put("isReady", ready);
        payload.putAll(RoomPayloads.readiness(readiness));
        payload.put("dbSynced", isDbSynced(gameId));
        broadcast(gameId, LobbyEvents.PLAYER_READY_CHANGED, payload);
        return readiness;
    }

    /** Host only. Randomly partitions all players into two balanced teams; repeated calls re-shuffle. */
    public Teams formTeams(String gameId, String requesterId) {
        RoomSession room = requireRoom(gameId);
        Teams teams;
        RoomStateView view;
        synchronized (room) {
            requireLive(room);
            requireRosterChanges(room);
            requireHost(room, requesterId, "form teams");
            if (room.playerCount() < 2) {
                throw new CapacityException("At least 2 players are required to form teams",
                        Map.of("playerCount", room.playerCount()));
            }
            List<String> ids = new ArrayList<>(room.playerIds());
            Collections.shuffle(ids, random);
            int firstSize = (ids.size() + 1) / 2;
            teams = new Teams(ids.subList(0, firstSize), ids.subList(firstSize, ids.size()));
            room.applyTeams(teams);
            room.bumpVersion();
            view = room.toView();
        }
        log.info("TEAMS room={} team1={} team2={}", gameId, teams.team1(), teams.team2());
        persistAndBroadcastTeams(gameId, requesterId, teams, view);
        return teams;
    }

    /**
     * Applies an explicit partition. Applying the partition the room already has is a no-op,
     * so a retried fallback call leaves no trace.
     */
    public Teams applyTeams(String gameId, String requesterId, List<String> team1, List<String> team2) {
        RoomSession room = requireRoom(gameId);
        Teams teams = new Teams(team1, team2);
        RoomStateView view;
        synchronized (room) {
            requireLive(room);
            requireRosterChanges(room);
            requireHost(room, requesterId, "form teams");
            if (!teams.partitions(room.playerIds())) {
                throw new ValidationException("Teams must partition all players of the room into two balanced groups",
                        Map.of("players", new ArrayList<>(room.playerIds())));
            }
            Teams current = room.getTeams();
            if (new HashSet<>(current.team1()).equals(new HashSet<>(teams.team1()))
                    && new HashSet<>(current.team2()).equals(new HashSet<>(teams.team2()))) {
                return current;
            }
            room.applyTeams(teams);
            room.bumpVersion();
            view = room.toView();
        }
        log.info("TEAMS applied room={} team1={} team2={}", gameId, teams.team1(), teams.team2());
        persistAndBroadcastTeams(gameId, requesterId, teams, view);
        return teams;
    }

    private void persistAndBroadcastTeams(String gameId, String requesterId, Teams teams, RoomStateView view) {
        persist(gameId, "form-teams", requesterId, () -> persistence.formTeams(gameId, teams.team1(), teams.team2()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", gameId);
        payload.put("teams", RoomPayloads.teams(teams));
        payload.put("players", RoomPayloads.players(view));
        payload.put("formedBy", requesterId);
        broadcast(gameId, LobbyEvents.TEAMS_FORMED, payload);
    }

    public RoomStateView startGame(String gameId, String requesterId) {
        return startGame(gameId, requesterId, false);
    }

    /**
     * WAITING → STARTING → PLAYING. With {@code service} set, a room that is already starting
     * or playing is returned unchanged and the host check is skipped.
     */
    public RoomStateView startGame(String gameId, String requesterId, boolean service) {
        RoomSession room = requireRoom(gameId);
        synchronized (room) {
            requireLive(room);
            if (service && (room.getStatus() == RoomStatus.STARTING || room.getStatus() == RoomStatus.PLAYING)) {
                return room.toView();
            }
            if (room.getStatus() != RoomStatus.WAITING) {
                throw new StateException("Game in room " + gameId + " has already started",
                        Map.of("status", room.getStatus().wireName()));
            }
            if (!service) requireHost(room, requesterId, "start the game");

            Readiness r = Readiness.of(room);
            if (r.connectedPlayers() < 2) {
                throw new StateException("Need at least 2 connected players", Map.of("connectedPlayers", r.connectedPlayers()));
            }
            if (!r.allReady()) {
                throw new StateException("All connected players must be ready",
                        Map.of("readyCount", r.readyCount(), "connectedPlayers", r.connectedPlayers()));
            }
            if (room.playerCount() == 4 && !room.getTeams().isFormed()) {
                throw new StateException("Teams must be formed for 4-player games");
            }
            room.transitionTo(RoomStatus.STARTING);
            room.bumpVersion();
        }
        log.info("START room={} by={}", gameId, requesterId);

        persist(gameId, "start", requesterId, () -> persistence.updateStatus(gameId, RoomStatus.PLAYING));

        RoomStateView view;
        synchronized (room) {
            if (room.transitionTo(RoomStatus.PLAYING)) room.bumpVersion();
            view = room.toView();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", gameId);
        payload.put("gameMode", GameMode.forPlayerCount(view.playerCount()).label());
        payload.put("roomStatus", RoomStatus.PLAYING.wireName());
        payload.put("hostId", view.hostId());
        payload.put("players", RoomPayloads.players(view));
        payload.put("teams", RoomPayloads.teams(view.teams()));
        payload.put("playerCount", view.playerCount());
        broadcast(gameId, LobbyEvents.GAME_STARTING, payload);
        return view;
    }

    /** PLAYING → COMPLETED; the room is torn down after the completion grace period. */
    public RoomStateView completeGame(String gameId) {
        RoomSession room = requireRoom(gameId);
        RoomStateView view;
        synchronized (room) {
            requireLive(room);
            if (room.getStatus() == RoomStatus.COMPLETED) return room.toView();
            if (!room.transitionTo(RoomStatus.COMPLETED)) {
                throw new StateException("Only a game in progress can be completed",
                        Map.of("status", room.getStatus().wireName()));
            }
            room.bumpVersion();
            view = room.toView();
        }
        log.info("COMPLETE room={} teardown in {}s", gameId, completionGrace.toSeconds());
        persist(gameId, "complete", null, () -> persistence.updateStatus(gameId, RoomStatus.COMPLETED));
        timers.schedule(TimerKey.teardown(gameId), completionGrace, () -> teardown(gameId, "completed"));
        return view;
    }

    // ========================================================================
    //  PRESENCE
    // ========================================================================

    /**
     * Marks the member disconnected and starts its eviction timer.
     * Ignored if the member is already disconnected or now bound to a different connection.
     */
    public void markDisconnected(String gameId, String userId, String connectionId) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return;
        PlayerStateView view;
        Instant episode;
        RoomStateView roomView;
        synchronized (room) {
            if (rooms.get(gameId) != room) return;
            PlayerSession p = room.getPlayer(userId);
            if (p == null || !p.isConnected()) return;
            if (connectionId != null && p.getConnectionId() != null && !connectionId.equals(p.getConnectionId())) return;
            episode = clock.instant();
            p.markDisconnected(episode);
            room.bumpVersion();
            view = p.toView();
            roomView = room.toView();
        }
        timers.schedule(TimerKey.eviction(gameId, userId), evictionTimeout, () -> evict(gameId, userId, episode));
        log.info("DISCONNECT room={} user={} evictIn={}s", gameId, userId, evictionTimeout.toSeconds());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", gameId);
        payload.put("playerId", userId);
        payload.put("username", view.username());
        payload.put("reconnectTimeoutMs", evictionTimeout.toMillis());
        payload.put("players", RoomPayloads.players(roomView));
        broadcast(gameId, LobbyEvents.PLAYER_DISCONNECTED, payload);
    }

    /**
     * Rebinds a member to a new connection. A disconnected member is reactivated with its
     * previous ready/team state and the room is told; the connection always gets a snapshot.
     *
     * @return false if the user is not a member of a live, non-terminal room
     */
    public boolean reconnect(String gameId, Identity identity, String connectionId) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return false;
        String userId = identity.userId();
        boolean wasDisconnected;
        RoomStateView view;
        synchronized (room) {
            if (rooms.get(gameId) != room) return false;
            PlayerSession p = room.getPlayer(userId);
            if (p == null || room.getStatus() == RoomStatus.COMPLETED) return false;
            wasDisconnected = !p.isConnected();
            p.markReconnected(connectionId, clock.instant());
            timers.cancel(TimerKey.eviction(gameId, userId));
            if (wasDisconnected) room.bumpVersion();
            view = room.toView();
        }
        registry.subscribe(connectionId, gameId);
        if (wasDisconnected) {
            log.info("RECONNECT room={} user={}", gameId, userId);
            broadcastReconnected(view, view.player(userId));
        } else {
            log.debug("REBIND room={} user={} conn={}", gameId, userId, connectionId);
        }
        sendSnapshot(gameId, connectionId);
        return true;
    }

    /** Eviction timer callback; only acts on the disconnect episode that scheduled it. */
    void evict(String gameId, String userId, Instant episode) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return;
        RoomStateView view;
        String username;
        String previousHost;
        String newHost;
        boolean empty;
        synchronized (room) {
            if (rooms.get(gameId) != room) return;
            PlayerSession p = room.getPlayer(userId);
            if (p == null || p.isConnected() || !Objects.equals(p.getDisconnectedAt(), episode)) return;
            previousHost = room.getHostId();
            room.removePlayer(userId);
            username = p.getUsername();
            newHost = room.assignNewHostIfNecessary();
            room.bumpVersion();
            empty = room.isEmpty();
            if (empty) rooms.remove(gameId, room);
            view = room.toView();
        }
        log.info("EVICT room={} user={} reason=timeout newHost={}", gameId, userId, newHost);

        persist(gameId, "evict", null, () -> {
            persistence.removePlayer(gameId, userId);
            if (newHost != null) persistence.updateOwner(gameId, newHost);
        });

        if (empty) {
            afterTeardown(gameId, "empty");
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", gameId);
        payload.put("playerId", userId);
        payload.put("username", username);
        payload.put("reason", "timeout");
        payload.put("newHostId", view.hostId());
        payload.put("hostTransferred", newHost != null);
        payload.put("players", RoomPayloads.players(view));
        broadcast(gameId, LobbyEvents.PLAYER_REMOVED, payload);
        if (newHost != null) broadcastHostTransferred(gameId, previousHost, newHost, "timeout");
    }

    // ========================================================================
    //  RECONCILIATION SUPPORT
    // ========================================================================

    /**
     * Overwrites host, membership, ready, team and connection flags from a resolved view.
     * Members that only exist in {@code resolved} are added disconnected with an eviction timer;
     * members missing from it are unsubscribed and announced as {@code player-removed}.
     * The view's version must match the room's; a room mutated since the view was taken is left
     * alone until the next run.
     *
     * @return true if anything changed
     */
    public boolean applyReconciledState(String gameId, RoomStateView resolved) {
        RoomSession room = rooms.get(gameId);
        if (room == null || resolved == null) return false;
        List<Runnable> evictions = new ArrayList<>();
        Map<String, String> removed = new LinkedHashMap<>();
        boolean changed = false;
        boolean empty;
        RoomStateView after;
        synchronized (room) {
            if (rooms.get(gameId) != room) return false;
            if (room.getVersion() != resolved.version()) {
                log.debug("Reconciled view of room {} is stale (v{} != v{})", gameId, resolved.version(), room.getVersion());
                return false;
            }
            Instant now = clock.instant();

            for (String userId : room.playerIds()) {
                if (!resolved.players().containsKey(userId)) {
                    removed.put(userId, room.removePlayer(userId).getUsername());
                    changed = true;
                }
            }
            for (PlayerStateView target : resolved.players().values()) {
                PlayerSession p = room.getPlayer(target.userId());
                if (p == null) {
                    if (room.isFull()) continue;
                    p = new PlayerSession(target.userId(), target.username(),
                            target.joinedAt() != null ? target.joinedAt() : now);
                    p.setReady(target.ready());
                    p.setTeamAssignment(target.teamAssignment());
                    p.markDisconnected(now);
                    room.addPlayer(p);
                    Instant episode = p.getDisconnectedAt();
                    String uid = p.getUserId();
                    evictions.add(() -> timers.schedule(TimerKey.eviction(gameId, uid), evictionTimeout,
                            () -> evict(gameId, uid, episode)));
                    changed = true;
                    continue;
                }
                if (p.isReady() != target.ready()) { p.setReady(target.ready()); changed = true; }
                if (p.getTeamAssignment() != target.teamAssignment()) { p.setTeamAssignment(target.teamAssignment()); changed = true; }
                if (p.isConnected() != target.connected()) { p.setConnected(target.connected()); changed = true; }
            }

            if (resolved.hostId() != null && room.hasPlayer(resolved.hostId())) {
                if (!resolved.hostId().equals(room.getHostId())) {
                    room.setHostId(resolved.hostId());
                    changed = true;
                }
            } else if (room.assignNewHostIfNecessary() != null) {
                changed = true;
            }
            if (changed) room.bumpVersion();
            empty = room.isEmpty();
            if (empty) rooms.remove(gameId, room);
            after = room.toView();
        }
        for (String userId : removed.keySet()) {
            timers.cancel(TimerKey.eviction(gameId, userId));
            registry.connectionOf(userId).ifPresent(c -> registry.unsubscribe(c.id(), gameId));
        }
        if (empty) {
            afterTeardown(gameId, "reconciled");
            return changed;
        }
        evictions.forEach(Runnable::run);
        removed.forEach((userId, username) -> {
            log.info("RECONCILE-REMOVE room={} user={}", gameId, userId);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("gameId", gameId);
            payload.put("playerId", userId);
            payload.put("username", username);
            payload.put("reason", "reconciled");
            payload.put("newHostId", after.hostId());
            payload.put("players", RoomPayloads.players(after));
            broadcast(gameId, LobbyEvents.PLAYER_REMOVED, payload);
        });
        return changed;
    }

    // ========================================================================
    //  TEARDOWN
    // ========================================================================

    /** Drops the room and everything keyed by it. */
    public void teardown(String gameId, String reason) {
        RoomSession room = rooms.get(gameId);
        if (room == null) return;
        synchronized (room) {
            if (!rooms.remove(gameId, room)) return;
        }
        afterTeardown(gameId, reason);
    }

    private void afterTeardown(String gameId, String reason) {
        timers.cancelAll(gameId);
        registry.unsubscribeAll(gameId);
        log.info("Room torn down {} (reason={})", gameId, reason);
        for (RoomLifecycleListener l : listeners) {
            try {
                l.onRoomTornDown(gameId);
            } catch (RuntimeException e) {
                log.error("Teardown listener failed for room {}", gameId, e);
            }
        }
    }

    // ========================================================================
    //  INTERNALS
    // ========================================================================

    /** Runs inside computeIfAbsent: the room is published only after this returns. */
    private RoomSession hydrate(String gameId) {
        RoomSession room = new RoomSession(gameId, clock.instant());
        Optional<RoomStateView> persisted;
        try {
            persisted = persistence.findById(gameId);
        } catch (PersistenceException e) {
            log.warn("Hydration of room {} failed, starting empty: {}", gameId, e.getMessage());
            room.setDbSynced(false);
            return room;
        }
        if (persisted.isEmpty()) return room;

        RoomStateView stored = persisted.get();
        restoreStatus(room, stored.status());
        Instant now = clock.instant();
        for (PlayerStateView sp : stored.players().values()) {
            if (room.isFull()) break;
            PlayerSession p = new PlayerSession(sp.userId(), sp.username(), sp.joinedAt() != null ? sp.joinedAt() : now);
            p.setReady(sp.ready());
            p.setTeamAssignment(sp.teamAssignment());
            p.markDisconnected(now);
            room.addPlayer(p);
            String uid = sp.userId();
            timers.schedule(TimerKey.eviction(gameId, uid), evictionTimeout, () -> evict(gameId, uid, now));
        }
        room.setHostId(stored.hostId());
        room.assignNewHostIfNecessary();
        room.bumpVersion();
        log.info("Room {} hydrated from storage (status={}, host={}, players={})",
                gameId, room.getStatus(), room.getHostId(), room.playerCount());
        return room;
    }

    private static void restoreStatus(RoomSession room, RoomStatus target) {
        for (RoomStatus s : RoomStatus.values()) {
            if (room.getStatus() == target) return;
            room.transitionTo(s);
        }
    }

    /**
     * Runs a persistence write. A failure does not fail the caller: the live change stands, the
     * room is marked as holding unsaved changes and listeners are asked to write it back.
     */
    private void persist(String gameId, String operation, String initiatorUserId, Runnable write) {
        try {
            write.run();
            markDbSynced(gameId, true);
        } catch (PersistenceException e) {
            log.warn("DB sync failed room={} op={}: {}", gameId, operation, e.getMessage());
            RoomSession room = rooms.get(gameId);
            if (room != null) {
                synchronized (room) {
                    room.setDbSynced(false);
                    room.setUnsavedChanges(true);
                }
            }
            if (initiatorUserId != null) {
                registry.connectionOf(initiatorUserId).ifPresent(c -> {
                    Map<String, Object> warning = new LinkedHashMap<>();
                    warning.put("gameId", gameId);
                    warning.put("code", e.getCode());
                    warning.put("message", "database sync failed");
                    warning.put("operation", operation);
                    sendTo(c.id(), LobbyEvents.WARNING, warning);
                });
            }
            for (RoomLifecycleListener l : listeners) {
                try {
                    l.onPersistenceDrift(gameId);
                } catch (RuntimeException ex) {
                    log.error("Drift listener failed for room {}", gameId, ex);
                }
            }
        }
    }

    private void broadcastReconnected(RoomStateView view, PlayerStateView player) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", view.gameId());
        payload.put("playerId", player.userId());
        payload.put("username", player.username());
        payload.put("player", RoomPayloads.player(player));
        payload.put("players", RoomPayloads.players(view));
        payload.put("teams", RoomPayloads.teams(view.teams()));
        payload.put("hostId", view.hostId());
        broadcast(view.gameId(), LobbyEvents.PLAYER_RECONNECTED, payload);
    }

    private void broadcastHostTransferred(String gameId, String previousHost, String newHost, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("gameId", gameId);
        payload.put("previousHostId", previousHost);
        payload.put("newHostId", newHost);
        payload.put("reason", reason);
        broadcast(gameId, LobbyEvents.HOST_TRANSFERRED, payload);
    }

    private void sendSnapshot(String gameId, String connectionId) {
        if (connectionId == null) return;
        RoomSession room = rooms.get(gameId);
        if (room == null) return;
        Map<String, Object> payload;
        synchronized (room) {
            payload = RoomPayloads.room(room.toView(), room.isDbSynced());
            payload.putAll(RoomPayloads.readiness(Readiness.of(room)));
        }
        sendTo(connectionId, LobbyEvents.ROOM_JOINED, payload);
    }

    private void broadcast(String gameId, String event, Map<String, Object> payload) {
        delivery.emit(EventTarget.room(gameId), event, payload, delivery.defaults());
    }

    private void sendTo(String connectionId, String event, Map<String, Object> payload) {
        delivery.emit(EventTarget.connection(connectionId), event, payload, delivery.defaults());
    }

    private RoomSession requireRoom(String gameId) {
        String id = requireGameId(gameId);
        RoomSession room = rooms.get(id);
        if (room == null) throw new RoomNotFoundException(id);
        return room;
    }

    private void requireLive(RoomSession room) {
        if (rooms.get(room.getGameId()) != room) throw new RoomNotFoundException(room.getGameId());
    }

    private static String requireGameId(String gameId) {
        if (gameId == null || gameId.isBlank()) throw new ValidationException("gameId is required");
        return gameId.trim();
    }

    private static PlayerSession requireMember(RoomSession room, String userId) {
        PlayerSession p = room.getPlayer(userId);
        if (p == null) {
            throw new ValidationException("Player " + userId + " is not in room " + room.getGameId(),
                    Map.of("gameId", room.getGameId()));
        }
        return p;
    }

    private static void requireRosterChanges(RoomSession room) {
        if (!room.getStatus().acceptsRosterChanges()) {
            throw new StateException("Room " + room.getGameId() + " no longer accepts changes",
                    Map.of("status", room.getStatus().wireName()));
        }
    }

    private static void requireHost(RoomSession room, String userId, String action) {
        if (!room.isHost(userId)) {
            throw new AuthorizationException("Only the host can " + action, Map.of("hostId", String.valueOf(room.getHostId())));
        }
    }
}
