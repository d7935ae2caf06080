package com.example.cardlobby.reconcile;

import com.example.cardlobby.delivery.DeliveryReliabilityLayer;
import com.example.cardlobby.delivery.EventTarget;
import com.example.cardlobby.delivery.LobbyEvents;
import com.example.cardlobby.error.PersistenceException;
import com.example.cardlobby.model.PlayerStateView;
import com.example.cardlobby.model.RoomStateView;
import com.example.cardlobby.model.RoomStatus;
import com.example.cardlobby.persistence.PersistentRooms;
import com.example.cardlobby.persistence.StateUpdate;
import com.example.cardlobby.session.RoomLifecycleListener;
import com.example.cardlobby.session.RoomPayloads;
import com.example.cardlobby.session.RoomSessionStore;
import com.example.cardlobby.timer.KeyedTimers;
import com.example.cardlobby.timer.TimerHandle;
import com.example.cardlobby.timer.TimerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Detects and resolves divergence between a live room and its persisted record.
 *
 * Persisted state wins for host, membership, ready flags and teams; live state wins for
 * connection flags. A room whose own writes failed holds changes storage never saw; for it a
 * run writes the live state back instead. At most one run per room is in flight; a concurrent
 * request returns null.
 */
public class StateReconciliationEngine implements RoomLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(StateReconciliationEngine.class);

    private final RoomSessionStore store;
    private final PersistentRooms persistence;
    private final KeyedTimers timers;
    private final DeliveryReliabilityLayer delivery;
    private final Executor executor;
    private final Clock clock;
    private final boolean periodicEnabled;
    private final Duration interval;
    private final int historySize;

    private final Set<String> inProgress = ConcurrentHashMap.newKeySet();
    private final Map<String, Deque<ReconciliationRecord>> history = new ConcurrentHashMap<>();
    private final Set<String> roomsTouched = ConcurrentHashMap.newKeySet();
    private final Map<InconsistencyType, ResolutionStrategy> strategies = new ConcurrentHashMap<>();

    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong totalInconsistencies = new AtomicLong();
    private final Map<InconsistencyType, AtomicLong> typeCounts = new ConcurrentHashMap<>();

    public StateReconciliationEngine(RoomSessionStore store,
                                     PersistentRooms persistence,
                                     KeyedTimers timers,
                                     DeliveryReliabilityLayer delivery,
                                     Executor executor,
                                     Clock clock,
                                     boolean periodicEnabled,
                                     Duration interval,
                                     int historySize) {
        this.store = Objects.requireNonNull(store, "store");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.periodicEnabled = periodicEnabled;
        this.interval = (interval == null) ? Duration.ofSeconds(30) : interval;
        this.historySize = Math.max(1, historySize);
        registerDefaultStrategies();
        store.addLifecycleListener(this);
    }

    private void registerDefaultStrategies() {
        strategies.put(InconsistencyType.HOST_MISMATCH,
                (resolved, i, persisted, live) -> resolved.withHost(persisted.hostId()));

        strategies.put(InconsistencyType.PLAYER_MISSING, (resolved, i, persisted, live) -> {
            PlayerStateView stored = persisted.player(i.playerId());
            if (stored == null) return resolved.withoutPlayer(i.playerId());
            return resolved.withPlayer(stored.withConnected(false));
        });

        strategies.put(InconsistencyType.READY_STATUS_MISMATCH, (resolved, i, persisted, live) -> {
            PlayerStateView p = resolved.player(i.playerId());
            PlayerStateView stored = persisted.player(i.playerId());
            return (p == null || stored == null) ? resolved : resolved.withPlayer(p.withReady(stored.ready()));
        });

        strategies.put(InconsistencyType.TEAM_ASSIGNMENT_CONFLICT, (resolved, i, persisted, live) -> {
            PlayerStateView p = resolved.player(i.playerId());
            PlayerStateView stored = persisted.player(i.playerId());
            return (p == null || stored == null) ? resolved : resolved.withPlayer(p.withTeam(stored.teamAssignment()));
        });

        strategies.put(InconsistencyType.CONNECTION_STATUS_MISMATCH, (resolved, i, persisted, live) -> {
            PlayerStateView p = resolved.player(i.playerId());
            PlayerStateView current = live.player(i.playerId());
            return (p == null || current == null) ? resolved : resolved.withPlayer(p.withConnected(current.connected()));
        });
    }

    public void registerStrategy(InconsistencyType type, ResolutionStrategy strategy) {
        strategies.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(strategy, "strategy"));
    }

    /** Removes the strategy; inconsistencies of that type are then logged and left alone. */
    public void unregisterStrategy(InconsistencyType type) {
        strategies.remove(type);
    }

    // ========================================================================
    //  DETECTION / RESOLUTION
    // ========================================================================

    public List<Inconsistency> detectInconsistencies(RoomStateView live, RoomStateView persisted, String gameId) {
        if (live == null || persisted == null) return List.of();
        Instant now = clock.instant();
        List<Inconsistency> out = new ArrayList<>();

        if (!Objects.equals(live.hostId(), persisted.hostId())) {
            out.add(Inconsistency.of(InconsistencyType.HOST_MISMATCH, gameId, null, live.hostId(), persisted.hostId(), now));
        }

        Set<String> ids = new LinkedHashSet<>(persisted.players().keySet());
        ids.addAll(live.players().keySet());
        for (String userId : ids) {
            PlayerStateView lp = live.player(userId);
            PlayerStateView pp = persisted.player(userId);
            if (lp == null || pp == null) {
                out.add(Inconsistency.of(InconsistencyType.PLAYER_MISSING, gameId, userId, lp != null, pp != null, now));
                continue;
            }
            if (lp.ready() != pp.ready()) {
                out.add(Inconsistency.of(InconsistencyType.READY_STATUS_MISMATCH, gameId, userId, lp.ready(), pp.ready(), now));
            }
            if (lp.teamAssignment() != pp.teamAssignment()) {
                out.add(Inconsistency.of(InconsistencyType.TEAM_ASSIGNMENT_CONFLICT, gameId, userId,
                        lp.teamAssignment(), pp.teamAssignment(), now));
            }
            if (lp.connected() != pp.connected()) {
                out.add(Inconsistency.of(InconsistencyType.CONNECTION_STATUS_MISMATCH, gameId, userId,
                        lp.connected(), pp.connected(), now));
            }
        }
        return out;
    }

    /**
     * Starts from the persisted state and applies one strategy per inconsistency, most severe
     * first. The result carries the live version and status.
     */
    public RoomStateView resolveConflicts(List<Inconsistency> inconsistencies, RoomStateView persisted, RoomStateView live) {
        RoomStateView resolved = new RoomStateView(persisted.gameId(), live.status(), persisted.hostId(),
                persisted.players(), live.version());

        List<Inconsistency> ordered = new ArrayList<>(inconsistencies);
        ordered.sort(Inconsistency.BY_SEVERITY_DESC);
        for (Inconsistency i : ordered) {
            ResolutionStrategy strategy = strategies.get(i.type());
            if (strategy == null) {
                log.warn("No resolution strategy for {} in room {}; keeping live value", i.type(), i.gameId());
                resolved = keepLive(resolved, i, live);
                continue;
            }
            resolved = strategy.resolve(resolved, i, persisted, live);
        }
        return resolved;
    }

    private static RoomStateView keepLive(RoomStateView resolved, Inconsistency i, RoomStateView live) {
        if (i.type() == InconsistencyType.HOST_MISMATCH) return resolved.withHost(live.hostId());
        PlayerStateView lp = (i.playerId() == null) ? null : live.player(i.playerId());
        if (lp == null) return (i.playerId() == null) ? resolved : resolved.withoutPlayer(i.playerId());
        return resolved.withPlayer(lp);
    }

    /** Persists the changes under the room's row lock; a failure rolls back and propagates. */
    public RoomStateView atomicStateUpdate(String gameId, StateUpdate updates) {
        return persistence.applyAtomically(gameId, updates);
    }

    // ========================================================================
    //  RECONCILIATION RUN
    // ========================================================================

    public RoomStateView reconcileRoomState(String gameId) {
        return reconcileRoomState(gameId, null);
    }

    /**
     * @return the resolved state, or null if a run for the room is already in flight, the room
     *         is not live, or no persisted record exists
     */
    public RoomStateView reconcileRoomState(String gameId, RoomStateView liveState) {
        if (gameId == null) return null;
        if (!inProgress.add(gameId)) {
            log.debug("Reconciliation already running for room {}", gameId);
            return null;
        }
        try {
            RoomStateView live = (liveState != null) ? liveState : store.liveView(gameId);
            if (live == null) return null;

            Optional<RoomStateView> stored;
            try {
                stored = persistence.findById(gameId);
            } catch (PersistenceException e) {
                log.warn("Reconciliation of room {} skipped, load failed: {}", gameId, e.getMessage());
                return null;
            }
            if (store.hasUnsavedChanges(gameId)) {
                return writeBackLive(gameId, live, stored.orElse(null));
            }
            if (stored.isEmpty()) {
                log.debug("Room {} has no persisted record, nothing to reconcile", gameId);
                return null;
            }
            RoomStateView persisted = stored.get();

            List<Inconsistency> found = detectInconsistencies(live, persisted, gameId);
            if (found.isEmpty()) {
                store.markDbSynced(gameId, true);
                record(gameId, found, live, false, true);
                return live;
            }

            RoomStateView resolved = resolveConflicts(found, persisted, live);
            boolean written = persistResolved(gameId, persisted, resolved);
            boolean changed = store.applyReconciledState(gameId, resolved);

            log.info("Reconciled room {}: {} inconsistency(ies) {}, liveChanged={}, persisted={}",
                    gameId, found.size(), countByType(found).keySet(), changed, written);
            if (changed) broadcastSynchronized(gameId, found);
            record(gameId, found, resolved, changed, written);
            return resolved;
        } finally {
            inProgress.remove(gameId);
        }
    }

    /**
     * Stores the live view as it is, creating the record if the write that failed was its
     * first. Live state is not touched; on failure the room stays out of sync for the next run.
     */
    private RoomStateView writeBackLive(String gameId, RoomStateView live, RoomStateView persisted) {
        List<Inconsistency> found = detectInconsistencies(live, persisted, gameId);
        boolean written = false;
        try {
            if (persisted == null) {
                for (PlayerStateView p : live.players().values()) persistence.addPlayer(gameId, p, live.hostId());
                if (live.status() != RoomStatus.WAITING) persistence.updateStatus(gameId, live.status());
            } else {
                StateUpdate update = StateUpdate.diff(persisted, live);
                if (!update.isEmpty()) atomicStateUpdate(gameId, update);
            }
            written = store.markSaved(gameId, live.version());
            log.info("Room {} written back from live state ({} difference(s)), inSync={}", gameId, found.size(), written);
        } catch (PersistenceException e) {
            log.warn("Write-back of room {} failed, still out of sync: {}", gameId, e.getMessage());
        }
        record(gameId, found, live, false, written);
        return live;
    }

    private boolean persistResolved(String gameId, RoomStateView persisted, RoomStateView resolved) {
        StateUpdate update = StateUpdate.diff(persisted, resolved);
        if (update.isEmpty()) {
            store.markDbSynced(gameId, true);
            return true;
        }
        try {
            atomicStateUpdate(gameId, update);
            store.markDbSynced(gameId, true);
            return true;
        } catch (PersistenceException e) {
            log.warn("Reconciliation write for room {} failed: {}", gameId, e.getMessage());
            store.markDbSynced(gameId, false);
            Map<String, Object> warning = new LinkedHashMap<>();
            warning.put("gameId", gameId);
            warning.put("code", e.getCode());
            warning.put("message", "database sync failed");
            warning.put("operation", "reconcile");
            delivery.emit(EventTarget.room(gameId), LobbyEvents.WARNING, warning, delivery.defaults());
            return false;
        }
    }

    private void broadcastSynchronized(String gameId, List<Inconsistency> found) {
        store.getRoom(gameId).ifPresent(room -> {
            Map<String, Object> payload;
            synchronized (room) {
                payload = RoomPayloads.room(room.toView(), room.isDbSynced());
            }
            payload.put("inconsistencies", found.size());
            payload.put("resolvedTypes", new ArrayList<>(countByType(found).keySet()));
            payload.put("resolvedAt", clock.instant().toString());
            delivery.emit(EventTarget.room(gameId), LobbyEvents.STATE_SYNCHRONIZED, payload, delivery.defaults());
        });
    }

    private void record(String gameId, List<Inconsistency> found, RoomStateView result, boolean changed, boolean written) {
        Map<InconsistencyType, Integer> byType = countByType(found);
        ReconciliationRecord entry = new ReconciliationRecord(gameId, clock.instant(), found.size(), byType,
                result.playerCount(), result.hostId(), result.status(), changed, written);

        roomsTouched.add(gameId);
        Deque<ReconciliationRecord> deque = history.computeIfAbsent(gameId, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(entry);
            while (deque.size() > historySize) deque.removeFirst();
        }
        totalRuns.incrementAndGet();
        totalInconsistencies.addAndGet(found.size());
        byType.forEach((t, n) -> typeCounts.computeIfAbsent(t, k -> new AtomicLong()).addAndGet(n));
    }

    private static Map<InconsistencyType, Integer> countByType(List<Inconsistency> found) {
        Map<InconsistencyType, Integer> out = new EnumMap<>(InconsistencyType.class);
        for (Inconsistency i : found) out.merge(i.type(), 1, Integer::sum);
        return out;
    }

    // ========================================================================
    //  SCHEDULING / LIFECYCLE
    // ========================================================================

    public TimerHandle schedulePeriodicReconciliation(String gameId, Duration every) {
        log.debug("Periodic reconciliation for room {} every {}s", gameId, every.toSeconds());
        return timers.scheduleAtFixedRate(TimerKey.reconciliation(gameId), every, () -> reconcileRoomState(gameId));
    }

    @Override
    public void onRoomCreated(String gameId) {
        if (periodicEnabled) schedulePeriodicReconciliation(gameId, interval);
    }

    @Override
    public void onRoomTornDown(String gameId) {
        clearHistory(gameId);
    }

    /** Writes the room's live state back; the failed change is not reverted. */
    @Override
    public void onPersistenceDrift(String gameId) {
        try {
            executor.execute(() -> {
                try {
                    reconcileRoomState(gameId);
                } catch (RuntimeException e) {
                    log.error("Drift reconciliation of room {} failed", gameId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Drift reconciliation of room {} not scheduled: {}", gameId, e.toString());
        }
    }

    // ========================================================================
    //  HISTORY / STATS
    // ========================================================================

    public List<ReconciliationRecord> getHistory(String gameId) {
        Deque<ReconciliationRecord> deque = history.get(gameId);
        if (deque == null) return List.of();
        synchronized (deque) {
            return List.copyOf(deque);
        }
    }

    public void clearHistory(String gameId) {
        history.remove(gameId);
    }

    public boolean isInProgress(String gameId) {
        return inProgress.contains(gameId);
    }

    public ReconciliationStats getReconciliationStats() {
        long runs = totalRuns.get();
        Map<InconsistencyType, Long> histogram = new EnumMap<>(InconsistencyType.class);
        typeCounts.forEach((t, n) -> histogram.put(t, n.get()));
        double avg = runs == 0 ? 0.0 : (double) totalInconsistencies.get() / runs;
        return new ReconciliationStats(runs, roomsTouched.size(), inProgress.size(), histogram, avg);
    }
}
