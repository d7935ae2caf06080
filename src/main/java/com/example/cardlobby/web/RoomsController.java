package com.example.cardlobby.web;

import com.example.cardlobby.error.ValidationException;
import com.example.cardlobby.model.Identity;
import com.example.cardlobby.model.RoomSession;
import com.example.cardlobby.model.RoomStateView;
import com.example.cardlobby.model.Teams;
import com.example.cardlobby.reconcile.StateReconciliationEngine;
import com.example.cardlobby.session.Readiness;
import com.example.cardlobby.session.RoomPayloads;
import com.example.cardlobby.session.RoomSessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP equivalents of the real-time room actions. All mutations are idempotent so the
 * delivery fallback can repeat them safely.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomsController {

  private final RoomSessionStore store;
  private final StateReconciliationEngine engine;
  private final RequestIdentities identities;

  public RoomsController(RoomSessionStore store, StateReconciliationEngine engine, RequestIdentities identities) {
    this.store = store;
    this.engine = engine;
    this.identities = identities;
  }

  // --- Get -----------------------------------------------------------------

  @GetMapping("/{gameId}")
  public ResponseEntity<?> get(@RequestHeader(value = "Authorization", required = false) String auth,
                               @PathVariable String gameId) {
    identities.authenticate(auth);
    return store.getRoom(gameId)
        .<ResponseEntity<?>>map(room -> ResponseEntity.ok(snapshot(room)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  // --- Ready / Teams / Start -----------------------------------------------

  @PostMapping("/{gameId}/ready")
  public Map<String, Object> ready(@RequestHeader(value = "Authorization", required = false) String auth,
                                   @PathVariable String gameId,
                                   @RequestBody ReadyRequest body) {
    Identity caller = identities.authenticate(auth);
    if (body == null || body.isReady == null) throw new ValidationException("isReady is required");
    String userId = identities.actingUserId(caller, body.userId);
    if (userId == null) throw new ValidationException("userId is required for service calls");

    Readiness r = store.setReady(gameId, userId, body.isReady);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("gameId", gameId);
    out.put("playerId", userId);
    out.put("isReady", body.isReady);
    out.putAll(RoomPayloads.readiness(r));
    out.put("dbSynced", store.isDbSynced(gameId));
    return out;
  }

  @PostMapping("/{gameId}/form-teams")
  public Map<String, Object> formTeams(@RequestHeader(value = "Authorization", required = false) String auth,
                                       @PathVariable String gameId,
                                       @RequestBody(required = false) TeamsRequest body) {
    Identity caller = identities.authenticate(auth);
    String requester = requesterOrHost(caller, gameId, body == null ? null : body.userId);

    Teams teams = (body != null && body.team1 != null && body.team2 != null)
        ? store.applyTeams(gameId, requester, body.team1, body.team2)
        : store.formTeams(gameId, requester);

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("gameId", gameId);
    out.put("teams", RoomPayloads.teams(teams));
    return out;
  }

  @PostMapping("/{gameId}/start")
  public Map<String, Object> start(@RequestHeader(value = "Authorization", required = false) String auth,
                                   @PathVariable String gameId,
                                   @RequestBody(required = false) UserRequest body) {
    Identity caller = identities.authenticate(auth);
    RoomStateView view = caller.service()
        ? store.startGame(gameId, requesterOrHost(caller, gameId, body == null ? null : body.userId), true)
        : store.startGame(gameId, caller.userId());
    return RoomPayloads.room(view, store.isDbSynced(gameId));
  }

  @PostMapping("/{gameId}/complete")
  public Map<String, Object> complete(@RequestHeader(value = "Authorization", required = false) String auth,
                                      @PathVariable String gameId) {
    Identity caller = identities.authenticate(auth);
    identities.requireService(caller, "complete a game");
    return RoomPayloads.room(store.completeGame(gameId), store.isDbSynced(gameId));
  }

  // --- Reconcile -----------------------------------------------------------

  @PostMapping("/{gameId}/reconcile")
  public ResponseEntity<?> reconcile(@RequestHeader(value = "Authorization", required = false) String auth,
                                     @PathVariable String gameId) {
    identities.authenticate(auth);
    if (store.getRoom(gameId).isEmpty()) return ResponseEntity.notFound().build();

    RoomStateView resolved = engine.reconcileRoomState(gameId);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("gameId", gameId);
    out.put("reconciled", resolved != null);
    if (resolved != null) out.put("room", RoomPayloads.room(resolved, store.isDbSynced(gameId)));
    return ResponseEntity.ok(out);
  }

  // ===== helpers ==========================================================

  private String requesterOrHost(Identity caller, String gameId, String requested) {
    String userId = identities.actingUserId(caller, requested);
    if (userId != null) return userId;
    // service caller acting for the room itself
    return store.snapshot(gameId).map(RoomStateView::hostId).orElse(null);
  }

  private static Map<String, Object> snapshot(RoomSession room) {
    synchronized (room) {
      Map<String, Object> out = RoomPayloads.room(room.toView(), room.isDbSynced());
      out.putAll(RoomPayloads.readiness(Readiness.of(room)));
      return out;
    }
  }

  // ===== DTOs (Requests) ==================================================

  /** POST ready body */
  public static final class ReadyRequest {
    public String  userId;
    public Boolean isReady;
  }

  /** POST form-teams body; without teams the host's random split is used */
  public static final class TeamsRequest {
    public String       userId;
    public List<String> team1;
    public List<String> team2;
  }

  public static final class UserRequest {
    public String userId;
  }
}
