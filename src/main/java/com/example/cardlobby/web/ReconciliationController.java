package com.example.cardlobby.web;

import com.example.cardlobby.reconcile.ReconciliationRecord;
import com.example.cardlobby.reconcile.ReconciliationStats;
import com.example.cardlobby.reconcile.StateReconciliationEngine;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

  private final StateReconciliationEngine engine;
  private final RequestIdentities identities;

  public ReconciliationController(StateReconciliationEngine engine, RequestIdentities identities) {
    this.engine = engine;
    this.identities = identities;
  }

  @GetMapping("/stats")
  public ReconciliationStats stats(@RequestHeader(value = "Authorization", required = false) String auth) {
    identities.authenticate(auth);
    return engine.getReconciliationStats();
  }

  @GetMapping("/{gameId}/history")
  public List<ReconciliationRecord> history(@RequestHeader(value = "Authorization", required = false) String auth,
                                            @PathVariable String gameId) {
    identities.authenticate(auth);
    return engine.getHistory(gameId);
  }

  @DeleteMapping("/{gameId}/history")
  public void clearHistory(@RequestHeader(value = "Authorization", required = false) String auth,
                           @PathVariable String gameId) {
    identities.requireService(identities.authenticate(auth), "clear reconciliation history");
    engine.clearHistory(gameId);
  }
}
