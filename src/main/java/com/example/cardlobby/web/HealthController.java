package com.example.cardlobby.web;

import com.example.cardlobby.presence.ConnectionRegistry;
import com.example.cardlobby.session.RoomSessionStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomSessionStore store;
  private final ConnectionRegistry registry;

  @Value("${lobby.persistence.mode:memory}")
  private String persistenceMode;

  public HealthController(RoomSessionStore store, ConnectionRegistry registry) {
    this.store = store;
    this.registry = registry;
  }

  /** Liveness check without touching the database. */
  @GetMapping("/healthz")
  public Map<String, Object> healthz() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "ok");
    m.put("rooms", store.roomCount());
    m.put("connections", registry.connectionCount());
    m.put("persistence", persistenceMode);
    return m;
  }
}
