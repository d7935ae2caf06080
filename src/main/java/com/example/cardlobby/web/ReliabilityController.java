package com.example.cardlobby.web;

import com.example.cardlobby.delivery.DeliveryReliabilityLayer;
import com.example.cardlobby.delivery.DeliveryStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/reliability")
public class ReliabilityController {

  private final DeliveryReliabilityLayer delivery;
  private final RequestIdentities identities;

  public ReliabilityController(DeliveryReliabilityLayer delivery, RequestIdentities identities) {
    this.delivery = delivery;
    this.identities = identities;
  }

  @GetMapping("/stats")
  public DeliveryStats stats(@RequestHeader(value = "Authorization", required = false) String auth) {
    identities.authenticate(auth);
    return delivery.getDeliveryStats();
  }

  @PostMapping("/reset-stats")
  public ResponseEntity<Void> resetStats(@RequestHeader(value = "Authorization", required = false) String auth) {
    identities.requireService(identities.authenticate(auth), "reset delivery stats");
    delivery.resetStats();
    return ResponseEntity.noContent().build();
  }
}
