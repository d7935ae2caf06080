package com.example.cardlobby.config;

import com.example.cardlobby.delivery.DeliveryReliabilityLayer;
import com.example.cardlobby.delivery.EmitOptions;
import com.example.cardlobby.delivery.EventTransport;
import com.example.cardlobby.delivery.FallbackClient;
import com.example.cardlobby.delivery.RestTemplateFallbackClient;
import com.example.cardlobby.handler.LobbyWebSocketHandler;
import com.example.cardlobby.handler.WebSocketEventTransport;
import com.example.cardlobby.model.Identity;
import com.example.cardlobby.persistence.PersistentRooms;
import com.example.cardlobby.presence.ConnectionRegistry;
import com.example.cardlobby.presence.PresenceService;
import com.example.cardlobby.presence.TokenAuthenticator;
import com.example.cardlobby.reconcile.StateReconciliationEngine;
import com.example.cardlobby.session.RoomSessionStore;
import com.example.cardlobby.timer.KeyedTimers;
import com.example.cardlobby.web.RequestIdentities;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(LobbyProperties.class)
public class LobbyConfig {

  private static final Logger log = LoggerFactory.getLogger(LobbyConfig.class);

  static final String SERVICE_USER = "lobby-service";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // --- presence -------------------------------------------------------------

  @Bean
  public TokenAuthenticator tokenAuthenticator(LobbyProperties props, Clock clock) {
    String secret = props.auth().secret();
    if (secret == null || secret.isBlank()) {
      byte[] raw = new byte[32];
      new SecureRandom().nextBytes(raw);
      secret = Base64.getEncoder().encodeToString(raw);
      log.warn("lobby.auth.secret not set; using a random secret, tokens from other services will be rejected");
    }
    return new TokenAuthenticator(secret, clock);
  }

  @Bean
  public ConnectionRegistry connectionRegistry(TokenAuthenticator authenticator) {
    return new ConnectionRegistry(authenticator);
  }

  @Bean(destroyMethod = "shutdown")
  public KeyedTimers keyedTimers() {
    return new KeyedTimers();
  }

  // --- delivery -------------------------------------------------------------

  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService deliveryScheduler() {
    return Executors.newScheduledThreadPool(4, namedDaemon("lobby-delivery-"));
  }

  @Bean
  public RestTemplate fallbackRestTemplate(LobbyProperties props) {
    SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
    f.setConnectTimeout((int) props.fallback().connectTimeout().toMillis());
    f.setReadTimeout((int) props.fallback().readTimeout().toMillis());
    return new RestTemplate(f);
  }

  @Bean
  public FallbackClient fallbackClient(RestTemplate fallbackRestTemplate, LobbyProperties props,
                                       TokenAuthenticator authenticator) {
    Identity service = Identity.service(SERVICE_USER);
    return new RestTemplateFallbackClient(fallbackRestTemplate, props.fallback().baseUrl(),
        () -> authenticator.issue(service, props.auth().serviceTokenTtl()));
  }

  @Bean
  public EventTransport eventTransport(ConnectionRegistry registry, ObjectMapper mapper) {
    return new WebSocketEventTransport(registry, mapper);
  }

  @Bean
  public DeliveryReliabilityLayer deliveryReliabilityLayer(EventTransport transport, FallbackClient fallbackClient,
                                                           ScheduledExecutorService deliveryScheduler,
                                                           LobbyProperties props, Clock clock) {
    LobbyProperties.Delivery d = props.delivery();
    EmitOptions defaults = new EmitOptions(d.maxRetries(), d.baseDelay(), d.maxDelay(), d.multiplier(),
        false, d.confirmationTimeout());
    return new DeliveryReliabilityLayer(transport, fallbackClient, deliveryScheduler, defaults, d.eventTtl(), clock);
  }

  // --- rooms ----------------------------------------------------------------

  @Bean
  public RoomSessionStore roomSessionStore(ConnectionRegistry registry, PersistentRooms persistentRooms,
                                           KeyedTimers timers, DeliveryReliabilityLayer delivery,
                                           LobbyProperties props, Clock clock) {
    return new RoomSessionStore(registry, persistentRooms, timers, delivery, clock,
        props.presence().evictionTimeout(), props.session().completionGrace(), new Random());
  }

  @Bean
  public PresenceService presenceService(ConnectionRegistry registry, RoomSessionStore store) {
    return new PresenceService(registry, store);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService reconciliationExecutor() {
    return Executors.newFixedThreadPool(2, namedDaemon("lobby-reconcile-"));
  }

  @Bean
  public StateReconciliationEngine stateReconciliationEngine(RoomSessionStore store, PersistentRooms persistentRooms,
                                                             KeyedTimers timers, DeliveryReliabilityLayer delivery,
                                                             ExecutorService reconciliationExecutor,
                                                             LobbyProperties props, Clock clock) {
    LobbyProperties.Reconciliation r = props.reconciliation();
    return new StateReconciliationEngine(store, persistentRooms, timers, delivery, reconciliationExecutor, clock,
        r.enabled(), r.interval(), r.historySize());
  }

  // --- adapters -------------------------------------------------------------

  @Bean
  public RequestIdentities requestIdentities(ConnectionRegistry registry) {
    return new RequestIdentities(registry);
  }

  @Bean
  public LobbyWebSocketHandler lobbyWebSocketHandler(PresenceService presence, RoomSessionStore store,
                                                     DeliveryReliabilityLayer delivery, ObjectMapper mapper) {
    return new LobbyWebSocketHandler(presence, store, delivery, mapper);
  }

  private static ThreadFactory namedDaemon(String prefix) {
    AtomicInteger c = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + c.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
