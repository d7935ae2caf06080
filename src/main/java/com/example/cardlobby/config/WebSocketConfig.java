package com.example.cardlobby.config;

import com.example.cardlobby.handler.LobbyWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Mounts the lobby socket; the handshake token is checked by the handler itself. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final LobbyWebSocketHandler lobbyHandler;
  private final String lobbyPath;
  private final List<String> allowedOrigins;

  public WebSocketConfig(
      LobbyWebSocketHandler lobbyHandler,
      @Value("${app.websocket.path:/lobby}") String lobbyPath,
      @Value("${app.websocket.allowed-origins:http://localhost:8080}") String allowedOriginsCsv
  ) {
    this.lobbyHandler = lobbyHandler;
    this.lobbyPath = lobbyPath;
    this.allowedOrigins = originPatterns(allowedOriginsCsv);
  }

  /**
   * Comma separated origins to Spring origin patterns. A local dev origin also admits
   * any port on localhost and 127.0.0.1; an empty list admits everything.
   */
  static List<String> originPatterns(String csv) {
    Set<String> patterns = new LinkedHashSet<>();
    if (csv != null) {
      for (String raw : csv.split(",")) {
        String origin = raw.trim();
        if (origin.isEmpty()) continue;
        patterns.add(origin);
        if (origin.startsWith("http://localhost") || origin.startsWith("http://127.0.0.1")) {
          patterns.add("http://localhost:*");
          patterns.add("http://127.0.0.1:*");
        }
      }
    }
    return patterns.isEmpty() ? List.of("*") : List.copyOf(patterns);
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(lobbyHandler, lobbyPath)
            .setAllowedOriginPatterns(allowedOrigins.toArray(String[]::new));
  }
}
