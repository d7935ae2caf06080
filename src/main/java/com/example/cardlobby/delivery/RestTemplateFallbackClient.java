package com.example.cardlobby.delivery;

import com.example.cardlobby.error.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Maps critical events onto the idempotent REST endpoints of the room service:
 * <ul>
 *   <li>player-ready-changed → POST /api/rooms/{id}/ready</li>
 *   <li>teams-formed → POST /api/rooms/{id}/form-teams</li>
 *   <li>game-starting → POST /api/rooms/{id}/start</li>
 *   <li>player-joined, player-left, state-synchronized → GET /api/rooms/{id}</li>
 * </ul>
 * Calls carry a service bearer token.
 */
public class RestTemplateFallbackClient implements FallbackClient {

    private static final Logger log = LoggerFactory.getLogger(RestTemplateFallbackClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final Supplier<String> serviceToken;

    public RestTemplateFallbackClient(RestTemplate restTemplate, String baseUrl, Supplier<String> serviceToken) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.baseUrl = trimTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.serviceToken = Objects.requireNonNull(serviceToken, "serviceToken");
    }

    @Override
    public void execute(String eventName, Map<String, Object> payload) {
        Object gameId = payload == null ? null : payload.get("gameId");
        if (gameId == null) {
            throw new DeliveryException("Fallback needs a gameId", eventName, null);
        }
        String roomUrl = baseUrl + "/api/rooms/" + gameId;

        switch (eventName) {
            case LobbyEvents.PLAYER_READY_CHANGED -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("userId", payload.get("playerId"));
                body.put("isReady", payload.get("isReady"));
                call(eventName, HttpMethod.POST, roomUrl + "/ready", body);
            }
            case LobbyEvents.TEAMS_FORMED -> {
                Map<String, Object> body = new LinkedHashMap<>();
                if (payload.get("teams") instanceof Map<?, ?> teams) {
                    body.put("team1", teams.get("team1"));
                    body.put("team2", teams.get("team2"));
                }
                call(eventName, HttpMethod.POST, roomUrl + "/form-teams", body);
            }
            case LobbyEvents.GAME_STARTING -> call(eventName, HttpMethod.POST, roomUrl + "/start", Map.of());
            case LobbyEvents.PLAYER_JOINED, LobbyEvents.PLAYER_LEFT, LobbyEvents.STATE_SYNCHRONIZED ->
                    call(eventName, HttpMethod.GET, roomUrl, null);
            default -> throw new DeliveryException("No fallback endpoint for " + eventName, eventName, null);
        }
    }

    private void call(String eventName, HttpMethod method, String url, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(serviceToken.get());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DeliveryException("Fallback " + method + " " + url + " returned " + response.getStatusCode(), eventName, null);
            }
            log.debug("Fallback {} {} ok for {}", method, url, eventName);
        } catch (RestClientException e) {
            throw new DeliveryException("Fallback " + method + " " + url + " failed: " + e.getMessage(), eventName, e);
        }
    }

    private static String trimTrailingSlash(String s) {
        String t = s.trim();
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }
}
