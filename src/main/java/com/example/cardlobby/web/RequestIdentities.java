package com.example.cardlobby.web;

import com.example.cardlobby.error.AuthorizationException;
import com.example.cardlobby.model.Identity;
import com.example.cardlobby.presence.ConnectionRegistry;

/**
 * Bearer token → identity for REST calls. A service identity may act for the user named in
 * the request body; a player always acts as itself.
 */
public class RequestIdentities {

    private final ConnectionRegistry registry;

    public RequestIdentities(ConnectionRegistry registry) {
        this.registry = registry;
    }

    public Identity authenticate(String authorizationHeader) {
        return registry.authenticate(authorizationHeader);
    }

    /** User id the caller acts as; null when a service caller named nobody. */
    public String actingUserId(Identity caller, String requestedUserId) {
        if (!caller.service()) return caller.userId();
        return (requestedUserId == null || requestedUserId.isBlank()) ? null : requestedUserId.trim();
    }

    public void requireService(Identity caller, String action) {
        if (!caller.service()) throw new AuthorizationException("Only the room service may " + action);
    }
}
