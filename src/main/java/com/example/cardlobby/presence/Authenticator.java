package com.example.cardlobby.presence;

import com.example.cardlobby.error.AuthenticationException;
import com.example.cardlobby.model.Identity;

/** Resolves a credential presented at handshake (or in an Authorization header) to an identity. */
public interface Authenticator {

    Identity authenticate(String credential) throws AuthenticationException;
}
