package com.example.cardlobby.error;

/** A persisted write or read failed; the atomic update it belonged to was rolled back. */
public class PersistenceException extends LobbyException {

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_FAILED", message, null, cause);
    }
}
