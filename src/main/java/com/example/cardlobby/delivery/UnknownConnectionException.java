package com.example.cardlobby.delivery;

import java.io.IOException;

/** The target connection is not registered; delivery fails without retry. */
public class UnknownConnectionException extends IOException {

    public UnknownConnectionException(String connectionId) {
        super("Connection " + connectionId + " not found");
    }
}
