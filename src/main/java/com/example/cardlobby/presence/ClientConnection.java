package com.example.cardlobby.presence;

import java.io.IOException;

/** Transport-agnostic handle of one live client connection. */
public interface ClientConnection {

    String id();

    boolean isOpen();

    void send(String text) throws IOException;

    void close(int code, String reason);
}
