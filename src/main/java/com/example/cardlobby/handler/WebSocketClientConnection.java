package com.example.cardlobby.handler;

import com.example.cardlobby.presence.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/** {@link ClientConnection} over a Spring WebSocket session; sends are serialized by the decorator. */
public class WebSocketClientConnection implements ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketClientConnection(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) throw new IOException("Connection " + session.getId() + " is closed");
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(int code, String reason) {
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("WS close failed sid={}: {}", session.getId(), e.toString());
        }
    }
}
