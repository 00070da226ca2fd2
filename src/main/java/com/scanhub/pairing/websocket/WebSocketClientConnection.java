package com.scanhub.pairing.websocket;

import java.io.IOException;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanhub.pairing.model.dto.OutboundEvent;
import com.scanhub.pairing.session.ClientConnection;

/**
 * {@link ClientConnection} over a WebSocket session.
 *
 * The session must be safe for concurrent sends (see
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}).
 */
public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketClientConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(OutboundEvent event) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public String toString() {
        return "WebSocketClientConnection[" + session.getId() + "]";
    }
}
