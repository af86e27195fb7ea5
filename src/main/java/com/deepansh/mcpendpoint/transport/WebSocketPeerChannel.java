package com.deepansh.mcpendpoint.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link PeerChannel} over a Spring WebSocket session.
 *
 * Sends go through a {@link ConcurrentWebSocketSessionDecorator} so that concurrent
 * relays to the same peer are serialized and a slow peer is cut off once its
 * buffer or time limit is exceeded, instead of stalling the sender.
 */
@Slf4j
public class WebSocketPeerChannel implements PeerChannel {

    private final WebSocketSession session;

    public WebSocketPeerChannel(WebSocketSession session, int sendTimeLimitMs, int sendBufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (SessionLimitExceededException | IllegalStateException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("Failed to close WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketPeerChannel[" + session.getId() + "]";
    }
}
