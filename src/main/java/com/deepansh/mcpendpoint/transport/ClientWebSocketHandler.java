package com.deepansh.mcpendpoint.transport;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.registry.ClientConnection;
import com.deepansh.mcpendpoint.registry.ConnectionRegistry;
import com.deepansh.mcpendpoint.routing.MessageRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Endpoint for tool callers: /mcp_endpoint/call/?token=...
 */
@Component
@Slf4j
public class ClientWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CONNECTION = "mcpe.client";

    private final ConnectionRegistry registry;
    private final MessageRouter messageRouter;
    private final EndpointProperties properties;

    public ClientWebSocketHandler(ConnectionRegistry registry,
                                  MessageRouter messageRouter,
                                  EndpointProperties properties) {
        this.registry = registry;
        this.messageRouter = messageRouter;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String agentId = (String) session.getAttributes().get(EndpointHandshakeInterceptor.ATTR_AGENT_ID);
        EndpointProperties.WebSocket ws = properties.getWebsocket();
        PeerChannel channel = new WebSocketPeerChannel(session, ws.getSendTimeLimitMs(), ws.getSendBufferSizeLimit());

        ClientConnection client = registry.registerClient(agentId, channel);
        session.getAttributes().put(ATTR_CONNECTION, client);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection client = (ClientConnection) session.getAttributes().get(ATTR_CONNECTION);
        if (client == null) {
            return;
        }
        try {
            messageRouter.onClientMessage(client, message.getPayload());
        } catch (RuntimeException e) {
            log.error("Failed to handle message from client [agentId={}, connection={}]: {}",
                    client.getAgentId(), client.getConnectionId(), e.getMessage(), e);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on client session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection client = (ClientConnection) session.getAttributes().remove(ATTR_CONNECTION);
        if (client != null) {
            registry.unregisterClient(client.getAgentId(), client.getChannel());
            log.debug("Client connection closed [agentId={}, status={}]", client.getAgentId(), status);
        }
    }
}
