package com.deepansh.mcpendpoint.transport;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.exception.DuplicateServerIdException;
import com.deepansh.mcpendpoint.registry.ConnectionRegistry;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.deepansh.mcpendpoint.routing.MessageRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Endpoint for MCP servers: /mcp_endpoint/mcp/?token=...&server_id=...
 */
@Component
@Slf4j
public class ProviderWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CONNECTION = "mcpe.provider";

    private final ConnectionRegistry registry;
    private final MessageRouter messageRouter;
    private final EndpointProperties properties;

    public ProviderWebSocketHandler(ConnectionRegistry registry,
                                    MessageRouter messageRouter,
                                    EndpointProperties properties) {
        this.registry = registry;
        this.messageRouter = messageRouter;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String agentId = (String) session.getAttributes().get(EndpointHandshakeInterceptor.ATTR_AGENT_ID);
        String serverId = (String) session.getAttributes().get(EndpointHandshakeInterceptor.ATTR_SERVER_ID);
        EndpointProperties.WebSocket ws = properties.getWebsocket();
        PeerChannel channel = new WebSocketPeerChannel(session, ws.getSendTimeLimitMs(), ws.getSendBufferSizeLimit());

        try {
            ProviderConnection provider = registry.registerProvider(agentId, serverId, channel);
            session.getAttributes().put(ATTR_CONNECTION, provider);
        } catch (DuplicateServerIdException e) {
            log.warn("Refusing MCP server connection: {}", e.getMessage());
            channel.close(ConnectionRegistry.CLOSE_POLICY_VIOLATION, "Duplicate server_id");
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ProviderConnection provider = (ProviderConnection) session.getAttributes().get(ATTR_CONNECTION);
        if (provider == null) {
            return;
        }
        try {
            messageRouter.onProviderMessage(provider, message.getPayload());
        } catch (RuntimeException e) {
            log.error("Failed to handle message from MCP server [agentId={}, serverId={}]: {}",
                    provider.getAgentId(), provider.getServerId(), e.getMessage(), e);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on MCP server session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ProviderConnection provider = (ProviderConnection) session.getAttributes().remove(ATTR_CONNECTION);
        if (provider == null) {
            return;
        }
        boolean removed = registry.unregisterProvider(provider.getAgentId(), provider.getServerId(), provider.getChannel());
        log.info("MCP server connection closed [agentId={}, serverId={}, status={}, removed={}]",
                provider.getAgentId(), provider.getServerId(), status, removed);
    }
}
