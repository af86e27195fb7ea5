package com.deepansh.mcpendpoint.transport;

import com.deepansh.mcpendpoint.auth.TokenResolver;
import com.deepansh.mcpendpoint.exception.TokenResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Authenticates the upgrade request before any WebSocket is opened.
 *
 * A missing or unresolvable token answers 401. On the provider endpoint a missing
 * server_id answers 400. Accepted handshakes carry the agent id (and server id)
 * into the session attributes.
 */
@Slf4j
public class EndpointHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_AGENT_ID = "mcpe.agentId";
    public static final String ATTR_SERVER_ID = "mcpe.serverId";

    static final String TOKEN_PARAM = "token";
    static final String SERVER_ID_PARAM = "server_id";

    private final TokenResolver tokenResolver;
    private final boolean serverIdRequired;

    public EndpointHandshakeInterceptor(TokenResolver tokenResolver, boolean serverIdRequired) {
        this.tokenResolver = tokenResolver;
        this.serverIdRequired = serverIdRequired;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams();

        String agentId;
        try {
            agentId = tokenResolver.resolveAgentId(query.getFirst(TOKEN_PARAM));
        } catch (TokenResolutionException e) {
            log.warn("Rejected WebSocket handshake [path={}, remote={}]: {}",
                    request.getURI().getPath(), request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(ATTR_AGENT_ID, agentId);

        if (serverIdRequired) {
            String serverId = decode(query.getFirst(SERVER_ID_PARAM));
            if (serverId == null || serverId.isBlank()) {
                log.warn("Rejected MCP server handshake without server_id [agentId={}]", agentId);
                response.setStatusCode(HttpStatus.BAD_REQUEST);
                return false;
            }
            attributes.put(ATTR_SERVER_ID, serverId.trim());
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake failed [path={}]: {}", request.getURI().getPath(), exception.getMessage());
        }
    }

    private static String decode(String value) {
        if (value == null) return null;
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
