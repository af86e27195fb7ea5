package com.deepansh.mcpendpoint.auth;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.exception.TokenResolutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Tokens are URL-encoded JSON objects: {@code {"agentId": "my_agent"}}.
 *
 * With endpoint.auth.plain-token-as-agent-id enabled, a token that is not JSON
 * is taken as the agent id itself.
 */
@Component
@Slf4j
public class JsonTokenResolver implements TokenResolver {

    private static final String AGENT_ID_FIELD = "agentId";

    private final ObjectMapper objectMapper;
    private final EndpointProperties properties;

    public JsonTokenResolver(ObjectMapper objectMapper, EndpointProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String resolveAgentId(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenResolutionException("token is required");
        }
        String decoded = decode(token.trim());

        JsonNode node;
        try {
            node = objectMapper.readTree(decoded);
        } catch (JsonProcessingException e) {
            if (properties.getAuth().isPlainTokenAsAgentId()) {
                return decoded;
            }
            throw new TokenResolutionException("token is not valid JSON", e);
        }

        JsonNode agentId = node != null ? node.get(AGENT_ID_FIELD) : null;
        if (agentId == null || !agentId.isTextual() || agentId.asText().isBlank()) {
            throw new TokenResolutionException("token does not carry an agentId");
        }
        return agentId.asText();
    }

    /** Query values may arrive encoded once or twice depending on the client */
    private String decode(String token) {
        if (token.startsWith("{") || !token.contains("%")) {
            return token;
        }
        try {
            return URLDecoder.decode(token, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Token is not URL-encoded, using as-is: {}", e.getMessage());
            return token;
        }
    }
}
