package com.deepansh.mcpendpoint.auth;

import com.deepansh.mcpendpoint.exception.TokenResolutionException;

/**
 * Turns the token presented on a WebSocket handshake into the agent id it grants access to.
 */
public interface TokenResolver {

    /**
     * @throws TokenResolutionException if the token is missing, malformed or names no agent
     */
    String resolveAgentId(String token);
}
