package com.deepansh.mcpendpoint.exception;

import lombok.Getter;

/**
 * Raised when a provider registers a server_id that is already live under the same
 * agent and the registry is configured to reject rather than supersede.
 */
@Getter
public class DuplicateServerIdException extends BrokerException {

    private final String agentId;
    private final String serverId;

    public DuplicateServerIdException(String agentId, String serverId) {
        super(String.format("MCP server '%s' is already connected for agent '%s'", serverId, agentId));
        this.agentId = agentId;
        this.serverId = serverId;
    }
}
