package com.deepansh.mcpendpoint.registry;

import com.deepansh.mcpendpoint.transport.PeerChannel;
import lombok.Getter;

import java.time.Instant;

/**
 * One connected client bound to an agent. Many may exist per agent.
 */
@Getter
public class ClientConnection {

    private final String agentId;
    private final PeerChannel channel;
    private final Instant connectedAt;

    private volatile Instant lastActivity;

    public ClientConnection(String agentId, PeerChannel channel, Instant connectedAt) {
        this.agentId = agentId;
        this.channel = channel;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public String getConnectionId() {
        return channel.getId();
    }

    public void touch() {
        lastActivity = Instant.now();
    }

    @Override
    public String toString() {
        return "ClientConnection[" + agentId + ", channel=" + channel.getId() + "]";
    }
}
