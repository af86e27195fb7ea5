package com.deepansh.mcpendpoint.registry;

import com.deepansh.mcpendpoint.protocol.ToolDescriptor;
import com.deepansh.mcpendpoint.transport.PeerChannel;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One registered tool-providing connection.
 *
 * Everything except {@link #lastActivity} is guarded by the owning agent's lock.
 */
@Getter
public class ProviderConnection {

    private final String agentId;
    private final String serverId;
    private final PeerChannel channel;
    private final Instant connectedAt;

    private volatile Instant lastActivity;

    /** Latest tools list, in the provider's order */
    private List<ToolDescriptor> tools = List.of();

    /** Monotonic stamp of the last tools update; decides ownership when names collide */
    private long toolsRevision;

    /** serverInfo/capabilities from the provider's initialize result */
    @Setter
    private JsonNode serverInfo;

    /** Ids of requests the relay issued to this provider on its own behalf, mapped to their method */
    private final Map<String, String> bootstrapRequests = new HashMap<>();

    /** Pages of a paginated tools/list collected so far */
    private final List<ToolDescriptor> toolPages = new ArrayList<>();

    public ProviderConnection(String agentId, String serverId, PeerChannel channel, Instant connectedAt) {
        this.agentId = agentId;
        this.serverId = serverId;
        this.channel = channel;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public boolean isLive() {
        return channel.isOpen();
    }

    public void touch() {
        lastActivity = Instant.now();
    }

    public void replaceTools(List<ToolDescriptor> tools, long revision) {
        this.tools = List.copyOf(tools);
        this.toolsRevision = revision;
    }

    public List<String> getToolNames() {
        return tools.stream().map(ToolDescriptor::getName).toList();
    }

    @Override
    public String toString() {
        return "ProviderConnection[" + agentId + "/" + serverId + ", channel=" + channel.getId() + "]";
    }
}
