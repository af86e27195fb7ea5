package com.deepansh.mcpendpoint.observability;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the relay, rendered by the health endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionStats {

    @JsonProperty("provider_connections")
    private int providerConnections;

    @JsonProperty("client_connections")
    private int clientConnections;

    @JsonProperty("total_connections")
    private int totalConnections;

    /** Agents with at least one live MCP server */
    @JsonProperty("agents")
    @Builder.Default
    private List<String> agents = new ArrayList<>();

    @JsonProperty("total_tools")
    private int totalTools;

    /** agentId -> serverId -> tools */
    @JsonProperty("agent_details")
    @Builder.Default
    private Map<String, Map<String, ServerToolStats>> agentDetails = new LinkedHashMap<>();

    @JsonProperty("pending_calls")
    private int pendingCalls;

    @JsonProperty("pending_aggregations")
    private int pendingAggregations;

    @JsonProperty("providers_registered_total")
    private long providersRegisteredTotal;

    @JsonProperty("clients_registered_total")
    private long clientsRegisteredTotal;

    public record ServerToolStats(
            @JsonProperty("tool_count") int toolCount,
            @JsonProperty("tool_names") List<String> toolNames
    ) {}
}
