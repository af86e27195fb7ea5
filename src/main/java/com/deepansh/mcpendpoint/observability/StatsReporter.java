package com.deepansh.mcpendpoint.observability;

import com.deepansh.mcpendpoint.aggregation.AggregationEngine;
import com.deepansh.mcpendpoint.catalog.ToolCatalog;
import com.deepansh.mcpendpoint.catalog.ToolCatalogEntry;
import com.deepansh.mcpendpoint.registry.AgentContext;
import com.deepansh.mcpendpoint.registry.ConnectionRegistry;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.deepansh.mcpendpoint.registry.RegistryEvent;
import com.deepansh.mcpendpoint.registry.RegistryListener;
import com.deepansh.mcpendpoint.routing.MessageRouter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-only projection of the registry, catalog and pending tables.
 *
 * Each agent is read under its own lock, so one agent's figures are consistent;
 * totals across agents are not a single atomic snapshot.
 */
@Service
public class StatsReporter implements RegistryListener {

    private final ConnectionRegistry registry;
    private final ToolCatalog toolCatalog;
    private final MessageRouter messageRouter;
    private final AggregationEngine aggregationEngine;

    private final AtomicLong providersRegistered = new AtomicLong();
    private final AtomicLong clientsRegistered = new AtomicLong();

    public StatsReporter(ConnectionRegistry registry,
                         ToolCatalog toolCatalog,
                         MessageRouter messageRouter,
                         AggregationEngine aggregationEngine) {
        this.registry = registry;
        this.toolCatalog = toolCatalog;
        this.messageRouter = messageRouter;
        this.aggregationEngine = aggregationEngine;
        registry.addListener(this);
    }

    public ConnectionStats snapshot() {
        int[] providers = {0};
        int[] clients = {0};
        int[] tools = {0};
        Map<String, Map<String, ConnectionStats.ServerToolStats>> details = new TreeMap<>();

        registry.forEachAgent(context -> {
            providers[0] += context.getProviders().size();
            clients[0] += context.getClients().size();
            tools[0] += toolCatalog.toolCount(context);
            if (!context.getProviders().isEmpty()) {
                details.put(context.getAgentId(), describeServers(context));
            }
        });

        return ConnectionStats.builder()
                .providerConnections(providers[0])
                .clientConnections(clients[0])
                .totalConnections(providers[0] + clients[0])
                .agents(new ArrayList<>(details.keySet()))
                .totalTools(tools[0])
                .agentDetails(new LinkedHashMap<>(details))
                .pendingCalls(messageRouter.pendingCallCount())
                .pendingAggregations(aggregationEngine.pendingCount())
                .providersRegisteredTotal(providersRegistered.get())
                .clientsRegisteredTotal(clientsRegistered.get())
                .build();
    }

    @Override
    public void onRegistryEvent(AgentContext context, RegistryEvent event) {
        switch (event.type()) {
            case PROVIDER_ADDED -> providersRegistered.incrementAndGet();
            case CLIENT_ADDED -> clientsRegistered.incrementAndGet();
            default -> {
            }
        }
    }

    /** Tools counted are the ones each server currently owns in the catalog. */
    private Map<String, ConnectionStats.ServerToolStats> describeServers(AgentContext context) {
        Map<String, List<String>> owned = new LinkedHashMap<>();
        for (ProviderConnection provider : context.getProviders()) {
            owned.put(provider.getServerId(), new ArrayList<>());
        }
        for (ToolCatalogEntry entry : toolCatalog.listAll(context)) {
            owned.computeIfAbsent(entry.getServerId(), k -> new ArrayList<>()).add(entry.getToolName());
        }

        Map<String, ConnectionStats.ServerToolStats> servers = new LinkedHashMap<>();
        owned.forEach((serverId, names) ->
                servers.put(serverId, new ConnectionStats.ServerToolStats(names.size(), List.copyOf(names))));
        return servers;
    }
}
