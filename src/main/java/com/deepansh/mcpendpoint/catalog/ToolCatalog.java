package com.deepansh.mcpendpoint.catalog;

import com.deepansh.mcpendpoint.protocol.ToolDescriptor;
import com.deepansh.mcpendpoint.registry.AgentContext;
import com.deepansh.mcpendpoint.registry.ConnectionRegistry;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.deepansh.mcpendpoint.registry.RegistryEvent;
import com.deepansh.mcpendpoint.registry.RegistryListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-agent unified tool namespace: tool name -> owning server_id.
 *
 * Each provider's tools list is authoritative for that provider only and replaces its
 * previous list wholesale. When two providers offer the same name, the one whose list
 * was updated most recently owns it (last-write-wins). If the owner goes away, the name
 * falls back to the most recently updated remaining provider that still offers it.
 *
 * The context-level methods assume the caller holds the agent's lock, i.e. runs inside
 * {@link ConnectionRegistry#withAgent}.
 */
@Component
@Slf4j
public class ToolCatalog implements RegistryListener {

    private final ConnectionRegistry registry;
    private final AtomicLong revisions = new AtomicLong();

    public ToolCatalog(ConnectionRegistry registry) {
        this.registry = registry;
        registry.addListener(this);
    }

    public void updateTools(String agentId, String serverId, List<ToolDescriptor> tools) {
        registry.withExistingAgent(agentId, context -> {
            context.getProvider(serverId).ifPresentOrElse(
                    provider -> updateTools(context, provider, tools),
                    () -> log.warn("Ignoring tools for unknown MCP server [agentId={}, serverId={}]",
                            agentId, serverId));
            return null;
        });
    }

    public void removeOwner(String agentId, String serverId) {
        registry.withExistingAgent(agentId, context -> {
            removeOwner(context, serverId);
            return null;
        });
    }

    public Optional<String> resolve(String agentId, String toolName) {
        return registry.withExistingAgent(agentId, context -> resolve(context, toolName).orElse(null));
    }

    public List<ToolCatalogEntry> listAll(String agentId) {
        return registry.withExistingAgent(agentId, this::listAll).orElse(List.of());
    }

    public void updateTools(AgentContext context, ProviderConnection provider, List<ToolDescriptor> tools) {
        String serverId = provider.getServerId();
        Map<String, String> owners = context.getToolOwners();

        owners.values().removeIf(serverId::equals);
        provider.replaceTools(tools, revisions.incrementAndGet());

        for (ToolDescriptor tool : tools) {
            String previous = owners.put(tool.getName(), serverId);
            if (previous != null && !previous.equals(serverId)) {
                log.warn("Tool name collision, last registration wins [agentId={}, tool={}, owner={}, shadowed={}]",
                        context.getAgentId(), tool.getName(), serverId, previous);
            }
        }
        // names this provider dropped may still be offered by someone else
        reassignOrphans(context, serverId);

        log.info("Tools updated [agentId={}, serverId={}, tools={}, catalogSize={}]",
                context.getAgentId(), serverId, tools.size(), owners.size());
    }

    public void removeOwner(AgentContext context, String serverId) {
        Map<String, String> owners = context.getToolOwners();
        int before = owners.size();
        owners.values().removeIf(serverId::equals);
        int removed = before - owners.size();
        context.getProvider(serverId).ifPresent(p -> p.replaceTools(List.of(), p.getToolsRevision()));
        reassignOrphans(context, serverId);

        log.info("Tools removed [agentId={}, serverId={}, removed={}, catalogSize={}]",
                context.getAgentId(), serverId, removed, owners.size());
    }

    public Optional<String> resolve(AgentContext context, String toolName) {
        return Optional.ofNullable(context.getToolOwners().get(toolName));
    }

    /**
     * Provider registration order, then each provider's own list order. Each name appears once.
     */
    public List<ToolCatalogEntry> listAll(AgentContext context) {
        Map<String, String> owners = context.getToolOwners();
        Set<String> emitted = new HashSet<>();
        List<ToolCatalogEntry> entries = new ArrayList<>();

        for (ProviderConnection provider : context.getProviders()) {
            for (ToolDescriptor tool : provider.getTools()) {
                if (provider.getServerId().equals(owners.get(tool.getName())) && emitted.add(tool.getName())) {
                    entries.add(ToolCatalogEntry.of(provider.getServerId(), tool));
                }
            }
        }
        return entries;
    }

    public int toolCount(AgentContext context) {
        return context.getToolOwners().size();
    }

    @Override
    public void onRegistryEvent(AgentContext context, RegistryEvent event) {
        if (event.type() == RegistryEvent.Type.PROVIDER_REMOVED) {
            removeOwner(context, event.provider().getServerId());
        }
    }

    private void reassignOrphans(AgentContext context, String excludedServerId) {
        Map<String, String> owners = context.getToolOwners();
        List<ProviderConnection> candidates = context.getProviders().stream()
                .filter(p -> !p.getServerId().equals(excludedServerId))
                .sorted(Comparator.comparingLong(ProviderConnection::getToolsRevision).reversed())
                .toList();

        for (ProviderConnection candidate : candidates) {
            for (String name : candidate.getToolNames()) {
                if (!owners.containsKey(name)) {
                    owners.put(name, candidate.getServerId());
                    log.info("Tool ownership fell back [agentId={}, tool={}, owner={}]",
                            context.getAgentId(), name, candidate.getServerId());
                }
            }
        }
    }
}
