package com.deepansh.mcpendpoint.registry;

import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All state of one tenant: its providers, its clients and the tool ownership table.
 *
 * Every read and write goes through {@link ConnectionRegistry#withAgent}, which holds
 * {@link #lock} for the duration. A context is retired once reaped and never touched again.
 */
public class AgentContext {

    @Getter
    private final String agentId;

    final ReentrantLock lock = new ReentrantLock();
    boolean retired;

    /** Insertion order is registration order */
    private final Map<String, ProviderConnection> providers = new LinkedHashMap<>();
    private final Map<String, ClientConnection> clients = new LinkedHashMap<>();

    /** tool name -> owning server_id */
    private final Map<String, String> toolOwners = new LinkedHashMap<>();

    @Getter
    private final Outbox outbox = new Outbox();

    AgentContext(String agentId) {
        this.agentId = agentId;
    }

    public Optional<ProviderConnection> getProvider(String serverId) {
        return Optional.ofNullable(providers.get(serverId));
    }

    /** Providers in registration order */
    public Collection<ProviderConnection> getProviders() {
        return Collections.unmodifiableCollection(providers.values());
    }

    public List<ProviderConnection> getLiveProviders() {
        return providers.values().stream().filter(ProviderConnection::isLive).toList();
    }

    public Collection<ClientConnection> getClients() {
        return Collections.unmodifiableCollection(clients.values());
    }

    /** False once the provider has been superseded or removed. */
    public boolean isCurrent(ProviderConnection provider) {
        return providers.get(provider.getServerId()) == provider;
    }

    public boolean hasClient(ClientConnection client) {
        return clients.get(client.getConnectionId()) == client;
    }

    /** Ownership table of the unified tool namespace. Mutated by the tool catalog only. */
    public Map<String, String> getToolOwners() {
        return toolOwners;
    }

    public boolean isEmpty() {
        return providers.isEmpty() && clients.isEmpty();
    }

    void putProvider(ProviderConnection provider) {
        providers.put(provider.getServerId(), provider);
    }

    void removeProvider(ProviderConnection provider) {
        providers.remove(provider.getServerId(), provider);
    }

    void putClient(ClientConnection client) {
        clients.put(client.getConnectionId(), client);
    }

    ClientConnection removeClient(String connectionId) {
        return clients.remove(connectionId);
    }
}
