package com.deepansh.mcpendpoint.registry;

/**
 * Presence change, published while the agent's lock is still held.
 * Exactly one of {@code provider} and {@code client} is set.
 */
public record RegistryEvent(
        Type type,
        String agentId,
        ProviderConnection provider,
        ClientConnection client
) {

    public enum Type {
        PROVIDER_ADDED, PROVIDER_REMOVED, CLIENT_ADDED, CLIENT_REMOVED
    }

    public static RegistryEvent providerAdded(ProviderConnection provider) {
        return new RegistryEvent(Type.PROVIDER_ADDED, provider.getAgentId(), provider, null);
    }

    public static RegistryEvent providerRemoved(ProviderConnection provider) {
        return new RegistryEvent(Type.PROVIDER_REMOVED, provider.getAgentId(), provider, null);
    }

    public static RegistryEvent clientAdded(ClientConnection client) {
        return new RegistryEvent(Type.CLIENT_ADDED, client.getAgentId(), null, client);
    }

    public static RegistryEvent clientRemoved(ClientConnection client) {
        return new RegistryEvent(Type.CLIENT_REMOVED, client.getAgentId(), null, client);
    }
}
