package com.deepansh.mcpendpoint.registry;

/**
 * Observer of registry mutations. Called with the agent's lock held, so implementations
 * may mutate agent state and queue frames on {@link AgentContext#getOutbox()}, but must not block.
 */
@FunctionalInterface
public interface RegistryListener {

    void onRegistryEvent(AgentContext context, RegistryEvent event);
}
