package com.deepansh.mcpendpoint.registry;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.exception.DuplicateServerIdException;
import com.deepansh.mcpendpoint.transport.PeerChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Authoritative store of live connections, one {@link AgentContext} per agent id.
 *
 * Contexts are created on first reference and reaped as soon as they hold neither
 * providers nor clients. All work on an agent runs inside {@link #withAgent}: the
 * agent's lock is held while the action and any {@link RegistryListener}s run, then
 * released before queued frames are written out.
 *
 * Duplicate (agentId, serverId) registrations supersede the previous connection unless
 * the duplicate policy is REJECT.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    public static final int CLOSE_NORMAL = 1000;
    public static final int CLOSE_POLICY_VIOLATION = 1008;

    private final Map<String, AgentContext> agents = new ConcurrentHashMap<>();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();
    private final EndpointProperties properties;

    public ConnectionRegistry(EndpointProperties properties) {
        this.properties = properties;
    }

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    public ProviderConnection registerProvider(String agentId, String serverId, PeerChannel channel) {
        return withAgent(agentId, context -> {
            Optional<ProviderConnection> existing = context.getProvider(serverId);
            if (existing.isPresent()) {
                ProviderConnection previous = existing.get();
                if (properties.getRegistry().getDuplicatePolicy() == EndpointProperties.DuplicatePolicy.REJECT
                        && previous.isLive()) {
                    throw new DuplicateServerIdException(agentId, serverId);
                }
                log.info("Superseding MCP server connection [agentId={}, serverId={}, old={}, new={}]",
                        agentId, serverId, previous.getChannel().getId(), channel.getId());
                detachProvider(context, previous);
                context.getOutbox().close(previous.getChannel(), CLOSE_NORMAL, "Replaced by new connection");
            }

            ProviderConnection provider = new ProviderConnection(agentId, serverId, channel, Instant.now());
            context.putProvider(provider);
            publish(context, RegistryEvent.providerAdded(provider));

            log.info("MCP server registered [agentId={}, serverId={}, channel={}]",
                    agentId, serverId, channel.getId());
            return provider;
        });
    }

    public ClientConnection registerClient(String agentId, PeerChannel channel) {
        return withAgent(agentId, context -> {
            ClientConnection client = new ClientConnection(agentId, channel, Instant.now());
            context.putClient(client);
            publish(context, RegistryEvent.clientAdded(client));

            log.info("Client registered [agentId={}, channel={}, clients={}]",
                    agentId, channel.getId(), context.getClients().size());
            return client;
        });
    }

    /**
     * Removes whatever connection is registered under (agentId, serverId). Idempotent.
     */
    public void unregisterProvider(String agentId, String serverId) {
        withExistingAgent(agentId, context -> {
            context.getProvider(serverId).ifPresent(provider -> detachProvider(context, provider));
            return null;
        });
    }

    /**
     * Removes the provider only if it is still the one bound to {@code channel}, so that a
     * superseded connection closing late cannot evict its successor.
     *
     * @return true if a provider was removed
     */
    public boolean unregisterProvider(String agentId, String serverId, PeerChannel channel) {
        return withExistingAgent(agentId, context -> context.getProvider(serverId)
                .filter(provider -> provider.getChannel() == channel)
                .map(provider -> {
                    detachProvider(context, provider);
                    return true;
                })
                .orElse(false))
                .orElse(false);
    }

    /** Idempotent. */
    public void unregisterClient(String agentId, PeerChannel channel) {
        withExistingAgent(agentId, context -> {
            ClientConnection client = context.removeClient(channel.getId());
            if (client != null) {
                publish(context, RegistryEvent.clientRemoved(client));
                log.info("Client unregistered [agentId={}, channel={}, clients={}]",
                        agentId, channel.getId(), context.getClients().size());
            }
            return null;
        });
    }

    public Optional<ProviderConnection> lookupProvider(String agentId, String serverId) {
        return withExistingAgent(agentId, context -> context.getProvider(serverId).orElse(null));
    }

    /**
     * Runs {@code action} on the agent's context, creating it if needed.
     */
    public <T> T withAgent(String agentId, Function<AgentContext, T> action) {
        while (true) {
            AgentContext context = agents.computeIfAbsent(agentId, AgentContext::new);
            Attempt<T> attempt = attempt(context, action);
            if (attempt != null) {
                return attempt.result();
            }
        }
    }

    /**
     * Runs {@code action} only if the agent currently exists.
     *
     * @return the action's result; empty if the agent is absent or the action returned null
     */
    public <T> Optional<T> withExistingAgent(String agentId, Function<AgentContext, T> action) {
        while (true) {
            AgentContext context = agents.get(agentId);
            if (context == null) {
                return Optional.empty();
            }
            Attempt<T> attempt = attempt(context, action);
            if (attempt != null) {
                return Optional.ofNullable(attempt.result());
            }
        }
    }

    /**
     * Visits every agent, one lock at a time. No cross-agent consistency is implied.
     */
    public void forEachAgent(Consumer<AgentContext> visitor) {
        for (AgentContext context : agents.values()) {
            attempt(context, ctx -> {
                visitor.accept(ctx);
                return null;
            });
        }
    }

    /** Channels of providers and clients with no inbound traffic since {@code cutoff}. */
    public List<PeerChannel> findIdleChannels(Instant cutoff) {
        List<PeerChannel> idle = new ArrayList<>();
        forEachAgent(context -> {
            context.getProviders().stream()
                    .filter(p -> p.getLastActivity().isBefore(cutoff))
                    .forEach(p -> idle.add(p.getChannel()));
            context.getClients().stream()
                    .filter(c -> c.getLastActivity().isBefore(cutoff))
                    .forEach(c -> idle.add(c.getChannel()));
        });
        return idle;
    }

    public int agentCount() {
        return agents.size();
    }

    private void detachProvider(AgentContext context, ProviderConnection provider) {
        context.removeProvider(provider);
        publish(context, RegistryEvent.providerRemoved(provider));
        log.info("MCP server unregistered [agentId={}, serverId={}, channel={}]",
                provider.getAgentId(), provider.getServerId(), provider.getChannel().getId());
    }

    private void publish(AgentContext context, RegistryEvent event) {
        for (RegistryListener listener : listeners) {
            try {
                listener.onRegistryEvent(context, event);
            } catch (RuntimeException e) {
                log.error("Registry listener {} failed on {} [agentId={}]",
                        listener.getClass().getSimpleName(), event.type(), event.agentId(), e);
            }
        }
    }

    /**
     * @return null if the context was retired before the lock was taken; the caller retries
     */
    private <T> Attempt<T> attempt(AgentContext context, Function<AgentContext, T> action) {
        context.lock.lock();
        if (context.retired) {
            context.lock.unlock();
            return null;
        }
        // nested calls leave reaping and delivery to the outermost holder
        boolean outermost = context.lock.getHoldCount() == 1;
        List<Outbox.Delivery> deliveries = List.of();
        try {
            return new Attempt<>(action.apply(context));
        } finally {
            if (outermost) {
                reapIfEmpty(context);
                deliveries = context.getOutbox().drain();
            }
            context.lock.unlock();
            deliver(context.getAgentId(), deliveries);
        }
    }

    private void reapIfEmpty(AgentContext context) {
        if (context.isEmpty()) {
            context.retired = true;
            agents.remove(context.getAgentId(), context);
            log.debug("Agent context reaped [agentId={}]", context.getAgentId());
        }
    }

    private void deliver(String agentId, List<Outbox.Delivery> deliveries) {
        for (Outbox.Delivery delivery : deliveries) {
            try {
                if (delivery.isClose()) {
                    delivery.target().close(delivery.closeCode(), delivery.closeReason());
                    continue;
                }
                delivery.target().send(delivery.payload());
            } catch (IOException e) {
                log.warn("Delivery failed [agentId={}, channel={}]: {}",
                        agentId, delivery.target().getId(), e.getMessage());
                notifyFailure(agentId, delivery, e);
            } catch (RuntimeException e) {
                log.error("Unexpected error delivering to channel {} [agentId={}]",
                        delivery.target().getId(), agentId, e);
            }
        }
    }

    private void notifyFailure(String agentId, Outbox.Delivery delivery, IOException cause) {
        if (delivery.onFailure() == null) {
            return;
        }
        try {
            delivery.onFailure().accept(cause);
        } catch (RuntimeException e) {
            log.error("Failure handler for channel {} threw [agentId={}]",
                    delivery.target().getId(), agentId, e);
        }
    }

    private record Attempt<T>(T result) {
    }
}
