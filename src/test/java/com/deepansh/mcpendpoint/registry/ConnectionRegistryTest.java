package com.deepansh.mcpendpoint.registry;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.exception.DuplicateServerIdException;
import com.deepansh.mcpendpoint.support.FakeChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private EndpointProperties props;
    private ConnectionRegistry registry;
    private List<RegistryEvent> events;

    @BeforeEach
    void setUp() {
        props = new EndpointProperties();
        registry = new ConnectionRegistry(props);
        events = new ArrayList<>();
        registry.addListener((context, event) -> events.add(event));
    }

    @Test
    void registerProvider_isVisibleToLookup() {
        FakeChannel channel = new FakeChannel();
        ProviderConnection provider = registry.registerProvider("agent", "calc", channel);

        assertThat(registry.lookupProvider("agent", "calc")).containsSame(provider);
        assertThat(provider.getChannel()).isSameAs(channel);
        assertThat(events).extracting(RegistryEvent::type).containsExactly(RegistryEvent.Type.PROVIDER_ADDED);
    }

    @Test
    void duplicateServerId_supersedesAndClosesPreviousConnection() {
        FakeChannel first = new FakeChannel();
        FakeChannel second = new FakeChannel();
        registry.registerProvider("agent", "calc", first);

        ProviderConnection current = registry.registerProvider("agent", "calc", second);

        assertThat(registry.lookupProvider("agent", "calc")).containsSame(current);
        assertThat(first.isOpen()).isFalse();
        assertThat(first.getCloseCode()).isEqualTo(ConnectionRegistry.CLOSE_NORMAL);
        assertThat(second.isOpen()).isTrue();
        assertThat(events).extracting(RegistryEvent::type).containsExactly(
                RegistryEvent.Type.PROVIDER_ADDED,
                RegistryEvent.Type.PROVIDER_REMOVED,
                RegistryEvent.Type.PROVIDER_ADDED);
    }

    @Test
    void duplicateServerId_rejectPolicy_refusesWhileFirstIsLive() {
        props.getRegistry().setDuplicatePolicy(EndpointProperties.DuplicatePolicy.REJECT);
        FakeChannel first = new FakeChannel();
        registry.registerProvider("agent", "calc", first);

        assertThatThrownBy(() -> registry.registerProvider("agent", "calc", new FakeChannel()))
                .isInstanceOf(DuplicateServerIdException.class)
                .hasMessageContaining("calc");
        assertThat(first.isOpen()).isTrue();

        first.setOpen(false);
        FakeChannel replacement = new FakeChannel();
        ProviderConnection current = registry.registerProvider("agent", "calc", replacement);
        assertThat(current.getChannel()).isSameAs(replacement);
    }

    @Test
    void unregisterWithStaleChannel_keepsSuccessor() {
        FakeChannel first = new FakeChannel();
        FakeChannel second = new FakeChannel();
        registry.registerProvider("agent", "calc", first);
        ProviderConnection successor = registry.registerProvider("agent", "calc", second);

        boolean removed = registry.unregisterProvider("agent", "calc", first);

        assertThat(removed).isFalse();
        assertThat(registry.lookupProvider("agent", "calc")).containsSame(successor);
    }

    @Test
    void unregister_isIdempotent() {
        FakeChannel channel = new FakeChannel();
        registry.registerProvider("agent", "calc", channel);

        assertThat(registry.unregisterProvider("agent", "calc", channel)).isTrue();
        assertThat(registry.unregisterProvider("agent", "calc", channel)).isFalse();
        registry.unregisterProvider("agent", "calc");

        assertThat(events).filteredOn(e -> e.type() == RegistryEvent.Type.PROVIDER_REMOVED).hasSize(1);
    }

    @Test
    void emptyAgent_isReaped() {
        FakeChannel provider = new FakeChannel();
        FakeChannel client = new FakeChannel();
        registry.registerProvider("agent", "calc", provider);
        registry.registerClient("agent", client);
        assertThat(registry.agentCount()).isEqualTo(1);

        registry.unregisterProvider("agent", "calc", provider);
        assertThat(registry.agentCount()).isEqualTo(1);

        registry.unregisterClient("agent", client);
        assertThat(registry.agentCount()).isZero();
        assertThat(registry.withExistingAgent("agent", AgentContext::getAgentId)).isEmpty();
    }

    @Test
    void clients_areTrackedPerConnection() {
        FakeChannel a = new FakeChannel();
        FakeChannel b = new FakeChannel();
        registry.registerClient("agent", a);
        registry.registerClient("agent", b);

        registry.unregisterClient("agent", a);

        assertThat(registry.withExistingAgent("agent", ctx -> ctx.getClients().size())).contains(1);
        assertThat(events).extracting(RegistryEvent::type).containsExactly(
                RegistryEvent.Type.CLIENT_ADDED,
                RegistryEvent.Type.CLIENT_ADDED,
                RegistryEvent.Type.CLIENT_REMOVED);
    }

    @Test
    void outboxFrames_areWrittenAfterTheLockIsReleased() {
        FakeChannel channel = new FakeChannel();
        registry.registerClient("agent", channel);

        registry.withAgent("agent", context -> {
            context.getOutbox().send(channel, "{\"hello\":1}");
            assertThat(channel.getSent()).isEmpty();
            return null;
        });

        assertThat(channel.getSent()).containsExactly("{\"hello\":1}");
    }

    @Test
    void failedWrite_invokesFailureCallback() {
        FakeChannel channel = new FakeChannel();
        channel.setFailSends(true);
        registry.registerClient("agent", channel);
        AtomicReference<IOException> failure = new AtomicReference<>();

        registry.withAgent("agent", context -> {
            context.getOutbox().send(channel, "payload", failure::set);
            return null;
        });

        assertThat(failure.get()).hasMessage("broken pipe");
    }

    @Test
    void throwingListener_doesNotBreakRegistration() {
        registry.addListener((context, event) -> {
            throw new IllegalStateException("boom");
        });

        ProviderConnection provider = registry.registerProvider("agent", "calc", new FakeChannel());

        assertThat(registry.lookupProvider("agent", "calc")).containsSame(provider);
    }

    @Test
    void findIdleChannels_returnsConnectionsSilentSinceCutoff() {
        FakeChannel provider = new FakeChannel();
        FakeChannel client = new FakeChannel();
        registry.registerProvider("agent", "calc", provider);
        registry.registerClient("agent", client);

        assertThat(registry.findIdleChannels(Instant.now().minusSeconds(60))).isEmpty();
        assertThat(registry.findIdleChannels(Instant.now().plusSeconds(60)))
                .containsExactlyInAnyOrder(provider, client);
    }
}
