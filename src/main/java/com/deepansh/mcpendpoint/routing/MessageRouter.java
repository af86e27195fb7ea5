package com.deepansh.mcpendpoint.routing;

import com.deepansh.mcpendpoint.aggregation.AggregationEngine;
import com.deepansh.mcpendpoint.catalog.ToolCatalog;
import com.deepansh.mcpendpoint.catalog.ToolCatalogEntry;
import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.exception.JsonRpcException;
import com.deepansh.mcpendpoint.protocol.JsonRpcCodec;
import com.deepansh.mcpendpoint.protocol.JsonRpcError;
import com.deepansh.mcpendpoint.protocol.JsonRpcMessage;
import com.deepansh.mcpendpoint.protocol.JsonRpcMessages;
import com.deepansh.mcpendpoint.protocol.McpMethods;
import com.deepansh.mcpendpoint.protocol.ToolDescriptor;
import com.deepansh.mcpendpoint.registry.AgentContext;
import com.deepansh.mcpendpoint.registry.ClientConnection;
import com.deepansh.mcpendpoint.registry.ConnectionRegistry;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.deepansh.mcpendpoint.registry.RegistryEvent;
import com.deepansh.mcpendpoint.registry.RegistryListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies every inbound JSON-RPC message and decides where it goes.
 *
 * Client side, dispatched on method:
 * <ul>
 *   <li>initialize / notifications/initialized / tools/list / ping: answered by the relay</li>
 *   <li>tools/call: forwarded to the provider owning the tool</li>
 *   <li>broadcast and configured fan-out methods: handed to the {@link AggregationEngine}</li>
 *   <li>anything carrying params.server_id: forwarded to that provider</li>
 *   <li>everything else: -32601</li>
 * </ul>
 * Provider side: replies are matched against pending calls, aggregations and handshake
 * requests, in that order; tools lists refresh the catalog; the rest is dropped with a warning.
 *
 * Every forwarded request gets a fresh id and a {@link PendingCall}. Exactly one of
 * reply, timeout, forward failure or provider disconnect resolves it.
 */
@Component
@Slf4j
public class MessageRouter implements RegistryListener {

    private final ConnectionRegistry registry;
    private final ToolCatalog toolCatalog;
    private final AggregationEngine aggregationEngine;
    private final ProviderHandshake providerHandshake;
    private final JsonRpcCodec codec;
    private final RequestIdSequence requestIds;
    private final TaskScheduler scheduler;
    private final EndpointProperties properties;

    private final Map<String, PendingCall> pendingCalls = new ConcurrentHashMap<>();
    private final Map<String, ClientMethodHandler> clientMethods;

    public MessageRouter(ConnectionRegistry registry,
                         ToolCatalog toolCatalog,
                         AggregationEngine aggregationEngine,
                         ProviderHandshake providerHandshake,
                         JsonRpcCodec codec,
                         RequestIdSequence requestIds,
                         @Qualifier("brokerTaskScheduler") TaskScheduler scheduler,
                         EndpointProperties properties) {
        this.registry = registry;
        this.toolCatalog = toolCatalog;
        this.aggregationEngine = aggregationEngine;
        this.providerHandshake = providerHandshake;
        this.codec = codec;
        this.requestIds = requestIds;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clientMethods = Map.of(
                McpMethods.INITIALIZE, this::handleInitialize,
                McpMethods.NOTIFICATIONS_INITIALIZED, this::handleInitializedNotification,
                McpMethods.TOOLS_LIST, this::handleToolsList,
                McpMethods.TOOLS_CALL, this::handleToolsCall,
                McpMethods.PING, this::handlePing,
                McpMethods.BROADCAST, aggregationEngine::broadcast
        );
        registry.addListener(this);
    }

    public void onClientMessage(ClientConnection client, String text) {
        client.touch();
        JsonRpcMessage message;
        try {
            message = codec.parse(text);
        } catch (JsonRpcException e) {
            log.warn("Unparsable client message [agentId={}, channel={}]: {}",
                    client.getAgentId(), client.getConnectionId(), e.getMessage());
            registry.withExistingAgent(client.getAgentId(), context -> {
                reply(context, client, JsonRpcMessages.error(null, e.getError(), e.getMessage()));
                return null;
            });
            return;
        }

        registry.withExistingAgent(client.getAgentId(), context -> {
            if (!context.hasClient(client)) {
                log.debug("Dropping message from departed client [agentId={}, channel={}]",
                        client.getAgentId(), client.getConnectionId());
                return null;
            }
            dispatchClientMessage(context, client, message);
            return null;
        });
    }

    private void dispatchClientMessage(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        try {
            if (message.isResponse()) {
                log.warn("Ignoring response sent by client [agentId={}, id={}]", context.getAgentId(), message.getId());
                return;
            }
            if (!message.isVersion2() || message.getMethod() == null) {
                throw new JsonRpcException(JsonRpcError.INVALID_REQUEST, "Expected a JSON-RPC 2.0 request");
            }
            log.debug("Client message [agentId={}, method={}, id={}]",
                    context.getAgentId(), message.getMethod(), message.getId());
            clientMethods.getOrDefault(message.getMethod(), this::handlePassthrough)
                    .handle(context, client, message);
        } catch (JsonRpcException e) {
            log.info("Client request rejected [agentId={}, method={}, code={}]: {}",
                    context.getAgentId(), message.getMethod(), e.getError().getCode(), e.getMessage());
            replyError(context, client, message, e.getError(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to route client message [agentId={}, method={}]",
                    context.getAgentId(), message.getMethod(), e);
            replyError(context, client, message, JsonRpcError.INTERNAL_ERROR, "Internal error while routing request");
        }
    }

    private void handleInitialize(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        if (!message.hasId()) {
            return;
        }
        JsonNode requested = message.getParams().get("protocolVersion");
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("protocolVersion", requested != null && requested.isTextual()
                ? requested.asText()
                : properties.getBootstrap().getProtocolVersion());
        result.putObject("capabilities").putObject("tools").put("listChanged", false);
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", properties.getBootstrap().getClientName());
        serverInfo.put("version", properties.getVersion());

        reply(context, client, JsonRpcMessages.result(message.getId(), result));
    }

    private void handleInitializedNotification(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        log.debug("Client initialized [agentId={}, channel={}]", context.getAgentId(), client.getConnectionId());
    }

    private void handleToolsList(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        if (!message.hasId()) {
            return;
        }
        List<ToolCatalogEntry> entries = toolCatalog.listAll(context);
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode tools = result.putArray("tools");
        entries.forEach(entry -> tools.add(entry.toJson()));

        reply(context, client, JsonRpcMessages.result(message.getId(), result));
        log.info("Returned tools list [agentId={}, tools={}]", context.getAgentId(), entries.size());
    }

    private void handleToolsCall(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        JsonNode name = message.getParams().get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw JsonRpcException.invalidParams("Missing tool name");
        }
        String toolName = name.asText();
        String serverId = toolCatalog.resolve(context, toolName)
                .orElseThrow(() -> JsonRpcException.toolNotFound(toolName));
        ProviderConnection provider = context.getProvider(serverId)
                .filter(ProviderConnection::isLive)
                .orElseThrow(() -> JsonRpcException.serverUnavailable(serverId));

        forward(context, client, message, provider);
    }

    private void handlePing(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        if (message.getTargetServerId() != null) {
            forwardToTarget(context, client, message);
            return;
        }
        if (message.hasId()) {
            reply(context, client, JsonRpcMessages.result(message.getId(), null));
        }
    }

    private void handlePassthrough(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        if (message.getTargetServerId() != null) {
            forwardToTarget(context, client, message);
        } else if (properties.getRouting().getFanOutMethods().contains(message.getMethod())) {
            aggregationEngine.broadcast(context, client, message);
        } else if (message.isNotification()) {
            log.debug("Ignoring untargeted client notification [agentId={}, method={}]",
                    context.getAgentId(), message.getMethod());
        } else {
            throw JsonRpcException.methodNotFound(message.getMethod());
        }
    }

    private void forwardToTarget(AgentContext context, ClientConnection client, JsonRpcMessage message) {
        String serverId = message.getTargetServerId();
        ProviderConnection provider = context.getProvider(serverId)
                .filter(ProviderConnection::isLive)
                .orElseThrow(() -> JsonRpcException.serverUnavailable(serverId));
        forward(context, client, message, provider);
    }

    private void forward(AgentContext context, ClientConnection client, JsonRpcMessage message, ProviderConnection provider) {
        if (!message.hasId()) {
            context.getOutbox().send(provider.getChannel(), codec.write(message));
            return;
        }

        String agentId = context.getAgentId();
        String forwardedId = requestIds.next();
        Instant now = Instant.now();
        PendingCall call = PendingCall.builder()
                .forwardedId(forwardedId)
                .originalId(message.getId())
                .client(client)
                .provider(provider)
                .method(message.getMethod())
                .createdAt(now)
                .deadline(now.plus(properties.getRouting().getCallTimeout()))
                .build();
        pendingCalls.put(forwardedId, call);
        call.setTimeout(scheduler.schedule(() -> onCallTimeout(agentId, forwardedId), call.getDeadline()));

        context.getOutbox().send(provider.getChannel(),
                codec.write(message.withId(TextNode.valueOf(forwardedId))),
                e -> onForwardFailure(agentId, forwardedId, e));

        log.info("Forwarded {} [agentId={}, serverId={}, id={} -> {}]",
                message.getMethod(), agentId, provider.getServerId(), message.getId(), forwardedId);
    }

    private void onForwardFailure(String agentId, String forwardedId, IOException cause) {
        registry.withExistingAgent(agentId, context -> {
            PendingCall call = pendingCalls.remove(forwardedId);
            if (call != null) {
                call.cancelTimeout();
                failCall(context, call, JsonRpcError.FORWARD_FAILED,
                        "Failed to forward request to MCP server '" + call.getServerId() + "': " + cause.getMessage());
            }
            return null;
        });
    }

    private void onCallTimeout(String agentId, String forwardedId) {
        registry.withExistingAgent(agentId, context -> {
            PendingCall call = pendingCalls.remove(forwardedId);
            if (call != null) {
                log.warn("MCP server did not reply in time [agentId={}, serverId={}, method={}, id={}]",
                        agentId, call.getServerId(), call.getMethod(), forwardedId);
                failCall(context, call, JsonRpcError.REQUEST_TIMEOUT,
                        "MCP server '" + call.getServerId() + "' did not respond within "
                                + properties.getRouting().getCallTimeout().toSeconds() + "s");
            }
            return null;
        });
    }

    public void onProviderMessage(ProviderConnection provider, String text) {
        provider.touch();
        JsonRpcMessage message;
        try {
            message = codec.parse(text);
        } catch (JsonRpcException e) {
            log.warn("Dropping unparsable message from MCP server [agentId={}, serverId={}]: {}",
                    provider.getAgentId(), provider.getServerId(), e.getMessage());
            return;
        }

        registry.withExistingAgent(provider.getAgentId(), context -> {
            if (!context.isCurrent(provider)) {
                log.debug("Dropping message from superseded MCP server connection [agentId={}, serverId={}]",
                        provider.getAgentId(), provider.getServerId());
                return null;
            }
            try {
                if (message.isResponse()) {
                    handleProviderReply(context, provider, message);
                } else if (message.isRequest()) {
                    handleProviderRequest(context, provider, message);
                } else if (message.isNotification()) {
                    handleProviderNotification(context, provider, message);
                } else {
                    log.warn("Dropping malformed message from MCP server [agentId={}, serverId={}]",
                            provider.getAgentId(), provider.getServerId());
                }
            } catch (RuntimeException e) {
                log.error("Failed to handle MCP server message [agentId={}, serverId={}]",
                        provider.getAgentId(), provider.getServerId(), e);
            }
            return null;
        });
    }

    private void handleProviderReply(AgentContext context, ProviderConnection provider, JsonRpcMessage reply) {
        String replyId = reply.idKey();
        if (replyId != null) {
            PendingCall call = pendingCalls.get(replyId);
            if (call != null && call.getProvider() == provider) {
                pendingCalls.remove(replyId);
                call.cancelTimeout();
                deliverReply(context, call, reply);
                return;
            }
            if (aggregationEngine.onProviderReply(context, provider, replyId, reply)) {
                return;
            }
            if (providerHandshake.onReply(context, provider, replyId, reply)) {
                return;
            }
        }

        JsonNode result = reply.getResult();
        if (result != null && result.path("tools").isArray()) {
            log.info("Unsolicited tools list [agentId={}, serverId={}]", provider.getAgentId(), provider.getServerId());
            toolCatalog.updateTools(context, provider, ToolDescriptor.listFrom(result.get("tools")));
            return;
        }
        log.warn("Dropping unmatched reply from MCP server [agentId={}, serverId={}, id={}]",
                provider.getAgentId(), provider.getServerId(), reply.getId());
    }

    private void deliverReply(AgentContext context, PendingCall call, JsonRpcMessage reply) {
        if (!context.hasClient(call.getClient())) {
            log.debug("Reply arrived after client left [agentId={}, id={}]", context.getAgentId(), call.getForwardedId());
            return;
        }
        reply(context, call.getClient(), reply.withId(call.getOriginalId()).toNode());
        log.info("Relayed {} reply [agentId={}, serverId={}, id={} -> {}, latency={}ms]",
                call.getMethod(), context.getAgentId(), call.getServerId(), call.getForwardedId(),
                call.getOriginalId(), Duration.between(call.getCreatedAt(), Instant.now()).toMillis());
    }

    private void handleProviderRequest(AgentContext context, ProviderConnection provider, JsonRpcMessage request) {
        ObjectNode response = McpMethods.PING.equals(request.getMethod())
                ? JsonRpcMessages.result(request.getId(), null)
                : JsonRpcMessages.error(request.getId(), JsonRpcError.METHOD_NOT_FOUND,
                        "Method not supported by relay: " + request.getMethod());
        context.getOutbox().send(provider.getChannel(), codec.write(response));
    }

    private void handleProviderNotification(AgentContext context, ProviderConnection provider, JsonRpcMessage notification) {
        if (McpMethods.TOOLS_LIST_CHANGED.equals(notification.getMethod())) {
            log.info("MCP server tools changed [agentId={}, serverId={}]", provider.getAgentId(), provider.getServerId());
            providerHandshake.requestTools(context, provider);
            return;
        }
        log.debug("Ignoring MCP server notification [agentId={}, serverId={}, method={}]",
                provider.getAgentId(), provider.getServerId(), notification.getMethod());
    }

    @Override
    public void onRegistryEvent(AgentContext context, RegistryEvent event) {
        switch (event.type()) {
            case PROVIDER_REMOVED -> failCallsTo(context, event.provider());
            case CLIENT_REMOVED -> discardCallsFrom(context, event.client());
            default -> {
            }
        }
    }

    public int pendingCallCount() {
        return pendingCalls.size();
    }

    private void failCallsTo(AgentContext context, ProviderConnection provider) {
        for (PendingCall call : new ArrayList<>(pendingCalls.values())) {
            if (call.getProvider() == provider && pendingCalls.remove(call.getForwardedId(), call)) {
                call.cancelTimeout();
                failCall(context, call, JsonRpcError.SERVER_UNAVAILABLE,
                        "MCP server '" + provider.getServerId() + "' disconnected before replying");
            }
        }
    }

    private void discardCallsFrom(AgentContext context, ClientConnection client) {
        int discarded = 0;
        for (PendingCall call : new ArrayList<>(pendingCalls.values())) {
            if (call.getClient() == client && pendingCalls.remove(call.getForwardedId(), call)) {
                call.cancelTimeout();
                discarded++;
            }
        }
        if (discarded > 0) {
            log.debug("Discarded {} pending calls of departed client [agentId={}]", discarded, context.getAgentId());
        }
    }

    private void failCall(AgentContext context, PendingCall call, JsonRpcError error, String message) {
        if (context.hasClient(call.getClient())) {
            reply(context, call.getClient(), JsonRpcMessages.error(call.getOriginalId(), error, message));
        }
    }

    private void replyError(AgentContext context, ClientConnection client, JsonRpcMessage request,
                            JsonRpcError error, String message) {
        if (request.isNotification()) {
            return;
        }
        reply(context, client, JsonRpcMessages.error(request.getId(), error, message));
    }

    private void reply(AgentContext context, ClientConnection client, JsonNode response) {
        context.getOutbox().send(client.getChannel(), codec.write(response));
    }

    @FunctionalInterface
    private interface ClientMethodHandler {
        void handle(AgentContext context, ClientConnection client, JsonRpcMessage message);
    }
}
