package com.deepansh.mcpendpoint.aggregation;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.exception.JsonRpcException;
import com.deepansh.mcpendpoint.protocol.JsonRpcCodec;
import com.deepansh.mcpendpoint.protocol.JsonRpcError;
import com.deepansh.mcpendpoint.protocol.JsonRpcMessage;
import com.deepansh.mcpendpoint.protocol.JsonRpcMessages;
import com.deepansh.mcpendpoint.protocol.McpMethods;
import com.deepansh.mcpendpoint.registry.AgentContext;
import com.deepansh.mcpendpoint.registry.ClientConnection;
import com.deepansh.mcpendpoint.registry.ConnectionRegistry;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.deepansh.mcpendpoint.registry.RegistryEvent;
import com.deepansh.mcpendpoint.registry.RegistryListener;
import com.deepansh.mcpendpoint.routing.RequestIdSequence;
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
 * Fan-out of one client request to every live provider of its agent, fan-in of a single reply:
 * <pre>
 * { "responses": [ {"server_id": "a", "result": {...}}, {"server_id": "b", "error": {...}} ],
 *   "total_servers": 2, "responded_servers": 2 }
 * </pre>
 * Responses are in arrival order. An aggregation is finalized exactly once, by whichever of
 * completion, deadline or provider disconnect gets there first: removal from {@link #pending}
 * under the agent's lock is the guard.
 *
 * A {@code broadcast} request carries the method to fan out in {@code params.method} and its
 * arguments in {@code params.params}; methods listed in endpoint.routing.fan-out-methods are
 * fanned out as they are.
 */
@Component
@Slf4j
public class AggregationEngine implements RegistryListener {

    private final ConnectionRegistry registry;
    private final JsonRpcCodec codec;
    private final RequestIdSequence requestIds;
    private final TaskScheduler scheduler;
    private final EndpointProperties properties;

    private final Map<String, PendingAggregation> pending = new ConcurrentHashMap<>();

    public AggregationEngine(ConnectionRegistry registry,
                             JsonRpcCodec codec,
                             RequestIdSequence requestIds,
                             @Qualifier("brokerTaskScheduler") TaskScheduler scheduler,
                             EndpointProperties properties) {
        this.registry = registry;
        this.codec = codec;
        this.requestIds = requestIds;
        this.scheduler = scheduler;
        this.properties = properties;
        registry.addListener(this);
    }

    /**
     * Must run inside {@link ConnectionRegistry#withAgent} for the client's agent.
     *
     * @throws JsonRpcException for a malformed broadcast envelope
     */
    public void broadcast(AgentContext context, ClientConnection client, JsonRpcMessage request) {
        JsonRpcMessage outbound = unwrap(request);
        List<ProviderConnection> targets = context.getLiveProviders();

        if (!request.hasId()) {
            String payload = codec.write(outbound);
            targets.forEach(target -> context.getOutbox().send(target.getChannel(), payload));
            return;
        }

        if (targets.isEmpty()) {
            log.info("Broadcast with no MCP servers connected [agentId={}, method={}]",
                    context.getAgentId(), outbound.getMethod());
            context.getOutbox().send(client.getChannel(),
                    codec.write(JsonRpcMessages.result(request.getId(), aggregateResult(List.of(), 0, 0))));
            return;
        }

        String forwardedId = requestIds.next();
        String agentId = context.getAgentId();
        Instant now = Instant.now();
        Duration timeout = properties.getRouting().getAggregationTimeout();

        PendingAggregation aggregation = new PendingAggregation(forwardedId, request.getId(), client,
                outbound.getMethod(), targets.stream().map(ProviderConnection::getServerId).toList(),
                now, now.plus(timeout));
        pending.put(forwardedId, aggregation);
        aggregation.setTimeout(scheduler.schedule(() -> onTimeout(agentId, forwardedId), aggregation.getDeadline()));

        String payload = codec.write(outbound.withId(TextNode.valueOf(forwardedId)));
        for (ProviderConnection target : targets) {
            String serverId = target.getServerId();
            context.getOutbox().send(target.getChannel(), payload,
                    e -> onForwardFailure(agentId, forwardedId, serverId, e));
        }

        log.info("Broadcast fanned out [agentId={}, method={}, id={} -> {}, servers={}]",
                agentId, outbound.getMethod(), request.getId(), forwardedId, aggregation.getExpected());
    }

    /**
     * Must run inside {@link ConnectionRegistry#withAgent} for the provider's agent.
     *
     * @return true if the reply belonged to an open aggregation, including replies that were ignored
     */
    public boolean onProviderReply(AgentContext context, ProviderConnection provider, String replyId, JsonRpcMessage reply) {
        PendingAggregation aggregation = pending.get(replyId);
        if (aggregation == null || !aggregation.getAgentId().equals(context.getAgentId())) {
            return false;
        }
        String serverId = provider.getServerId();

        if (!aggregation.isExpected(serverId)) {
            log.warn("Ignoring aggregation reply from unexpected MCP server [agentId={}, serverId={}, id={}]",
                    context.getAgentId(), serverId, replyId);
            return true;
        }
        if (!aggregation.record(serverId, payloadOf(serverId, reply))) {
            log.debug("Ignoring duplicate aggregation reply [agentId={}, serverId={}, id={}]",
                    context.getAgentId(), serverId, replyId);
            return true;
        }
        if (aggregation.isComplete()) {
            finalizeAggregation(context, aggregation, "complete");
        }
        return true;
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void onRegistryEvent(AgentContext context, RegistryEvent event) {
        switch (event.type()) {
            case PROVIDER_REMOVED -> onProviderRemoved(context, event.provider().getServerId());
            case CLIENT_REMOVED -> onClientRemoved(context, event.client());
            default -> {
            }
        }
    }

    private void onProviderRemoved(AgentContext context, String serverId) {
        for (PendingAggregation aggregation : aggregationsOf(context)) {
            if (aggregation.dropExpected(serverId)) {
                log.info("MCP server left mid-aggregation [agentId={}, serverId={}, id={}, outstanding={}]",
                        context.getAgentId(), serverId, aggregation.getForwardedId(),
                        aggregation.totalServers() - aggregation.respondedServers());
                if (aggregation.isComplete()) {
                    finalizeAggregation(context, aggregation, "provider disconnected");
                }
            }
        }
    }

    private void onClientRemoved(AgentContext context, ClientConnection client) {
        for (PendingAggregation aggregation : aggregationsOf(context)) {
            if (aggregation.getClient() == client && pending.remove(aggregation.getForwardedId(), aggregation)) {
                aggregation.cancelTimeout();
                log.debug("Discarded aggregation of departed client [agentId={}, id={}]",
                        context.getAgentId(), aggregation.getForwardedId());
            }
        }
    }

    private void onTimeout(String agentId, String forwardedId) {
        registry.withExistingAgent(agentId, context -> {
            PendingAggregation aggregation = pending.get(forwardedId);
            if (aggregation != null) {
                finalizeAggregation(context, aggregation, "timeout");
            }
            return null;
        });
    }

    private void onForwardFailure(String agentId, String forwardedId, String serverId, IOException cause) {
        registry.withExistingAgent(agentId, context -> {
            PendingAggregation aggregation = pending.get(forwardedId);
            if (aggregation == null) {
                return null;
            }
            ObjectNode payload = JsonNodeFactory.instance.objectNode();
            payload.put("server_id", serverId);
            ObjectNode error = payload.putObject("error");
            error.put("code", JsonRpcError.FORWARD_FAILED.getCode());
            error.put("message", "Failed to forward request: " + cause.getMessage());

            if (aggregation.recordForwardFailure(serverId, payload) && aggregation.isComplete()) {
                finalizeAggregation(context, aggregation, "forward failed");
            }
            return null;
        });
    }

    private void finalizeAggregation(AgentContext context, PendingAggregation aggregation, String reason) {
        if (!pending.remove(aggregation.getForwardedId(), aggregation)) {
            return;
        }
        aggregation.cancelTimeout();

        ClientConnection client = aggregation.getClient();
        if (!context.hasClient(client)) {
            log.debug("Aggregation finalized after client left [agentId={}, id={}]",
                    context.getAgentId(), aggregation.getForwardedId());
            return;
        }

        JsonNode response;
        if (aggregation.allForwardsFailed()) {
            response = JsonRpcMessages.error(aggregation.getOriginalId(), JsonRpcError.FORWARD_FAILED,
                    "Failed to forward request to any MCP server");
        } else {
            response = JsonRpcMessages.result(aggregation.getOriginalId(), aggregateResult(
                    aggregation.responsesInArrivalOrder(),
                    aggregation.totalServers(),
                    aggregation.respondedServers()));
        }
        context.getOutbox().send(client.getChannel(), codec.write(response));

        log.info("Aggregation finalized [agentId={}, method={}, reason={}, responded={}/{}, elapsed={}ms]",
                context.getAgentId(), aggregation.getMethod(), reason,
                aggregation.respondedServers(), aggregation.totalServers(),
                Duration.between(aggregation.getCreatedAt(), Instant.now()).toMillis());
    }

    private List<PendingAggregation> aggregationsOf(AgentContext context) {
        List<PendingAggregation> result = new ArrayList<>();
        for (PendingAggregation aggregation : pending.values()) {
            if (aggregation.getAgentId().equals(context.getAgentId())) {
                result.add(aggregation);
            }
        }
        return result;
    }

    private JsonRpcMessage unwrap(JsonRpcMessage request) {
        if (!McpMethods.BROADCAST.equals(request.getMethod())) {
            return request;
        }
        JsonNode method = request.getParams().get("method");
        if (method == null || !method.isTextual() || method.asText().isBlank()) {
            throw JsonRpcException.invalidParams("broadcast requires params.method");
        }
        if (McpMethods.BROADCAST.equals(method.asText())) {
            throw JsonRpcException.invalidParams("broadcast cannot be nested");
        }
        JsonNode params = request.getParams().get("params");
        return JsonRpcMessage.of(JsonRpcMessages.notification(method.asText(), params));
    }

    private static ObjectNode payloadOf(String serverId, JsonRpcMessage reply) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("server_id", serverId);
        if (reply.getError() != null) {
            payload.set("error", reply.getError());
        } else {
            payload.set("result", reply.getResult());
        }
        return payload;
    }

    private static ObjectNode aggregateResult(List<ObjectNode> responses, int total, int responded) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode list = result.putArray("responses");
        responses.forEach(list::add);
        result.put("total_servers", total);
        result.put("responded_servers", responded);
        return result;
    }
}
