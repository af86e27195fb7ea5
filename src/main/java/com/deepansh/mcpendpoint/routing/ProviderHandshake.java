package com.deepansh.mcpendpoint.routing;

import com.deepansh.mcpendpoint.catalog.ToolCatalog;
import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.protocol.JsonRpcCodec;
import com.deepansh.mcpendpoint.protocol.JsonRpcMessage;
import com.deepansh.mcpendpoint.protocol.JsonRpcMessages;
import com.deepansh.mcpendpoint.protocol.McpMethods;
import com.deepansh.mcpendpoint.protocol.ToolDescriptor;
import com.deepansh.mcpendpoint.registry.AgentContext;
import com.deepansh.mcpendpoint.registry.ConnectionRegistry;
import com.deepansh.mcpendpoint.registry.ProviderConnection;
import com.deepansh.mcpendpoint.registry.RegistryEvent;
import com.deepansh.mcpendpoint.registry.RegistryListener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drives the MCP session with each newly registered provider, acting as its client:
 * <ol>
 *   <li>initialize, recording the provider's serverInfo/capabilities</li>
 *   <li>notifications/initialized</li>
 *   <li>tools/list, following nextCursor until the list is complete, then publishing it to the catalog</li>
 * </ol>
 * The tools/list step is repeated whenever the provider announces notifications/tools/list_changed.
 */
@Component
@Slf4j
public class ProviderHandshake implements RegistryListener {

    private final ToolCatalog toolCatalog;
    private final JsonRpcCodec codec;
    private final RequestIdSequence requestIds;
    private final EndpointProperties properties;

    public ProviderHandshake(ConnectionRegistry registry,
                             ToolCatalog toolCatalog,
                             JsonRpcCodec codec,
                             RequestIdSequence requestIds,
                             EndpointProperties properties) {
        this.toolCatalog = toolCatalog;
        this.codec = codec;
        this.requestIds = requestIds;
        this.properties = properties;
        registry.addListener(this);
    }

    @Override
    public void onRegistryEvent(AgentContext context, RegistryEvent event) {
        if (event.type() == RegistryEvent.Type.PROVIDER_ADDED && properties.getBootstrap().isEnabled()) {
            start(context, event.provider());
        }
    }

    public void start(AgentContext context, ProviderConnection provider) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("protocolVersion", properties.getBootstrap().getProtocolVersion());
        params.putObject("capabilities");
        ObjectNode clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", properties.getBootstrap().getClientName());
        clientInfo.put("version", properties.getVersion());

        sendRequest(context, provider, McpMethods.INITIALIZE, params);
        log.info("Initializing MCP server [agentId={}, serverId={}]", provider.getAgentId(), provider.getServerId());
    }

    /** Starts a fresh tools/list round, discarding any partially collected pages. */
    public void requestTools(AgentContext context, ProviderConnection provider) {
        provider.getToolPages().clear();
        requestToolsPage(context, provider, null);
    }

    /**
     * @return true if {@code reply} answers a request issued by this handshake
     */
    public boolean onReply(AgentContext context, ProviderConnection provider, String replyId, JsonRpcMessage reply) {
        String method = provider.getBootstrapRequests().remove(replyId);
        if (method == null) {
            return false;
        }
        if (reply.getError() != null) {
            log.warn("MCP server rejected {} [agentId={}, serverId={}]: {}",
                    method, provider.getAgentId(), provider.getServerId(), reply.getError());
        }

        switch (method) {
            case McpMethods.INITIALIZE -> onInitialized(context, provider, reply);
            case McpMethods.TOOLS_LIST -> onToolsPage(context, provider, reply);
            default -> log.debug("Reply to bootstrap {} ignored", method);
        }
        return true;
    }

    private void onInitialized(AgentContext context, ProviderConnection provider, JsonRpcMessage reply) {
        JsonNode result = reply.getResult();
        if (result != null && result.isObject()) {
            provider.setServerInfo(result);
            log.info("MCP server initialized [agentId={}, serverId={}, serverInfo={}]",
                    provider.getAgentId(), provider.getServerId(), result.path("serverInfo"));
        }
        context.getOutbox().send(provider.getChannel(),
                codec.write(JsonRpcMessages.notification(McpMethods.NOTIFICATIONS_INITIALIZED, null)));
        requestTools(context, provider);
    }

    private void onToolsPage(AgentContext context, ProviderConnection provider, JsonRpcMessage reply) {
        JsonNode result = reply.getResult();
        if (result == null || !result.isObject()) {
            provider.getToolPages().clear();
            return;
        }
        provider.getToolPages().addAll(ToolDescriptor.listFrom(result.get("tools")));

        JsonNode nextCursor = result.get("nextCursor");
        if (nextCursor != null && nextCursor.isTextual() && !nextCursor.asText().isBlank()) {
            requestToolsPage(context, provider, nextCursor.asText());
            return;
        }
        List<ToolDescriptor> tools = List.copyOf(provider.getToolPages());
        provider.getToolPages().clear();
        toolCatalog.updateTools(context, provider, tools);
    }

    private void requestToolsPage(AgentContext context, ProviderConnection provider, String cursor) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        if (cursor != null) {
            params.put("cursor", cursor);
        }
        sendRequest(context, provider, McpMethods.TOOLS_LIST, params);
    }

    private void sendRequest(AgentContext context, ProviderConnection provider, String method, ObjectNode params) {
        String id = requestIds.next();
        provider.getBootstrapRequests().put(id, method);
        context.getOutbox().send(provider.getChannel(),
                codec.write(JsonRpcMessages.request(id, method, params)),
                e -> log.warn("Failed to send {} to MCP server [agentId={}, serverId={}]: {}",
                        method, provider.getAgentId(), provider.getServerId(), e.getMessage()));
    }
}
