package com.deepansh.mcpendpoint.catalog;

import com.deepansh.mcpendpoint.protocol.ToolDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Data;

/**
 * A tool in an agent's unified namespace, tagged with the provider that serves it.
 */
@Data
@Builder
public class ToolCatalogEntry {

    public static final String SERVER_ID_FIELD = "server_id";

    private String toolName;
    private String serverId;
    private String description;
    private JsonNode schema;
    private ObjectNode definition;

    public static ToolCatalogEntry of(String serverId, ToolDescriptor tool) {
        return ToolCatalogEntry.builder()
                .toolName(tool.getName())
                .serverId(serverId)
                .description(tool.getDescription())
                .schema(tool.getInputSchema())
                .definition(tool.getDefinition())
                .build();
    }

    /**
     * The provider's tool object plus a {@code server_id} field, as returned to clients in tools/list.
     */
    public ObjectNode toJson() {
        ObjectNode json = definition.deepCopy();
        json.put(SERVER_ID_FIELD, serverId);
        return json;
    }
}
