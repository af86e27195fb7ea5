package com.deepansh.mcpendpoint.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One tool as advertised by a provider in its tools/list result.
 *
 * {@code definition} is the provider's full tool object, kept verbatim so
 * annotations and other fields survive the relay.
 */
@Data
@Builder
public class ToolDescriptor {

    private String name;
    private String description;
    private JsonNode inputSchema;
    private ObjectNode definition;

    public static ToolDescriptor from(ObjectNode tool) {
        return ToolDescriptor.builder()
                .name(tool.path("name").asText())
                .description(tool.path("description").asText(null))
                .inputSchema(tool.get("inputSchema"))
                .definition(tool.deepCopy())
                .build();
    }

    /**
     * Parses a tools array, skipping entries that are not objects or lack a name.
     */
    public static List<ToolDescriptor> listFrom(JsonNode tools) {
        List<ToolDescriptor> result = new ArrayList<>();
        if (tools == null || !tools.isArray()) {
            return result;
        }
        for (JsonNode tool : tools) {
            if (tool.isObject() && tool.path("name").isTextual() && !tool.path("name").asText().isBlank()) {
                result.add(from((ObjectNode) tool));
            }
        }
        return result;
    }
}
