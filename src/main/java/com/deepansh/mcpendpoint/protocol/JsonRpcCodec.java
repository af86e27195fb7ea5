package com.deepansh.mcpendpoint.protocol;

import com.deepansh.mcpendpoint.exception.JsonRpcException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Text frame &lt;-&gt; JSON-RPC envelope conversion, backed by the application's ObjectMapper.
 */
@Component
public class JsonRpcCodec {

    private final ObjectMapper objectMapper;

    public JsonRpcCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws JsonRpcException with {@link JsonRpcError#PARSE_ERROR} for invalid JSON,
     *                          {@link JsonRpcError#INVALID_REQUEST} for a non-object payload
     */
    public JsonRpcMessage parse(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new JsonRpcException(JsonRpcError.PARSE_ERROR, "Parse error: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new JsonRpcException(JsonRpcError.INVALID_REQUEST, "Message must be a JSON object");
        }
        return JsonRpcMessage.of((ObjectNode) node);
    }

    public String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // a tree built from parsed JSON always serializes
            throw new IllegalStateException("Failed to serialize JSON-RPC message", e);
        }
    }

    public String write(JsonRpcMessage message) {
        return write(message.toNode());
    }
}
