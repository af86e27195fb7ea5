package com.deepansh.mcpendpoint.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Factory for the envelopes the relay itself produces.
 */
public final class JsonRpcMessages {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonRpcMessages() {
    }

    public static ObjectNode request(String id, String method, JsonNode params) {
        ObjectNode node = envelope(TextNode.valueOf(id));
        node.put("method", method);
        node.set("params", params != null ? params : NODES.objectNode());
        return node;
    }

    public static ObjectNode notification(String method, JsonNode params) {
        ObjectNode node = NODES.objectNode();
        node.put("jsonrpc", JsonRpcMessage.VERSION);
        node.put("method", method);
        if (params != null) {
            node.set("params", params);
        }
        return node;
    }

    public static ObjectNode result(JsonNode id, JsonNode result) {
        ObjectNode node = envelope(id);
        node.set("result", result != null ? result : NODES.objectNode());
        return node;
    }

    public static ObjectNode error(JsonNode id, JsonRpcError error, String message) {
        ObjectNode node = envelope(id);
        ObjectNode body = node.putObject("error");
        body.put("code", error.getCode());
        body.put("message", message != null ? message : error.getDefaultMessage());
        return node;
    }

    private static ObjectNode envelope(JsonNode id) {
        ObjectNode node = NODES.objectNode();
        node.put("jsonrpc", JsonRpcMessage.VERSION);
        node.set("id", id != null ? id : NullNode.getInstance());
        return node;
    }
}
