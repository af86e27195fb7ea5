package com.deepansh.mcpendpoint.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Read-only view over a JSON-RPC 2.0 envelope.
 *
 * The underlying tree is kept whole so that fields the relay does not understand
 * reach the other side untouched. Structure:
 * <pre>
 * { "jsonrpc": "2.0", "id": 1, "method": "tools/call", "params": {...} }
 * { "jsonrpc": "2.0", "id": 1, "result": {...} }  or  "error": {...}
 * </pre>
 */
public final class JsonRpcMessage {

    public static final String VERSION = "2.0";
    public static final String TARGET_PARAM = "server_id";

    private final ObjectNode node;

    private JsonRpcMessage(ObjectNode node) {
        this.node = node;
    }

    public static JsonRpcMessage of(ObjectNode node) {
        return new JsonRpcMessage(node);
    }

    /** Raw id, or null when absent. An explicit JSON null is returned as-is. */
    public JsonNode getId() {
        return node.get("id");
    }

    public boolean hasId() {
        JsonNode id = node.get("id");
        return id != null && !id.isNull();
    }

    /** Id rendered as text, used as a correlation key. */
    public String idKey() {
        return hasId() ? node.get("id").asText() : null;
    }

    public String getMethod() {
        JsonNode method = node.get("method");
        return method != null && method.isTextual() ? method.asText() : null;
    }

    public ObjectNode getParams() {
        JsonNode params = node.get("params");
        return params != null && params.isObject()
                ? (ObjectNode) params
                : JsonNodeFactory.instance.objectNode();
    }

    public boolean isRequest() {
        return getMethod() != null && hasId();
    }

    public boolean isNotification() {
        return getMethod() != null && !hasId();
    }

    public boolean isResponse() {
        return getMethod() == null && (node.has("result") || node.has("error"));
    }

    public JsonNode getResult() {
        return node.get("result");
    }

    public JsonNode getError() {
        return node.get("error");
    }

    public boolean isVersion2() {
        return VERSION.equals(node.path("jsonrpc").asText(null));
    }

    /** Provider explicitly addressed by the client through {@code params.server_id}. */
    public String getTargetServerId() {
        JsonNode target = getParams().get(TARGET_PARAM);
        if (target == null || !target.isTextual() || target.asText().isBlank()) {
            return null;
        }
        return target.asText();
    }

    /** Copy of this message with its id replaced. */
    public JsonRpcMessage withId(JsonNode id) {
        ObjectNode copy = node.deepCopy();
        copy.set("id", id);
        return new JsonRpcMessage(copy);
    }

    public ObjectNode toNode() {
        return node;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
