package com.deepansh.mcpendpoint.exception;

import com.deepansh.mcpendpoint.protocol.JsonRpcError;
import lombok.Getter;

/**
 * A routing failure that is answered to the caller as a JSON-RPC error object.
 * Never escapes the router.
 */
@Getter
public class JsonRpcException extends BrokerException {

    private final JsonRpcError error;

    public JsonRpcException(JsonRpcError error, String message) {
        super(message);
        this.error = error;
    }

    public static JsonRpcException invalidParams(String message) {
        return new JsonRpcException(JsonRpcError.INVALID_PARAMS, message);
    }

    public static JsonRpcException toolNotFound(String toolName) {
        return new JsonRpcException(JsonRpcError.METHOD_NOT_FOUND, "Tool '" + toolName + "' not found");
    }

    public static JsonRpcException methodNotFound(String method) {
        return new JsonRpcException(JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + method);
    }

    public static JsonRpcException serverUnavailable(String serverId) {
        return new JsonRpcException(JsonRpcError.SERVER_UNAVAILABLE, "MCP server '" + serverId + "' is not connected");
    }
}
