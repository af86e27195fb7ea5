package com.deepansh.mcpendpoint.protocol;

/**
 * JSON-RPC 2.0 error codes returned to clients.
 *
 * The -320xx range is reserved by JSON-RPC for implementation-defined server errors;
 * the relay uses it for failures that only exist because a provider sits in between.
 */
public enum JsonRpcError {

    PARSE_ERROR(-32700, "Parse error"),
    INVALID_REQUEST(-32600, "Invalid Request"),
    /** Unknown method, and also unknown tool name on tools/call */
    METHOD_NOT_FOUND(-32601, "Method not found"),
    INVALID_PARAMS(-32602, "Invalid params"),
    INTERNAL_ERROR(-32603, "Internal error"),
    SERVER_UNAVAILABLE(-32001, "MCP server not connected"),
    FORWARD_FAILED(-32002, "Forwarding to MCP server failed"),
    REQUEST_TIMEOUT(-32003, "MCP server did not respond in time");

    private final int code;
    private final String defaultMessage;

    JsonRpcError(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
