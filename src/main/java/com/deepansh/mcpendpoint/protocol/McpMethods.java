package com.deepansh.mcpendpoint.protocol;

/**
 * Method names the relay recognises. Everything else is either forwarded to an
 * explicit target or rejected.
 */
public final class McpMethods {

    public static final String INITIALIZE = "initialize";
    public static final String NOTIFICATIONS_INITIALIZED = "notifications/initialized";
    public static final String TOOLS_LIST = "tools/list";
    public static final String TOOLS_CALL = "tools/call";
    public static final String TOOLS_LIST_CHANGED = "notifications/tools/list_changed";
    public static final String PING = "ping";
    public static final String BROADCAST = "broadcast";

    private McpMethods() {
    }
}
