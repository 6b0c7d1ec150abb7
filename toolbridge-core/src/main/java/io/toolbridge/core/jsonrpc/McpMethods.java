package io.toolbridge.core.jsonrpc;

public final class McpMethods {
    public static final String JSONRPC_VERSION = "2.0";
    public static final String NOTIFICATION_PREFIX = "notifications/";

    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "notifications/initialized";
    public static final String CANCELLED = "notifications/cancelled";
    public static final String TOOLS_LIST = "tools/list";
    public static final String TOOLS_CALL = "tools/call";

    private McpMethods() {
    }

    public static boolean isNotification(String method) {
        return method != null && method.startsWith(NOTIFICATION_PREFIX);
    }
}
