package io.toolbridge.core.jsonrpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

/**
 * Builds request strings the way a client would send them. Intended for tests and for hosts that drive a
 * server in-process.
 */
public final class McpRequests {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_ID = 1;

    private McpRequests() {
    }

    public static String toolsList() {
        return toolsList(DEFAULT_ID);
    }

    public static String toolsList(int id) {
        return write(request(id, McpMethods.TOOLS_LIST));
    }

    public static String toolsCall(String toolName) {
        return toolsCall(toolName, DEFAULT_ID, Map.of());
    }

    public static String toolsCall(String toolName, int id) {
        return toolsCall(toolName, id, Map.of());
    }

    /**
     * Pass a map with a defined iteration order (for example {@link java.util.LinkedHashMap}) when the order of
     * arguments matters; single-argument tools receive the first entry.
     */
    public static String toolsCall(String toolName, int id, Map<String, ?> arguments) {
        ObjectNode request = request(id, McpMethods.TOOLS_CALL);
        ObjectNode params = request.putObject("params");
        params.put("name", toolName);
        params.set("arguments", MAPPER.valueToTree(arguments == null ? Map.of() : arguments));
        return write(request);
    }

    public static String initialize(int id) {
        ObjectNode request = request(id, McpMethods.INITIALIZE);
        request.putObject("params");
        return write(request);
    }

    public static String notification(String method) {
        ObjectNode notification = MAPPER.createObjectNode();
        notification.put("jsonrpc", McpMethods.JSONRPC_VERSION);
        notification.put("method", method);
        return write(notification);
    }

    private static ObjectNode request(int id, String method) {
        ObjectNode request = MAPPER.createObjectNode();
        request.put("jsonrpc", McpMethods.JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        return request;
    }

    private static String write(ObjectNode node) {
        return node.toString();
    }
}
