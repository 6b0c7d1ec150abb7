package io.toolbridge.core.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class JsonRpcResponses {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonRpcResponses() {
    }

    public static ObjectNode success(JsonNode id, JsonNode result) {
        ObjectNode response = NODES.objectNode();
        response.put("jsonrpc", McpMethods.JSONRPC_VERSION);
        response.set("id", id == null ? NullNode.getInstance() : id);
        response.set("result", result == null ? NODES.objectNode() : result);
        return response;
    }

    public static ObjectNode error(JsonNode id, JsonRpcError error, String message) {
        ObjectNode body = NODES.objectNode();
        body.put("code", error.code());
        body.put("message", message);

        ObjectNode response = NODES.objectNode();
        response.put("jsonrpc", McpMethods.JSONRPC_VERSION);
        response.set("id", id == null ? NullNode.getInstance() : id);
        response.set("error", body);
        return response;
    }

    public static boolean isError(JsonNode response) {
        return response != null && response.has("error");
    }
}
