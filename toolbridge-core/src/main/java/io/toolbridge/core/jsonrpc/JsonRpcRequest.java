package io.toolbridge.core.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Envelope fields of one inbound message. Absent fields are {@code null}; a JSON {@code null} id counts as
 * absent.
 */
public record JsonRpcRequest(
    String jsonrpc,
    JsonNode id,
    String method,
    JsonNode params
) {
    public static JsonRpcRequest from(JsonNode message) {
        if (message == null || !message.isObject()) {
            return new JsonRpcRequest(null, null, null, null);
        }
        JsonNode version = message.get("jsonrpc");
        JsonNode id = message.get("id");
        JsonNode method = message.get("method");
        JsonNode params = message.get("params");
        return new JsonRpcRequest(
            version != null && version.isTextual() ? version.textValue() : null,
            id == null || id.isNull() ? null : id,
            method != null && method.isTextual() ? method.textValue() : null,
            params == null || params.isNull() ? null : params
        );
    }

    public boolean hasId() {
        return id != null;
    }

    public boolean isNotification() {
        return McpMethods.isNotification(method);
    }

    /**
     * Id to echo back in a response; JSON {@code null} when the message carried none.
     */
    public JsonNode responseId() {
        return id == null ? NullNode.getInstance() : id;
    }

    public JsonNode param(String name) {
        if (params == null || !params.isObject()) {
            return null;
        }
        JsonNode value = params.get(name);
        return value == null || value.isNull() ? null : value;
    }
}
