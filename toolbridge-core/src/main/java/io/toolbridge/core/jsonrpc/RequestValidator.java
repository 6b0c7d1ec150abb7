package io.toolbridge.core.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks the JSON-RPC 2.0 envelope of a decoded message. Checks run in a fixed order and stop at the first
 * failure.
 */
public final class RequestValidator {

    private RequestValidator() {
    }

    public static ValidationResult validate(JsonNode message) {
        JsonRpcRequest request = JsonRpcRequest.from(message);

        if (!McpMethods.JSONRPC_VERSION.equals(request.jsonrpc())) {
            return ValidationResult.invalid(request, "Invalid Request: Not JSON-RPC 2.0");
        }
        if (request.isNotification() && request.hasId()) {
            return ValidationResult.invalid(request, "Invalid Request: Notifications must not include 'id' field");
        }
        if (!request.isNotification() && !request.hasId()) {
            return ValidationResult.invalid(request, "Invalid Request: Missing required 'id' field");
        }
        if (request.method() == null) {
            return ValidationResult.invalid(request, "Invalid Request: Missing required 'method' field");
        }
        return ValidationResult.valid(request);
    }
}
