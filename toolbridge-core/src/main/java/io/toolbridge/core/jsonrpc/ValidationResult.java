package io.toolbridge.core.jsonrpc;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record ValidationResult(
    JsonRpcRequest request,
    ObjectNode errorResponse
) {
    public static ValidationResult valid(JsonRpcRequest request) {
        return new ValidationResult(request, null);
    }

    public static ValidationResult invalid(JsonRpcRequest request, String message) {
        return new ValidationResult(
            request,
            JsonRpcResponses.error(request.responseId(), JsonRpcError.INVALID_REQUEST, message)
        );
    }

    public boolean isValid() {
        return errorResponse == null;
    }
}
