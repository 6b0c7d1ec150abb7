package io.toolbridge.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolbridge.core.jsonrpc.JsonRpcError;
import io.toolbridge.core.jsonrpc.JsonRpcRequest;
import io.toolbridge.core.jsonrpc.JsonRpcResponses;
import io.toolbridge.core.tool.ToolException;
import io.toolbridge.core.tool.ToolHandler;
import io.toolbridge.core.tool.ToolRegistration;
import io.toolbridge.core.tool.ToolRegistry;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code tools/call}. The handler runs on the caller's thread and is never interrupted.
 */
final class ToolInvoker {
    private static final Logger LOG = LoggerFactory.getLogger(ToolInvoker.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ToolRegistry registry;

    ToolInvoker(ToolRegistry registry) {
        this.registry = registry;
    }

    ObjectNode call(JsonRpcRequest request) {
        JsonNode nameNode = request.param("name");
        String name = nameNode == null ? "" : nameNode.asText();
        Optional<ToolRegistration> registration = registry.lookup(name);
        if (registration.isEmpty()) {
            return JsonRpcResponses.error(request.responseId(), JsonRpcError.INVALID_REQUEST, "Tool not found: " + name);
        }

        ToolHandler handler = registration.get().handler();
        String argument = null;
        if (handler instanceof ToolHandler.SingleArgument single) {
            argument = firstArgument(request.param("arguments"));
            if (argument == null) {
                return JsonRpcResponses.error(
                    request.responseId(),
                    JsonRpcError.INVALID_PARAMS,
                    "Invalid params: tool '" + name + "' requires argument '" + single.parameter() + "'"
                );
            }
        }

        try {
            return JsonRpcResponses.success(request.responseId(), toolResult(invoke(handler, argument), false));
        } catch (ToolException e) {
            LOG.debug("Tool {} reported an error: {}", name, e.getMessage());
            return JsonRpcResponses.success(request.responseId(), toolResult(e.getMessage(), true));
        } catch (Exception | Error e) {
            rethrowIfFatal(e);
            LOG.warn("Tool {} failed", name, e);
            return JsonRpcResponses.error(
                request.responseId(),
                JsonRpcError.INTERNAL_ERROR,
                "Internal error executing tool: " + describe(e)
            );
        }
    }

    // Every VirtualMachineError except StackOverflowError is rethrown.
    static void rethrowIfFatal(Throwable failure) {
        if (failure instanceof VirtualMachineError && !(failure instanceof StackOverflowError)) {
            throw (VirtualMachineError) failure;
        }
    }

    static String describe(Throwable failure) {
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }

    private String invoke(ToolHandler handler, String argument) throws Exception {
        if (handler instanceof ToolHandler.NoArgument noArgument) {
            return noArgument.function().apply();
        }
        return ((ToolHandler.SingleArgument) handler).function().apply(argument);
    }

    // Only the first supplied entry is passed; the rest are ignored.
    private String firstArgument(JsonNode arguments) {
        if (arguments == null || !arguments.isObject() || arguments.isEmpty()) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = arguments.fields();
        JsonNode value = fields.next().getValue();
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.textValue() : value.toString();
    }

    private ObjectNode toolResult(String text, boolean isError) {
        ObjectNode result = NODES.objectNode();
        ArrayNode content = result.putArray("content");
        content.addObject()
            .put("type", "text")
            .put("text", text == null ? "" : text);
        result.put("isError", isError);
        return result;
    }
}
