package io.toolbridge.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolbridge.core.config.ServerConfig;
import io.toolbridge.core.jsonrpc.JsonRpcError;
import io.toolbridge.core.jsonrpc.JsonRpcRequest;
import io.toolbridge.core.jsonrpc.JsonRpcResponses;
import io.toolbridge.core.jsonrpc.McpMethods;
import io.toolbridge.core.tool.ToolRegistration;
import io.toolbridge.core.tool.ToolRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a validated request by method name. Notifications never produce a response.
 */
final class MethodDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(MethodDispatcher.class);

    private final ToolRegistry registry;
    private final ServerConfig config;
    private final ObjectMapper mapper;
    private final ToolInvoker invoker;

    MethodDispatcher(ToolRegistry registry, ServerConfig config, ObjectMapper mapper) {
        this.registry = registry;
        this.config = config;
        this.mapper = mapper;
        this.invoker = new ToolInvoker(registry);
    }

    Optional<ObjectNode> dispatch(JsonRpcRequest request) {
        if (request.isNotification()) {
            handleNotification(request.method());
            return Optional.empty();
        }
        return Optional.of(switch (request.method()) {
            case McpMethods.INITIALIZE -> JsonRpcResponses.success(request.responseId(), initializeResult());
            case McpMethods.TOOLS_LIST -> JsonRpcResponses.success(request.responseId(), toolsListResult());
            case McpMethods.TOOLS_CALL -> invoker.call(request);
            default -> JsonRpcResponses.error(
                request.responseId(),
                JsonRpcError.METHOD_NOT_FOUND,
                "Method not found: " + request.method()
            );
        });
    }

    private void handleNotification(String method) {
        switch (method) {
            case McpMethods.INITIALIZED -> LOG.debug("Client completed initialization");
            // In-flight handlers always run to completion.
            case McpMethods.CANCELLED -> LOG.debug("Ignoring cancellation notification");
            default -> LOG.debug("Ignoring unknown notification {}", method);
        }
    }

    private ObjectNode initializeResult() {
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", config.protocolVersion());

        ObjectNode capabilities = result.putObject("capabilities");
        ObjectNode tools = capabilities.putObject("tools");
        if (!registry.isEmpty()) {
            tools.put("listChanged", true);
        }
        capabilities.putObject("resources");
        capabilities.putObject("prompts");

        result.putObject("serverInfo")
            .put("name", config.serverName())
            .put("version", config.serverVersion());
        return result;
    }

    private ObjectNode toolsListResult() {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolRegistration registration : registry.list()) {
            ObjectNode tool = tools.addObject();
            tool.put("name", registration.id());
            tool.put("description", registration.description());
            tool.set("inputSchema", mapper.valueToTree(registration.inputSchema()));
            if (!registration.annotations().isEmpty()) {
                tool.set("annotations", mapper.valueToTree(registration.annotations().toMap()));
            }
        }
        return result;
    }
}
