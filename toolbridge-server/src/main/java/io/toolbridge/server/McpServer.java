package io.toolbridge.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolbridge.core.config.ServerConfig;
import io.toolbridge.core.jsonrpc.JsonRpcError;
import io.toolbridge.core.jsonrpc.JsonRpcResponses;
import io.toolbridge.core.jsonrpc.RequestValidator;
import io.toolbridge.core.jsonrpc.ValidationResult;
import io.toolbridge.core.observability.LoggingMessageTrace;
import io.toolbridge.core.observability.MessageTrace;
import io.toolbridge.core.observability.TraceDirection;
import io.toolbridge.core.tool.ToolAnnotations;
import io.toolbridge.core.tool.ToolHandler;
import io.toolbridge.core.tool.ToolRegistration;
import io.toolbridge.core.tool.ToolRegistry;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One MCP server: its tools, its running flag and the message entry point.
 *
 * <p>The transport that moves bytes to and from the client lives outside this class. It hands each raw
 * message to {@link #process(String)} and writes back whatever comes out. Every public method locks the server
 * instance, so calls from several threads are handled one at a time.
 *
 * <p>Registered tools survive {@link #stop()}; stopping only closes the entry point.
 */
public final class McpServer {
    private static final Logger LOG = LoggerFactory.getLogger(McpServer.class);

    private final ServerConfig config;
    private final MessageTrace trace;
    private final ObjectMapper mapper;
    private final ToolRegistry registry;
    private final MethodDispatcher dispatcher;
    private ServerState state = ServerState.STOPPED;

    public McpServer() {
        this(ServerConfig.defaults());
    }

    public McpServer(ServerConfig config) {
        this(config, new LoggingMessageTrace());
    }

    public McpServer(ServerConfig config, MessageTrace trace) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.trace = Objects.requireNonNull(trace, "trace must not be null");
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.registry = new ToolRegistry();
        this.dispatcher = new MethodDispatcher(registry, config, mapper);
    }

    public synchronized void start() {
        if (state == ServerState.RUNNING) {
            throw new IllegalStateException("MCP server is already running");
        }
        state = ServerState.RUNNING;
        LOG.info("MCP server {} {} started with {} tool(s)", config.serverName(), config.serverVersion(), registry.size());
    }

    public synchronized void stop() {
        if (state == ServerState.STOPPED) {
            throw new IllegalStateException("MCP server is not running");
        }
        state = ServerState.STOPPED;
        LOG.info("MCP server {} stopped", config.serverName());
    }

    public synchronized boolean isRunning() {
        return state == ServerState.RUNNING;
    }

    public synchronized ServerState state() {
        return state;
    }

    public ServerConfig config() {
        return config;
    }

    public synchronized ToolRegistration registerTool(ToolHandler handler, String id, String description) {
        return registry.register(handler, id, description);
    }

    public synchronized ToolRegistration registerTool(
        ToolHandler handler,
        String id,
        String description,
        ToolAnnotations annotations
    ) {
        return registry.register(handler, id, description, annotations);
    }

    public synchronized boolean unregisterTool(String id) {
        return registry.unregister(id);
    }

    public synchronized Optional<ToolRegistration> tool(String id) {
        return registry.lookup(id);
    }

    /**
     * Handles one raw JSON-RPC message.
     *
     * @return the serialized response, or empty for notifications
     * @throws IllegalStateException if the server is not running
     */
    public synchronized Optional<String> process(String message) {
        requireRunning();
        traceIo(TraceDirection.REQUEST, message);

        JsonNode parsed;
        try {
            parsed = mapper.readTree(message == null ? "" : message);
        } catch (JsonProcessingException e) {
            return respond(JsonRpcResponses.error(
                NullNode.getInstance(),
                JsonRpcError.PARSE_ERROR,
                "Parse error: " + e.getOriginalMessage()
            ));
        }
        if (parsed == null || parsed.isMissingNode()) {
            return respond(JsonRpcResponses.error(NullNode.getInstance(), JsonRpcError.PARSE_ERROR, "Parse error: empty message"));
        }
        return respond(handle(parsed).orElse(null));
    }

    /**
     * Handles a message that the caller has already decoded. Validation and dispatch are the same as for
     * {@link #process(String)}.
     */
    public synchronized Optional<JsonNode> process(JsonNode message) {
        requireRunning();
        traceIo(TraceDirection.REQUEST, String.valueOf(message));
        Optional<JsonNode> response = handle(message).map(JsonNode.class::cast);
        response.ifPresent(node -> traceIo(TraceDirection.RESPONSE, node.toString()));
        return response;
    }

    private Optional<ObjectNode> handle(JsonNode message) {
        try {
            ValidationResult validation = RequestValidator.validate(message);
            if (!validation.isValid()) {
                return Optional.of(validation.errorResponse());
            }
            return dispatcher.dispatch(validation.request());
        } catch (RuntimeException | Error e) {
            ToolInvoker.rethrowIfFatal(e);
            LOG.error("Failed to handle message", e);
            return Optional.of(JsonRpcResponses.error(
                responseIdOf(message),
                JsonRpcError.INTERNAL_ERROR,
                "Internal error: " + ToolInvoker.describe(e)
            ));
        }
    }

    // Reads only the id field.
    private JsonNode responseIdOf(JsonNode message) {
        JsonNode id = message != null && message.isObject() ? message.get("id") : null;
        return id == null ? NullNode.getInstance() : id;
    }

    private Optional<String> respond(ObjectNode response) {
        if (response == null) {
            return Optional.empty();
        }
        String serialized = response.toString();
        traceIo(TraceDirection.RESPONSE, serialized);
        return Optional.of(serialized);
    }

    private void requireRunning() {
        if (state != ServerState.RUNNING) {
            throw new IllegalStateException("MCP server is not running");
        }
    }

    private void traceIo(TraceDirection direction, String message) {
        if (config.logIo()) {
            trace.record(direction, message);
        }
    }
}
