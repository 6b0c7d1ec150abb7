package io.toolbridge.core.tool;

import io.toolbridge.core.schema.SchemaDeriver;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tools exposed by one server, keyed by id and listed in registration order. Not thread-safe; the owning
 * server serializes access.
 */
public final class ToolRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolRegistration> tools = new LinkedHashMap<>();

    public ToolRegistration register(ToolHandler handler, String id, String description) {
        return register(handler, id, description, ToolAnnotations.none());
    }

    public ToolRegistration register(ToolHandler handler, String id, String description, ToolAnnotations annotations) {
        if (handler == null) {
            throw new IllegalArgumentException("Tool handler is required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Tool id is required");
        }
        if (description == null) {
            throw new IllegalArgumentException("Tool description is required for '" + id + "'");
        }

        Map<String, Object> schema = SchemaDeriver.derive(handler.parameters(), handler.documentation());
        ToolRegistration registration = new ToolRegistration(id, description, schema, handler, annotations);
        ToolRegistration previous = tools.put(id, registration);
        LOG.debug("{} tool {}", previous == null ? "Registered" : "Replaced", id);
        return registration;
    }

    public boolean unregister(String id) {
        boolean removed = id != null && tools.remove(id) != null;
        if (removed) {
            LOG.debug("Unregistered tool {}", id);
        }
        return removed;
    }

    public Optional<ToolRegistration> lookup(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(tools.get(id));
    }

    public List<ToolRegistration> list() {
        return List.copyOf(tools.values());
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public int size() {
        return tools.size();
    }
}
