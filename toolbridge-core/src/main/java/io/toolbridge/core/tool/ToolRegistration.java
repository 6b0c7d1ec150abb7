package io.toolbridge.core.tool;

import java.util.Map;

public record ToolRegistration(
    String id,
    String description,
    Map<String, Object> inputSchema,
    ToolHandler handler,
    ToolAnnotations annotations
) {
    public ToolRegistration {
        annotations = annotations == null ? ToolAnnotations.none() : annotations;
        inputSchema = inputSchema == null ? Map.of("type", "object") : inputSchema;
    }
}
