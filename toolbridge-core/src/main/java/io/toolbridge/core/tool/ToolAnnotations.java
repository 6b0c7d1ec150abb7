package io.toolbridge.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional display hints for a tool. Only {@code null} means unset: an empty title is still listed, and
 * {@code readOnlyHint} is tri-state, so {@code false} is advertised explicitly.
 */
public record ToolAnnotations(
    String title,
    Boolean readOnlyHint
) {
    private static final ToolAnnotations NONE = new ToolAnnotations(null, null);

    public static ToolAnnotations none() {
        return NONE;
    }

    public static ToolAnnotations titled(String title) {
        return new ToolAnnotations(title, null);
    }

    public boolean isEmpty() {
        return title == null && readOnlyHint == null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (title != null) {
            map.put("title", title);
        }
        if (readOnlyHint != null) {
            map.put("readOnlyHint", readOnlyHint);
        }
        return Collections.unmodifiableMap(map);
    }
}
