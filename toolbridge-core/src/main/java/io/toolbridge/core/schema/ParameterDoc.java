package io.toolbridge.core.schema;

public record ParameterDoc(
    String name,
    String description
) {
    public ParameterDoc {
        name = name == null ? "" : name.trim();
        description = description == null ? "" : description.trim();
    }

    public boolean hasDescription() {
        return !description.isBlank();
    }
}
