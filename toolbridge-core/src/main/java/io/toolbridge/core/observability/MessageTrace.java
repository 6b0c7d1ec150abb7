package io.toolbridge.core.observability;

/**
 * Receives every raw message crossing the server boundary while I/O tracing is enabled.
 */
@FunctionalInterface
public interface MessageTrace {
    void record(TraceDirection direction, String message);

    static MessageTrace noop() {
        return (direction, message) -> {
        };
    }
}
