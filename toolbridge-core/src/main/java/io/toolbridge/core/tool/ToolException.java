package io.toolbridge.core.tool;

/**
 * Thrown by a tool handler to report a problem to the client. The message is shown to the client as-is,
 * inside a tool result flagged {@code isError}, rather than as a protocol error.
 */
public final class ToolException extends Exception {
    public ToolException(String message) {
        super(message);
    }

    public ToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
