package io.toolbridge.core.observability;

public enum TraceDirection {
    REQUEST("->", "request"),
    RESPONSE("<-", "response");

    private final String arrow;
    private final String label;

    TraceDirection(String arrow, String label) {
        this.arrow = arrow;
        this.label = label;
    }

    public String prefix() {
        return arrow + " (" + label + ")";
    }
}
