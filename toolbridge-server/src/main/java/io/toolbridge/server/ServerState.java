package io.toolbridge.server;

public enum ServerState {
    RUNNING,
    STOPPED
}
