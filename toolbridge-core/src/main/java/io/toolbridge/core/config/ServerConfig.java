package io.toolbridge.core.config;

import java.util.Locale;
import java.util.Map;

public record ServerConfig(
    String serverName,
    String serverVersion,
    String protocolVersion,
    boolean logIo
) {
    public static final String DEFAULT_SERVER_NAME = "toolbridge";
    public static final String DEFAULT_SERVER_VERSION = "0.1.0";
    public static final String DEFAULT_PROTOCOL_VERSION = "2025-03-26";

    public ServerConfig {
        serverName = blankToDefault(serverName, DEFAULT_SERVER_NAME);
        serverVersion = blankToDefault(serverVersion, DEFAULT_SERVER_VERSION);
        protocolVersion = blankToDefault(protocolVersion, DEFAULT_PROTOCOL_VERSION);
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_SERVER_NAME, DEFAULT_SERVER_VERSION, DEFAULT_PROTOCOL_VERSION, false);
    }

    public static ServerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static ServerConfig fromEnv(Map<String, String> env) {
        return new ServerConfig(
            env(env, "TOOLBRIDGE_SERVER_NAME", DEFAULT_SERVER_NAME),
            env(env, "TOOLBRIDGE_SERVER_VERSION", DEFAULT_SERVER_VERSION),
            env(env, "TOOLBRIDGE_PROTOCOL_VERSION", DEFAULT_PROTOCOL_VERSION),
            boolEnv(env, "TOOLBRIDGE_LOG_IO", false)
        );
    }

    public ServerConfig withLogIo(boolean enabled) {
        return new ServerConfig(serverName, serverVersion, protocolVersion, enabled);
    }

    private static String env(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static boolean boolEnv(Map<String, String> env, String key, boolean fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off" -> false;
            default -> fallback;
        };
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
