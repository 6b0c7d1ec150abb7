package io.toolbridge.core.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingMessageTrace implements MessageTrace {
    public static final String LOGGER_NAME = "io.toolbridge.trace";

    private final Logger logger;

    public LoggingMessageTrace() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public LoggingMessageTrace(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void record(TraceDirection direction, String message) {
        logger.info("{} {}", direction.prefix(), message);
    }
}
