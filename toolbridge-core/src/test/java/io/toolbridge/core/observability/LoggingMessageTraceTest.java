package io.toolbridge.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingMessageTraceTest {
    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingMessageTrace.LOGGER_NAME);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void tagsMessagesWithDirection() {
        MessageTrace trace = new LoggingMessageTrace();

        trace.record(TraceDirection.REQUEST, "{\"id\":1}");
        trace.record(TraceDirection.RESPONSE, "{\"id\":1,\"result\":{}}");

        assertThat(appender.list)
            .extracting(ILoggingEvent::getFormattedMessage)
            .containsExactly("-> (request) {\"id\":1}", "<- (response) {\"id\":1,\"result\":{}}");
    }
}
