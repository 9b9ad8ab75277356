package fr.lapetina.tracker.client.infrastructure.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class Slf4jLeveledLoggerTest {

    private Logger logbackLogger;
    private ListAppender<ILoggingEvent> appender;
    private Slf4jLeveledLogger logger;

    @BeforeEach
    void setUp() {
        logbackLogger = (Logger) LoggerFactory.getLogger("tracker-test-sink");
        logbackLogger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logbackLogger.addAppender(appender);
        logger = new Slf4jLeveledLogger(logbackLogger);
    }

    @AfterEach
    void tearDown() {
        logbackLogger.detachAppender(appender);
    }

    @Test
    @DisplayName("should suppress debug messages")
    void shouldSuppressDebug() {
        logger.debug("performing request", "url", "http://tracker.test");

        assertThat(appender.list).isEmpty();
    }

    @Test
    @DisplayName("should forward other levels with key-value pairs after the message")
    void shouldForwardOtherLevels() {
        logger.info("retrying", "attempt", 2);
        logger.warn("tracker server error", "status", 503, "latencyMs", 12);
        logger.error("request failed");

        assertThat(appender.list).hasSize(3);
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(appender.list.get(0).getFormattedMessage()).isEqualTo("retrying attempt=2");
        assertThat(appender.list.get(1).getLevel()).isEqualTo(Level.WARN);
        assertThat(appender.list.get(1).getFormattedMessage())
                .isEqualTo("tracker server error status=503 latencyMs=12");
        assertThat(appender.list.get(2).getLevel()).isEqualTo(Level.ERROR);
        assertThat(appender.list.get(2).getFormattedMessage()).isEqualTo("request failed");
    }

    @Test
    @DisplayName("should render a dangling key on its own")
    void shouldRenderDanglingKey() {
        assertThat(Slf4jLeveledLogger.format("done", "items", 3, "orphan"))
                .isEqualTo("done items=3 orphan");
    }

    @Test
    @DisplayName("should not interpret braces in values as placeholders")
    void shouldNotInterpretBraces() {
        logger.warn("bad body", "body", "{}");

        assertThat(appender.list.get(0).getFormattedMessage()).isEqualTo("bad body body={}");
    }
}
