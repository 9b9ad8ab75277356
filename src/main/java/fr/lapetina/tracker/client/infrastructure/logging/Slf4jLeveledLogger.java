package fr.lapetina.tracker.client.infrastructure.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link LeveledLogger} writing to SLF4J.
 *
 * Debug messages are dropped. Other levels are forwarded with the key-value
 * pairs rendered after the message as {@code key=value}.
 */
public final class Slf4jLeveledLogger implements LeveledLogger {

    private final Logger log;

    public Slf4jLeveledLogger(Logger log) {
        this.log = log;
    }

    public Slf4jLeveledLogger() {
        this(LoggerFactory.getLogger("fr.lapetina.tracker.client.transport"));
    }

    @Override
    public void debug(String message, Object... keysAndValues) {
        // suppressed
    }

    @Override
    public void info(String message, Object... keysAndValues) {
        if (log.isInfoEnabled()) {
            log.info(format(message, keysAndValues));
        }
    }

    @Override
    public void warn(String message, Object... keysAndValues) {
        if (log.isWarnEnabled()) {
            log.warn(format(message, keysAndValues));
        }
    }

    @Override
    public void error(String message, Object... keysAndValues) {
        if (log.isErrorEnabled()) {
            log.error(format(message, keysAndValues));
        }
    }

    static String format(String message, Object... keysAndValues) {
        if (keysAndValues == null || keysAndValues.length == 0) {
            return message;
        }
        StringBuilder line = new StringBuilder(message);
        for (int i = 0; i < keysAndValues.length; i += 2) {
            line.append(' ').append(keysAndValues[i]);
            if (i + 1 < keysAndValues.length) {
                line.append('=').append(keysAndValues[i + 1]);
            }
        }
        return line.toString();
    }
}
