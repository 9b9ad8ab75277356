package fr.lapetina.tracker.client.infrastructure.logging;

/**
 * Leveled log sink handed to the HTTP transport.
 *
 * Each method takes a message followed by alternating keys and values,
 * e.g. {@code logger.warn("request failed", "url", uri, "status", 503)}.
 */
public interface LeveledLogger {

    void debug(String message, Object... keysAndValues);

    void info(String message, Object... keysAndValues);

    void warn(String message, Object... keysAndValues);

    void error(String message, Object... keysAndValues);
}
