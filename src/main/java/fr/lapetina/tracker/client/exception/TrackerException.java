package fr.lapetina.tracker.client.exception;

import fr.lapetina.tracker.client.domain.model.TrackerError;

import java.util.OptionalInt;

/**
 * Exception thrown when the tracker answers with a status code the client
 * maps to a {@link TrackerError}.
 *
 * Callers branch on {@link #getError()}; the message is informational only.
 */
public final class TrackerException extends RuntimeException {

    private final TrackerError error;
    private final int statusCode;

    public TrackerException(TrackerError error) {
        super(error.getMessage());
        this.error = error;
        this.statusCode = -1;
    }

    public TrackerException(TrackerError error, int statusCode) {
        super(error.getMessage() + ": " + statusCode);
        this.error = error;
        this.statusCode = statusCode;
    }

    public TrackerError getError() {
        return error;
    }

    public boolean is(TrackerError candidate) {
        return error == candidate;
    }

    /**
     * Status code for {@link TrackerError#INVALID_TRACKER_RESPONSE}, empty otherwise.
     */
    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
