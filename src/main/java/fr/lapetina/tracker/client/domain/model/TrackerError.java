package fr.lapetina.tracker.client.domain.model;

/**
 * Outcomes the tracker signals through HTTP status codes.
 */
public enum TrackerError {
    /** Nothing to hand out right now; back off and ask again later. */
    NO_TASKS_AVAILABLE("no tasks available"),

    /** The tracker does not know the configured project. */
    NO_SUCH_PROJECT("this project doesn't exist"),

    /** Any other unexpected status code. */
    INVALID_TRACKER_RESPONSE("invalid tracker response");

    private final String message;

    TrackerError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
