package fr.lapetina.tracker.client.exception;

import java.util.List;

/**
 * Exception for client configuration that fails validation.
 * Carries every violation found, not only the first one.
 */
public final class InvalidConfigurationException extends RuntimeException {

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super(format(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    private static String format(List<String> violations) {
        if (violations.size() == 1) {
            return "1 error occurred:\n\t* " + violations.get(0);
        }
        StringBuilder message = new StringBuilder()
                .append(violations.size())
                .append(" errors occurred:");
        for (String violation : violations) {
            message.append("\n\t* ").append(violation);
        }
        return message.toString();
    }
}
