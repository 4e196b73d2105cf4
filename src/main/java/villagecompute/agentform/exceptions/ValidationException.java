package villagecompute.agentform.exceptions;

/**
 * Exception thrown when a work unit is malformed or a prerequisite state is missing (e.g., a form response that is
 * not completed, a question without AI enhancement).
 *
 * <p>
 * Extends RuntimeException per project standards. Classified as {@code validation}, which every retry policy treats as
 * fatal: the run fails once and goes straight to terminal handling.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
