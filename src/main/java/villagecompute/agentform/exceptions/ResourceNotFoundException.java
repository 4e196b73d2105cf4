package villagecompute.agentform.exceptions;

/**
 * Exception thrown when a record a work unit refers to cannot be found (e.g., form, form response, question).
 *
 * <p>
 * Extends RuntimeException per project standards. Classified as {@code not_found}; fatal by default, but the
 * completion workflow allows a short bounded retry for eventual-consistency races.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
