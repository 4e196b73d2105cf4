package villagecompute.agentform.exceptions;

/**
 * Exception thrown when an outbound call (webhook, Slack, CRM, LLM workflow) returns a non-success response.
 *
 * <p>
 * Carries the HTTP status code when one is available so the error classifier can tell client errors (fatal) from
 * server errors (retryable). A status of {@code -1} means the failure happened without an HTTP exchange, e.g. an LLM
 * workflow reporting {@code success=false}.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class ExternalApiException extends RuntimeException {

    private final int statusCode;

    public ExternalApiException(String message) {
        this(message, -1);
    }

    public ExternalApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExternalApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode > 0;
    }
}
