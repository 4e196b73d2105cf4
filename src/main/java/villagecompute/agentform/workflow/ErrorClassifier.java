package villagecompute.agentform.workflow;

import villagecompute.agentform.exceptions.CircuitOpenException;
import villagecompute.agentform.exceptions.ExternalApiException;
import villagecompute.agentform.exceptions.RateLimitException;
import villagecompute.agentform.exceptions.ResourceNotFoundException;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.exceptions.WorkflowFailedException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions to {@link ErrorCategory} values.
 *
 * <p>
 * The cause chain is walked from the outermost exception inward and the first recognised type wins, so a
 * {@code RuntimeException} wrapping an {@link HttpTimeoutException} still classifies as {@code timeout}.
 *
 * <p>
 * HTTP status mapping for {@link ExternalApiException}: 429 is {@code rate_limited}, any other 4xx is
 * {@code validation}, everything else is {@code external_api_error}.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class, no instantiation
    }

    public static ClassifiedError classify(Throwable throwable) {
        if (throwable == null) {
            return ClassifiedError.of(ErrorCategory.UNKNOWN, "Unknown error");
        }
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = throwable;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            ClassifiedError match = match(current);
            if (match != null) {
                return match;
            }
            current = current.getCause();
        }
        return error(ErrorCategory.UNKNOWN, throwable, null);
    }

    private static ClassifiedError match(Throwable t) {
        if (t instanceof WorkflowFailedException failed) {
            return failed.getError();
        }
        if (t instanceof ValidationException || t instanceof IllegalArgumentException) {
            return error(ErrorCategory.VALIDATION, t, null);
        }
        if (t instanceof ResourceNotFoundException) {
            return error(ErrorCategory.NOT_FOUND, t, null);
        }
        if (t instanceof RateLimitException rateLimit) {
            return error(ErrorCategory.RATE_LIMITED, t, rateLimit.getRetryAfter());
        }
        if (t instanceof CircuitOpenException open) {
            return error(ErrorCategory.CIRCUIT_OPEN, t, open.getRemainingCooldown());
        }
        if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException
                || t instanceof TimeoutException) {
            return error(ErrorCategory.TIMEOUT, t, null);
        }
        if (t instanceof ExternalApiException api) {
            return error(categoryForStatus(api.getStatusCode()), t, null);
        }
        if (t instanceof IOException || t instanceof UncheckedIOException) {
            if (t.getCause() != null && match(t.getCause()) != null) {
                return null; // the cause is more specific
            }
            return error(ErrorCategory.EXTERNAL_API_ERROR, t, null);
        }
        return null;
    }

    /**
     * Category for an HTTP status code returned by an outbound call.
     */
    public static ErrorCategory categoryForStatus(int statusCode) {
        if (statusCode == 429) {
            return ErrorCategory.RATE_LIMITED;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return ErrorCategory.VALIDATION;
        }
        return ErrorCategory.EXTERNAL_API_ERROR;
    }

    private static ClassifiedError error(ErrorCategory category, Throwable t, Duration retryAfter) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new ClassifiedError(category, message, t.getClass().getSimpleName(), retryAfter);
    }
}
