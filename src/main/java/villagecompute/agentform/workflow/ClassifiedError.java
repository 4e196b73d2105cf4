package villagecompute.agentform.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * A failure reduced to the data the retry machinery and status events need.
 *
 * @param category
 *            retry classification
 * @param message
 *            human-readable message, safe to surface in status events
 * @param sourceType
 *            simple class name of the exception that was classified (kept for persisted error metadata)
 * @param retryAfter
 *            upstream-suggested delay (rate-limit reset, breaker cooldown), or null
 */
public record ClassifiedError(ErrorCategory category, String message, String sourceType, Duration retryAfter) {

    public ClassifiedError {
        Objects.requireNonNull(category, "category is required");
        message = message == null ? category.getWireName() : message;
    }

    public static ClassifiedError of(ErrorCategory category, String message) {
        return new ClassifiedError(category, message, null, null);
    }
}
