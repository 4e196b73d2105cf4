package villagecompute.agentform.exceptions;

import java.time.Duration;

/**
 * Exception thrown when a rate limit is exceeded, either locally (per-tenant {@code RateLimitService} window) or by an
 * upstream API (HTTP 429, LLM provider throttling).
 *
 * <p>
 * The run is rescheduled after {@link #getRetryAfter()} without consuming a retry attempt.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class RateLimitException extends RuntimeException {

    private final Duration retryAfter;

    public RateLimitException(String message) {
        this(message, (Duration) null);
    }

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
        this.retryAfter = null;
    }

    /**
     * Returns the suggested delay before retrying, or null when the caller should use its policy default.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
