package villagecompute.agentform.workflow;

/**
 * Classification used to decide whether, when, and how a failure is retried.
 *
 * <p>
 * {@link #RATE_LIMITED} and {@link #CIRCUIT_OPEN} are deferrals: the work is rescheduled for later without consuming a
 * retry attempt, and is never retried inline.
 */
public enum ErrorCategory {

    /** Malformed input or missing prerequisite state. Never retried. */
    VALIDATION("validation"),

    /** Referenced record does not exist. Fatal unless a policy opts into a short bounded retry. */
    NOT_FOUND("not_found"),

    /** Local or upstream rate limit. Rescheduled with a mandatory delay. */
    RATE_LIMITED("rate_limited"),

    /** Request-level timeout. Retryable with backoff. */
    TIMEOUT("timeout"),

    /** Upstream returned an error (5xx, workflow failure). Retryable up to the policy maximum. */
    EXTERNAL_API_ERROR("external_api_error"),

    /** Short-circuited by an open breaker. Surfaced immediately; the host reschedules after the cooldown. */
    CIRCUIT_OPEN("circuit_open"),

    /** Anything else. Retried conservatively with a fixed delay and a low attempt cap. */
    UNKNOWN("unknown");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isDeferral() {
        return this == RATE_LIMITED || this == CIRCUIT_OPEN;
    }
}
