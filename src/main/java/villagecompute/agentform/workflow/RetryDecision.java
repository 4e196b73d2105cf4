package villagecompute.agentform.workflow;

import java.time.Duration;

/**
 * Outcome of {@link RetryPolicy#decide(ErrorCategory, int)}.
 *
 * @param action
 *            what the caller should do
 * @param delay
 *            wait before the next attempt ({@link Duration#ZERO} when giving up)
 */
public record RetryDecision(Action action, Duration delay) {

    public enum Action {
        /** Try again after {@code delay}; consumes an attempt. */
        RETRY,
        /** Reschedule after {@code delay} without consuming an attempt. Never done inline. */
        DEFER,
        /** Terminal. */
        GIVE_UP
    }

    public static RetryDecision retry(Duration delay) {
        return new RetryDecision(Action.RETRY, delay);
    }

    public static RetryDecision defer(Duration delay) {
        return new RetryDecision(Action.DEFER, delay);
    }

    public static RetryDecision giveUp() {
        return new RetryDecision(Action.GIVE_UP, Duration.ZERO);
    }

    public boolean shouldRetry() {
        return action != Action.GIVE_UP;
    }

    public boolean consumesAttempt() {
        return action == Action.RETRY;
    }
}
