package villagecompute.agentform.exceptions;

import java.time.Duration;

/**
 * Exception thrown by {@code CircuitBreakerService} when a call is short-circuited because the dependency's breaker is
 * open (or a half-open trial is already in flight).
 *
 * <p>
 * The wrapped function is never invoked. Callers are expected to reschedule after {@link #getRemainingCooldown()}.
 */
public class CircuitOpenException extends RuntimeException {

    private final String dependencyKey;
    private final Duration remainingCooldown;

    public CircuitOpenException(String dependencyKey, Duration remainingCooldown) {
        super("Circuit open for " + dependencyKey + " (retry in " + remainingCooldown.toSeconds() + "s)");
        this.dependencyKey = dependencyKey;
        this.remainingCooldown = remainingCooldown;
    }

    public String getDependencyKey() {
        return dependencyKey;
    }

    public Duration getRemainingCooldown() {
        return remainingCooldown;
    }
}
