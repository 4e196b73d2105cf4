package villagecompute.agentform.data.models;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable breaker state for one dependency. Transitions return new instances and are applied atomically by
 * {@code CircuitBreakerService}.
 *
 * <p>
 * Transitions:
 * <ul>
 * <li>{@code closed -> open} once {@code consecutiveFailures >= threshold}</li>
 * <li>{@code open -> half_open} when the cooldown has elapsed; exactly one trial call is admitted</li>
 * <li>{@code half_open -> closed} on the trial's success, {@code half_open -> open} on its failure</li>
 * </ul>
 */
public record CircuitState(String dependencyKey, CircuitStatus status, int consecutiveFailures, Instant openedAt,
        Duration cooldown, int threshold, boolean trialInFlight) {

    public static CircuitState closed(String dependencyKey, int threshold, Duration cooldown) {
        return new CircuitState(dependencyKey, CircuitStatus.CLOSED, 0, null, cooldown, threshold, false);
    }

    public boolean cooldownElapsed(Instant now) {
        return openedAt == null || !now.isBefore(openedAt.plus(cooldown));
    }

    public Duration remainingCooldown(Instant now) {
        if (openedAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, openedAt.plus(cooldown));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public CircuitState startTrial() {
        return new CircuitState(dependencyKey, CircuitStatus.HALF_OPEN, consecutiveFailures, openedAt, cooldown,
                threshold, true);
    }

    public CircuitState recordSuccess() {
        return closed(dependencyKey, threshold, cooldown);
    }

    public CircuitState recordFailure(Instant now) {
        int failures = consecutiveFailures + 1;
        if (status == CircuitStatus.HALF_OPEN || failures >= threshold) {
            return new CircuitState(dependencyKey, CircuitStatus.OPEN, failures, now, cooldown, threshold, false);
        }
        return new CircuitState(dependencyKey, status, failures, openedAt, cooldown, threshold, false);
    }

    public CircuitState withSettings(int newThreshold, Duration newCooldown) {
        return new CircuitState(dependencyKey, status, consecutiveFailures, openedAt, newCooldown, newThreshold,
                trialInFlight);
    }
}
