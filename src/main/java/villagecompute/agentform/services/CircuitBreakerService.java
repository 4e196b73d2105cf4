package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.agentform.data.models.CircuitState;
import villagecompute.agentform.data.models.CircuitStatus;
import villagecompute.agentform.exceptions.CircuitOpenException;
import villagecompute.agentform.observability.ObservabilityMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-dependency circuit breakers for outbound calls.
 *
 * <p>
 * State lives in this bean, one {@link CircuitState} per dependency key, and every transition is applied with an
 * atomic {@link ConcurrentMap#compute} so concurrent runs against the same dependency see a consistent failure count.
 *
 * <p>
 * <b>Call protocol:</b>
 * <ol>
 * <li>{@code closed}: the call goes through</li>
 * <li>{@code open} with cooldown remaining: rejected with {@link CircuitOpenException}, the function is not
 * invoked</li>
 * <li>{@code open} with cooldown elapsed: moves to {@code half_open} and admits exactly one trial call; concurrent
 * callers are rejected until the trial finishes</li>
 * <li>success resets the failure count and closes the circuit; failure increments it and opens the circuit at the
 * threshold (a failed trial reopens immediately)</li>
 * </ol>
 *
 * <p>
 * Defaults are threshold 5 and cooldown 60s; both can be overridden per dependency via {@link #configure}.
 */
@ApplicationScoped
public class CircuitBreakerService {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerService.class);

    /** Breaker key for the LLM workflow engine. */
    public static final String LLM_WORKFLOW = "llm_workflow";

    private static final Duration TRIAL_IN_FLIGHT_RETRY = Duration.ofSeconds(1);

    @ConfigProperty(
            name = "orchestrator.circuit-breaker.failure-threshold",
            defaultValue = "5")
    int defaultThreshold;

    @ConfigProperty(
            name = "orchestrator.circuit-breaker.cooldown-seconds",
            defaultValue = "60")
    long defaultCooldownSeconds;

    @Inject
    Clock clock;

    @Inject
    ObservabilityMetrics metrics;

    private final ConcurrentMap<String, CircuitState> circuits = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, CircuitState> settings = new ConcurrentHashMap<>();

    /**
     * Invokes {@code fn} through the breaker for {@code dependencyKey}.
     *
     * @return the function's result
     * @throws CircuitOpenException
     *             if the circuit is open (function not invoked)
     * @throws Exception
     *             whatever {@code fn} throws, after it has been counted as a failure
     */
    public <T> T call(String dependencyKey, Callable<T> fn) throws Exception {
        admit(dependencyKey);
        boolean succeeded = false;
        try {
            T result = fn.call();
            succeeded = true;
            return result;
        } finally {
            if (succeeded) {
                recordSuccess(dependencyKey);
            } else {
                recordFailure(dependencyKey);
            }
        }
    }

    /**
     * Overrides threshold and cooldown for one dependency. Applies to the live state as well.
     */
    public void configure(String dependencyKey, int threshold, Duration cooldown) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        settings.put(dependencyKey, CircuitState.closed(dependencyKey, threshold, cooldown));
        circuits.computeIfPresent(dependencyKey, (k, state) -> state.withSettings(threshold, cooldown));
        LOG.infof("Configured circuit breaker: dependency=%s threshold=%d cooldown=%ds", dependencyKey, threshold,
                cooldown.toSeconds());
    }

    /**
     * Current state, without applying time-based transitions. An open circuit whose cooldown has elapsed still
     * reports {@code open} until the next call.
     */
    public CircuitState state(String dependencyKey) {
        return Optional.ofNullable(circuits.get(dependencyKey)).orElseGet(() -> initialState(dependencyKey));
    }

    public List<CircuitState> states() {
        return circuits.values().stream().sorted(Comparator.comparing(CircuitState::dependencyKey)).toList();
    }

    /**
     * Forces the circuit closed (admin operation).
     */
    public CircuitState reset(String dependencyKey) {
        CircuitState closed = circuits.compute(dependencyKey,
                (k, state) -> state == null ? initialState(k) : state.recordSuccess());
        LOG.infof("Circuit manually reset: dependency=%s", dependencyKey);
        metrics.incrementCircuitTransition(dependencyKey, CircuitStatus.CLOSED.getWireName());
        return closed;
    }

    public long openCircuitCount() {
        return circuits.values().stream().filter(s -> s.status() != CircuitStatus.CLOSED).count();
    }

    private void admit(String dependencyKey) {
        Instant now = clock.instant();
        AtomicReference<Duration> rejection = new AtomicReference<>();
        AtomicReference<CircuitStatus> previous = new AtomicReference<>();

        CircuitState after = circuits.compute(dependencyKey, (k, state) -> {
            CircuitState current = state != null ? state : initialState(k);
            previous.set(current.status());
            if (current.status() == CircuitStatus.CLOSED) {
                return current;
            }
            if (current.status() == CircuitStatus.OPEN) {
                if (current.cooldownElapsed(now)) {
                    return current.startTrial();
                }
                rejection.set(current.remainingCooldown(now));
                return current;
            }
            if (current.trialInFlight()) {
                rejection.set(TRIAL_IN_FLIGHT_RETRY);
                return current;
            }
            return current.startTrial();
        });

        if (previous.get() == CircuitStatus.OPEN && after.status() == CircuitStatus.HALF_OPEN) {
            LOG.infof("Circuit half-open, admitting trial call: dependency=%s", dependencyKey);
            metrics.incrementCircuitTransition(dependencyKey, CircuitStatus.HALF_OPEN.getWireName());
        }
        if (rejection.get() != null) {
            LOG.debugf("Circuit open, rejecting call: dependency=%s remaining=%ds", dependencyKey,
                    rejection.get().toSeconds());
            throw new CircuitOpenException(dependencyKey, rejection.get());
        }
    }

    private void recordSuccess(String dependencyKey) {
        AtomicReference<CircuitStatus> previous = new AtomicReference<>();
        circuits.compute(dependencyKey, (k, state) -> {
            CircuitState current = state != null ? state : initialState(k);
            previous.set(current.status());
            return current.recordSuccess();
        });
        if (previous.get() != CircuitStatus.CLOSED) {
            LOG.infof("Circuit closed after successful call: dependency=%s", dependencyKey);
            metrics.incrementCircuitTransition(dependencyKey, CircuitStatus.CLOSED.getWireName());
        }
    }

    private void recordFailure(String dependencyKey) {
        Instant now = clock.instant();
        AtomicReference<CircuitStatus> previous = new AtomicReference<>();
        CircuitState after = circuits.compute(dependencyKey, (k, state) -> {
            CircuitState current = state != null ? state : initialState(k);
            previous.set(current.status());
            return current.recordFailure(now);
        });
        if (after.status() == CircuitStatus.OPEN && previous.get() != CircuitStatus.OPEN) {
            LOG.warnf("Circuit opened: dependency=%s consecutiveFailures=%d cooldown=%ds", dependencyKey,
                    after.consecutiveFailures(), after.cooldown().toSeconds());
            metrics.incrementCircuitTransition(dependencyKey, CircuitStatus.OPEN.getWireName());
        } else {
            LOG.debugf("Circuit failure recorded: dependency=%s consecutiveFailures=%d/%d", dependencyKey,
                    after.consecutiveFailures(), after.threshold());
        }
    }

    private CircuitState initialState(String dependencyKey) {
        CircuitState configured = settings.get(dependencyKey);
        if (configured != null) {
            return configured;
        }
        return CircuitState.closed(dependencyKey, defaultThreshold, Duration.ofSeconds(defaultCooldownSeconds));
    }
}
