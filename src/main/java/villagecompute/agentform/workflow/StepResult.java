package villagecompute.agentform.workflow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of one attempt of one step. Inline retries append further results for the same step name; earlier
 * results are kept for audit.
 *
 * @param stepName
 *            step identifier
 * @param required
 *            whether the step's failure fails the run
 * @param status
 *            success, failure or skipped
 * @param error
 *            classified error (failure only)
 * @param sideEffects
 *            structured data reported by the step
 * @param stepAttempt
 *            1-indexed inline attempt number
 * @param startedAt
 *            attempt start
 * @param finishedAt
 *            attempt end
 */
public record StepResult(String stepName, boolean required, StepStatus status, ClassifiedError error,
        Map<String, Object> sideEffects, int stepAttempt, Instant startedAt, Instant finishedAt) {

    public StepResult {
        Objects.requireNonNull(stepName, "stepName is required");
        Objects.requireNonNull(status, "status is required");
        if (status == StepStatus.FAILURE && error == null) {
            throw new IllegalArgumentException("failed step result requires an error");
        }
        sideEffects = sideEffects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sideEffects));
    }

    public static StepResult success(String stepName, boolean required, Map<String, Object> sideEffects,
            int stepAttempt, Instant startedAt, Instant finishedAt) {
        return new StepResult(stepName, required, StepStatus.SUCCESS, null, sideEffects, stepAttempt, startedAt,
                finishedAt);
    }

    public static StepResult failure(String stepName, boolean required, ClassifiedError error, int stepAttempt,
            Instant startedAt, Instant finishedAt) {
        return new StepResult(stepName, required, StepStatus.FAILURE, error, Map.of(), stepAttempt, startedAt,
                finishedAt);
    }

    public static StepResult skipped(String stepName, boolean required, Map<String, Object> sideEffects,
            int stepAttempt, Instant startedAt, Instant finishedAt) {
        return new StepResult(stepName, required, StepStatus.SKIPPED, null, sideEffects, stepAttempt, startedAt,
                finishedAt);
    }

    public boolean isFailure() {
        return status == StepStatus.FAILURE;
    }
}
