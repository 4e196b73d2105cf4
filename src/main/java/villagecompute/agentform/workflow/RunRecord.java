package villagecompute.agentform.workflow;

import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.WorkflowFailedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * All step results for one execution attempt of a work unit.
 *
 * <p>
 * Immutable: every transition returns a new record. {@link #overallStatus()} is derived from the step results and
 * each result's {@code required} flag; it is never stored.
 *
 * <p>
 * Derivation uses the latest result per step name, so a step that failed and then succeeded on an inline retry counts
 * as succeeded:
 * <ul>
 * <li>not started: {@code pending}; started but not finished: {@code running}</li>
 * <li>any required step failed: {@code failed}</li>
 * <li>otherwise any optional step failed: {@code partial}</li>
 * <li>otherwise: {@code completed} (skipped steps do not degrade the run)</li>
 * </ul>
 */
public record RunRecord(String workUnitId, EventType eventType, int attemptNumber, Instant startedAt,
        Instant finishedAt, List<StepResult> stepResults) {

    static final String PREREQUISITES_STEP = "validate_prerequisites";

    public RunRecord {
        Objects.requireNonNull(workUnitId, "workUnitId is required");
        Objects.requireNonNull(eventType, "eventType is required");
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
    }

    public static RunRecord pending(WorkUnit workUnit, int attemptNumber) {
        return new RunRecord(workUnit.id(), workUnit.eventType(), attemptNumber, null, null, List.of());
    }

    /**
     * A run that failed before any step was executed (prerequisite validation, missing records). Recorded as a single
     * failed required step so the audit trail and status derivation stay uniform.
     */
    public static RunRecord rejected(WorkUnit workUnit, int attemptNumber, ClassifiedError error, Instant now) {
        return pending(workUnit, attemptNumber).start(now)
                .withStepResult(StepResult.failure(PREREQUISITES_STEP, true, error, 1, now, now)).finish(now);
    }

    public RunRecord start(Instant now) {
        return new RunRecord(workUnitId, eventType, attemptNumber, now, null, stepResults);
    }

    public RunRecord withStepResult(StepResult result) {
        if (startedAt == null || finishedAt != null) {
            throw new IllegalStateException("Step results can only be added to a running run");
        }
        List<StepResult> results = new ArrayList<>(stepResults);
        results.add(result);
        return new RunRecord(workUnitId, eventType, attemptNumber, startedAt, null, results);
    }

    public RunRecord finish(Instant now) {
        return new RunRecord(workUnitId, eventType, attemptNumber, startedAt == null ? now : startedAt, now,
                stepResults);
    }

    public RunStatus overallStatus() {
        if (startedAt == null) {
            return RunStatus.PENDING;
        }
        if (finishedAt == null) {
            return RunStatus.RUNNING;
        }
        boolean optionalFailed = false;
        for (StepResult latest : latestResults().values()) {
            if (latest.isFailure()) {
                if (latest.required()) {
                    return RunStatus.FAILED;
                }
                optionalFailed = true;
            }
        }
        return optionalFailed ? RunStatus.PARTIAL : RunStatus.COMPLETED;
    }

    /**
     * Latest result per step name, in first-execution order.
     */
    public Map<String, StepResult> latestResults() {
        Map<String, StepResult> latest = new LinkedHashMap<>();
        for (StepResult result : stepResults) {
            latest.put(result.stepName(), result);
        }
        return latest;
    }

    public List<StepResult> resultsFor(String stepName) {
        return stepResults.stream().filter(r -> r.stepName().equals(stepName)).toList();
    }

    /**
     * Error of the required step that failed the run, if any.
     */
    public Optional<ClassifiedError> failure() {
        return latestResults().values().stream().filter(r -> r.required() && r.isFailure()).map(StepResult::error)
                .findFirst();
    }

    /**
     * Translates a failed run into an exception for the host scheduler.
     *
     * @throws WorkflowFailedException
     *             if {@link #overallStatus()} is {@code failed}
     */
    public RunRecord throwIfFailed() {
        if (overallStatus() == RunStatus.FAILED) {
            throw new WorkflowFailedException(failure().orElseThrow(), this);
        }
        return this;
    }
}
