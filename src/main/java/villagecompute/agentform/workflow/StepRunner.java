package villagecompute.agentform.workflow;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.observability.LoggingConfig;
import villagecompute.agentform.observability.ObservabilityMetrics;

import java.time.Clock;
import java.time.Instant;

/**
 * Executes one attempt of one step and captures the outcome as a {@link StepResult}.
 *
 * <p>
 * Never throws for step failures: any exception raised by the action is classified with {@link ErrorClassifier} and
 * returned as a {@code failure} result. Each attempt runs in its own {@code workflow.step} span with
 * {@code step_name} in the MDC.
 */
@ApplicationScoped
public class StepRunner {

    private static final Logger LOG = Logger.getLogger(StepRunner.class);

    @Inject
    Clock clock;

    @Inject
    Tracer tracer;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    public StepResult run(String stepName, boolean required, StepAction action) {
        return run(stepName, required, 1, action);
    }

    public StepResult run(String stepName, boolean required, int stepAttempt, StepAction action) {
        Instant startedAt = clock.instant();
        Span span = tracer.spanBuilder("workflow.step").setAttribute("step.name", stepName)
                .setAttribute("step.required", required).setAttribute("step.attempt", stepAttempt).startSpan();
        LoggingConfig.setStepName(stepName);

        StepResult result;
        try (Scope scope = span.makeCurrent()) {
            StepOutcome outcome = action.execute();
            if (outcome == null) {
                outcome = StepOutcome.success();
            }
            if (outcome.skipped()) {
                LOG.infof("Step %s skipped: %s", stepName, outcome.reason());
                result = StepResult.skipped(stepName, required, outcome.sideEffects(), stepAttempt, startedAt,
                        clock.instant());
            } else {
                LOG.debugf("Step %s succeeded on attempt %d", stepName, stepAttempt);
                result = StepResult.success(stepName, required, outcome.sideEffects(), stepAttempt, startedAt,
                        clock.instant());
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ClassifiedError error = ErrorClassifier.classify(e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, error.category().getWireName());
            if (required) {
                LOG.errorf(e, "Required step %s failed on attempt %d: category=%s", stepName, stepAttempt,
                        error.category().getWireName());
            } else {
                LOG.warnf("Optional step %s failed on attempt %d: category=%s message=%s", stepName, stepAttempt,
                        error.category().getWireName(), error.message());
            }
            result = StepResult.failure(stepName, required, error, stepAttempt, startedAt, clock.instant());
        } finally {
            span.end();
            LoggingConfig.clearStepName();
        }

        observabilityMetrics.incrementStepOutcome(stepName, result.status().getWireName());
        return result;
    }
}
