package villagecompute.agentform.workflow;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.RateLimitException;
import villagecompute.agentform.observability.LoggingConfig;
import villagecompute.agentform.observability.ObservabilityMetrics;
import villagecompute.agentform.services.CreditLedgerService;
import villagecompute.agentform.services.RateLimitService;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs an ordered list of steps for one work unit attempt and returns the resulting {@link RunRecord}.
 *
 * <p>
 * <b>Per step:</b>
 * <ol>
 * <li>Paid step and the account is below the credit floor: recorded as {@code skipped} with reason
 * {@code insufficient_credits}; the run continues</li>
 * <li>Rate-limited step: acquires a slot before the body runs; a denied slot fails the attempt as
 * {@code rate_limited}</li>
 * <li>Body runs through {@link StepRunner}; failures are retried inline while the step's {@link RetryPolicy} says
 * {@code retry}, with each attempt appended to the run</li>
 * <li>A required step that still failed short-circuits the remaining steps</li>
 * </ol>
 *
 * <p>
 * Deferrals ({@code rate_limited}, {@code circuit_open}) are never retried inline; they are left on the run for the
 * job host to reschedule.
 *
 * <p>
 * Inline retry pacing blocks the calling worker thread for the backoff delay (see {@link ThreadSleepPacer}). Only
 * retries between runs are suspended without holding a thread, by re-enqueueing the work unit with a delay.
 */
@ApplicationScoped
public class WorkflowOrchestrator {

    private static final Logger LOG = Logger.getLogger(WorkflowOrchestrator.class);

    static final String INSUFFICIENT_CREDITS = "insufficient_credits";

    @Inject
    Clock clock;

    @Inject
    StepRunner stepRunner;

    @Inject
    Pacer pacer;

    @Inject
    CreditLedgerService creditLedgerService;

    @Inject
    RateLimitService rateLimitService;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    public RunRecord runWorkflow(WorkUnit workUnit, List<StepDefinition> steps) {
        return runWorkflow(workUnit, 1, steps);
    }

    public RunRecord runWorkflow(WorkUnit workUnit, int attemptNumber, List<StepDefinition> steps) {
        LoggingConfig.setWorkUnit(workUnit);
        LoggingConfig.setAttempt(attemptNumber);

        RunRecord run = RunRecord.pending(workUnit, attemptNumber).start(clock.instant());
        LOG.infof("Starting workflow %s for work unit %s (attempt %d, %d steps)", workUnit.eventType().getWireName(),
                workUnit.id(), attemptNumber, steps.size());

        for (StepDefinition step : steps) {
            run = executeStep(run, step);
            StepResult latest = run.latestResults().get(step.name());
            if (step.required() && latest.isFailure()) {
                LOG.warnf("Required step %s failed (%s), skipping remaining steps", step.name(),
                        latest.error().category().getWireName());
                break;
            }
        }

        run = run.finish(clock.instant());
        RunStatus status = run.overallStatus();
        observabilityMetrics.incrementRunOutcome(workUnit.eventType().getWireName(), status.getWireName());
        LOG.infof("Workflow %s for work unit %s finished with status %s", workUnit.eventType().getWireName(),
                workUnit.id(), status.getWireName());
        return run;
    }

    private RunRecord executeStep(RunRecord run, StepDefinition step) {
        if (step.isPaid() && !creditLedgerService.hasSufficientCredits(step.creditAccountId())) {
            Instant now = clock.instant();
            LOG.infof("Skipping paid step %s: account %s below credit floor", step.name(), step.creditAccountId());
            observabilityMetrics.incrementPaidStepSkipped(step.name());
            return run.withStepResult(
                    StepResult.skipped(step.name(), step.required(), Map.of("reason", INSUFFICIENT_CREDITS), 1, now,
                            now));
        }

        StepAction action = guarded(step);
        int stepAttempt = 1;
        while (true) {
            StepResult result = stepRunner.run(step.name(), step.required(), stepAttempt, action);
            run = run.withStepResult(result);
            if (!result.isFailure()) {
                return run;
            }

            RetryDecision decision = step.retryPolicy().decide(result.error().category(), stepAttempt);
            if (!decision.consumesAttempt()) {
                return run;
            }

            LOG.infof("Retrying step %s in %dms (attempt %d failed: %s)", step.name(), decision.delay().toMillis(),
                    stepAttempt, result.error().category().getWireName());
            try {
                pacer.pause(decision.delay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Interrupted while waiting to retry step %s", step.name());
                return run;
            }
            stepAttempt++;
        }
    }

    private StepAction guarded(StepDefinition step) {
        if (!step.isRateLimited()) {
            return step.action();
        }
        return () -> {
            String key = step.rateLimitKey();
            int limit = step.rateLimit() > 0 ? step.rateLimit() : rateLimitService.limitFor(key);
            if (!rateLimitService.tryAcquire(key, limit)) {
                throw new RateLimitException("Rate limit exceeded for " + key, rateLimitService.getRescheduleDelay());
            }
            return step.action().execute();
        };
    }
}
