package villagecompute.agentform.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.StatusEventType;
import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.WorkflowFailedException;
import villagecompute.agentform.jobs.JobHandler;
import villagecompute.agentform.jobs.JobQueue;
import villagecompute.agentform.jobs.JobScheduler;
import villagecompute.agentform.jobs.JobType;
import villagecompute.agentform.observability.LoggingConfig;
import villagecompute.agentform.observability.ObservabilityMetrics;
import villagecompute.agentform.workflow.ClassifiedError;
import villagecompute.agentform.workflow.ErrorClassifier;
import villagecompute.agentform.workflow.RetryDecision;
import villagecompute.agentform.workflow.RunRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Host runtime for work units: enqueue, dispatch to the handler for the event's {@link JobType}, and apply the outer
 * retry policy.
 *
 * <p>
 * This service provides the boundary between workflow results and the job queues:
 * <ul>
 * <li>Work unit creation with the subject key taken from the payload</li>
 * <li>Dispatch onto the queue family's workers via {@link JobScheduler}</li>
 * <li>Outer retry, deferral and terminal failure handling per the handler's retry policy</li>
 * <li>Audit of every run in {@link RunHistoryService}</li>
 * <li>OpenTelemetry instrumentation for observability</li>
 * </ul>
 *
 * <p>
 * <b>Failure handling:</b> a run whose overall status is {@code failed} is translated into
 * {@link WorkflowFailedException} here and nowhere else. The handler's policy then decides:
 * <ul>
 * <li>{@code retry}: re-enqueued with {@code attempt + 1} after the policy delay</li>
 * <li>{@code defer} ({@code rate_limited}, {@code circuit_open}): re-enqueued with the same attempt number after the
 * error's retry-after (or the policy delay), at most {@code orchestrator.jobs.max-deferrals} times</li>
 * <li>{@code give_up}: terminal; the error is persisted (last 3 kept) and a {@code failed} status event is sent</li>
 * </ul>
 *
 * @see JobHandler for handler contract
 * @see JobQueue for queue family descriptions
 * @see JobType for job-to-queue mappings
 */
@ApplicationScoped
public class DelayedJobService {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    /**
     * Number of terminal errors kept per work unit.
     */
    static final int ERROR_HISTORY_LIMIT = 3;

    @ConfigProperty(
            name = "orchestrator.jobs.max-deferrals",
            defaultValue = "10")
    int maxDeferrals;

    /**
     * Registry mapping JobType → JobHandler for CDI-based handler discovery. Populated at application startup via
     * {@link #buildHandlerRegistry}.
     */
    private final Map<JobType, JobHandler> handlerRegistry;

    private final Map<JobQueue, AtomicInteger> inFlight = new EnumMap<>(JobQueue.class);

    @Inject
    Tracer tracer;

    @Inject
    Clock clock;

    @Inject
    JobScheduler jobScheduler;

    @Inject
    RunHistoryService runHistoryService;

    @Inject
    RecordStore recordStore;

    @Inject
    StatusNotifier statusNotifier;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    @Inject
    public DelayedJobService(Instance<JobHandler> handlers) {
        this((Iterable<JobHandler>) handlers);
    }

    DelayedJobService(Iterable<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        for (JobQueue queue : JobQueue.values()) {
            inFlight.put(queue, new AtomicInteger());
        }
        LOG.infof("Initialized DelayedJobService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds the type → handler map.
     *
     * @throws IllegalStateException
     *             if duplicate handlers register for the same JobType
     */
    private Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s (queue: %s)", handler.getClass().getSimpleName(), type,
                    type.getQueue());
        }
        return registry;
    }

    /**
     * Creates a work unit for {@code eventType} and schedules its first attempt immediately.
     *
     * @return the work unit id (the event's subject key)
     * @throws villagecompute.agentform.exceptions.ValidationException
     *             if the payload lacks the subject key
     */
    public String enqueue(EventType eventType, Map<String, Object> payload) {
        return enqueue(eventType, payload, Duration.ZERO);
    }

    public String enqueue(EventType eventType, Map<String, Object> payload, Duration delay) {
        WorkUnit workUnit = WorkUnit.of(eventType, payload, clock.instant());
        JobType jobType = JobType.forEvent(eventType);
        LOG.infof("Enqueued %s work unit %s on queue %s (delay %ds)", eventType.getWireName(), workUnit.id(),
                jobType.getQueue(), delay.toSeconds());
        submit(jobType, workUnit, 1, 0, delay);
        return workUnit.id();
    }

    /**
     * Executes one attempt of a work unit and applies the outer retry policy to the outcome.
     *
     * @param deferrals
     *            deferrals already spent on this attempt number
     * @return the run record of this attempt
     * @throws IllegalStateException
     *             if no handler registered for jobType
     */
    public RunRecord executeJob(JobType jobType, WorkUnit workUnit, int attempt, int deferrals) {
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("work_unit.id", workUnit.id())
                .setAttribute("job.type", jobType.name()).setAttribute("job.queue", jobType.getQueue().name())
                .setAttribute("job.attempt", attempt).startSpan();

        RunRecord run;
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setWorkUnit(workUnit);
            LoggingConfig.setJobQueue(jobType.getQueue().name());
            LoggingConfig.setAttempt(attempt);

            run = runHandler(handler, workUnit, attempt);
            runHistoryService.record(run);

            try {
                run.throwIfFailed();
                span.addEvent("job.completed");
                LOG.infof("Work unit %s (type: %s) finished with status %s on attempt %d", workUnit.id(), jobType,
                        run.overallStatus().getWireName(), attempt);
                statusNotifier.notify(workUnit.channelKey(),
                        StatusEventType.completed(run, clock.instant()).toMap());
            } catch (WorkflowFailedException e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, e.getError().category().getWireName());
                span.addEvent("job.failed");
                handleFailure(jobType, handler, workUnit, attempt, deferrals, e);
            }
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
        return run;
    }

    /**
     * Scheduled or running jobs for a queue family.
     */
    public int getInFlightCount(JobQueue queue) {
        return inFlight.get(queue).get();
    }

    private RunRecord runHandler(JobHandler handler, WorkUnit workUnit, int attempt) {
        try {
            return handler.execute(workUnit, attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf(e, "Work unit %s interrupted during execution", workUnit.id());
            return RunRecord.rejected(workUnit, attempt, ErrorClassifier.classify(e), clock.instant());
        } catch (Exception e) {
            ClassifiedError error = ErrorClassifier.classify(e);
            LOG.warnf("Work unit %s rejected before any step ran: category=%s message=%s", workUnit.id(),
                    error.category().getWireName(), error.message());
            return RunRecord.rejected(workUnit, attempt, error, clock.instant());
        }
    }

    private void handleFailure(JobType jobType, JobHandler handler, WorkUnit workUnit, int attempt, int deferrals,
            WorkflowFailedException failure) {
        ClassifiedError error = failure.getError();
        RetryDecision decision = handler.retryPolicy().decide(error.category(), attempt);

        switch (decision.action()) {
            case RETRY -> {
                LOG.warnf("Work unit %s (type: %s) failed on attempt %d (%s), retrying in %ds", workUnit.id(),
                        jobType, attempt, error.category().getWireName(), decision.delay().toSeconds());
                observabilityMetrics.incrementJobReschedule(jobType.name(), "retry");
                submit(jobType, workUnit, attempt + 1, 0, decision.delay());
            }
            case DEFER -> {
                if (deferrals >= maxDeferrals) {
                    LOG.errorf("Work unit %s (type: %s) exceeded %d deferrals", workUnit.id(), jobType, maxDeferrals);
                    terminal(jobType, workUnit, failure);
                    return;
                }
                Duration delay = error.retryAfter() != null ? error.retryAfter() : decision.delay();
                LOG.infof("Work unit %s (type: %s) deferred (%s), rescheduling attempt %d in %ds", workUnit.id(),
                        jobType, error.category().getWireName(), attempt, delay.toSeconds());
                observabilityMetrics.incrementJobReschedule(jobType.name(), "defer");
                submit(jobType, workUnit, attempt, deferrals + 1, delay);
            }
            case GIVE_UP -> terminal(jobType, workUnit, failure);
        }
    }

    private void terminal(JobType jobType, WorkUnit workUnit, WorkflowFailedException failure) {
        ClassifiedError error = failure.getError();
        RunRecord run = failure.getRunRecord();
        Instant now = clock.instant();
        LOG.errorf("Work unit %s (type: %s) failed terminally on attempt %d: category=%s message=%s", workUnit.id(),
                jobType, run.attemptNumber(), error.category().getWireName(), error.message());
        observabilityMetrics.incrementJobTerminalFailure(jobType.name(), error.category().getWireName());

        try {
            recordStore.persist(workUnit.channelKey(), record -> {
                List<Map<String, Object>> errors = new ArrayList<>(errorHistory(record.get("workflow_errors")));
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("error", error.message());
                entry.put("error_type", error.category().getWireName());
                entry.put("source_type", error.sourceType());
                entry.put("attempt", run.attemptNumber());
                entry.put("failed_at", now.toString());
                errors.add(entry);
                int from = Math.max(0, errors.size() - ERROR_HISTORY_LIMIT);
                record.put("workflow_errors", new ArrayList<>(errors.subList(from, errors.size())));
                record.put("status", StatusEventType.FAILED);
                record.put("event_type", workUnit.eventType().getWireName());
                return record;
            });
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to persist error details for work unit %s", workUnit.id());
        }

        statusNotifier.notify(workUnit.channelKey(), StatusEventType.failed(run, error, now).toMap());
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> errorHistory(Object stored) {
        return stored instanceof List<?> list ? (List<Map<String, Object>>) list : List.of();
    }

    private void submit(JobType jobType, WorkUnit workUnit, int attempt, int deferrals, Duration delay) {
        AtomicInteger counter = inFlight.get(jobType.getQueue());
        counter.incrementAndGet();
        try {
            jobScheduler.schedule(jobType.getQueue(), delay, () -> {
                try {
                    executeJob(jobType, workUnit, attempt, deferrals);
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Unhandled failure executing work unit %s", workUnit.id());
                } finally {
                    counter.decrementAndGet();
                }
            });
        } catch (RuntimeException e) {
            counter.decrementAndGet();
            throw e;
        }
    }
}
