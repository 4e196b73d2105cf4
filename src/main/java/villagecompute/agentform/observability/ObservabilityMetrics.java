package villagecompute.agentform.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.jobs.JobQueue;
import villagecompute.agentform.services.CircuitBreakerService;
import villagecompute.agentform.services.DelayedJobService;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers and manages custom metrics for the orchestrator.
 *
 * <p>
 * All metrics follow the naming convention {@code agentform_<category>_<metric>}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code agentform_jobs_in_flight{queue}} - scheduled or running jobs per queue family</li>
 * <li><b>Gauges:</b> {@code agentform_circuits_open} - dependencies whose breaker is open or half-open</li>
 * <li><b>Counters:</b> {@code agentform_steps_total{step,status}} - step attempt outcomes</li>
 * <li><b>Counters:</b> {@code agentform_runs_total{event,status}} - run outcomes</li>
 * <li><b>Counters:</b> {@code agentform_job_reschedules_total{job,action}} - outer retries and deferrals</li>
 * <li><b>Counters:</b> {@code agentform_job_terminal_failures_total{job,category}} - runs that exhausted retries</li>
 * <li><b>Counters:</b> {@code agentform_rate_limit_checks_total{scope,result}} - rate limit decisions</li>
 * <li><b>Counters:</b> {@code agentform_circuit_transitions_total{dependency,state}} - breaker transitions</li>
 * <li><b>Counters:</b> {@code agentform_credits_debited_total} - AI credits consumed</li>
 * <li><b>Counters:</b> {@code agentform_paid_steps_skipped_total{step}} - paid steps skipped for lack of credit</li>
 * <li><b>Counters:</b> {@code agentform_integration_deliveries_total{type,result}} - outbound integration calls</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    DelayedJobService delayedJobService;

    @Inject
    CircuitBreakerService circuitBreakerService;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    /**
     * Registers gauges at application startup. Counters are created lazily on first use.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering orchestrator metrics");

        for (JobQueue queue : JobQueue.values()) {
            Gauge.builder("agentform_jobs_in_flight", delayedJobService, s -> s.getInFlightCount(queue))
                    .description("Scheduled or running jobs in the " + queue.name() + " queue").tags(List
                            .of(Tag.of("queue", queue.name()), Tag.of("priority", String.valueOf(queue.getPriority()))))
                    .register(registry);
            LOG.debugf("Registered gauge: agentform_jobs_in_flight{queue=%s}", queue.name());
        }

        Gauge.builder("agentform_circuits_open", circuitBreakerService, CircuitBreakerService::openCircuitCount)
                .description("Dependencies whose circuit breaker is open or half-open").register(registry);

        LOG.infof("Orchestrator metrics registration complete. Access metrics at /q/metrics");
    }

    public void incrementStepOutcome(String stepName, String status) {
        counter("agentform_steps_total", "Workflow step attempt outcomes", "step", stepName, "status", status)
                .increment();
    }

    public void incrementRunOutcome(String eventType, String status) {
        counter("agentform_runs_total", "Workflow run outcomes", "event", eventType, "status", status).increment();
    }

    /**
     * @param action
     *            {@code retry} or {@code defer}
     */
    public void incrementJobReschedule(String jobType, String action) {
        counter("agentform_job_reschedules_total", "Jobs re-enqueued after a failed run", "job", jobType, "action",
                action).increment();
    }

    public void incrementJobTerminalFailure(String jobType, String category) {
        counter("agentform_job_terminal_failures_total", "Jobs that failed terminally", "job", jobType, "category",
                category).increment();
    }

    /**
     * Increments the rate limit check counter. The tag uses the bucket's scope (the key up to the first {@code ':'})
     * to keep tenant ids out of the tag set.
     */
    public void incrementRateLimitCheck(String bucketKey, boolean allowed) {
        int colon = bucketKey.indexOf(':');
        String scope = colon > 0 ? bucketKey.substring(0, colon) : bucketKey;
        counter("agentform_rate_limit_checks_total", "Rate limit checks performed", "scope", scope, "result",
                allowed ? "allowed" : "denied").increment();
    }

    public void incrementCircuitTransition(String dependencyKey, String toState) {
        counter("agentform_circuit_transitions_total", "Circuit breaker state transitions", "dependency",
                dependencyKey, "state", toState).increment();
    }

    public void recordCreditDebit(BigDecimal amount) {
        counter("agentform_credits_debited_total", "AI credits debited").increment(amount.doubleValue());
    }

    public void incrementPaidStepSkipped(String stepName) {
        counter("agentform_paid_steps_skipped_total", "Paid steps skipped for insufficient credits", "step", stepName)
                .increment();
    }

    public void incrementIntegrationDelivery(String integrationType, boolean success) {
        counter("agentform_integration_deliveries_total", "Outbound integration deliveries", "type", integrationType,
                "result", success ? "success" : "failure").increment();
    }

    private Counter counter(String name, String description, String... tagPairs) {
        String key = name + String.join(":", tagPairs);
        return counters.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name).description(description);
            for (int i = 0; i + 1 < tagPairs.length; i += 2) {
                builder.tag(tagPairs[i], tagPairs[i + 1]);
            }
            return builder.register(registry);
        });
    }
}
