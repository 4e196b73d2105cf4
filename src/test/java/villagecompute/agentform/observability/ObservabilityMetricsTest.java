package villagecompute.agentform.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.agentform.jobs.JobQueue;
import villagecompute.agentform.services.CircuitBreakerService;
import villagecompute.agentform.services.DelayedJobService;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ObservabilityMetrics}.
 */
class ObservabilityMetricsTest {

    @Mock
    DelayedJobService delayedJobService;

    @Mock
    CircuitBreakerService circuitBreakerService;

    private SimpleMeterRegistry registry;
    private ObservabilityMetrics metrics;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new SimpleMeterRegistry();
        metrics = new ObservabilityMetrics();
        metrics.registry = registry;
        metrics.delayedJobService = delayedJobService;
        metrics.circuitBreakerService = circuitBreakerService;
    }

    @Test
    void testRegisterMetrics_gaugesReadServices() {
        when(delayedJobService.getInFlightCount(JobQueue.AI_PROCESSING)).thenReturn(3);
        when(circuitBreakerService.openCircuitCount()).thenReturn(1L);

        metrics.registerMetrics(new Object());

        assertEquals(3.0, registry.get("agentform_jobs_in_flight").tag("queue", "AI_PROCESSING").gauge().value());
        assertEquals(1.0, registry.get("agentform_circuits_open").gauge().value());
    }

    @Test
    void testCounters_reuseMeterPerTagSet() {
        metrics.incrementStepOutcome("update_analytics", "success");
        metrics.incrementStepOutcome("update_analytics", "success");
        metrics.incrementStepOutcome("update_analytics", "failure");

        assertEquals(2.0, registry.get("agentform_steps_total").tag("step", "update_analytics")
                .tag("status", "success").counter().count());
        assertEquals(1.0, registry.get("agentform_steps_total").tag("status", "failure").counter().count());
    }

    @Test
    void testRateLimitCheck_tagsScopeOnly() {
        metrics.incrementRateLimitCheck("ai_rate_limit:form-1", true);
        metrics.incrementRateLimitCheck("ai_rate_limit:form-2", false);
        metrics.incrementRateLimitCheck("global", true);

        assertEquals(1.0, registry.get("agentform_rate_limit_checks_total").tag("scope", "ai_rate_limit")
                .tag("result", "allowed").counter().count());
        assertEquals(1.0, registry.get("agentform_rate_limit_checks_total").tag("scope", "ai_rate_limit")
                .tag("result", "denied").counter().count());
        assertEquals(1.0, registry.get("agentform_rate_limit_checks_total").tag("scope", "global").counter().count());
    }

    @Test
    void testRecordCreditDebit_accumulatesAmount() {
        metrics.recordCreditDebit(new BigDecimal("0.0200"));
        metrics.recordCreditDebit(new BigDecimal("0.0500"));

        assertEquals(0.07, registry.get("agentform_credits_debited_total").counter().count(), 1e-9);
    }
}
