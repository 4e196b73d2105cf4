package villagecompute.agentform.workflow;

import org.junit.jupiter.api.Test;
import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.data.models.WorkUnit;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RunRecord} status derivation.
 */
class RunRecordTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final WorkUnit workUnit = WorkUnit.of(EventType.INTEGRATION_TRIGGERED,
            Map.of("form_response_id", "resp-1", "trigger_event", "form_completed"), NOW);

    @Test
    void testOverallStatus_lifecycle() {
        RunRecord pending = RunRecord.pending(workUnit, 1);
        assertEquals(RunStatus.PENDING, pending.overallStatus());

        RunRecord running = pending.start(NOW);
        assertEquals(RunStatus.RUNNING, running.overallStatus());

        assertEquals(RunStatus.COMPLETED, running.finish(NOW).overallStatus());
    }

    @Test
    void testOverallStatus_latestResultWins() {
        ClassifiedError timeout = ClassifiedError.of(ErrorCategory.TIMEOUT, "timed out");
        RunRecord run = RunRecord.pending(workUnit, 1).start(NOW)
                .withStepResult(StepResult.failure("integration:slack", false, timeout, 1, NOW, NOW))
                .withStepResult(StepResult.success("integration:slack", false, Map.of(), 2, NOW, NOW)).finish(NOW);

        assertEquals(RunStatus.COMPLETED, run.overallStatus());
        assertEquals(2, run.stepResults().size());
    }

    @Test
    void testOverallStatus_optionalFailureIsPartial() {
        ClassifiedError error = ClassifiedError.of(ErrorCategory.EXTERNAL_API_ERROR, "502");
        RunRecord run = RunRecord.pending(workUnit, 1).start(NOW)
                .withStepResult(StepResult.failure("integration:webhook", false, error, 1, NOW, NOW)).finish(NOW);

        assertEquals(RunStatus.PARTIAL, run.overallStatus());
        assertTrue(run.failure().isEmpty());
    }

    @Test
    void testRejected_isFailedWithPrerequisiteStep() {
        ClassifiedError error = ClassifiedError.of(ErrorCategory.VALIDATION, "integrations disabled");

        RunRecord run = RunRecord.rejected(workUnit, 3, error, NOW);

        assertEquals(RunStatus.FAILED, run.overallStatus());
        assertEquals(3, run.attemptNumber());
        assertEquals(error, run.failure().orElseThrow());
        assertTrue(run.latestResults().containsKey(RunRecord.PREREQUISITES_STEP));
    }

    @Test
    void testWithStepResult_rejectedAfterFinish() {
        RunRecord finished = RunRecord.pending(workUnit, 1).start(NOW).finish(NOW);

        assertThrows(IllegalStateException.class,
                () -> finished.withStepResult(StepResult.success("late", false, Map.of(), 1, NOW, NOW)));
    }
}
