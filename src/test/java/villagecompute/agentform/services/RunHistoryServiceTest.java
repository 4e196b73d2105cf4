package villagecompute.agentform.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.testing.MutableClock;
import villagecompute.agentform.workflow.RunRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RunHistoryService}.
 */
class RunHistoryServiceTest {

    private RunHistoryService runHistoryService;
    private MutableClock clock;
    private WorkUnit workUnit;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        runHistoryService = new RunHistoryService();
        runHistoryService.clock = clock;
        runHistoryService.retentionHours = 24;
        workUnit = WorkUnit.of(EventType.FORM_COMPLETED, Map.of("form_response_id", "resp-1"), clock.instant());
    }

    @Test
    void testRecord_keepsExecutionOrder() {
        runHistoryService.record(finishedRun(1, clock.instant()));
        runHistoryService.record(finishedRun(2, clock.instant()));

        assertEquals(2, runHistoryService.runsFor(workUnit.id()).size());
        assertEquals(2, runHistoryService.latest(workUnit.id()).orElseThrow().attemptNumber());
    }

    @Test
    void testRunsFor_unknownWorkUnit() {
        assertTrue(runHistoryService.runsFor("missing").isEmpty());
        assertTrue(runHistoryService.latest("missing").isEmpty());
    }

    @Test
    void testPruneExpired_removesOnlyOldFinishedRuns() {
        runHistoryService.record(finishedRun(1, clock.instant()));
        runHistoryService.record(finishedRun(2, clock.instant().plus(Duration.ofHours(20))));
        runHistoryService.record(RunRecord.pending(workUnit, 3).start(clock.instant()));

        clock.advance(Duration.ofHours(30));
        int removed = runHistoryService.pruneExpired();

        assertEquals(1, removed);
        assertEquals(2, runHistoryService.runsFor(workUnit.id()).size());
    }

    @Test
    void testPruneFinishedBefore_dropsEmptyWorkUnits() {
        runHistoryService.record(finishedRun(1, clock.instant()));

        runHistoryService.pruneFinishedBefore(clock.instant().plusSeconds(1));

        assertTrue(runHistoryService.runsFor(workUnit.id()).isEmpty());
    }

    private RunRecord finishedRun(int attempt, Instant finishedAt) {
        return RunRecord.pending(workUnit, attempt).start(finishedAt).finish(finishedAt);
    }
}
