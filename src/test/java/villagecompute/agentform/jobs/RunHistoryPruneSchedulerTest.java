package villagecompute.agentform.jobs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.agentform.services.RunHistoryService;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RunHistoryPruneScheduler}.
 */
class RunHistoryPruneSchedulerTest {

    @Mock
    RunHistoryService runHistoryService;

    private RunHistoryPruneScheduler scheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        scheduler = new RunHistoryPruneScheduler();
        scheduler.runHistoryService = runHistoryService;
    }

    @Test
    void testPruneRunHistory() {
        when(runHistoryService.pruneExpired()).thenReturn(4);

        scheduler.pruneRunHistory();

        verify(runHistoryService).pruneExpired();
    }
}
