package villagecompute.agentform.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.services.RunHistoryService;

/**
 * Hourly pruning of finished run records older than {@code orchestrator.history.retention-hours}.
 */
@ApplicationScoped
public class RunHistoryPruneScheduler {

    private static final Logger LOG = Logger.getLogger(RunHistoryPruneScheduler.class);

    @Inject
    RunHistoryService runHistoryService;

    @Scheduled(
            every = "1h",
            delayed = "5m")
    void pruneRunHistory() {
        int removed = runHistoryService.pruneExpired();
        if (removed > 0) {
            LOG.infof("Pruned %d expired run records", removed);
        }
    }
}
