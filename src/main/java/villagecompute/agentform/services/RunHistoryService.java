package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.agentform.workflow.RunRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Audit trail of every run record, failed attempts included, per work unit.
 */
@ApplicationScoped
public class RunHistoryService {

    private static final Logger LOG = Logger.getLogger(RunHistoryService.class);

    @ConfigProperty(
            name = "orchestrator.history.retention-hours",
            defaultValue = "168")
    long retentionHours;

    @Inject
    Clock clock;

    private final ConcurrentMap<String, List<RunRecord>> runs = new ConcurrentHashMap<>();

    public void record(RunRecord run) {
        runs.computeIfAbsent(run.workUnitId(), id -> new CopyOnWriteArrayList<>()).add(run);
        LOG.debugf("Recorded run for %s: attempt=%d status=%s", run.workUnitId(), run.attemptNumber(),
                run.overallStatus().getWireName());
    }

    /**
     * Runs for a work unit in execution order (empty if unknown or pruned).
     */
    public List<RunRecord> runsFor(String workUnitId) {
        List<RunRecord> recorded = runs.get(workUnitId);
        return recorded == null ? List.of() : List.copyOf(recorded);
    }

    public Optional<RunRecord> latest(String workUnitId) {
        List<RunRecord> recorded = runsFor(workUnitId);
        return recorded.isEmpty() ? Optional.empty() : Optional.of(recorded.get(recorded.size() - 1));
    }

    /**
     * Drops finished runs older than the retention window.
     *
     * @return number of runs removed
     */
    public int pruneExpired() {
        return pruneFinishedBefore(clock.instant().minus(Duration.ofHours(retentionHours)));
    }

    public int pruneFinishedBefore(Instant cutoff) {
        AtomicInteger removed = new AtomicInteger();
        for (String workUnitId : runs.keySet()) {
            runs.computeIfPresent(workUnitId, (id, recorded) -> {
                int before = recorded.size();
                recorded.removeIf(run -> run.finishedAt() != null && run.finishedAt().isBefore(cutoff));
                removed.addAndGet(before - recorded.size());
                return recorded.isEmpty() ? null : recorded;
            });
        }
        return removed.get();
    }
}
