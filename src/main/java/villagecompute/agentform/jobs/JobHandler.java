package villagecompute.agentform.jobs;

import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.services.DelayedJobService;
import villagecompute.agentform.workflow.RetryPolicy;
import villagecompute.agentform.workflow.RunRecord;

/**
 * Contract for async job handler implementations.
 *
 * <p>Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement
 * this interface. The {@link DelayedJobService} discovers handlers at runtime and routes work units
 * based on their {@link JobType}.
 *
 * <p><b>Execution Model:</b>
 * <ul>
 *   <li>Handlers execute in the worker pool of their job type's {@link JobQueue}</li>
 *   <li>A handler builds its step list and runs it through the workflow orchestrator, returning the run record</li>
 *   <li>A {@code failed} run is retried, deferred or given up per {@link #retryPolicy()}</li>
 *   <li>OpenTelemetry spans automatically wrap handler execution for observability</li>
 * </ul>
 *
 * @see DelayedJobService for dispatcher implementation
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Outer retry rules applied by the host when a run fails.
     */
    RetryPolicy retryPolicy();

    /**
     * Executes one attempt for the work unit.
     *
     * <p><b>Thread Safety:</b> This method may be called concurrently by multiple worker threads.
     *
     * <p><b>Error Handling:</b> Step failures are captured in the returned run record. A thrown exception means the
     * run could not start (missing records, invalid payload) and is recorded as a failed run by the host.
     *
     * @param workUnit the work unit (payload is immutable)
     * @param attemptNumber current attempt number (1-indexed)
     * @return the finished run record
     * @throws Exception if prerequisites could not be loaded
     */
    RunRecord execute(WorkUnit workUnit, int attemptNumber) throws Exception;
}
