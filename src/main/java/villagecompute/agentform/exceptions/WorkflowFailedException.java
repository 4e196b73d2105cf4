package villagecompute.agentform.exceptions;

import villagecompute.agentform.workflow.ClassifiedError;
import villagecompute.agentform.workflow.RunRecord;

/**
 * Raised at the job boundary when a run ends in {@code failed}.
 *
 * <p>
 * Steps never throw; their failures are recorded as data on the {@link RunRecord}. This exception is how a failed run
 * crosses into the host scheduler, which applies the job's outer retry policy using the classified error of the
 * required step that failed.
 */
public class WorkflowFailedException extends RuntimeException {

    private final transient ClassifiedError error;
    private final transient RunRecord runRecord;

    public WorkflowFailedException(ClassifiedError error, RunRecord runRecord) {
        super("Workflow " + runRecord.eventType().getWireName() + " failed for work unit " + runRecord.workUnitId()
                + " (attempt " + runRecord.attemptNumber() + "): [" + error.category().getWireName() + "] "
                + error.message());
        this.error = error;
        this.runRecord = runRecord;
    }

    public ClassifiedError getError() {
        return error;
    }

    public RunRecord getRunRecord() {
        return runRecord;
    }
}
