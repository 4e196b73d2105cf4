package villagecompute.agentform.workflow;

/**
 * Body of a workflow step.
 */
@FunctionalInterface
public interface StepAction {

    /**
     * Performs the step.
     *
     * @return what the step did
     * @throws Exception
     *             any failure; classified by {@link ErrorClassifier} and recorded, never propagated past the runner
     */
    StepOutcome execute() throws Exception;
}
