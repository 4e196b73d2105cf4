package villagecompute.agentform.integration.ai;

import java.util.Map;

/**
 * A named LLM workflow (prompt, model call and output parsing) executed with structured inputs.
 *
 * <p>
 * Implementations report expected failures (model refused, unparseable output, upstream throttling) through
 * {@link WorkflowExecution#failed}; transport errors may be thrown and are classified by the caller.
 */
public interface LlmWorkflow {

    String RESPONSE_ANALYSIS = "response_analysis";

    String DYNAMIC_QUESTION = "dynamic_question";

    WorkflowExecution execute(String workflowName, Map<String, Object> inputs);
}
