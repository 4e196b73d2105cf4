package villagecompute.agentform.integration.ai;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one LLM workflow execution.
 *
 * @param success
 *            whether the workflow produced usable output
 * @param output
 *            parsed output (empty on failure)
 * @param errorMessage
 *            failure description
 * @param errorType
 *            failure kind reported by the workflow ({@code rate_limit}, {@code timeout}, {@code invalid_output},
 *            ...)
 */
public record WorkflowExecution(boolean success, Map<String, Object> output, String errorMessage,
        String errorType) {

    public WorkflowExecution {
        output = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
    }

    public static WorkflowExecution succeeded(Map<String, Object> output) {
        return new WorkflowExecution(true, output, null, null);
    }

    public static WorkflowExecution failed(String errorMessage, String errorType) {
        return new WorkflowExecution(false, Map.of(), errorMessage, errorType);
    }
}
