package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.exceptions.ExternalApiException;
import villagecompute.agentform.exceptions.RateLimitException;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.integration.ai.LlmWorkflow;
import villagecompute.agentform.integration.ai.WorkflowExecution;
import villagecompute.agentform.workflow.BackoffStrategy;
import villagecompute.agentform.workflow.ErrorCategory;
import villagecompute.agentform.workflow.RetryPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Calls the LLM workflow engine through the {@value CircuitBreakerService#LLM_WORKFLOW} circuit breaker.
 *
 * <p>
 * A failed {@link WorkflowExecution} is turned into the exception matching its {@code errorType} so the step runner
 * classifies it; unsuccessful executions count as breaker failures.
 */
@ApplicationScoped
public class AiWorkflowService {

    private static final Logger LOG = Logger.getLogger(AiWorkflowService.class);

    private static final RetryPolicy LLM_RETRY_POLICY = RetryPolicy.builder().maxAttempts(3)
            .baseDelay(Duration.ofSeconds(2)).backoff(BackoffStrategy.EXPONENTIAL)
            .retryOn(ErrorCategory.TIMEOUT, ErrorCategory.EXTERNAL_API_ERROR, ErrorCategory.UNKNOWN).build();

    @Inject
    LlmWorkflow llmWorkflow;

    @Inject
    CircuitBreakerService circuitBreakerService;

    /**
     * Inline retry rules for steps that call the LLM: exponential from 2s, 3 attempts.
     */
    public static RetryPolicy llmRetryPolicy() {
        return LLM_RETRY_POLICY;
    }

    /**
     * Executes {@code workflowName} and returns its output.
     *
     * @throws villagecompute.agentform.exceptions.CircuitOpenException
     *             if the breaker is open
     * @throws Exception
     *             the classified failure otherwise
     */
    public Map<String, Object> execute(String workflowName, Map<String, Object> inputs) throws Exception {
        WorkflowExecution execution = circuitBreakerService.call(CircuitBreakerService.LLM_WORKFLOW, () -> {
            WorkflowExecution result = llmWorkflow.execute(workflowName, inputs);
            if (!result.success()) {
                LOG.warnf("LLM workflow %s failed: type=%s message=%s", workflowName, result.errorType(),
                        result.errorMessage());
                throw toException(workflowName, result);
            }
            return result;
        });
        return execution.output();
    }

    static Exception toException(String workflowName, WorkflowExecution failed) {
        String message = "LLM workflow " + workflowName + " failed: "
                + (failed.errorMessage() != null ? failed.errorMessage() : "no output");
        String type = failed.errorType() == null ? "" : failed.errorType().toLowerCase(Locale.ROOT);
        if (type.contains("rate_limit")) {
            return new RateLimitException(message);
        }
        if (type.contains("timeout")) {
            return new TimeoutException(message);
        }
        if (type.equals("validation") || type.equals("invalid_input")) {
            return new ValidationException(message);
        }
        return new ExternalApiException(message);
    }
}
