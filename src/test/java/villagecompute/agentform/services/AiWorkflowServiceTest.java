package villagecompute.agentform.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.agentform.data.models.CircuitStatus;
import villagecompute.agentform.exceptions.CircuitOpenException;
import villagecompute.agentform.exceptions.ExternalApiException;
import villagecompute.agentform.exceptions.RateLimitException;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.integration.ai.LlmWorkflow;
import villagecompute.agentform.integration.ai.WorkflowExecution;
import villagecompute.agentform.observability.ObservabilityMetrics;
import villagecompute.agentform.testing.MutableClock;
import villagecompute.agentform.workflow.ErrorCategory;
import villagecompute.agentform.workflow.RetryDecision;

import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AiWorkflowService}.
 */
class AiWorkflowServiceTest {

    @Mock
    LlmWorkflow llmWorkflow;

    @Mock
    ObservabilityMetrics metrics;

    private AiWorkflowService aiWorkflowService;
    private CircuitBreakerService circuitBreakerService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        circuitBreakerService = new CircuitBreakerService();
        circuitBreakerService.clock = MutableClock.at("2025-03-01T10:00:00Z");
        circuitBreakerService.metrics = metrics;
        circuitBreakerService.defaultThreshold = 2;
        circuitBreakerService.defaultCooldownSeconds = 60;

        aiWorkflowService = new AiWorkflowService();
        aiWorkflowService.llmWorkflow = llmWorkflow;
        aiWorkflowService.circuitBreakerService = circuitBreakerService;
    }

    @Test
    void testExecute_returnsOutput() throws Exception {
        when(llmWorkflow.execute(eq(LlmWorkflow.RESPONSE_ANALYSIS), anyMap()))
                .thenReturn(WorkflowExecution.succeeded(Map.of("sentiment_score", 0.8)));

        Map<String, Object> output = aiWorkflowService.execute(LlmWorkflow.RESPONSE_ANALYSIS,
                Map.of("answer_text", "Great product"));

        assertEquals(0.8, output.get("sentiment_score"));
    }

    @Test
    void testExecute_failuresOpenCircuit() {
        when(llmWorkflow.execute(eq(LlmWorkflow.RESPONSE_ANALYSIS), anyMap()))
                .thenReturn(WorkflowExecution.failed("upstream 503", "server_error"));

        assertThrows(ExternalApiException.class,
                () -> aiWorkflowService.execute(LlmWorkflow.RESPONSE_ANALYSIS, Map.of()));
        assertThrows(ExternalApiException.class,
                () -> aiWorkflowService.execute(LlmWorkflow.RESPONSE_ANALYSIS, Map.of()));
        assertThrows(CircuitOpenException.class,
                () -> aiWorkflowService.execute(LlmWorkflow.RESPONSE_ANALYSIS, Map.of()));

        assertEquals(CircuitStatus.OPEN, circuitBreakerService.state(CircuitBreakerService.LLM_WORKFLOW).status());
        verify(llmWorkflow, times(2)).execute(eq(LlmWorkflow.RESPONSE_ANALYSIS), anyMap());
    }

    @Test
    void testToException_mapsErrorTypes() {
        assertInstanceOf(RateLimitException.class,
                AiWorkflowService.toException("w", WorkflowExecution.failed("slow down", "rate_limit_error")));
        assertInstanceOf(TimeoutException.class,
                AiWorkflowService.toException("w", WorkflowExecution.failed("took too long", "TIMEOUT")));
        assertInstanceOf(ValidationException.class,
                AiWorkflowService.toException("w", WorkflowExecution.failed("bad input", "invalid_input")));
        assertInstanceOf(ExternalApiException.class,
                AiWorkflowService.toException("w", WorkflowExecution.failed(null, null)));
    }

    @Test
    void testLlmRetryPolicy_retriesTimeouts() {
        RetryDecision decision = AiWorkflowService.llmRetryPolicy().decide(ErrorCategory.TIMEOUT, 1);

        assertEquals(RetryDecision.Action.RETRY, decision.action());
        assertEquals(RetryDecision.Action.GIVE_UP,
                AiWorkflowService.llmRetryPolicy().decide(ErrorCategory.TIMEOUT, 3).action());
    }
}
