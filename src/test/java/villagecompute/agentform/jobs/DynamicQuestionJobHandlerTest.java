package villagecompute.agentform.jobs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.ResourceNotFoundException;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.services.CreditLedgerService;
import villagecompute.agentform.services.DynamicQuestionService.GeneratedQuestion;
import villagecompute.agentform.services.DynamicQuestionService;
import villagecompute.agentform.services.FormAnalyticsService;
import villagecompute.agentform.services.PayloadFixtures;
import villagecompute.agentform.services.RateLimitService;
import villagecompute.agentform.testing.MutableClock;
import villagecompute.agentform.testing.Snapshots;
import villagecompute.agentform.workflow.InlineWorkflows;
import villagecompute.agentform.workflow.RunRecord;
import villagecompute.agentform.workflow.RunStatus;
import villagecompute.agentform.workflow.StepStatus;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link DynamicQuestionJobHandler}.
 */
class DynamicQuestionJobHandlerTest {

    private static final GeneratedQuestion QUESTION = new GeneratedQuestion("Which part of delivery took longest?",
            "text_short", Map.of("type", "expand"), new BigDecimal("0.0500"));

    @Mock
    DynamicQuestionService dynamicQuestionService;

    @Mock
    FormAnalyticsService formAnalyticsService;

    @Mock
    CreditLedgerService creditLedgerService;

    @Mock
    RateLimitService rateLimitService;

    private DynamicQuestionJobHandler handler;
    private FormSnapshotType form;
    private FormResponseSnapshotType response;
    private AnswerSnapshotType answer;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        handler = new DynamicQuestionJobHandler();
        handler.workflowOrchestrator = InlineWorkflows.orchestrator(MutableClock.at("2025-03-01T10:06:00Z"),
                creditLedgerService, rateLimitService);
        handler.payloadReader = PayloadFixtures.reader();
        handler.dynamicQuestionService = dynamicQuestionService;
        handler.formAnalyticsService = formAnalyticsService;

        answer = Snapshots.answer("qr-1", "q-1", "How was shipping?", "Slow");
        form = Snapshots.form().question(Snapshots.question("q-1", "How was shipping?", true, true)).build();
        response = Snapshots.response().answer(answer).build();

        when(dynamicQuestionService.validatePrerequisites(any(), any(), any())).thenReturn(answer);
        when(creditLedgerService.hasSufficientCredits(Snapshots.OWNER_ID)).thenReturn(true);
        when(rateLimitService.limitFor("ai_rate_limit:form-1")).thenReturn(10);
        when(rateLimitService.tryAcquire("ai_rate_limit:form-1", 10)).thenReturn(true);
        when(dynamicQuestionService.store(any(), any(), any(), eq(QUESTION)))
                .thenReturn(Map.of("dynamic_question_id", "dq-1", "ai_cost", 0.05));
        when(formAnalyticsService.recordDynamicQuestion(anyString(), anyString(), anyDouble()))
                .thenReturn(Map.of("dynamic_questions_generated", 1));
    }

    @Test
    void testHandlesType() {
        assertEquals(JobType.DYNAMIC_QUESTION_GENERATION, handler.handlesType());
    }

    @Test
    void testExecute_generatesScreensAndStores() throws Exception {
        when(dynamicQuestionService.generate(any(), any(), any(), anyString())).thenReturn(Optional.of(QUESTION));

        RunRecord run = handler.execute(workUnit(Map.of()), 1);

        assertEquals(RunStatus.COMPLETED, run.overallStatus());
        assertEquals("dq-1", run.latestResults().get("store_question").sideEffects().get("dynamic_question_id"));
        verify(dynamicQuestionService).generate(any(), any(), eq(answer), eq("response_analysis"));
        verify(formAnalyticsService).recordDynamicQuestion("form-1", "expand", 0.05);
    }

    @Test
    void testExecute_passesExplicitTrigger() throws Exception {
        when(dynamicQuestionService.generate(any(), any(), any(), anyString())).thenReturn(Optional.empty());

        handler.execute(workUnit(Map.of("trigger", "manual")), 1);

        verify(dynamicQuestionService).generate(any(), any(), any(), eq("manual"));
    }

    @Test
    void testExecute_rejectedQuestionIsNotStored() throws Exception {
        when(dynamicQuestionService.generate(any(), any(), any(), anyString())).thenReturn(Optional.of(QUESTION));
        doThrow(new ValidationException("Generated question too similar to source question"))
                .when(dynamicQuestionService).screen(any(), any(), any(), eq(QUESTION));

        RunRecord run = handler.execute(workUnit(Map.of()), 1);

        assertEquals(RunStatus.PARTIAL, run.overallStatus());
        assertEquals(StepStatus.FAILURE, run.latestResults().get("validate_question").status());
        assertEquals("question_rejected", run.latestResults().get("store_question").sideEffects().get("reason"));
        verify(dynamicQuestionService, never()).store(any(), any(), any(), any());
        verify(formAnalyticsService, never()).recordDynamicQuestion(anyString(), anyString(), anyDouble());
    }

    @Test
    void testExecute_noQuestionGenerated() throws Exception {
        when(dynamicQuestionService.generate(any(), any(), any(), anyString())).thenReturn(Optional.empty());

        RunRecord run = handler.execute(workUnit(Map.of()), 1);

        assertEquals(RunStatus.COMPLETED, run.overallStatus());
        run.latestResults().values().forEach(result -> assertEquals(StepStatus.SKIPPED, result.status()));
        verify(dynamicQuestionService, never()).screen(any(), any(), any(), any());
    }

    @Test
    void testExecute_unknownSourceQuestion() {
        Map<String, Object> extra = new HashMap<>();
        extra.put("form_response_id", "resp-1");
        extra.put("source_question_id", "q-404");

        assertThrows(ResourceNotFoundException.class, () -> handler.execute(
                WorkUnit.of(EventType.DYNAMIC_QUESTION_REQUESTED, PayloadFixtures.payload(form, response, extra),
                        MutableClock.at("2025-03-01T10:06:00Z").instant()),
                1));
    }

    @Test
    void testExecute_failedPrerequisitesPropagate() {
        when(dynamicQuestionService.validatePrerequisites(any(), any(), any()))
                .thenThrow(new ValidationException("Maximum dynamic questions limit reached (3/3)"));

        assertThrows(ValidationException.class, () -> handler.execute(workUnit(Map.of()), 1));
    }

    private WorkUnit workUnit(Map<String, Object> extra) {
        Map<String, Object> payload = new HashMap<>(extra);
        payload.put("form_response_id", "resp-1");
        payload.put("source_question_id", "q-1");
        return WorkUnit.of(EventType.DYNAMIC_QUESTION_REQUESTED, PayloadFixtures.payload(form, response, payload),
                MutableClock.at("2025-03-01T10:06:00Z").instant());
    }
}
