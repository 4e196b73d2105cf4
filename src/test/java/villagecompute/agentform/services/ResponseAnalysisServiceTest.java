package villagecompute.agentform.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.QuestionSnapshotType;
import villagecompute.agentform.exceptions.InsufficientCreditsException;
import villagecompute.agentform.integration.ai.LlmWorkflow;
import villagecompute.agentform.testing.MutableClock;
import villagecompute.agentform.testing.Snapshots;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ResponseAnalysisService}.
 */
class ResponseAnalysisServiceTest {

    private static final String ANSWER_TEXT = "Shipping was slow but support was great!";

    @Mock
    AiWorkflowService aiWorkflowService;

    @Mock
    CreditLedgerService creditLedgerService;

    @Mock
    DynamicQuestionService dynamicQuestionService;

    private ResponseAnalysisService analysisService;
    private InMemoryRecordStore recordStore;

    private final QuestionSnapshotType question = Snapshots.question("q-1", "How was your experience?", true, true);
    private final AnswerSnapshotType answer = Snapshots.answer("qr-1", "q-1", "How was your experience?",
            ANSWER_TEXT);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        recordStore = new InMemoryRecordStore();
        analysisService = new ResponseAnalysisService();
        analysisService.clock = MutableClock.at("2025-03-01T10:06:00Z");
        analysisService.aiWorkflowService = aiWorkflowService;
        analysisService.recordStore = recordStore;
        analysisService.creditLedgerService = creditLedgerService;
        analysisService.dynamicQuestionService = dynamicQuestionService;
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAnalyze_normalizesWorkflowOutput() throws Exception {
        when(aiWorkflowService.execute(eq(LlmWorkflow.RESPONSE_ANALYSIS), anyMap())).thenReturn(Map.of("sentiment",
                Map.of("label", "positive", "confidence", 0.9, "score", 0.7), "quality", Map.of("overall_score", 0.6),
                "insights", List.of("Wants faster shipping"), "flags", Map.of("needs_review", true)));

        Map<String, Object> analysis = analysisService.analyze(Snapshots.form().question(question).build(), question,
                answer);

        Map<String, Object> aiAnalysis = (Map<String, Object>) analysis.get("ai_analysis");
        assertEquals("positive", ((Map<String, Object>) aiAnalysis.get("sentiment")).get("label"));
        assertEquals(0.5, ((Map<String, Object>) aiAnalysis.get("quality")).get("clarity"));
        assertEquals(Map.of("text", "Wants faster shipping", "confidence", 0.7, "category", "general"),
                ((List<?>) aiAnalysis.get("insights")).get(0));
        assertEquals(true, ((Map<String, Object>) aiAnalysis.get("flags")).get("needs_review"));
        assertEquals(false, ((Map<String, Object>) aiAnalysis.get("flags")).get("potential_spam"));
        assertEquals(0.75, analysis.get("confidence_score"));
        assertEquals(0.45, analysis.get("completeness_score"));
        assertEquals(true, analysis.get("generate_followup"));
        assertTrue(ResponseAnalysisService.suggestsFollowup(analysis));
    }

    @Test
    void testAnalyze_explicitScoresWin() throws Exception {
        when(aiWorkflowService.execute(eq(LlmWorkflow.RESPONSE_ANALYSIS), anyMap()))
                .thenReturn(Map.of("confidence_score", 0.95, "completeness_score", 0.2, "generate_followup", false,
                        "quality", Map.of("overall_score", 0.95)));

        Map<String, Object> analysis = analysisService.analyze(Snapshots.form().build(), question, answer);

        assertEquals(0.95, analysis.get("confidence_score"));
        assertEquals(0.2, analysis.get("completeness_score"));
        assertFalse(ResponseAnalysisService.suggestsFollowup(analysis));
    }

    @Test
    void testCompletenessScore_choiceQuestions() {
        AnswerSnapshotType choice = new AnswerSnapshotType("qr-2", "q-2", "Plan", "single_choice", "pro", null, false,
                null);

        assertEquals(1.0, ResponseAnalysisService.completenessScore(Map.of(), "single_choice", choice));
        assertEquals(0.5, ResponseAnalysisService.completenessScore(Map.of(), "rating", choice));
    }

    @Test
    void testAnalysisCost_scalesWithLength() {
        assertEquals(new BigDecimal("0.0200"), ResponseAnalysisService.analysisCost(""));
        assertEquals(new BigDecimal("0.0500"), ResponseAnalysisService.analysisCost("x".repeat(1500)));
        assertEquals(new BigDecimal("0.0600"), ResponseAnalysisService.analysisCost("x".repeat(5000)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStoreAnalysis_persistsAndDebits() {
        when(creditLedgerService.debit(eq(Snapshots.OWNER_ID), any())).thenReturn(new BigDecimal("9.98"));
        Map<String, Object> analysis = Map.of("ai_analysis", Map.of("completeness", 0.45), "confidence_score", 0.75,
                "completeness_score", 0.45);

        Map<String, Object> sideEffects = analysisService.storeAnalysis(Snapshots.form().build(), answer, analysis);

        Map<String, Object> record = recordStore.find("question_response:qr-1").orElseThrow();
        assertEquals(0.75, record.get("ai_confidence_score"));
        assertEquals(0.45, ((Map<String, Object>) record.get("ai_analysis_results")).get("completeness"));
        assertEquals(9.98, sideEffects.get("remaining_credits"));
        verify(creditLedgerService).debit(Snapshots.OWNER_ID, ResponseAnalysisService.analysisCost(ANSWER_TEXT));
    }

    @Test
    void testStoreAnalysis_rejectedDebitLeavesNoAnalysis() {
        when(creditLedgerService.debit(eq(Snapshots.OWNER_ID), any())).thenThrow(
                new InsufficientCreditsException(Snapshots.OWNER_ID, BigDecimal.ZERO, new BigDecimal("0.02")));
        Map<String, Object> analysis = Map.of("ai_analysis", Map.of(), "confidence_score", 0.75,
                "completeness_score", 0.45);

        assertThrows(InsufficientCreditsException.class,
                () -> analysisService.storeAnalysis(Snapshots.form().build(), answer, analysis));

        assertTrue(recordStore.find("question_response:qr-1").isEmpty());
    }

    @Test
    void testFollowupAllowed_respectsQuestionCap() {
        FormResponseSnapshotType response = Snapshots.response().build();
        when(dynamicQuestionService.existingCount(response, "q-1")).thenReturn(2);

        assertFalse(analysisService.followupAllowed(response, question));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUpdateAggregate_combinesStoredAnalyses() {
        recordStore.persist("question_response:qr-2", record -> {
            record.put("ai_analysis_results", Map.of("sentiment", Map.of("label", "negative", "confidence", 0.5),
                    "quality", Map.of("overall_score", 0.4), "completeness", 0.3, "insights", List.of("late")));
            return record;
        });
        FormResponseSnapshotType response = Snapshots.response().answer(answer)
                .answer(Snapshots.answer("qr-2", "q-2", "Anything else?", "It arrived late")).build();
        Map<String, Object> fresh = Map.of("sentiment", Map.of("label", "positive", "confidence", 0.9), "quality",
                Map.of("overall_score", 0.8), "completeness", 0.9, "insights", List.of("support"));

        Map<String, Object> result = analysisService.updateAggregate(response, answer, fresh);

        assertEquals(2, result.get("analysis_count"));
        assertEquals(0.7, result.get("overall_sentiment"));
        assertEquals(0.6, result.get("overall_quality"));
        Map<String, Object> aggregate = (Map<String, Object>) recordStore.find("form_response:resp-1").orElseThrow()
                .get("ai_analysis_results");
        assertEquals(List.of("support", "late"), aggregate.get("key_insights"));
        assertEquals(Map.of("negative", 50.0, "positive", 50.0), aggregate.get("sentiment_distribution"));
        assertEquals(1L, ((Map<String, Object>) aggregate.get("completeness_distribution")).get("high"));
    }

    @Test
    void testAggregate_emptyDefaults() {
        Map<String, Object> aggregate = ResponseAnalysisService.aggregate(List.of(), "2025-03-01T10:06:00Z");

        assertEquals(0.5, aggregate.get("overall_sentiment"));
        assertEquals(0, aggregate.get("analysis_count"));
    }
}
