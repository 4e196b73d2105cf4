package villagecompute.agentform.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.testing.MutableClock;
import villagecompute.agentform.testing.Snapshots;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FormAnalyticsService}.
 */
class FormAnalyticsServiceTest {

    private static final String DAILY_KEY = "form_analytics:form-1:2025-03-01";

    private FormAnalyticsService analyticsService;
    private InMemoryRecordStore recordStore;

    @BeforeEach
    void setUp() {
        recordStore = new InMemoryRecordStore();
        analyticsService = new FormAnalyticsService();
        analyticsService.clock = MutableClock.at("2025-03-01T10:06:00Z");
        analyticsService.recordStore = recordStore;
    }

    @Test
    void testRecordCompletion_countsAndAveragesCompletionTime() {
        FormSnapshotType form = Snapshots.form().completionCount(4).build();

        Map<String, Object> first = analyticsService.recordCompletion(form, Snapshots.response().build());
        analyticsService.recordCompletion(form,
                Snapshots.response().startedAt("2025-03-01T09:50:00Z").completedAt("2025-03-01T10:05:00Z").build());

        assertEquals(5, first.get("completion_count"));
        assertEquals(5.0, first.get("avg_completion_time"));
        Map<String, Object> daily = recordStore.find(DAILY_KEY).orElseThrow();
        assertEquals(2, daily.get("completed_responses_count"));
        assertEquals(10.0, daily.get("avg_completion_time"));
        assertEquals(6, recordStore.find("form:form-1").orElseThrow().get("completion_count"));
    }

    @Test
    void testRecordCompletion_withoutStartTimeSkipsAverage() {
        Map<String, Object> sideEffects = analyticsService.recordCompletion(Snapshots.form().build(),
                Snapshots.response().startedAt(null).build());

        assertFalse(sideEffects.containsKey("avg_completion_time"));
    }

    @Test
    void testRecordCompletion_foldsAiMetrics() {
        FormResponseSnapshotType response = Snapshots.response()
                .aiAnalysis(Map.of("overall_sentiment", 0.8, "overall_quality", 0.6, "key_insights",
                        List.of("Shipping is slow")))
                .build();

        analyticsService.recordCompletion(Snapshots.form().build(), response);

        Map<String, Object> daily = recordStore.find(DAILY_KEY).orElseThrow();
        assertEquals(0.8, daily.get("avg_sentiment_score"));
        assertEquals(0.6, daily.get("avg_quality_score"));
        assertEquals(List.of("Shipping is slow"),
                RecordValues.mapValue(daily.get("ai_insights")).get("latest_insights"));
    }

    @Test
    void testUpdateQuestionAnalytics_countsAnsweredAndSkipped() {
        FormResponseSnapshotType response = Snapshots.response()
                .answer(Snapshots.answer("qr-1", "q-1", "How was shipping?", "Slow"))
                .answer(Snapshots.answer("qr-2", "q-2", "Anything else?", ""))
                .build();

        Map<String, Object> result = analyticsService.updateQuestionAnalytics(response);

        assertEquals(2, result.get("questions_updated"));
        assertEquals(1, recordStore.find("question_analytics:q-1").orElseThrow().get("answered_count"));
        assertEquals(1, recordStore.find("question_analytics:q-2").orElseThrow().get("skipped_count"));
    }

    @Test
    void testIsFormAnalysisDue_everyTenthResponse() {
        assertTrue(analyticsService.isFormAnalysisDue(Snapshots.form().responsesCount(20).build()));
        assertFalse(analyticsService.isFormAnalysisDue(Snapshots.form().responsesCount(21).build()));
        assertFalse(analyticsService.isFormAnalysisDue(Snapshots.form().responsesCount(0).build()));
    }

    @Test
    void testRequestFormAnalysis_stampsForm() {
        analyticsService.requestFormAnalysis(Snapshots.form().responsesCount(10).build());

        assertEquals("2025-03-01T10:06:00Z",
                recordStore.find("form:form-1").orElseThrow().get("analysis_requested_at"));
    }

    @Test
    void testUpdateCompletionMetrics_computesRate() {
        FormSnapshotType form = Snapshots.form().responsesCount(8).completionCount(2).build();
        analyticsService.recordCompletion(form, Snapshots.response().build());

        Map<String, Object> result = analyticsService.updateCompletionMetrics(form, Snapshots.response().build());

        assertEquals(37.5, result.get("completion_rate"));
        assertEquals(8, result.get("total_responses"));
        Map<String, Object> settings = RecordValues
                .mapValue(recordStore.find("form:form-1").orElseThrow().get("form_settings"));
        assertEquals("2025-03-01T10:05:00Z", settings.get("last_completion_at"));
    }

    @Test
    void testUpdateCompletionMetrics_noResponses() {
        Map<String, Object> result = analyticsService
                .updateCompletionMetrics(Snapshots.form().responsesCount(0).build(), Snapshots.response().build());

        assertEquals(0.0, result.get("completion_rate"));
    }

    @Test
    void testRecordDynamicQuestion_tracksStrategiesAndCost() {
        analyticsService.recordDynamicQuestion("form-1", "clarify", 0.05);
        Map<String, Object> result = analyticsService.recordDynamicQuestion("form-1", "clarify", 0.03);

        assertEquals(2, result.get("generated_count"));
        assertEquals(0.08, (Double) result.get("total_ai_cost"), 1e-9);
        Map<String, Object> dynamic = RecordValues
                .mapValue(recordStore.find(DAILY_KEY).orElseThrow().get("dynamic_questions"));
        assertEquals(2, RecordValues.mapValue(dynamic.get("strategy_counts")).get("clarify"));
    }
}
