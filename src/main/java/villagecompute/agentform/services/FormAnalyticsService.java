package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static villagecompute.agentform.services.RecordValues.doubleValue;
import static villagecompute.agentform.services.RecordValues.intValue;
import static villagecompute.agentform.services.RecordValues.mapValue;
import static villagecompute.agentform.services.RecordValues.round;
import static villagecompute.agentform.services.RecordValues.runningAverage;

/**
 * Form, daily and question-level analytics written by the completion and dynamic question workflows.
 *
 * <p>
 * <b>Records:</b>
 * <ul>
 * <li>{@code form:<formId>}: {@code completion_count}, {@code form_settings} (completion rate and timestamps),
 * {@code analysis_requested_at}</li>
 * <li>{@code form_analytics:<formId>:<yyyy-MM-dd>}: completed count, running averages of completion minutes,
 * sentiment and quality, latest AI insights and dynamic question metrics</li>
 * <li>{@code question_analytics:<questionId>}: response counts per question</li>
 * </ul>
 *
 * <p>
 * Every write is an independent upsert; re-running a step after a crash counts the completion again, which matches
 * the at-least-once delivery of the job runtime.
 */
@ApplicationScoped
public class FormAnalyticsService {

    private static final Logger LOG = Logger.getLogger(FormAnalyticsService.class);

    static final int FORM_ANALYSIS_INTERVAL = 10;

    @Inject
    Clock clock;

    @Inject
    RecordStore recordStore;

    /**
     * Counts the completion on the form and folds it into today's analytics.
     *
     * @return counts and averages after the update
     */
    public Map<String, Object> recordCompletion(FormSnapshotType form, FormResponseSnapshotType response) {
        Instant now = clock.instant();
        Map<String, Object> formRecord = recordStore.persist(RecordKeys.form(form.id()), record -> {
            int current = intValue(record.get("completion_count"), form.completionCount());
            record.put("completion_count", current + 1);
            record.put("updated_at", response.completedAtInstant().orElse(now).toString());
            return record;
        });

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Double completionMinutes = completionMinutes(response).orElse(null);
        String dailyKey = RecordKeys.dailyFormAnalytics(form.id(), today);
        Map<String, Object> analytics = recordStore.persist(dailyKey, record -> {
            int count = intValue(record.get("completed_responses_count"), 0) + 1;
            record.put("completed_responses_count", count);

            if (completionMinutes != null) {
                double average = doubleValue(record.get("avg_completion_time"), 0.0);
                record.put("avg_completion_time", runningAverage(average, count, completionMinutes));
            }
            if (response.hasAiAnalysis()) {
                applyAiMetrics(record, count, response.aiAnalysis(), now);
            }
            return record;
        });

        Map<String, Object> sideEffects = new LinkedHashMap<>();
        sideEffects.put("form_id", form.id());
        sideEffects.put("date", today.toString());
        sideEffects.put("completion_count", formRecord.get("completion_count"));
        sideEffects.put("completed_responses_count", analytics.get("completed_responses_count"));
        if (analytics.containsKey("avg_completion_time")) {
            sideEffects.put("avg_completion_time", analytics.get("avg_completion_time"));
        }
        LOG.infof("Analytics updated for form %s: completed_responses_count=%s avg_completion_time=%s", form.id(),
                analytics.get("completed_responses_count"), analytics.get("avg_completion_time"));
        return sideEffects;
    }

    /**
     * Bumps per-question counters for every answer in the response.
     */
    public Map<String, Object> updateQuestionAnalytics(FormResponseSnapshotType response) {
        String now = clock.instant().toString();
        int updated = 0;
        for (AnswerSnapshotType answer : response.answersOrEmpty()) {
            if (answer.questionId() == null) {
                continue;
            }
            recordStore.persist(RecordKeys.questionAnalytics(answer.questionId()), record -> {
                record.put("response_count", intValue(record.get("response_count"), 0) + 1);
                String counter = answer.hasAnswer() ? "answered_count" : "skipped_count";
                record.put(counter, intValue(record.get(counter), 0) + 1);
                record.put("updated_at", now);
                return record;
            });
            updated++;
        }
        LOG.debugf("Updated question analytics for %d questions of response %s", updated, response.id());
        return Map.of("questions_updated", updated);
    }

    /**
     * Whether this response should also request a form-level analysis (every {@value #FORM_ANALYSIS_INTERVAL}th
     * response).
     */
    public boolean isFormAnalysisDue(FormSnapshotType form) {
        return form.responsesCount() > 0 && form.responsesCount() % FORM_ANALYSIS_INTERVAL == 0;
    }

    public void requestFormAnalysis(FormSnapshotType form) {
        String now = clock.instant().toString();
        recordStore.persist(RecordKeys.form(form.id()), record -> {
            record.put("analysis_requested_at", now);
            return record;
        });
        LOG.infof("Form analysis requested for form %s at %d responses", form.id(), form.responsesCount());
    }

    /**
     * Recomputes the completion rate (completions / responses, as a percentage with 2 decimals).
     */
    public Map<String, Object> updateCompletionMetrics(FormSnapshotType form, FormResponseSnapshotType response) {
        Instant now = clock.instant();
        Map<String, Object> updated = recordStore.persist(RecordKeys.form(form.id()), record -> {
            int completions = intValue(record.get("completion_count"), form.completionCount());
            int responses = form.responsesCount();
            double rate = responses > 0 ? round((double) completions / responses * 100, 2) : 0.0;

            Map<String, Object> settings = mapValue(record.get("form_settings"));
            settings.put("completion_rate", rate);
            response.completedAtInstant().ifPresent(at -> settings.put("last_completion_at", at.toString()));
            settings.put("completion_metrics_updated_at", now.toString());
            record.put("form_settings", settings);
            return record;
        });

        Map<String, Object> settings = mapValue(updated.get("form_settings"));
        LOG.infof("Completion metrics updated for form %s: completion_rate=%s", form.id(),
                settings.get("completion_rate"));
        return Map.of("completion_rate", settings.get("completion_rate"), "total_responses", form.responsesCount());
    }

    /**
     * Adds one generated dynamic question to today's analytics.
     *
     * @param strategyType
     *            generation strategy reported by the LLM, or null
     */
    public Map<String, Object> recordDynamicQuestion(String formId, String strategyType, double aiCost) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        String dailyKey = RecordKeys.dailyFormAnalytics(formId, today);
        Map<String, Object> analytics = recordStore.persist(dailyKey, record -> {
            Map<String, Object> dynamic = mapValue(record.get("dynamic_questions"));
            dynamic.put("generated_count", intValue(dynamic.get("generated_count"), 0) + 1);
            dynamic.put("total_ai_cost", doubleValue(dynamic.get("total_ai_cost"), 0.0) + aiCost);
            dynamic.put("last_generated_at", now.toString());
            if (strategyType != null) {
                Map<String, Object> strategies = mapValue(dynamic.get("strategy_counts"));
                strategies.put(strategyType, intValue(strategies.get(strategyType), 0) + 1);
                dynamic.put("strategy_counts", strategies);
            }
            record.put("dynamic_questions", dynamic);
            return record;
        });

        Map<String, Object> dynamic = mapValue(analytics.get("dynamic_questions"));
        LOG.debugf("Dynamic question metrics for form %s: generated_count=%s total_ai_cost=%s", formId,
                dynamic.get("generated_count"), dynamic.get("total_ai_cost"));
        return Map.of("generated_count", dynamic.get("generated_count"), "total_ai_cost",
                dynamic.get("total_ai_cost"));
    }

    /**
     * Minutes between start and completion, 2 decimals; empty when either timestamp is missing.
     */
    static Optional<Double> completionMinutes(FormResponseSnapshotType response) {
        Optional<Instant> started = response.startedAtInstant();
        Optional<Instant> completed = response.completedAtInstant();
        if (started.isEmpty() || completed.isEmpty()) {
            return Optional.empty();
        }
        double seconds = Duration.between(started.get(), completed.get()).toMillis() / 1000.0;
        return Optional.of(round(seconds / 60.0, 2));
    }

    private static void applyAiMetrics(Map<String, Object> record, int count, Map<String, Object> aiAnalysis,
            Instant now) {
        Double sentiment = RecordValues.doubleOrNull(aiAnalysis.get("overall_sentiment"));
        if (sentiment != null) {
            double average = doubleValue(record.get("avg_sentiment_score"), 0.0);
            record.put("avg_sentiment_score", runningAverage(average, count, sentiment));
        }
        Double quality = RecordValues.doubleOrNull(aiAnalysis.get("overall_quality"));
        if (quality != null) {
            double average = doubleValue(record.get("avg_quality_score"), 0.0);
            record.put("avg_quality_score", runningAverage(average, count, quality));
        }
        Object insights = aiAnalysis.get("key_insights");
        if (insights != null) {
            Map<String, Object> aiInsights = mapValue(record.get("ai_insights"));
            aiInsights.put("latest_insights", insights);
            aiInsights.put("last_updated", now.toString());
            record.put("ai_insights", aiInsights);
        }
    }
}
