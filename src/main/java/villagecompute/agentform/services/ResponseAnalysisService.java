package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.QuestionSnapshotType;
import villagecompute.agentform.integration.ai.LlmWorkflow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static villagecompute.agentform.services.RecordValues.booleanValue;
import static villagecompute.agentform.services.RecordValues.doubleOrNull;
import static villagecompute.agentform.services.RecordValues.doubleValue;
import static villagecompute.agentform.services.RecordValues.listValue;
import static villagecompute.agentform.services.RecordValues.mapValue;
import static villagecompute.agentform.services.RecordValues.round;

/**
 * AI analysis of a single answer and the per-response aggregate built from all analysed answers.
 *
 * <p>
 * <b>Analysis shape</b> (returned by {@link #analyze} and stored under {@code question_response:<id>}):
 *
 * <pre>
 * {
 *   "ai_analysis": {sentiment, quality, insights, flags, completeness},
 *   "confidence_score": 0.0-1.0,
 *   "completeness_score": 0.0-1.0,
 *   "generate_followup": true|false,
 *   "analyzed_at": ISO-8601,
 *   "analysis_version": 1
 * }
 * </pre>
 *
 * <p>
 * Missing parts of the LLM output fall back to neutral defaults (sentiment {@code neutral}, scores {@code 0.5}, no
 * flags set) so a sparse reply still produces a complete record.
 */
@ApplicationScoped
public class ResponseAnalysisService {

    private static final Logger LOG = Logger.getLogger(ResponseAnalysisService.class);

    static final BigDecimal BASE_ANALYSIS_COST = new BigDecimal("0.02");
    static final int TOP_INSIGHTS = 5;

    private static final List<String> FLAG_NAMES = List.of("needs_review", "potential_spam", "incomplete_answer",
            "unusual_pattern", "high_quality");

    @Inject
    Clock clock;

    @Inject
    AiWorkflowService aiWorkflowService;

    @Inject
    RecordStore recordStore;

    @Inject
    CreditLedgerService creditLedgerService;

    @Inject
    DynamicQuestionService dynamicQuestionService;

    /**
     * Runs the {@value LlmWorkflow#RESPONSE_ANALYSIS} workflow for one answer and normalizes its output.
     */
    public Map<String, Object> analyze(FormSnapshotType form, QuestionSnapshotType question, AnswerSnapshotType answer)
            throws Exception {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("form_name", form.name());
        inputs.put("question_title", question.title());
        inputs.put("question_type", question.questionType());
        inputs.put("answer", answer.answer());

        Map<String, Object> output = aiWorkflowService.execute(LlmWorkflow.RESPONSE_ANALYSIS, inputs);
        Map<String, Object> analysis = extractAnalysis(output, question.questionType(), answer);
        LOG.infof("AI analysis completed for question response %s: confidence=%s sentiment=%s",
                answer.questionResponseId(), analysis.get("confidence_score"),
                mapValue(mapValue(analysis.get("ai_analysis")).get("sentiment")).get("label"));
        return analysis;
    }

    /**
     * Debits the analysis cost from the form owner, then persists the analysis on the question response.
     */
    public Map<String, Object> storeAnalysis(FormSnapshotType form, AnswerSnapshotType answer,
            Map<String, Object> analysis) {
        BigDecimal cost = analysisCost(answer.answerText());
        BigDecimal remaining = creditLedgerService.debit(form.owner().id(), cost);

        String now = clock.instant().toString();
        recordStore.persist(RecordKeys.questionResponse(answer.questionResponseId()), record -> {
            record.put("ai_analysis_results", analysis.get("ai_analysis"));
            record.put("ai_confidence_score", analysis.get("confidence_score"));
            record.put("ai_completeness_score", analysis.get("completeness_score"));
            record.put("ai_analysis_requested_at", now);
            return record;
        });
        LOG.infof("Stored analysis for question response %s (ai_cost=%s, remaining credits=%s)",
                answer.questionResponseId(), cost.toPlainString(), remaining.toPlainString());

        Map<String, Object> sideEffects = new LinkedHashMap<>();
        sideEffects.put("question_response_id", answer.questionResponseId());
        sideEffects.put("ai_cost", cost.doubleValue());
        sideEffects.put("remaining_credits", remaining.doubleValue());
        return sideEffects;
    }

    /**
     * Whether another follow-up from this answer's question stays within the question's follow-up cap.
     */
    public boolean followupAllowed(FormResponseSnapshotType response, QuestionSnapshotType question) {
        int existing = dynamicQuestionService.existingCount(response, question.id());
        if (existing >= question.maxFollowupsOrDefault()) {
            LOG.infof("Follow-up cap reached for question %s on response %s (%d/%d)", question.id(), response.id(),
                    existing, question.maxFollowupsOrDefault());
            return false;
        }
        return true;
    }

    /**
     * Rebuilds the response-level aggregate from every analysed answer and stores it on {@code form_response:<id>}.
     *
     * @param analyzed
     *            the answer analysed in this run
     * @param aiAnalysis
     *            its fresh {@code ai_analysis} block
     */
    public Map<String, Object> updateAggregate(FormResponseSnapshotType response, AnswerSnapshotType analyzed,
            Map<String, Object> aiAnalysis) {
        List<Map<String, Object>> analyses = new ArrayList<>();
        analyses.add(aiAnalysis);
        for (AnswerSnapshotType answer : response.answersOrEmpty()) {
            if (answer.questionResponseId() == null
                    || answer.questionResponseId().equals(analyzed.questionResponseId())) {
                continue;
            }
            storedAnalysis(answer).ifPresent(analyses::add);
        }

        String now = clock.instant().toString();
        Map<String, Object> aggregate = aggregate(analyses, now);
        recordStore.persist(RecordKeys.formResponse(response.id()), record -> {
            record.put("ai_analysis_results", aggregate);
            record.put("ai_analysis_updated_at", now);
            return record;
        });
        LOG.infof("Aggregate analysis updated for form response %s: overall_sentiment=%s overall_quality=%s",
                response.id(), aggregate.get("overall_sentiment"), aggregate.get("overall_quality"));
        return Map.of("analysis_count", aggregate.get("analysis_count"), "overall_sentiment",
                aggregate.get("overall_sentiment"), "overall_quality", aggregate.get("overall_quality"));
    }

    /**
     * Cost of analysing an answer: {@code 0.02 × min(1 + length/1000, 3)}, 4 decimals.
     */
    public static BigDecimal analysisCost(String answerText) {
        int length = answerText == null ? 0 : answerText.length();
        double multiplier = Math.min(1.0 + (length / 1000.0), 3.0);
        return BASE_ANALYSIS_COST.multiply(BigDecimal.valueOf(multiplier)).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Whether the analysis asks for a follow-up question.
     */
    public static boolean suggestsFollowup(Map<String, Object> analysis) {
        return booleanValue(analysis.get("generate_followup"));
    }

    Map<String, Object> extractAnalysis(Map<String, Object> output, String questionType, AnswerSnapshotType answer) {
        Map<String, Object> sentiment = sentiment(section(output, "sentiment"));
        Map<String, Object> quality = quality(section(output, "quality"));
        double completeness = completenessScore(output, questionType, answer);

        Map<String, Object> aiAnalysis = new LinkedHashMap<>();
        aiAnalysis.put("sentiment", sentiment);
        aiAnalysis.put("quality", quality);
        aiAnalysis.put("insights", insights(output));
        aiAnalysis.put("flags", flags(section(output, "flags")));
        aiAnalysis.put("completeness", completeness);

        Double explicitConfidence = doubleOrNull(output.get("confidence_score"));
        Double explicitCompleteness = doubleOrNull(output.get("completeness_score"));
        boolean generateFollowup = booleanValue(output.get("generate_followup")) || followupWorthy(sentiment, quality);

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("ai_analysis", aiAnalysis);
        analysis.put("confidence_score", explicitConfidence != null ? explicitConfidence : confidenceScore(output));
        analysis.put("completeness_score", explicitCompleteness != null ? explicitCompleteness : completeness);
        analysis.put("generate_followup", generateFollowup);
        analysis.put("analyzed_at", clock.instant().toString());
        analysis.put("analysis_version", 1);
        return analysis;
    }

    /**
     * A section of the output, either at the top level or nested under {@code ai_analysis}.
     */
    private static Map<String, Object> section(Map<String, Object> output, String name) {
        Map<String, Object> nested = mapValue(output.get("ai_analysis"));
        if (nested.get(name) instanceof Map<?, ?>) {
            return mapValue(nested.get(name));
        }
        return mapValue(output.get(name));
    }

    private static Map<String, Object> sentiment(Map<String, Object> data) {
        Map<String, Object> sentiment = new LinkedHashMap<>();
        sentiment.put("label", data.get("label") != null ? data.get("label") : "neutral");
        sentiment.put("confidence", doubleValue(data.get("confidence"), 0.5));
        sentiment.put("score", doubleValue(data.get("score"), 0.0));
        sentiment.put("reasoning", data.get("reasoning") != null ? data.get("reasoning") : "");
        return sentiment;
    }

    private static Map<String, Object> quality(Map<String, Object> data) {
        Map<String, Object> quality = new LinkedHashMap<>();
        quality.put("completeness", doubleValue(data.get("completeness"), 0.5));
        quality.put("relevance", doubleValue(data.get("relevance"), 0.5));
        quality.put("clarity", doubleValue(data.get("clarity"), 0.5));
        quality.put("overall_score", doubleValue(data.get("overall_score"), 0.5));
        quality.put("issues", listValue(data.get("issues")));
        quality.put("strengths", listValue(data.get("strengths")));
        return quality;
    }

    private static List<Object> insights(Map<String, Object> output) {
        Object raw = mapValue(output.get("ai_analysis")).get("insights");
        if (raw == null) {
            raw = output.get("insights");
        }
        List<Object> insights = new ArrayList<>();
        for (Object insight : listValue(raw)) {
            if (insight instanceof String text) {
                Map<String, Object> formatted = new LinkedHashMap<>();
                formatted.put("text", text);
                formatted.put("confidence", 0.7);
                formatted.put("category", "general");
                insights.add(formatted);
            } else if (insight != null) {
                insights.add(insight);
            }
        }
        return insights;
    }

    private static Map<String, Object> flags(Map<String, Object> data) {
        Map<String, Object> flags = new LinkedHashMap<>();
        for (String name : FLAG_NAMES) {
            flags.put(name, booleanValue(data.get(name)));
        }
        return flags;
    }

    /**
     * Completeness blended with answer length for text questions; all-or-nothing for choice questions; 3 decimals.
     */
    static double completenessScore(Map<String, Object> output, String questionType, AnswerSnapshotType answer) {
        double score = doubleValue(output.get("completeness_score"), 0.5);
        if (questionType != null) {
            switch (questionType) {
                case "text_short", "text_long" -> {
                    double lengthScore = Math.min(answer.answerText().length() / 100.0, 1.0);
                    score = (score + lengthScore) / 2.0;
                }
                case "multiple_choice", "single_choice" -> score = answer.hasAnswer() ? 1.0 : 0.0;
                default -> {
                }
            }
        }
        return round(Math.min(score, 1.0), 3);
    }

    /**
     * Mean of sentiment confidence, overall quality and completeness where present; 0.5 when none are.
     */
    static double confidenceScore(Map<String, Object> output) {
        List<Double> indicators = new ArrayList<>();
        addIfPresent(indicators, section(output, "sentiment").get("confidence"));
        addIfPresent(indicators, section(output, "quality").get("overall_score"));
        addIfPresent(indicators, output.get("completeness_score"));
        if (indicators.isEmpty()) {
            return 0.5;
        }
        double sum = indicators.stream().mapToDouble(Double::doubleValue).sum();
        return round(sum / indicators.size(), 3);
    }

    /**
     * Engaged but not exhaustive: quality in [0.4, 0.8] and sentiment confidence above 0.6.
     */
    static boolean followupWorthy(Map<String, Object> sentiment, Map<String, Object> quality) {
        double qualityScore = doubleValue(quality.get("overall_score"), 0.5);
        double sentimentConfidence = doubleValue(sentiment.get("confidence"), 0.5);
        return qualityScore >= 0.4 && qualityScore <= 0.8 && sentimentConfidence > 0.6;
    }

    static Map<String, Object> aggregate(List<Map<String, Object>> analyses, String analyzedAt) {
        Map<String, Object> aggregate = new LinkedHashMap<>();
        if (analyses.isEmpty()) {
            aggregate.put("overall_sentiment", 0.5);
            aggregate.put("overall_quality", 0.5);
            aggregate.put("key_insights", List.of());
            aggregate.put("flags", Map.of());
            aggregate.put("analysis_count", 0);
            aggregate.put("analyzed_at", analyzedAt);
            return aggregate;
        }

        List<Double> sentiments = new ArrayList<>();
        List<Double> qualities = new ArrayList<>();
        List<Double> completeness = new ArrayList<>();
        Map<String, Integer> labels = new TreeMap<>();
        Set<Object> insights = new LinkedHashSet<>();
        Map<String, Object> flags = new LinkedHashMap<>();

        for (Map<String, Object> analysis : analyses) {
            Map<String, Object> sentiment = mapValue(analysis.get("sentiment"));
            addIfPresent(sentiments, sentiment.get("confidence"));
            addIfPresent(qualities, mapValue(analysis.get("quality")).get("overall_score"));
            addIfPresent(completeness, analysis.get("completeness"));
            if (sentiment.get("label") != null) {
                labels.merge(sentiment.get("label").toString(), 1, Integer::sum);
            }
            insights.addAll(listValue(analysis.get("insights")));
            mapValue(analysis.get("flags"))
                    .forEach((flag, value) -> flags.merge(flag, booleanValue(value),
                            (a, b) -> booleanValue(a) || booleanValue(b)));
        }

        aggregate.put("overall_sentiment", round(average(sentiments, 0.5), 3));
        aggregate.put("overall_quality", round(average(qualities, 0.5), 3));
        aggregate.put("key_insights", insights.stream().limit(TOP_INSIGHTS).toList());
        aggregate.put("flags", flags);
        aggregate.put("analysis_count", analyses.size());
        aggregate.put("analyzed_at", analyzedAt);
        aggregate.put("completeness_distribution", completenessDistribution(completeness));
        aggregate.put("sentiment_distribution", sentimentDistribution(labels));
        return aggregate;
    }

    private static Map<String, Object> completenessDistribution(List<Double> scores) {
        if (scores.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> distribution = new LinkedHashMap<>();
        distribution.put("high", scores.stream().filter(s -> s > 0.8).count());
        distribution.put("medium", scores.stream().filter(s -> s >= 0.4 && s <= 0.8).count());
        distribution.put("low", scores.stream().filter(s -> s < 0.4).count());
        distribution.put("average", round(average(scores, 0.0), 3));
        return distribution;
    }

    private static Map<String, Object> sentimentDistribution(Map<String, Integer> labels) {
        int total = labels.values().stream().mapToInt(Integer::intValue).sum();
        Map<String, Object> distribution = new LinkedHashMap<>();
        labels.forEach((label, count) -> distribution.put(label, round((double) count / total * 100, 1)));
        return distribution;
    }

    private Optional<Map<String, Object>> storedAnalysis(AnswerSnapshotType answer) {
        Optional<Map<String, Object>> stored = recordStore
                .find(RecordKeys.questionResponse(answer.questionResponseId()))
                .map(record -> mapValue(record.get("ai_analysis_results"))).filter(results -> !results.isEmpty());
        if (stored.isPresent()) {
            return stored;
        }
        return answer.aiAnalysis() == null || answer.aiAnalysis().isEmpty() ? Optional.empty()
                : Optional.of(answer.aiAnalysis());
    }

    private static void addIfPresent(List<Double> values, Object value) {
        Double number = doubleOrNull(value);
        if (number != null) {
            values.add(number);
        }
    }

    private static double average(List<Double> values, double defaultValue) {
        return values.isEmpty() ? defaultValue
                : values.stream().mapToDouble(Double::doubleValue).sum() / values.size();
    }
}
