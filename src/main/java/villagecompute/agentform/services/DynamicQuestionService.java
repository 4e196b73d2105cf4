package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.DynamicQuestionSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.QuestionSnapshotType;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.integration.ai.LlmWorkflow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static villagecompute.agentform.services.RecordValues.listValue;
import static villagecompute.agentform.services.RecordValues.mapValue;

/**
 * Generation, screening and storage of AI follow-up questions.
 *
 * <p>
 * Generated questions are appended to {@code form_response:<id>.dynamic_questions}. Counts used for the per-response
 * and per-question caps combine the snapshot carried by the work unit with questions stored since, so a burst of
 * requests for the same response cannot exceed the caps by more than the in-flight ones.
 */
@ApplicationScoped
public class DynamicQuestionService {

    private static final Logger LOG = Logger.getLogger(DynamicQuestionService.class);

    static final Duration ACTIVE_WINDOW = Duration.ofHours(1);
    static final double EXISTING_SIMILARITY_LIMIT = 0.8;
    static final double SOURCE_SIMILARITY_LIMIT = 0.7;
    static final BigDecimal DEFAULT_GENERATION_COST = new BigDecimal("0.05");

    /**
     * A question returned by the {@value LlmWorkflow#DYNAMIC_QUESTION} workflow.
     */
    public record GeneratedQuestion(String title, String questionType, Map<String, Object> strategy,
            BigDecimal aiCost) {

        public String strategyType() {
            Object type = strategy == null ? null : strategy.get("type");
            return type == null ? null : type.toString();
        }
    }

    @Inject
    Clock clock;

    @Inject
    AiWorkflowService aiWorkflowService;

    @Inject
    RecordStore recordStore;

    @Inject
    CreditLedgerService creditLedgerService;

    /**
     * Checks that a follow-up may be generated and returns the source answer.
     *
     * @throws ValidationException
     *             if any prerequisite fails
     */
    public AnswerSnapshotType validatePrerequisites(FormSnapshotType form, FormResponseSnapshotType response,
            QuestionSnapshotType source) {
        if (!form.id().equals(response.formId()) || (source.formId() != null && !form.id().equals(source.formId()))) {
            throw new ValidationException(
                    "Form response " + response.id() + " does not belong to form " + source.formId());
        }
        if (!form.aiEnhanced()) {
            throw new ValidationException("Form " + form.id() + " does not have AI features enabled");
        }
        if (!source.generatesFollowups()) {
            throw new ValidationException(
                    "Source question " + source.id() + " is not configured for follow-up generation");
        }
        if (!form.ownerCanUseAi()) {
            throw new ValidationException("Owner of form " + form.id() + " does not have AI features available");
        }

        int existing = existingCount(response, null);
        int maxDynamic = form.maxDynamicQuestionsOrDefault();
        if (existing >= maxDynamic) {
            throw new ValidationException(
                    "Maximum dynamic questions limit reached (" + existing + "/" + maxDynamic + ")");
        }
        int fromSource = existingCount(response, source.id());
        int maxFollowups = source.maxFollowupsOrDefault();
        if (fromSource >= maxFollowups) {
            throw new ValidationException(
                    "Maximum follow-ups for this question reached (" + fromSource + "/" + maxFollowups + ")");
        }

        Optional<Instant> completedAt = response.completedAtInstant();
        if (response.isCompleted() && completedAt.isPresent()
                && completedAt.get().isBefore(clock.instant().minus(ACTIVE_WINDOW))) {
            throw new ValidationException("Form response was completed too long ago for dynamic questions");
        }

        AnswerSnapshotType answer = response.answerFor(source.id()).orElseThrow(
                () -> new ValidationException("No response found for source question " + source.id()));
        if (!answer.hasAnswer()) {
            throw new ValidationException("Source question response has no answer data");
        }
        LOG.debugf("Dynamic question prerequisites validated: response=%s source=%s existing=%d from_source=%d",
                response.id(), source.id(), existing, fromSource);
        return answer;
    }

    /**
     * Asks the LLM for a follow-up question.
     *
     * @return the question, or empty when the workflow produced no title
     */
    public Optional<GeneratedQuestion> generate(FormResponseSnapshotType response, QuestionSnapshotType source,
            AnswerSnapshotType answer, String trigger) throws Exception {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("form_response_id", response.id());
        inputs.put("source_question_id", source.id());
        inputs.put("source_question_title", source.title());
        inputs.put("source_question_type", source.questionType());
        inputs.put("source_answer_data", answer.answer());
        inputs.put("generation_trigger", trigger);

        Map<String, Object> output = aiWorkflowService.execute(LlmWorkflow.DYNAMIC_QUESTION, inputs);
        Object title = output.get("title");
        if (title == null || title.toString().isBlank()) {
            LOG.infof("Dynamic question workflow returned no question for response %s: %s", response.id(),
                    output.get("reason"));
            return Optional.empty();
        }

        BigDecimal cost = generationCost(output.get("ai_cost"), response.id());
        Object questionType = output.get("question_type");
        GeneratedQuestion question = new GeneratedQuestion(title.toString().trim(),
                questionType != null ? questionType.toString() : "text_short", mapValue(output.get("strategy")), cost);
        LOG.infof("Generated dynamic question for response %s (strategy=%s): %s", response.id(),
                question.strategyType(), question.title());
        return Optional.of(question);
    }

    private static BigDecimal generationCost(Object reported, String formResponseId) {
        Double value = RecordValues.doubleOrNull(reported);
        if (value == null) {
            return DEFAULT_GENERATION_COST;
        }
        if (!Double.isFinite(value) || value < 0) {
            LOG.warnf("Ignoring invalid ai_cost %s reported for response %s", reported, formResponseId);
            return DEFAULT_GENERATION_COST;
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Rejects a question that repeats an existing question or restates its source.
     *
     * @throws ValidationException
     *             if the title is too similar
     */
    public void screen(FormSnapshotType form, FormResponseSnapshotType response, QuestionSnapshotType source,
            GeneratedQuestion question) {
        List<String> existing = new ArrayList<>();
        form.questionsOrEmpty().forEach(q -> existing.add(q.title()));
        response.dynamicQuestionsOrEmpty().forEach(q -> existing.add(q.title()));
        storedDynamicQuestions(response.id()).forEach(q -> existing.add(String.valueOf(q.get("title"))));

        for (String title : existing) {
            if (similarity(question.title(), title) > EXISTING_SIMILARITY_LIMIT) {
                throw new ValidationException(
                        "Generated question too similar to existing question: '" + title + "'");
            }
        }
        if (similarity(question.title(), source.title()) > SOURCE_SIMILARITY_LIMIT) {
            throw new ValidationException("Generated question too similar to source question: '" + source.title()
                    + "'");
        }
    }

    /**
     * Debits the question's cost from the form owner, then appends the question to the response. A rejected debit
     * leaves the response untouched.
     */
    public Map<String, Object> store(FormSnapshotType form, FormResponseSnapshotType response,
            QuestionSnapshotType source, GeneratedQuestion question) {
        String id = UUID.randomUUID().toString();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", id);
        entry.put("title", question.title());
        entry.put("question_type", question.questionType());
        entry.put("source_question_id", source.id());
        entry.put("strategy", question.strategy());
        entry.put("ai_cost", question.aiCost().doubleValue());
        entry.put("generated_at", clock.instant().toString());

        BigDecimal remaining = creditLedgerService.debit(form.owner().id(), question.aiCost());
        recordStore.persist(RecordKeys.formResponse(response.id()), record -> {
            List<Object> questions = listValue(record.get("dynamic_questions"));
            questions.add(entry);
            record.put("dynamic_questions", questions);
            return record;
        });
        LOG.infof("Stored dynamic question %s for response %s (ai_cost=%s, remaining credits=%s)", id, response.id(),
                question.aiCost().toPlainString(), remaining.toPlainString());

        return Map.of("dynamic_question_id", id, "ai_cost", question.aiCost().doubleValue());
    }

    /**
     * Dynamic questions on the response, optionally only those generated from {@code sourceQuestionId}.
     */
    public int existingCount(FormResponseSnapshotType response, String sourceQuestionId) {
        Set<String> ids = new LinkedHashSet<>();
        int unidentified = 0;
        for (DynamicQuestionSnapshotType question : response.dynamicQuestionsOrEmpty()) {
            if (sourceQuestionId == null || sourceQuestionId.equals(question.sourceQuestionId())) {
                if (question.id() != null) {
                    ids.add(question.id());
                } else {
                    unidentified++;
                }
            }
        }
        for (Map<String, Object> stored : storedDynamicQuestions(response.id())) {
            if (sourceQuestionId == null || sourceQuestionId.equals(stored.get("source_question_id"))) {
                Object id = stored.get("id");
                if (id != null) {
                    ids.add(id.toString());
                } else {
                    unidentified++;
                }
            }
        }
        return ids.size() + unidentified;
    }

    @SuppressWarnings("unchecked")
    List<Map<String, Object>> storedDynamicQuestions(String formResponseId) {
        Object stored = recordStore.find(RecordKeys.formResponse(formResponseId))
                .map(record -> record.get("dynamic_questions")).orElse(null);
        List<Map<String, Object>> questions = new ArrayList<>();
        for (Object entry : listValue(stored)) {
            if (entry instanceof Map<?, ?> map) {
                questions.add((Map<String, Object>) map);
            }
        }
        return questions;
    }

    /**
     * Jaccard similarity of the lowercase word sets of two texts; 0 when either is blank.
     */
    public static double similarity(String first, String second) {
        Set<String> firstWords = words(first);
        Set<String> secondWords = words(second);
        if (firstWords.isEmpty() || secondWords.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(firstWords);
        common.retainAll(secondWords);
        Set<String> union = new HashSet<>(firstWords);
        union.addAll(secondWords);
        return (double) common.size() / union.size();
    }

    private static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> words = new LinkedHashSet<>();
        Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+")).filter(w -> !w.isBlank()).forEach(words::add);
        return words;
    }
}
