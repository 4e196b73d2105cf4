package villagecompute.agentform.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.QuestionSnapshotType;
import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.ResourceNotFoundException;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.services.AiWorkflowService;
import villagecompute.agentform.services.DelayedJobService;
import villagecompute.agentform.services.IdempotencyGuard;
import villagecompute.agentform.services.RateLimitService;
import villagecompute.agentform.services.ResponseAnalysisService;
import villagecompute.agentform.services.WorkUnitPayloadReader;
import villagecompute.agentform.workflow.BackoffStrategy;
import villagecompute.agentform.workflow.ErrorCategory;
import villagecompute.agentform.workflow.RetryPolicy;
import villagecompute.agentform.workflow.RunRecord;
import villagecompute.agentform.workflow.StepDefinition;
import villagecompute.agentform.workflow.StepOutcome;
import villagecompute.agentform.workflow.WorkflowOrchestrator;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * AI analysis of a single answer ({@code response_analyzed}).
 *
 * <p>
 * <b>Steps:</b>
 * <ol>
 * <li>{@code analyze_response} (required, paid by the form owner, rate limited per form): LLM analysis</li>
 * <li>{@code store_analysis} (required): persists the analysis and debits its cost</li>
 * <li>{@code schedule_followup}: enqueues {@code dynamic_question_requested} when the analysis suggests one</li>
 * <li>{@code update_aggregate}: response-level aggregate over all analysed answers</li>
 * </ol>
 *
 * <p>
 * An answer stored within {@code orchestrator.idempotency.analysis-window-seconds} is not analysed again; the run
 * completes with {@code analyze_response} skipped.
 */
@ApplicationScoped
public class ResponseAnalysisJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ResponseAnalysisJobHandler.class);

    static final String ANALYZE_STEP = "analyze_response";
    static final String RECENTLY_ANALYZED = "recently_analyzed";

    private static final RetryPolicy RETRY_POLICY = RetryPolicy.builder().maxAttempts(2)
            .backoff(BackoffStrategy.POLYNOMIAL).fatal(ErrorCategory.VALIDATION, ErrorCategory.NOT_FOUND).build();

    @ConfigProperty(
            name = "orchestrator.idempotency.analysis-window-seconds",
            defaultValue = "300")
    long analysisWindowSeconds = 300;

    @Inject
    WorkflowOrchestrator workflowOrchestrator;

    @Inject
    WorkUnitPayloadReader payloadReader;

    @Inject
    ResponseAnalysisService responseAnalysisService;

    @Inject
    IdempotencyGuard idempotencyGuard;

    @Inject
    DelayedJobService delayedJobService;

    @Override
    public JobType handlesType() {
        return JobType.RESPONSE_ANALYSIS;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return RETRY_POLICY;
    }

    @Override
    public RunRecord execute(WorkUnit workUnit, int attemptNumber) {
        String questionResponseId = payloadReader.requiredString(workUnit, "question_response_id");
        FormSnapshotType form = payloadReader.form(workUnit);
        FormResponseSnapshotType response = payloadReader.response(workUnit);
        AnswerSnapshotType answer = response.answerById(questionResponseId).orElseThrow(
                () -> new ResourceNotFoundException("Question response " + questionResponseId + " not found"));
        QuestionSnapshotType question = form.question(answer.questionId()).orElseThrow(
                () -> new ResourceNotFoundException("Question " + answer.questionId() + " not found"));
        validatePrerequisites(form, question, answer);

        String markerKey = IdempotencyGuard.key(workUnit.id(), ANALYZE_STEP);
        if (!idempotencyGuard.shouldProcess(markerKey, analysisWindowSeconds)) {
            LOG.infof("Question response %s was analysed within %ds, skipping", questionResponseId,
                    analysisWindowSeconds);
            return workflowOrchestrator.runWorkflow(workUnit, attemptNumber,
                    List.of(StepDefinition.optional(ANALYZE_STEP, () -> StepOutcome.skipped(RECENTLY_ANALYZED))));
        }

        AtomicReference<Map<String, Object>> analysis = new AtomicReference<>();
        int rateLimit = form.aiRateLimitPerMinute() != null ? form.aiRateLimitPerMinute() : 0;

        List<StepDefinition> steps = List.of(StepDefinition.required(ANALYZE_STEP, () -> {
            analysis.set(responseAnalysisService.analyze(form, question, answer));
            return StepOutcome.success(Map.of("confidence_score", analysis.get().get("confidence_score")));
        }).paidBy(form.owner().id()).rateLimited(RateLimitService.aiBucketKey(form.id()), rateLimit)
                .withRetry(AiWorkflowService.llmRetryPolicy()),

                StepDefinition.required("store_analysis", () -> {
                    if (analysis.get() == null) {
                        return StepOutcome.skipped("no_analysis");
                    }
                    Map<String, Object> stored = responseAnalysisService.storeAnalysis(form, answer, analysis.get());
                    idempotencyGuard.markProcessed(markerKey, analysisWindowSeconds);
                    return StepOutcome.success(stored);
                }),

                StepDefinition.optional("schedule_followup",
                        () -> scheduleFollowup(workUnit, response, question, analysis.get())),

                StepDefinition.optional("update_aggregate", () -> {
                    if (analysis.get() == null) {
                        return StepOutcome.skipped("no_analysis");
                    }
                    @SuppressWarnings("unchecked")
                    Map<String, Object> aiAnalysis = (Map<String, Object>) analysis.get().get("ai_analysis");
                    return StepOutcome.success(responseAnalysisService.updateAggregate(response, answer, aiAnalysis));
                }));

        return workflowOrchestrator.runWorkflow(workUnit, attemptNumber, steps);
    }

    static void validatePrerequisites(FormSnapshotType form, QuestionSnapshotType question,
            AnswerSnapshotType answer) {
        if (!question.aiEnhanced()) {
            throw new ValidationException("Question " + question.id() + " is not AI enhanced");
        }
        if (!form.ownerCanUseAi()) {
            throw new ValidationException("Owner of form " + form.id() + " does not have AI features available");
        }
        if (!answer.hasAnswer()) {
            throw new ValidationException("Question response " + answer.questionResponseId() + " has no answer data");
        }
    }

    private StepOutcome scheduleFollowup(WorkUnit workUnit, FormResponseSnapshotType response,
            QuestionSnapshotType question, Map<String, Object> analysis) {
        if (analysis == null || !ResponseAnalysisService.suggestsFollowup(analysis)) {
            return StepOutcome.skipped("no_followup_suggested");
        }
        if (!question.generatesFollowups()) {
            return StepOutcome.skipped("followups_disabled");
        }
        if (!responseAnalysisService.followupAllowed(response, question)) {
            return StepOutcome.skipped("followup_limit_reached");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("form_response_id", response.id());
        payload.put("source_question_id", question.id());
        payload.put(WorkUnitPayloadReader.FORM, workUnit.payload().get(WorkUnitPayloadReader.FORM));
        payload.put(WorkUnitPayloadReader.RESPONSE, workUnit.payload().get(WorkUnitPayloadReader.RESPONSE));
        payload.put("trigger", "response_analysis");

        String id = delayedJobService.enqueue(EventType.DYNAMIC_QUESTION_REQUESTED, payload, Duration.ofSeconds(2));
        LOG.infof("Follow-up generation queued for response %s, question %s: %s", response.id(), question.id(), id);
        return StepOutcome.success(Map.of("work_unit_id", id));
    }
}
