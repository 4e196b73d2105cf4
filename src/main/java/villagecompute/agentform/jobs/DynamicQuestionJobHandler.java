package villagecompute.agentform.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.QuestionSnapshotType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.ResourceNotFoundException;
import villagecompute.agentform.services.AiWorkflowService;
import villagecompute.agentform.services.DynamicQuestionService.GeneratedQuestion;
import villagecompute.agentform.services.DynamicQuestionService;
import villagecompute.agentform.services.FormAnalyticsService;
import villagecompute.agentform.services.RateLimitService;
import villagecompute.agentform.services.WorkUnitPayloadReader;
import villagecompute.agentform.workflow.BackoffStrategy;
import villagecompute.agentform.workflow.ErrorCategory;
import villagecompute.agentform.workflow.RetryPolicy;
import villagecompute.agentform.workflow.RunRecord;
import villagecompute.agentform.workflow.StepDefinition;
import villagecompute.agentform.workflow.StepOutcome;
import villagecompute.agentform.workflow.WorkflowOrchestrator;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Generates a follow-up question from a source answer ({@code dynamic_question_requested}).
 *
 * <p>
 * <b>Steps:</b>
 * <ol>
 * <li>{@code generate_question} (required, paid, rate limited per form): LLM generation</li>
 * <li>{@code validate_question}: similarity screen against existing and source questions</li>
 * <li>{@code store_question} (required): appends the question and debits its cost</li>
 * <li>{@code update_analytics}: daily dynamic question metrics</li>
 * </ol>
 *
 * <p>
 * A question rejected by {@code validate_question} is not stored. When generation returns no question the remaining
 * steps are skipped.
 */
@ApplicationScoped
public class DynamicQuestionJobHandler implements JobHandler {

    static final String DEFAULT_TRIGGER = "response_analysis";

    private static final RetryPolicy RETRY_POLICY = RetryPolicy.builder().maxAttempts(2)
            .backoff(BackoffStrategy.POLYNOMIAL).fatal(ErrorCategory.VALIDATION, ErrorCategory.NOT_FOUND).build();

    @Inject
    WorkflowOrchestrator workflowOrchestrator;

    @Inject
    WorkUnitPayloadReader payloadReader;

    @Inject
    DynamicQuestionService dynamicQuestionService;

    @Inject
    FormAnalyticsService formAnalyticsService;

    @Override
    public JobType handlesType() {
        return JobType.DYNAMIC_QUESTION_GENERATION;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return RETRY_POLICY;
    }

    @Override
    public RunRecord execute(WorkUnit workUnit, int attemptNumber) {
        String sourceQuestionId = payloadReader.requiredString(workUnit, "source_question_id");
        String trigger = payloadReader.optionalString(workUnit, "trigger", DEFAULT_TRIGGER);
        FormSnapshotType form = payloadReader.form(workUnit);
        FormResponseSnapshotType response = payloadReader.response(workUnit);
        QuestionSnapshotType source = form.question(sourceQuestionId).orElseThrow(
                () -> new ResourceNotFoundException("Source question " + sourceQuestionId + " not found"));
        AnswerSnapshotType answer = dynamicQuestionService.validatePrerequisites(form, response, source);

        AtomicReference<GeneratedQuestion> generated = new AtomicReference<>();
        AtomicReference<Boolean> accepted = new AtomicReference<>(Boolean.FALSE);
        int rateLimit = form.aiRateLimitPerMinute() != null ? form.aiRateLimitPerMinute() : 0;

        List<StepDefinition> steps = List.of(StepDefinition.required("generate_question", () -> {
            Optional<GeneratedQuestion> question = dynamicQuestionService.generate(response, source, answer, trigger);
            if (question.isEmpty()) {
                return StepOutcome.skipped("no_question_generated");
            }
            generated.set(question.get());
            return StepOutcome.success(Map.of("title", question.get().title()));
        }).paidBy(form.owner().id()).rateLimited(RateLimitService.aiBucketKey(form.id()), rateLimit)
                .withRetry(AiWorkflowService.llmRetryPolicy()),

                StepDefinition.optional("validate_question", () -> {
                    if (generated.get() == null) {
                        return StepOutcome.skipped("no_question_generated");
                    }
                    dynamicQuestionService.screen(form, response, source, generated.get());
                    accepted.set(Boolean.TRUE);
                    return StepOutcome.success();
                }),

                StepDefinition.required("store_question", () -> {
                    if (generated.get() == null) {
                        return StepOutcome.skipped("no_question_generated");
                    }
                    if (!accepted.get()) {
                        return StepOutcome.skipped("question_rejected");
                    }
                    return StepOutcome.success(dynamicQuestionService.store(form, response, source, generated.get()));
                }),

                StepDefinition.optional("update_analytics", () -> {
                    if (!accepted.get()) {
                        return StepOutcome.skipped("question_not_stored");
                    }
                    GeneratedQuestion question = generated.get();
                    return StepOutcome.success(formAnalyticsService.recordDynamicQuestion(form.id(),
                            question.strategyType(), question.aiCost().doubleValue()));
                }));

        return workflowOrchestrator.runWorkflow(workUnit, attemptNumber, steps);
    }
}
