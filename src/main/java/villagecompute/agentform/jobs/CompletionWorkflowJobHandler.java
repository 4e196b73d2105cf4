package villagecompute.agentform.jobs;

import io.opentelemetry.api.trace.Span;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.services.CompletionNotificationService;
import villagecompute.agentform.services.DelayedJobService;
import villagecompute.agentform.services.FormAnalyticsService;
import villagecompute.agentform.services.WorkUnitPayloadReader;
import villagecompute.agentform.workflow.BackoffStrategy;
import villagecompute.agentform.workflow.ErrorCategory;
import villagecompute.agentform.workflow.RetryPolicy;
import villagecompute.agentform.workflow.RunRecord;
import villagecompute.agentform.workflow.StepDefinition;
import villagecompute.agentform.workflow.StepOutcome;
import villagecompute.agentform.workflow.WorkflowOrchestrator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-completion workflow for a form response ({@code form_completed}).
 *
 * <p>
 * <b>Steps:</b>
 * <ol>
 * <li>{@code update_analytics} (required): completion count and daily analytics</li>
 * <li>{@code update_question_analytics}: per-question counters</li>
 * <li>{@code trigger_integrations}: enqueues {@code integration_triggered} when the form has integrations</li>
 * <li>{@code queue_ai_analysis}: enqueues {@code response_analyzed} per AI-enhanced answer once the form has
 * {@value #AI_ANALYSIS_MIN_RESPONSES} responses; every 10th response also requests a form-level analysis</li>
 * <li>{@code update_completion_metrics}: completion rate on the form settings</li>
 * <li>{@code send_notifications}: completion notification channels</li>
 * </ol>
 *
 * <p>
 * The response must be {@code completed} with a completion timestamp; otherwise the run is rejected as
 * {@code validation} and not retried.
 */
@ApplicationScoped
public class CompletionWorkflowJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(CompletionWorkflowJobHandler.class);

    static final int AI_ANALYSIS_MIN_RESPONSES = 5;

    private static final RetryPolicy RETRY_POLICY = RetryPolicy.builder().maxAttempts(2)
            .backoff(BackoffStrategy.POLYNOMIAL)
            .override(ErrorCategory.NOT_FOUND, 3, Duration.ofSeconds(5), BackoffStrategy.FIXED)
            .fatal(ErrorCategory.VALIDATION).build();

    private static final RetryPolicy ENQUEUE_RETRY_POLICY = RetryPolicy.builder().maxAttempts(2)
            .baseDelay(Duration.ofSeconds(1)).backoff(BackoffStrategy.FIXED).retryOn(ErrorCategory.TIMEOUT).build();

    @Inject
    WorkflowOrchestrator workflowOrchestrator;

    @Inject
    WorkUnitPayloadReader payloadReader;

    @Inject
    FormAnalyticsService formAnalyticsService;

    @Inject
    CompletionNotificationService completionNotificationService;

    @Inject
    DelayedJobService delayedJobService;

    @Override
    public JobType handlesType() {
        return JobType.COMPLETION_WORKFLOW;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return RETRY_POLICY;
    }

    @Override
    public RunRecord execute(WorkUnit workUnit, int attemptNumber) {
        FormSnapshotType form = payloadReader.form(workUnit);
        FormResponseSnapshotType response = payloadReader.response(workUnit);
        validatePrerequisites(response);

        List<StepDefinition> steps = List.of(
                StepDefinition.required("update_analytics",
                        () -> StepOutcome.success(formAnalyticsService.recordCompletion(form, response))),
                StepDefinition.optional("update_question_analytics",
                        () -> StepOutcome.success(formAnalyticsService.updateQuestionAnalytics(response))),
                StepDefinition.optional("trigger_integrations", () -> triggerIntegrations(workUnit, form, response))
                        .withRetry(ENQUEUE_RETRY_POLICY),
                StepDefinition.optional("queue_ai_analysis", () -> queueAiAnalysis(workUnit, form, response)),
                StepDefinition.optional("update_completion_metrics",
                        () -> StepOutcome.success(formAnalyticsService.updateCompletionMetrics(form, response))),
                StepDefinition.optional("send_notifications", () -> sendNotifications(form, response)));

        return workflowOrchestrator.runWorkflow(workUnit, attemptNumber, steps);
    }

    static void validatePrerequisites(FormResponseSnapshotType response) {
        if (!response.isCompleted()) {
            throw new ValidationException("Form response " + response.id() + " is not in completed state");
        }
        if (response.completedAtInstant().isEmpty()) {
            throw new ValidationException("Form response " + response.id() + " missing completion timestamp");
        }
    }

    private StepOutcome triggerIntegrations(WorkUnit workUnit, FormSnapshotType form,
            FormResponseSnapshotType response) {
        if (!form.integrationsEnabled() || form.integrationsOrEmpty().isEmpty()) {
            return StepOutcome.skipped("integrations_disabled");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("form_response_id", response.id());
        payload.put("trigger_event", "form_completed");
        payload.put(WorkUnitPayloadReader.FORM, workUnit.payload().get(WorkUnitPayloadReader.FORM));
        payload.put(WorkUnitPayloadReader.RESPONSE, workUnit.payload().get(WorkUnitPayloadReader.RESPONSE));
        payload.put("source", "completion_workflow");

        String id = delayedJobService.enqueue(EventType.INTEGRATION_TRIGGERED, payload);
        Span.current().addEvent("completion.integrations_queued");
        LOG.infof("Integration trigger queued for response %s: %s", response.id(), id);
        return StepOutcome.success(Map.of("work_unit_id", id));
    }

    private StepOutcome queueAiAnalysis(WorkUnit workUnit, FormSnapshotType form,
            FormResponseSnapshotType response) {
        if (!form.aiEnhanced() || !form.ownerCanUseAi()) {
            return StepOutcome.skipped("ai_disabled");
        }
        if (form.responsesCount() < AI_ANALYSIS_MIN_RESPONSES) {
            return StepOutcome.skipped("not_enough_responses");
        }

        boolean formAnalysis = formAnalyticsService.isFormAnalysisDue(form);
        if (formAnalysis) {
            formAnalyticsService.requestFormAnalysis(form);
        }

        List<String> queued = new ArrayList<>();
        for (AnswerSnapshotType answer : response.answersOrEmpty()) {
            if (!answer.aiEnhanced() || !answer.hasAnswer() || answer.questionResponseId() == null) {
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("question_response_id", answer.questionResponseId());
            payload.put(WorkUnitPayloadReader.FORM, workUnit.payload().get(WorkUnitPayloadReader.FORM));
            payload.put(WorkUnitPayloadReader.RESPONSE, workUnit.payload().get(WorkUnitPayloadReader.RESPONSE));
            queued.add(delayedJobService.enqueue(EventType.RESPONSE_ANALYZED, payload));
        }
        LOG.infof("Queued %d response analyses for response %s (form analysis requested: %s)", queued.size(),
                response.id(), formAnalysis);

        Map<String, Object> sideEffects = new LinkedHashMap<>();
        sideEffects.put("analyses_queued", queued.size());
        sideEffects.put("form_analysis_requested", formAnalysis);
        return StepOutcome.success(sideEffects);
    }

    private StepOutcome sendNotifications(FormSnapshotType form, FormResponseSnapshotType response) {
        if (!form.notifiesOnCompletion()) {
            return StepOutcome.skipped("notifications_disabled");
        }
        List<String> channels = completionNotificationService.sendCompletionNotifications(form, response);
        return StepOutcome.success(Map.of("channels", channels));
    }
}
