package villagecompute.agentform.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.IntegrationConfigType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.services.IntegrationDispatchService;
import villagecompute.agentform.services.WorkUnitPayloadReader;
import villagecompute.agentform.workflow.BackoffStrategy;
import villagecompute.agentform.workflow.ClassifiedError;
import villagecompute.agentform.workflow.ErrorCategory;
import villagecompute.agentform.workflow.ErrorClassifier;
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
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers a form event to the form's integrations ({@code integration_triggered}).
 *
 * <p>
 * Each eligible integration runs as an optional step {@code integration:<name>} with inline retries, so one failing
 * endpoint leaves the run {@code partial} without blocking the others. {@code update_integration_tracking} then
 * records the outcome of every integration on the response.
 */
@ApplicationScoped
public class IntegrationTriggerJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(IntegrationTriggerJobHandler.class);

    static final String STEP_PREFIX = "integration:";

    /**
     * Delivery errors stay inside the optional integration steps, so the outer policy only sees failures raised
     * before the steps run.
     */
    private static final RetryPolicy RETRY_POLICY = RetryPolicy.builder().maxAttempts(3)
            .backoff(BackoffStrategy.POLYNOMIAL).fatal(ErrorCategory.VALIDATION, ErrorCategory.NOT_FOUND).build();

    static final RetryPolicy DELIVERY_RETRY_POLICY = RetryPolicy.builder().maxAttempts(3)
            .baseDelay(Duration.ofSeconds(2)).backoff(BackoffStrategy.EXPONENTIAL)
            .retryOn(ErrorCategory.TIMEOUT, ErrorCategory.EXTERNAL_API_ERROR).build();

    @Inject
    WorkflowOrchestrator workflowOrchestrator;

    @Inject
    WorkUnitPayloadReader payloadReader;

    @Inject
    IntegrationDispatchService integrationDispatchService;

    @Override
    public JobType handlesType() {
        return JobType.INTEGRATION_TRIGGER;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return RETRY_POLICY;
    }

    @Override
    public RunRecord execute(WorkUnit workUnit, int attemptNumber) {
        String triggerEvent = payloadReader.requiredString(workUnit, "trigger_event");
        FormSnapshotType form = payloadReader.form(workUnit);
        FormResponseSnapshotType response = payloadReader.response(workUnit);
        integrationDispatchService.validatePrerequisites(form, response, triggerEvent);

        Map<String, IntegrationConfigType> eligible = integrationDispatchService.eligibleIntegrations(form,
                triggerEvent);
        if (eligible.isEmpty()) {
            LOG.infof("No integrations enabled for %s on form %s", triggerEvent, form.id());
        }

        Map<String, Map<String, Object>> results = new ConcurrentHashMap<>();
        List<StepDefinition> steps = new ArrayList<>();
        eligible.forEach((name, config) -> steps.add(StepDefinition.optional(STEP_PREFIX + name, () -> {
            try {
                Map<String, Object> result = integrationDispatchService.dispatch(name, config, form, response,
                        triggerEvent);
                results.put(name, result);
                return StepOutcome.success(result);
            } catch (Exception e) {
                results.put(name, failure(e));
                throw e;
            }
        }).withRetry(DELIVERY_RETRY_POLICY)));

        steps.add(StepDefinition.optional("update_integration_tracking", () -> {
            if (results.isEmpty()) {
                return StepOutcome.skipped("no_integrations");
            }
            Map<String, Map<String, Object>> ordered = new LinkedHashMap<>();
            eligible.keySet().stream().filter(results::containsKey).forEach(name -> ordered.put(name,
                    results.get(name)));
            return StepOutcome.success(integrationDispatchService.updateTracking(response, ordered));
        }));

        return workflowOrchestrator.runWorkflow(workUnit, attemptNumber, steps);
    }

    private static Map<String, Object> failure(Exception e) {
        ClassifiedError error = ErrorClassifier.classify(e);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", error.message());
        result.put("error_type", error.category().getWireName());
        return result;
    }
}
