package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.IntegrationConfigType;
import villagecompute.agentform.data.models.IntegrationType;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.integration.webhooks.IntegrationHandler;
import villagecompute.agentform.integration.webhooks.IntegrationRequest;
import villagecompute.agentform.observability.ObservabilityMetrics;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static villagecompute.agentform.services.RecordValues.intValue;
import static villagecompute.agentform.services.RecordValues.listValue;
import static villagecompute.agentform.services.RecordValues.mapValue;

/**
 * Resolves a form's configured integrations to {@link IntegrationHandler}s and records delivery history.
 *
 * <p>
 * Handlers are registered by {@link IntegrationType} when the bean is created; two handlers claiming the same type
 * fail startup.
 */
@ApplicationScoped
public class IntegrationDispatchService {

    private static final Logger LOG = Logger.getLogger(IntegrationDispatchService.class);

    public static final Set<String> TRIGGER_EVENTS = Set.of("form_completed", "response_updated",
            "question_answered", "form_abandoned");

    static final int HISTORY_LIMIT = 10;

    @Inject
    Clock clock;

    @Inject
    RecordStore recordStore;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    private final Map<IntegrationType, IntegrationHandler> handlers = new EnumMap<>(IntegrationType.class);

    @Inject
    public IntegrationDispatchService(Instance<IntegrationHandler> handlers) {
        this((Iterable<IntegrationHandler>) handlers);
    }

    IntegrationDispatchService(Iterable<IntegrationHandler> handlers) {
        for (IntegrationHandler handler : handlers) {
            for (IntegrationType type : handler.supportedTypes()) {
                IntegrationHandler existing = this.handlers.putIfAbsent(type, handler);
                if (existing != null) {
                    throw new IllegalStateException("Duplicate integration handler for " + type + ": "
                            + existing.getClass().getName() + " and " + handler.getClass().getName());
                }
            }
        }
        LOG.debugf("Registered integration handlers for %s", this.handlers.keySet());
    }

    /**
     * @throws ValidationException
     *             if the form, owner, event or response state do not allow integrations to run
     */
    public void validatePrerequisites(FormSnapshotType form, FormResponseSnapshotType response, String triggerEvent) {
        if (!form.integrationsEnabled()) {
            throw new ValidationException("Form " + form.id() + " does not have integrations enabled");
        }
        if (!form.ownerCanUseIntegrations()) {
            throw new ValidationException("Owner of form " + form.id() + " does not have integration capabilities");
        }
        if (triggerEvent == null || !TRIGGER_EVENTS.contains(triggerEvent)) {
            throw new ValidationException("Invalid trigger event: " + triggerEvent);
        }
        if ("form_completed".equals(triggerEvent) && !response.isCompleted()) {
            throw new ValidationException("Form response " + response.id() + " is not completed");
        }
        if ("form_abandoned".equals(triggerEvent) && !response.isAbandoned()) {
            throw new ValidationException("Form response " + response.id() + " is not abandoned");
        }
    }

    /**
     * Enabled integrations that fire on {@code triggerEvent}, in configuration order.
     */
    public Map<String, IntegrationConfigType> eligibleIntegrations(FormSnapshotType form, String triggerEvent) {
        Map<String, IntegrationConfigType> eligible = new LinkedHashMap<>();
        form.integrationsOrEmpty().forEach((name, config) -> {
            if (config != null && config.enabled() && config.firesOn(triggerEvent)) {
                eligible.put(name, config);
            }
        });
        LOG.debugf("Form %s has %d integrations for %s: %s", form.id(), eligible.size(), triggerEvent,
                eligible.keySet());
        return eligible;
    }

    /**
     * Type named by {@code config.type}, else by the integration name.
     *
     * @throws ValidationException
     *             if neither names a supported type
     */
    public IntegrationType resolveType(String name, IntegrationConfigType config) {
        return IntegrationType.fromName(config.type()).or(() -> IntegrationType.fromName(name))
                .orElseThrow(() -> new ValidationException("Unknown integration type: " + name));
    }

    /**
     * Delivers one integration.
     *
     * @return handler result, e.g. {@code {success, status_code, delivered_at}}
     */
    public Map<String, Object> dispatch(String name, IntegrationConfigType config, FormSnapshotType form,
            FormResponseSnapshotType response, String triggerEvent) throws Exception {
        IntegrationType type = resolveType(name, config);
        IntegrationHandler handler = handlers.get(type);
        if (handler == null) {
            throw new ValidationException("No handler registered for integration type " + type.getWireName());
        }

        LOG.infof("Dispatching %s integration %s for response %s (%s)", type.getWireName(), name, response.id(),
                triggerEvent);
        try {
            Map<String, Object> result = handler.deliver(new IntegrationRequest(name, config, form, response,
                    triggerEvent));
            observabilityMetrics.incrementIntegrationDelivery(type.getWireName(), true);
            return result;
        } catch (Exception e) {
            observabilityMetrics.incrementIntegrationDelivery(type.getWireName(), false);
            throw e;
        }
    }

    /**
     * Folds one trigger's results into {@code form_response:<id>.integration_metadata}.
     *
     * @param results
     *            per integration name, the delivery result or {@code {success: false, error, error_type}}
     */
    public Map<String, Object> updateTracking(FormResponseSnapshotType response,
            Map<String, Map<String, Object>> results) {
        String now = clock.instant().toString();
        long successCount = results.values().stream().filter(r -> Boolean.TRUE.equals(r.get("success"))).count();

        Map<String, Object> lastResults = new LinkedHashMap<>();
        lastResults.put("processed_count", results.size());
        lastResults.put("success_count", successCount);
        lastResults.put("error_count", results.size() - successCount);

        Map<String, Object> updated = recordStore.persist(RecordKeys.formResponse(response.id()), record -> {
            Map<String, Object> metadata = mapValue(record.get("integration_metadata"));
            metadata.put("last_triggered_at", now);
            metadata.put("trigger_count", intValue(metadata.get("trigger_count"), 0) + 1);
            metadata.put("last_results", lastResults);

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timestamp", now);
            entry.put("results", new LinkedHashMap<>(results));
            List<Object> history = listValue(metadata.get("integration_history"));
            history.add(entry);
            metadata.put("integration_history",
                    new ArrayList<>(history.subList(Math.max(0, history.size() - HISTORY_LIMIT), history.size())));
            record.put("integration_metadata", metadata);
            return record;
        });

        Object triggerCount = mapValue(updated.get("integration_metadata")).get("trigger_count");
        LOG.infof("Integration tracking updated for response %s: trigger_count=%s", response.id(), triggerCount);
        Map<String, Object> sideEffects = new LinkedHashMap<>(lastResults);
        sideEffects.put("trigger_count", triggerCount);
        return sideEffects;
    }
}
