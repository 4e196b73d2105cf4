package villagecompute.agentform.integration.webhooks;

import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.IntegrationConfigType;

import java.util.Objects;

/**
 * One integration delivery for a form event.
 *
 * @param name
 *            integration name as configured on the form
 * @param triggerEvent
 *            {@code form_completed}, {@code response_updated}, {@code question_answered} or {@code form_abandoned}
 */
public record IntegrationRequest(String name, IntegrationConfigType config, FormSnapshotType form,
        FormResponseSnapshotType response, String triggerEvent) {

    public IntegrationRequest {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(form, "form is required");
        Objects.requireNonNull(response, "response is required");
        Objects.requireNonNull(triggerEvent, "triggerEvent is required");
    }
}
