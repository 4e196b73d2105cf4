package villagecompute.agentform.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.data.models.WorkUnit;
import villagecompute.agentform.exceptions.ResourceNotFoundException;
import villagecompute.agentform.exceptions.ValidationException;

/**
 * Reads typed snapshots out of a work unit's opaque payload.
 *
 * <p>
 * A missing snapshot is {@link ResourceNotFoundException} (the record may not be visible yet); a snapshot that does
 * not map onto its type is {@link ValidationException}.
 */
@ApplicationScoped
public class WorkUnitPayloadReader {

    public static final String FORM = "form";
    public static final String RESPONSE = "response";

    @Inject
    ObjectMapper objectMapper;

    public FormSnapshotType form(WorkUnit workUnit) {
        return snapshot(workUnit, FORM, FormSnapshotType.class);
    }

    public FormResponseSnapshotType response(WorkUnit workUnit) {
        return snapshot(workUnit, RESPONSE, FormResponseSnapshotType.class);
    }

    public String requiredString(WorkUnit workUnit, String key) {
        Object value = workUnit.payload().get(key);
        if (value == null || value.toString().isBlank()) {
            throw new ValidationException("Payload of " + workUnit.id() + " is missing " + key);
        }
        return value.toString();
    }

    public String optionalString(WorkUnit workUnit, String key, String defaultValue) {
        Object value = workUnit.payload().get(key);
        return value == null ? defaultValue : value.toString();
    }

    private <T> T snapshot(WorkUnit workUnit, String key, Class<T> type) {
        Object raw = workUnit.payload().get(key);
        if (raw == null) {
            throw new ResourceNotFoundException(
                    "No " + key + " found for work unit " + workUnit.id() + " (" + workUnit.eventType().getWireName()
                            + ")");
        }
        try {
            return objectMapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed " + key + " snapshot for work unit " + workUnit.id(), e);
        }
    }
}
