package villagecompute.agentform.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload fixtures and a {@link WorkUnitPayloadReader} wired outside CDI.
 */
public final class PayloadFixtures {

    private PayloadFixtures() {
    }

    public static WorkUnitPayloadReader reader() {
        WorkUnitPayloadReader reader = new WorkUnitPayloadReader();
        reader.objectMapper = new ObjectMapper();
        return reader;
    }

    /**
     * Payload carrying both snapshots plus {@code extra} keys, in insertion order.
     */
    public static Map<String, Object> payload(FormSnapshotType form, FormResponseSnapshotType response,
            Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>(extra);
        payload.put(WorkUnitPayloadReader.FORM, form);
        payload.put(WorkUnitPayloadReader.RESPONSE, response);
        return payload;
    }
}
