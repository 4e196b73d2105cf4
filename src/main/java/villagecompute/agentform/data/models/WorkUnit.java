package villagecompute.agentform.data.models;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One orchestration invocation: an upstream event plus the opaque payload it carried.
 *
 * <p>
 * Immutable once created. Retries reuse the same work unit; each attempt produces its own {@code RunRecord}.
 *
 * @param id
 *            subject key derived from the payload (see {@link EventType#workUnitIdFrom(Map)})
 * @param eventType
 *            the triggering event
 * @param payload
 *            opaque key-value data supplied by the enqueuing layer
 * @param enqueuedAt
 *            time of the original enqueue
 */
public record WorkUnit(String id, EventType eventType, Map<String, Object> payload, Instant enqueuedAt) {

    public WorkUnit {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(eventType, "eventType is required");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt is required");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static WorkUnit of(EventType eventType, Map<String, Object> payload, Instant enqueuedAt) {
        return new WorkUnit(eventType.workUnitIdFrom(payload), eventType, payload, enqueuedAt);
    }

    /**
     * Channel key used for status events about this work unit.
     */
    public String channelKey() {
        return "work_unit:" + id;
    }
}
