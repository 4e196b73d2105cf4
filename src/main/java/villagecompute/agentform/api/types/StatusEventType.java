package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.agentform.workflow.ClassifiedError;
import villagecompute.agentform.workflow.RunRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status event pushed to UI subscribers on channel {@code work_unit:<id>}.
 *
 * <p>
 * Shape is stable: {@code {type: "completed"|"failed", workUnitId, ...}}. Failures expose only {@code errorType} (the
 * error category) and {@code message}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusEventType(@JsonProperty("type") String type,

        @JsonProperty("workUnitId") String workUnitId,

        @JsonProperty("eventType") String eventType,

        @JsonProperty("attemptNumber") Integer attemptNumber,

        @JsonProperty("overallStatus") String overallStatus,

        @JsonProperty("errorType") String errorType,

        @JsonProperty("message") String message,

        @JsonProperty("occurredAt") String occurredAt) {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    public static StatusEventType completed(RunRecord run, Instant now) {
        return new StatusEventType(COMPLETED, run.workUnitId(), run.eventType().getWireName(), run.attemptNumber(),
                run.overallStatus().getWireName(), null, null, now.toString());
    }

    public static StatusEventType failed(RunRecord run, ClassifiedError error, Instant now) {
        return new StatusEventType(FAILED, run.workUnitId(), run.eventType().getWireName(), run.attemptNumber(),
                run.overallStatus().getWireName(), error.category().getWireName(), error.message(), now.toString());
    }

    /**
     * Event as a map for the notifier; null fields are omitted.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type);
        event.put("workUnitId", workUnitId);
        putIfPresent(event, "eventType", eventType);
        putIfPresent(event, "attemptNumber", attemptNumber);
        putIfPresent(event, "overallStatus", overallStatus);
        putIfPresent(event, "errorType", errorType);
        putIfPresent(event, "message", message);
        putIfPresent(event, "occurredAt", occurredAt);
        return event;
    }

    private static void putIfPresent(Map<String, Object> event, String key, Object value) {
        if (value != null) {
            event.put(key, value);
        }
    }
}
