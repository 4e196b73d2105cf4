package villagecompute.agentform.data.models;

import villagecompute.agentform.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Upstream domain events that create a {@link WorkUnit}.
 *
 * <p>
 * Each event names the payload keys that identify its subject. The work unit id is built from those keys so that a
 * retry, or a second enqueue of the same event, lands on the same id.
 */
public enum EventType {

    /** A respondent finished a form; runs the completion workflow. */
    FORM_COMPLETED("form_completed", "form_response_id"),

    /** A question response needs AI analysis. */
    RESPONSE_ANALYZED("response_analyzed", "question_response_id"),

    /** A follow-up question should be generated from a source question's answer. */
    DYNAMIC_QUESTION_REQUESTED("dynamic_question_requested", "form_response_id", "source_question_id"),

    /** Integration fan-out for a form event (completion, abandonment, update). */
    INTEGRATION_TRIGGERED("integration_triggered", "form_response_id", "trigger_event");

    private final String wireName;
    private final List<String> subjectKeys;

    EventType(String wireName, String... subjectKeys) {
        this.wireName = wireName;
        this.subjectKeys = List.of(subjectKeys);
    }

    public String getWireName() {
        return wireName;
    }

    public List<String> getSubjectKeys() {
        return subjectKeys;
    }

    /**
     * Builds the work unit id from the payload's subject keys, joined with {@code ':'}.
     *
     * @throws ValidationException
     *             if any subject key is missing or blank
     */
    public String workUnitIdFrom(Map<String, Object> payload) {
        if (payload == null) {
            throw new ValidationException("Payload is required for " + wireName);
        }
        List<String> parts = new ArrayList<>(subjectKeys.size());
        for (String key : subjectKeys) {
            Object value = payload.get(key);
            if (value == null || value.toString().isBlank()) {
                throw new ValidationException("Payload for " + wireName + " is missing required key: " + key);
            }
            parts.add(value.toString());
        }
        return String.join(":", parts);
    }

    public static EventType fromWireName(String wireName) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst()
                .orElseThrow(() -> new ValidationException("Unknown event type: " + wireName));
    }
}
