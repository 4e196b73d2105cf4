package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * JSON body of webhook and Zapier deliveries.
 *
 * @param answers
 *            question id to answer details, in answer order
 * @param aiAnalysis
 *            response-level analysis summary, omitted when the response has none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookPayloadType(@JsonProperty("event") String event,

        @JsonProperty("timestamp") String timestamp,

        @JsonProperty("form") Map<String, Object> form,

        @JsonProperty("response") Map<String, Object> response,

        @JsonProperty("answers") Map<String, Object> answers,

        @JsonProperty("metadata") Map<String, Object> metadata,

        @JsonProperty("ai_analysis") Map<String, Object> aiAnalysis) {
}
