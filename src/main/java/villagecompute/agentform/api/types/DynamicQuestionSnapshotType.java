package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A follow-up question generated for a form response.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record DynamicQuestionSnapshotType(@JsonProperty("id") String id,

        @JsonProperty("title") String title,

        @JsonProperty("source_question_id") String sourceQuestionId) {
}
