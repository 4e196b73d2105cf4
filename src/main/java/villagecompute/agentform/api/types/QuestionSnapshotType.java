package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Form question as seen by the workflows.
 *
 * @param maxFollowups
 *            per-question follow-up cap; {@code null} uses the default of 2
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record QuestionSnapshotType(@JsonProperty("id") String id,

        @JsonProperty("form_id") String formId,

        @JsonProperty("title") String title,

        @JsonProperty("question_type") String questionType,

        @JsonProperty("ai_enhanced") boolean aiEnhanced,

        @JsonProperty("generates_followups") boolean generatesFollowups,

        @JsonProperty("max_followups") Integer maxFollowups) {

    public static final int DEFAULT_MAX_FOLLOWUPS = 2;

    public int maxFollowupsOrDefault() {
        return maxFollowups != null ? maxFollowups : DEFAULT_MAX_FOLLOWUPS;
    }
}
