package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Map;

/**
 * One answer (question response) inside a form response.
 *
 * @param answer
 *            raw answer data: text, a choice, a list of choices or a number
 * @param aiAnalysis
 *            per-answer analysis results, if any
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record AnswerSnapshotType(@JsonProperty("question_response_id") String questionResponseId,

        @JsonProperty("question_id") String questionId,

        @JsonProperty("question_title") String questionTitle,

        @JsonProperty("question_type") String questionType,

        @JsonProperty("answer") Object answer,

        @JsonProperty("answered_at") String answeredAt,

        @JsonProperty("ai_enhanced") boolean aiEnhanced,

        @JsonProperty("ai_analysis") Map<String, Object> aiAnalysis) {

    /**
     * Whether the answer carries data (non-null, non-blank, non-empty).
     */
    public boolean hasAnswer() {
        if (answer == null) {
            return false;
        }
        if (answer instanceof String text) {
            return !text.isBlank();
        }
        if (answer instanceof Collection<?> values) {
            return !values.isEmpty();
        }
        if (answer instanceof Map<?, ?> values) {
            return !values.isEmpty();
        }
        return true;
    }

    /**
     * Answer rendered as text (empty string when absent).
     */
    public String answerText() {
        return answer == null ? "" : answer.toString();
    }
}
