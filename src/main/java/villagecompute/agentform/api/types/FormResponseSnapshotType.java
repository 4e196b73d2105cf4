package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.agentform.exceptions.ValidationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Form response captured when the work unit was enqueued. Timestamps are ISO-8601 strings.
 *
 * @param status
 *            {@code in_progress}, {@code completed} or {@code abandoned}
 * @param aiAnalysis
 *            response-level analysis (overall_sentiment, overall_quality, key_insights), if any
 * @param dynamicQuestions
 *            follow-up questions generated before this work unit was enqueued
 * @param metadata
 *            client metadata (user agent, IP address, referrer)
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FormResponseSnapshotType(@JsonProperty("id") String id,

        @JsonProperty("form_id") String formId,

        @JsonProperty("status") String status,

        @JsonProperty("created_at") String createdAt,

        @JsonProperty("started_at") String startedAt,

        @JsonProperty("completed_at") String completedAt,

        @JsonProperty("progress_percentage") Integer progressPercentage,

        @JsonProperty("answers") List<AnswerSnapshotType> answers,

        @JsonProperty("ai_analysis") Map<String, Object> aiAnalysis,

        @JsonProperty("dynamic_questions") List<DynamicQuestionSnapshotType> dynamicQuestions,

        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_IN_PROGRESS = "in_progress";
    public static final String STATUS_ABANDONED = "abandoned";

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    public boolean isAbandoned() {
        return STATUS_ABANDONED.equals(status);
    }

    public boolean isInProgress() {
        return STATUS_IN_PROGRESS.equals(status);
    }

    public Optional<Instant> completedAtInstant() {
        return parse(completedAt);
    }

    public Optional<Instant> startedAtInstant() {
        return parse(startedAt);
    }

    public List<AnswerSnapshotType> answersOrEmpty() {
        return answers != null ? answers : List.of();
    }

    public List<DynamicQuestionSnapshotType> dynamicQuestionsOrEmpty() {
        return dynamicQuestions != null ? dynamicQuestions : List.of();
    }

    public Optional<AnswerSnapshotType> answerFor(String questionId) {
        return answersOrEmpty().stream().filter(a -> questionId.equals(a.questionId())).findFirst();
    }

    public Optional<AnswerSnapshotType> answerById(String questionResponseId) {
        return answersOrEmpty().stream().filter(a -> questionResponseId.equals(a.questionResponseId())).findFirst();
    }

    public boolean hasAiAnalysis() {
        return aiAnalysis != null && !aiAnalysis.isEmpty();
    }

    private static Optional<Instant> parse(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(timestamp));
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid timestamp: " + timestamp, e);
        }
    }
}
