package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Form state captured when the work unit was enqueued.
 *
 * @param responsesCount
 *            total responses including this one
 * @param completionCount
 *            completions before this one
 * @param maxDynamicQuestions
 *            per-response cap on generated questions; {@code null} uses the default of 3
 * @param aiRateLimitPerMinute
 *            per-form AI call limit; {@code null} uses the tenant default
 * @param completionNotifications
 *            {@code enabled}, {@code email_enabled}, {@code slack_enabled}, {@code webhook_enabled} and their targets
 * @param integrations
 *            integration name to configuration, in declaration order
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FormSnapshotType(@JsonProperty("id") String id,

        @JsonProperty("name") String name,

        @JsonProperty("description") String description,

        @JsonProperty("ai_enhanced") boolean aiEnhanced,

        @JsonProperty("integrations_enabled") boolean integrationsEnabled,

        @JsonProperty("responses_count") int responsesCount,

        @JsonProperty("completion_count") int completionCount,

        @JsonProperty("max_dynamic_questions") Integer maxDynamicQuestions,

        @JsonProperty("ai_rate_limit_per_minute") Integer aiRateLimitPerMinute,

        @JsonProperty("completion_notifications") Map<String, Object> completionNotifications,

        @JsonProperty("integrations") LinkedHashMap<String, IntegrationConfigType> integrations,

        @JsonProperty("questions") List<QuestionSnapshotType> questions,

        @JsonProperty("owner") OwnerSnapshotType owner) {

    public static final int DEFAULT_MAX_DYNAMIC_QUESTIONS = 3;

    public int maxDynamicQuestionsOrDefault() {
        return maxDynamicQuestions != null ? maxDynamicQuestions : DEFAULT_MAX_DYNAMIC_QUESTIONS;
    }

    public Optional<QuestionSnapshotType> question(String questionId) {
        if (questions == null) {
            return Optional.empty();
        }
        return questions.stream().filter(q -> q.id().equals(questionId)).findFirst();
    }

    public List<QuestionSnapshotType> questionsOrEmpty() {
        return questions != null ? questions : List.of();
    }

    public Map<String, IntegrationConfigType> integrationsOrEmpty() {
        return integrations != null ? integrations : Map.of();
    }

    public boolean ownerCanUseAi() {
        return owner != null && owner.canUseAi();
    }

    public boolean ownerCanUseIntegrations() {
        return owner != null && owner.canUseIntegrations();
    }

    /**
     * Whether completion notifications are switched on.
     */
    public boolean notifiesOnCompletion() {
        return completionNotifications != null && Boolean.TRUE.equals(completionNotifications.get("enabled"));
    }
}
