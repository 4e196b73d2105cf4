package villagecompute.agentform.integration.webhooks;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.IntegrationConfigType;
import villagecompute.agentform.data.models.IntegrationType;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.services.RecordValues;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Slack incoming-webhook message with one attachment summarising the response.
 */
@ApplicationScoped
public class SlackIntegrationHandler implements IntegrationHandler {

    private static final Logger LOG = Logger.getLogger(SlackIntegrationHandler.class);

    static final int MAX_ANSWER_FIELDS = 5;
    static final int MAX_ANSWER_LENGTH = 100;

    private static final DateTimeFormatter COMPLETED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    @Inject
    Clock clock;

    @Inject
    WebhookClient webhookClient;

    @Override
    public Set<IntegrationType> supportedTypes() {
        return Set.of(IntegrationType.SLACK);
    }

    @Override
    public Map<String, Object> deliver(IntegrationRequest request) throws Exception {
        IntegrationConfigType config = request.config();
        String url = config.resolvedUrl();
        if (url == null) {
            throw new ValidationException("Slack webhook URL not configured for integration " + request.name());
        }

        WebhookClient.Delivery delivery = webhookClient.postJson(url, buildPayload(request), Map.of(), null,
                config.timeoutSeconds());
        LOG.infof("Slack notification sent for response %s (channel: %s)", request.response().id(),
                config.channel());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("status_code", delivery.statusCode());
        result.put("delivered_at", clock.instant().toString());
        return result;
    }

    Map<String, Object> buildPayload(IntegrationRequest request) {
        String formName = request.form().name();
        String text = switch (request.triggerEvent()) {
            case "form_completed" -> "New form submission received for '" + formName + "'";
            case "form_abandoned" -> "Form '" + formName + "' was abandoned";
            case "response_updated" -> "Form response updated for '" + formName + "'";
            default -> "Form event '" + request.triggerEvent() + "' for '" + formName + "'";
        };

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color(request.response()));
        attachment.put("fields", fields(request.response()));
        attachment.put("footer", "AgentForm");
        attachment.put("ts", clock.instant().getEpochSecond());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", text);
        payload.put("attachments", List.of(attachment));
        IntegrationConfigType config = request.config();
        if (config.channel() != null && !config.channel().isBlank()) {
            payload.put("channel", config.channel());
        }
        if (config.username() != null && !config.username().isBlank()) {
            payload.put("username", config.username());
        }
        return payload;
    }

    static String color(FormResponseSnapshotType response) {
        if (response.isCompleted()) {
            return "#36a64f";
        }
        if (response.isInProgress()) {
            return "#ff9900";
        }
        if (response.isAbandoned()) {
            return "#ff0000";
        }
        return "#439fe0";
    }

    private static List<Map<String, Object>> fields(FormResponseSnapshotType response) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Response ID", response.id(), true));
        fields.add(field("Status", humanize(response.status()), true));
        response.completedAtInstant()
                .ifPresent(at -> fields.add(field("Completed At", COMPLETED_AT_FORMAT.format(at), true)));

        response.answersOrEmpty().stream().limit(MAX_ANSWER_FIELDS).filter(AnswerSnapshotType::hasAnswer)
                .forEach(answer -> fields.add(field(answer.questionTitle(), truncate(answer.answerText()), false)));

        if (response.hasAiAnalysis()) {
            Double sentiment = RecordValues.doubleOrNull(response.aiAnalysis().get("overall_sentiment"));
            if (sentiment != null) {
                fields.add(field("AI Sentiment", sentimentLabel(sentiment), true));
            }
        }
        return fields;
    }

    static String sentimentLabel(double sentiment) {
        if (sentiment <= 0.3) {
            return "Negative";
        }
        return sentiment <= 0.7 ? "Neutral" : "Positive";
    }

    static String truncate(String answer) {
        return answer.length() <= MAX_ANSWER_LENGTH ? answer : answer.substring(0, MAX_ANSWER_LENGTH - 2) + "...";
    }

    private static String humanize(String status) {
        if (status == null || status.isBlank()) {
            return "Unknown";
        }
        String words = status.replace('_', ' ').toLowerCase(Locale.ROOT);
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    private static Map<String, Object> field(String title, Object value, boolean isShort) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", isShort);
        return field;
    }
}
