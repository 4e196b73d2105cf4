package villagecompute.agentform.integration.webhooks;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;
import villagecompute.agentform.api.types.IntegrationConfigType;
import villagecompute.agentform.api.types.WebhookPayloadType;
import villagecompute.agentform.data.models.IntegrationType;
import villagecompute.agentform.exceptions.ValidationException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Signed JSON webhook delivery, also used for Zapier catch hooks.
 *
 * <p>
 * Headers: {@code Content-Type}, {@code User-Agent: AgentForm/1.0}, {@code X-AgentForm-Event},
 * {@code X-AgentForm-Form-Id}, {@code X-AgentForm-Response-Id}, any configured custom headers, and
 * {@code X-Signature} when a secret is configured.
 */
@ApplicationScoped
public class WebhookIntegrationHandler implements IntegrationHandler {

    private static final Logger LOG = Logger.getLogger(WebhookIntegrationHandler.class);

    @Inject
    Clock clock;

    @Inject
    WebhookClient webhookClient;

    @Override
    public Set<IntegrationType> supportedTypes() {
        return Set.of(IntegrationType.WEBHOOK, IntegrationType.ZAPIER);
    }

    @Override
    public Map<String, Object> deliver(IntegrationRequest request) throws Exception {
        IntegrationConfigType config = request.config();
        String url = config.resolvedUrl();
        if (url == null) {
            throw new ValidationException("Webhook URL not configured for integration " + request.name());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-AgentForm-Event", request.triggerEvent());
        headers.put("X-AgentForm-Form-Id", request.form().id());
        headers.put("X-AgentForm-Response-Id", request.response().id());
        headers.putAll(config.headersOrEmpty());

        WebhookClient.Delivery delivery = webhookClient.postJson(url, buildPayload(request), headers, config.secret(),
                config.timeoutSeconds());
        LOG.infof("Webhook %s delivered for response %s: status=%d", request.name(), request.response().id(),
                delivery.statusCode());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("status_code", delivery.statusCode());
        result.put("delivered_at", clock.instant().toString());
        return result;
    }

    WebhookPayloadType buildPayload(IntegrationRequest request) {
        FormSnapshotType form = request.form();
        FormResponseSnapshotType response = request.response();

        Map<String, Object> formPart = new LinkedHashMap<>();
        formPart.put("id", form.id());
        formPart.put("name", form.name());
        formPart.put("description", form.description());

        Map<String, Object> responsePart = new LinkedHashMap<>();
        responsePart.put("id", response.id());
        responsePart.put("submitted_at", response.createdAt());
        responsePart.put("completed_at", response.completedAt());
        responsePart.put("status", response.status());
        responsePart.put("progress_percentage", response.progressPercentage());

        Map<String, Object> answers = new LinkedHashMap<>();
        for (AnswerSnapshotType answer : response.answersOrEmpty()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("question_id", answer.questionId());
            entry.put("question_title", answer.questionTitle());
            entry.put("question_type", answer.questionType());
            entry.put("answer", answer.answer());
            entry.put("answered_at", answer.answeredAt());
            if (answer.aiAnalysis() != null && !answer.aiAnalysis().isEmpty()) {
                Map<String, Object> analysis = new LinkedHashMap<>();
                analysis.put("sentiment", answer.aiAnalysis().get("sentiment"));
                analysis.put("quality", answer.aiAnalysis().get("quality"));
                analysis.put("confidence_score", answer.aiAnalysis().get("confidence_score"));
                entry.put("ai_analysis", analysis);
            }
            answers.put(answer.questionId(), entry);
        }

        Map<String, Object> aiAnalysis = null;
        if (response.hasAiAnalysis()) {
            aiAnalysis = new LinkedHashMap<>();
            aiAnalysis.put("overall_sentiment", response.aiAnalysis().get("overall_sentiment"));
            aiAnalysis.put("overall_quality", response.aiAnalysis().get("overall_quality"));
            aiAnalysis.put("key_insights", response.aiAnalysis().get("key_insights"));
        }

        Map<String, Object> metadata = response.metadata() != null ? response.metadata() : Map.of();
        return new WebhookPayloadType(request.triggerEvent(), clock.instant().toString(), formPart, responsePart,
                answers, metadata, aiAnalysis);
    }
}
