package villagecompute.agentform.integration.webhooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.AnswerSnapshotType;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.IntegrationConfigType;
import villagecompute.agentform.data.models.IntegrationType;
import villagecompute.agentform.exceptions.ValidationException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Contact sync to a CRM endpoint.
 *
 * <p>
 * {@code field_mapping} maps a source key to a CRM field name. A source key is either a question id (the answer text
 * is sent) or one of {@code response_id}, {@code form_id}, {@code form_name}, {@code completed_at},
 * {@code trigger_event}. The body is {@code {crm_type, record: {...}}}, authorized with {@code Bearer <api_key>}.
 */
@ApplicationScoped
public class CrmIntegrationHandler implements IntegrationHandler {

    private static final Logger LOG = Logger.getLogger(CrmIntegrationHandler.class);

    static final String DEFAULT_CRM_TYPE = "salesforce";

    @Inject
    Clock clock;

    @Inject
    WebhookClient webhookClient;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public Set<IntegrationType> supportedTypes() {
        return Set.of(IntegrationType.CRM);
    }

    @Override
    public Map<String, Object> deliver(IntegrationRequest request) throws Exception {
        IntegrationConfigType config = request.config();
        String url = config.resolvedUrl();
        if (url == null) {
            throw new ValidationException("CRM endpoint not configured for integration " + request.name());
        }
        if (config.fieldMapping() == null || config.fieldMapping().isEmpty()) {
            throw new ValidationException("CRM integration " + request.name() + " has no field_mapping");
        }

        String crmType = crmType(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("crm_type", crmType);
        body.put("record", mapFields(request));

        Map<String, String> headers = new LinkedHashMap<>(config.headersOrEmpty());
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            headers.put("Authorization", "Bearer " + config.apiKey());
        }

        WebhookClient.Delivery delivery = webhookClient.postJson(url, body, headers, config.secret(),
                config.timeoutSeconds());
        String recordId = recordId(delivery.responseBody());
        LOG.infof("CRM sync completed for response %s: crm_type=%s record_id=%s", request.response().id(), crmType,
                recordId);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("crm_type", crmType);
        result.put("status_code", delivery.statusCode());
        if (recordId != null) {
            result.put("record_id", recordId);
        }
        result.put("synced_at", clock.instant().toString());
        return result;
    }

    /**
     * Configured {@code type} when it names a CRM, otherwise the integration name, otherwise Salesforce.
     */
    static String crmType(IntegrationRequest request) {
        String type = request.config().type();
        if (type != null && !type.isBlank() && !"crm".equalsIgnoreCase(type.trim())) {
            return type.trim().toLowerCase(Locale.ROOT);
        }
        String name = request.name().trim().toLowerCase(Locale.ROOT);
        return "crm".equals(name) ? DEFAULT_CRM_TYPE : name;
    }

    Map<String, Object> mapFields(IntegrationRequest request) {
        FormResponseSnapshotType response = request.response();
        Map<String, Object> record = new LinkedHashMap<>();
        request.config().fieldMapping().forEach((source, target) -> {
            Object value = switch (source) {
                case "response_id" -> response.id();
                case "form_id" -> request.form().id();
                case "form_name" -> request.form().name();
                case "completed_at" -> response.completedAt();
                case "trigger_event" -> request.triggerEvent();
                default -> response.answerFor(source).filter(AnswerSnapshotType::hasAnswer)
                        .map(AnswerSnapshotType::answerText).orElse(null);
            };
            if (value != null) {
                record.put(target, value);
            }
        });
        return record;
    }

    private String recordId(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            JsonNode id = node.hasNonNull("id") ? node.get("id") : node.get("record_id");
            return id == null || id.isNull() ? null : id.asText();
        } catch (JsonProcessingException e) {
            LOG.debugf("CRM response body is not JSON: %s", e.getOriginalMessage());
            return null;
        }
    }
}
