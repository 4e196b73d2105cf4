package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Per-form configuration of one integration, keyed by integration name in {@link FormSnapshotType#integrations()}.
 *
 * @param url
 *            target URL ({@code webhook_url} is accepted as an alias)
 * @param secret
 *            HMAC secret; when present the body is signed
 * @param triggerEvents
 *            events that fire this integration; {@code null} means {@code [form_completed]}
 * @param fieldMapping
 *            CRM only: CRM field name to answer question id (or a response attribute)
 * @param timeoutSeconds
 *            per-request timeout; {@code null} uses {@code orchestrator.integrations.http-timeout-seconds}
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record IntegrationConfigType(@JsonProperty("enabled") boolean enabled,

        @JsonProperty("type") String type,

        @JsonProperty("url") String url,

        @JsonProperty("webhook_url") String webhookUrl,

        @JsonProperty("secret") String secret,

        @JsonProperty("headers") Map<String, String> headers,

        @JsonProperty("trigger_events") List<String> triggerEvents,

        @JsonProperty("channel") String channel,

        @JsonProperty("username") String username,

        @JsonProperty("api_key") String apiKey,

        @JsonProperty("field_mapping") Map<String, String> fieldMapping,

        @JsonProperty("timeout_seconds") Integer timeoutSeconds) {

    public static final String DEFAULT_TRIGGER_EVENT = "form_completed";

    public String resolvedUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return webhookUrl != null && !webhookUrl.isBlank() ? webhookUrl : null;
    }

    public List<String> triggerEventsOrDefault() {
        return triggerEvents != null ? triggerEvents : List.of(DEFAULT_TRIGGER_EVENT);
    }

    public boolean firesOn(String triggerEvent) {
        return enabled && triggerEventsOrDefault().contains(triggerEvent);
    }

    public Map<String, String> headersOrEmpty() {
        return headers != null ? headers : Map.of();
    }
}
