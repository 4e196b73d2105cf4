package villagecompute.agentform.integration.webhooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.agentform.exceptions.ExternalApiException;
import villagecompute.agentform.exceptions.ValidationException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON POST client shared by the outbound integrations.
 *
 * <p>
 * <b>Status handling:</b> 2xx is success. Any other status raises {@link ExternalApiException} carrying the status
 * code, which the error classifier maps to {@code rate_limited} (429), {@code validation} (other 4xx) or
 * {@code external_api_error} (5xx). A request that exceeds its timeout raises
 * {@link java.net.http.HttpTimeoutException} ({@code timeout}).
 */
@ApplicationScoped
public class WebhookClient {

    private static final Logger LOG = Logger.getLogger(WebhookClient.class);

    public static final String USER_AGENT = "AgentForm/1.0";

    private static final int MAX_LOGGED_BODY = 200;

    @ConfigProperty(
            name = "orchestrator.integrations.http-timeout-seconds",
            defaultValue = "30")
    int defaultTimeoutSeconds = 30;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Inject
    public WebhookClient(ObjectMapper objectMapper) {
        this(objectMapper, HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10)).build());
    }

    WebhookClient(ObjectMapper objectMapper, HttpClient httpClient) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    /**
     * Outcome of a 2xx delivery.
     */
    public record Delivery(int statusCode, String responseBody) {
    }

    /**
     * Serializes {@code payload} and posts it to {@code url}.
     *
     * @param headers
     *            extra headers; {@code Content-Type} and {@code User-Agent} are always set
     * @param secret
     *            when not blank, the body is signed into {@value WebhookSigner#SIGNATURE_HEADER}
     * @param timeoutSeconds
     *            request timeout; null uses {@code orchestrator.integrations.http-timeout-seconds}
     * @throws ExternalApiException
     *             on a non-2xx status
     * @throws IOException
     *             on connection failures and timeouts
     */
    public Delivery postJson(String url, Object payload, Map<String, String> headers, String secret,
            Integer timeoutSeconds) throws IOException, InterruptedException {
        URI uri = parseUrl(url);
        String body = serialize(payload);

        Map<String, String> allHeaders = new LinkedHashMap<>();
        allHeaders.put("Content-Type", "application/json");
        allHeaders.put("User-Agent", USER_AGENT);
        if (headers != null) {
            allHeaders.putAll(headers);
        }
        if (secret != null && !secret.isBlank()) {
            allHeaders.put(WebhookSigner.SIGNATURE_HEADER, WebhookSigner.sign(secret, body));
        }

        int timeout = timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : defaultTimeoutSeconds;
        HttpRequest.Builder request = HttpRequest.newBuilder().uri(uri).timeout(Duration.ofSeconds(timeout))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        allHeaders.forEach(request::header);

        LOG.debugf("POST %s (%d bytes, timeout %ds)", uri.getHost(), body.length(), timeout);
        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());

        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new ExternalApiException("HTTP " + status + " from " + uri.getHost() + ": "
                    + truncate(response.body()), status);
        }
        LOG.debugf("Delivered to %s: status=%d body=%s", uri.getHost(), status, truncate(response.body()));
        return new Delivery(status, response.body());
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Integration payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static URI parseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Integration URL not configured");
        }
        try {
            URI uri = URI.create(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ValidationException("Integration URL is not absolute: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid integration URL: " + url, e);
        }
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
