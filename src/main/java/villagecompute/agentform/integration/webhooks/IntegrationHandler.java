package villagecompute.agentform.integration.webhooks;

import villagecompute.agentform.data.models.IntegrationType;

import java.util.Map;
import java.util.Set;

/**
 * Delivers a form event to one kind of third-party integration.
 *
 * <p>
 * Handlers are CDI beans; the dispatch service builds an {@link IntegrationType} to handler registry from them at
 * startup. A failed delivery is signalled by throwing, so the calling step records it and applies its inline retry
 * policy.
 */
public interface IntegrationHandler {

    /**
     * Integration types this handler delivers.
     */
    Set<IntegrationType> supportedTypes();

    /**
     * Performs the delivery.
     *
     * @return delivery details recorded as the step's side effects (status code, timestamps, remote ids)
     * @throws villagecompute.agentform.exceptions.ValidationException
     *             if the configuration is unusable (no URL, unsupported provider)
     * @throws Exception
     *             delivery failures (HTTP status, timeout)
     */
    Map<String, Object> deliver(IntegrationRequest request) throws Exception;
}
