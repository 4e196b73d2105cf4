package villagecompute.agentform.services;

import io.vertx.core.eventbus.EventBus;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Publishes status events on the Vert.x event bus, one address per channel key.
 */
@ApplicationScoped
public class EventBusStatusNotifier implements StatusNotifier {

    private static final Logger LOG = Logger.getLogger(EventBusStatusNotifier.class);

    @Inject
    EventBus eventBus;

    @Override
    public void notify(String channelKey, Map<String, Object> event) {
        try {
            eventBus.publish(channelKey, new JsonObject(event));
            LOG.debugf("Published %s to %s", event.get("type"), channelKey);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to publish status event to %s", channelKey);
        }
    }
}
