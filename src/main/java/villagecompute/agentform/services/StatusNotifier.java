package villagecompute.agentform.services;

import java.util.Map;

/**
 * Fire-and-forget status events for UI subscribers. Delivery failures are logged and never fail the caller.
 */
public interface StatusNotifier {

    void notify(String channelKey, Map<String, Object> event);
}
