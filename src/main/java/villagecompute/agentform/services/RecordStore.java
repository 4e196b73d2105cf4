package villagecompute.agentform.services;

import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Key-value persistence for the records workflow steps update (form analytics, response analyses, integration
 * tracking, job failure details).
 *
 * <p>
 * Implementations must apply {@link #persist} atomically per entity key so concurrent steps never lose updates.
 */
public interface RecordStore {

    /**
     * Applies {@code update} to the current value of {@code entityKey} (an empty map if absent) and stores the
     * result.
     *
     * @return the stored value
     */
    Map<String, Object> persist(String entityKey, UnaryOperator<Map<String, Object>> update);

    Optional<Map<String, Object>> find(String entityKey);
}
