package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link RecordStore}. Values are copied on the way in and out.
 */
@ApplicationScoped
public class InMemoryRecordStore implements RecordStore {

    private final ConcurrentMap<String, Map<String, Object>> records = new ConcurrentHashMap<>();

    @Override
    public Map<String, Object> persist(String entityKey, UnaryOperator<Map<String, Object>> update) {
        Map<String, Object> stored = records.compute(entityKey, (key, existing) -> {
            Map<String, Object> working = existing == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existing);
            Map<String, Object> updated = update.apply(working);
            return Collections.unmodifiableMap(new LinkedHashMap<>(updated == null ? working : updated));
        });
        return new LinkedHashMap<>(stored);
    }

    @Override
    public Optional<Map<String, Object>> find(String entityKey) {
        return Optional.ofNullable(records.get(entityKey)).map(LinkedHashMap::new);
    }
}
