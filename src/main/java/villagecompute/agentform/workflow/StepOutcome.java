package villagecompute.agentform.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value returned by a step body. Failures are signalled by throwing; the runner turns the exception into a
 * {@link StepResult}.
 *
 * @param skipped
 *            true when the step decided there was nothing to do
 * @param reason
 *            why the step was skipped (null on success)
 * @param sideEffects
 *            structured data about what the step did (counts, ids)
 */
public record StepOutcome(boolean skipped, String reason, Map<String, Object> sideEffects) {

    public StepOutcome {
        sideEffects = sideEffects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sideEffects));
    }

    public static StepOutcome success() {
        return new StepOutcome(false, null, Map.of());
    }

    public static StepOutcome success(Map<String, Object> sideEffects) {
        return new StepOutcome(false, null, sideEffects);
    }

    public static StepOutcome skipped(String reason) {
        return new StepOutcome(true, reason, Map.of("reason", reason));
    }
}
