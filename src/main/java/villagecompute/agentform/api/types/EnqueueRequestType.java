package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Map;

/**
 * Admin request to enqueue a work unit.
 *
 * @param eventType
 *            wire name, e.g. {@code form_completed}
 * @param delaySeconds
 *            optional initial delay
 */
public record EnqueueRequestType(@JsonProperty("event_type") @NotBlank String eventType,

        @JsonProperty("payload") @NotNull Map<String, Object> payload,

        @JsonProperty("delay_seconds") @PositiveOrZero Long delaySeconds) {
}
