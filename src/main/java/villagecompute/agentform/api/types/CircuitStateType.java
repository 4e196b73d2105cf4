package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.agentform.data.models.CircuitState;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircuitStateType(@JsonProperty("dependency_key") String dependencyKey,

        @JsonProperty("status") String status,

        @JsonProperty("consecutive_failures") int consecutiveFailures,

        @JsonProperty("threshold") int threshold,

        @JsonProperty("opened_at") String openedAt,

        @JsonProperty("remaining_cooldown_seconds") long remainingCooldownSeconds) {

    public static CircuitStateType from(CircuitState state, Instant now) {
        return new CircuitStateType(state.dependencyKey(), state.status().getWireName(), state.consecutiveFailures(),
                state.threshold(), state.openedAt() != null ? state.openedAt().toString() : null,
                state.remainingCooldown(now).toSeconds());
    }
}
