package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Form owner capabilities captured when the work unit was enqueued.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record OwnerSnapshotType(@JsonProperty("id") String id,

        @JsonProperty("can_use_ai") boolean canUseAi,

        @JsonProperty("can_use_integrations") boolean canUseIntegrations) {
}
