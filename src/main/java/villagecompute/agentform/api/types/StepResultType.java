package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.agentform.workflow.ClassifiedError;
import villagecompute.agentform.workflow.StepResult;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepResultType(@JsonProperty("step_name") String stepName,

        @JsonProperty("required") boolean required,

        @JsonProperty("status") String status,

        @JsonProperty("error_type") String errorType,

        @JsonProperty("error") String error,

        @JsonProperty("side_effects") Map<String, Object> sideEffects,

        @JsonProperty("step_attempt") int stepAttempt,

        @JsonProperty("started_at") String startedAt,

        @JsonProperty("finished_at") String finishedAt) {

    public static StepResultType from(StepResult result) {
        ClassifiedError error = result.error();
        return new StepResultType(result.stepName(), result.required(), result.status().getWireName(),
                error != null ? error.category().getWireName() : null, error != null ? error.message() : null,
                result.sideEffects(), result.stepAttempt(),
                result.startedAt() != null ? result.startedAt().toString() : null,
                result.finishedAt() != null ? result.finishedAt().toString() : null);
    }
}
