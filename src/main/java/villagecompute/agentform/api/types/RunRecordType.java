package villagecompute.agentform.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.agentform.workflow.RunRecord;

import java.util.List;

/**
 * Admin view of one execution attempt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunRecordType(@JsonProperty("work_unit_id") String workUnitId,

        @JsonProperty("event_type") String eventType,

        @JsonProperty("attempt_number") int attemptNumber,

        @JsonProperty("overall_status") String overallStatus,

        @JsonProperty("started_at") String startedAt,

        @JsonProperty("finished_at") String finishedAt,

        @JsonProperty("steps") List<StepResultType> steps) {

    public static RunRecordType from(RunRecord run) {
        return new RunRecordType(run.workUnitId(), run.eventType().getWireName(), run.attemptNumber(),
                run.overallStatus().getWireName(), run.startedAt() != null ? run.startedAt().toString() : null,
                run.finishedAt() != null ? run.finishedAt().toString() : null,
                run.stepResults().stream().map(StepResultType::from).toList());
    }
}
