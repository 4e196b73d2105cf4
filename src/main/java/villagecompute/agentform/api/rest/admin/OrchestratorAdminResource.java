package villagecompute.agentform.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.CircuitStateType;
import villagecompute.agentform.api.types.CreditBalanceType;
import villagecompute.agentform.api.types.CreditLimitRequestType;
import villagecompute.agentform.api.types.EnqueueRequestType;
import villagecompute.agentform.api.types.RunRecordType;
import villagecompute.agentform.data.models.EventType;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.services.CircuitBreakerService;
import villagecompute.agentform.services.CreditLedgerService;
import villagecompute.agentform.services.DelayedJobService;
import villagecompute.agentform.services.RunHistoryService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints for the job runtime.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>POST /admin/orchestrator/work-units - enqueue a work unit</li>
 * <li>GET /admin/orchestrator/work-units/{id}/runs - run history of a work unit</li>
 * <li>GET /admin/orchestrator/circuits - breaker states</li>
 * <li>POST /admin/orchestrator/circuits/{key}/reset - force a breaker closed</li>
 * <li>GET, PUT /admin/orchestrator/credits/{userId} - AI credit balance and monthly limit</li>
 * </ul>
 *
 * <p>
 * Authentication is handled in front of this service.
 */
@Path("/admin/orchestrator")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OrchestratorAdminResource {

    private static final Logger LOG = Logger.getLogger(OrchestratorAdminResource.class);

    @Inject
    Clock clock;

    @Inject
    DelayedJobService delayedJobService;

    @Inject
    RunHistoryService runHistoryService;

    @Inject
    CircuitBreakerService circuitBreakerService;

    @Inject
    CreditLedgerService creditLedgerService;

    @POST
    @Path("/work-units")
    public Response enqueue(@Valid EnqueueRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        try {
            EventType eventType = EventType.fromWireName(request.eventType());
            Duration delay = Duration.ofSeconds(request.delaySeconds() != null ? request.delaySeconds() : 0);
            String workUnitId = delayedJobService.enqueue(eventType, request.payload(), delay);
            LOG.infof("Admin enqueued %s work unit %s (delay %ds)", eventType.getWireName(), workUnitId,
                    delay.toSeconds());
            return Response.accepted(Map.of("work_unit_id", workUnitId, "event_type", eventType.getWireName()))
                    .build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @GET
    @Path("/work-units/{id}/runs")
    public Response runs(@PathParam("id") String workUnitId) {
        List<RunRecordType> runs = runHistoryService.runsFor(workUnitId).stream().map(RunRecordType::from).toList();
        if (runs.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("No runs recorded for work unit: " + workUnitId)).build();
        }
        return Response.ok(runs).build();
    }

    @GET
    @Path("/circuits")
    public Response circuits() {
        Instant now = clock.instant();
        return Response.ok(circuitBreakerService.states().stream().map(s -> CircuitStateType.from(s, now)).toList())
                .build();
    }

    @POST
    @Path("/circuits/{key}/reset")
    public Response resetCircuit(@PathParam("key") String dependencyKey) {
        return Response.ok(CircuitStateType.from(circuitBreakerService.reset(dependencyKey), clock.instant()))
                .build();
    }

    @GET
    @Path("/credits/{userId}")
    public Response credits(@PathParam("userId") String userId) {
        return Response.ok(CreditBalanceType.from(creditLedgerService.account(userId))).build();
    }

    @PUT
    @Path("/credits/{userId}")
    public Response configureCredits(@PathParam("userId") String userId, @Valid CreditLimitRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        return Response.ok(CreditBalanceType.from(creditLedgerService.configureAccount(userId, request.monthlyLimit())))
                .build();
    }

    public record ErrorResponse(String error) {
    }
}
