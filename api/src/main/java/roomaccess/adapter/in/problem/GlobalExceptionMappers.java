package roomaccess.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import roomaccess.core.service.RoomStatePreconditionException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>A room state failure is an internal error and is never reported as a denial.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapRoomStatePreconditionException(RoomStatePreconditionException e) {
        LOG.errorf(e, "Room state unavailable for %s", e.roomId());
        return toResponse(AccessProblem.roomStateUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(AccessProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
