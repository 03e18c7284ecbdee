package roomaccess.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for access rule errors.
 *
 * <p>All 4xx client errors are expected outcomes of the hooks and are not logged
 * as errors.
 */
public final class AccessProblem {

    private AccessProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    /**
     * The requested access rule does not fit the room being created.
     *
     * @param detail the rejection reason
     * @param status the suggested status code
     * @return invalid rule problem
     */
    public static HttpProblem invalidRule(String detail, int status) {
        return HttpProblem.builder()
                .withTitle("Invalid Access Rule")
                .withStatus(Status.fromStatusCode(status))
                .withDetail(detail)
                .build();
    }

    // ========== Authorization Errors ==========

    /**
     * A membership change was denied by the room's access rule.
     *
     * @param detail the denial reason
     * @param status the suggested status code
     * @return denial problem
     */
    public static HttpProblem policyDenied(String detail, int status) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.fromStatusCode(status))
                .withDetail(detail)
                .build();
    }

    // ========== Not Found Errors ==========

    public static HttpProblem stateNotFound(String roomId, String eventType, String stateKey) {
        return HttpProblem.builder()
                .withTitle("State Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No %s state with key '%s' in room %s".formatted(eventType, stateKey, roomId))
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem roomStateUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Room State Unavailable")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
