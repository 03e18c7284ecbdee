package roomaccess.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import roomaccess.adapter.in.problem.AccessProblem;
import roomaccess.core.port.out.RoomStateReader;
import roomaccess.core.port.out.RoomStateWriter;

/**
 * Write-through of resolved room state from the host.
 *
 * <p>The host pushes every state event it resolves, including the access rule it
 * stored at creation and each member event in order. The hooks read this state
 * back when deciding.
 */
@Path("/_access_rules/v1/rooms/{roomId}/state")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RoomStateResource {

    private final RoomStateReader reader;
    private final RoomStateWriter writer;

    @Inject
    public RoomStateResource(RoomStateReader reader, RoomStateWriter writer) {
        this.reader = reader;
        this.writer = writer;
    }

    /**
     * Store room-wide state (empty state key).
     */
    @PUT
    @Path("/{eventType}")
    public Uni<Response> putRoomState(
            @PathParam("roomId") String roomId, @PathParam("eventType") String eventType, Map<String, Object> content) {
        return putKeyedState(roomId, eventType, "", content);
    }

    /**
     * Store keyed state, e.g. a member event keyed by user id.
     */
    @PUT
    @Path("/{eventType}/{stateKey}")
    public Uni<Response> putKeyedState(
            @PathParam("roomId") String roomId,
            @PathParam("eventType") String eventType,
            @PathParam("stateKey") String stateKey,
            Map<String, Object> content) {
        if (content == null) {
            throw AccessProblem.validationError("request body is required");
        }
        return writer.putState(roomId, eventType, stateKey, content)
                .replaceWith(Response.noContent().build());
    }

    @GET
    @Path("/{eventType}")
    public Uni<Map<String, Object>> getRoomState(
            @PathParam("roomId") String roomId, @PathParam("eventType") String eventType) {
        return getKeyedState(roomId, eventType, "");
    }

    @GET
    @Path("/{eventType}/{stateKey}")
    public Uni<Map<String, Object>> getKeyedState(
            @PathParam("roomId") String roomId,
            @PathParam("eventType") String eventType,
            @PathParam("stateKey") String stateKey) {
        return reader.getResolvedState(roomId, eventType, stateKey)
                .map(content -> content.orElseThrow(() -> AccessProblem.stateNotFound(roomId, eventType, stateKey)));
    }
}
