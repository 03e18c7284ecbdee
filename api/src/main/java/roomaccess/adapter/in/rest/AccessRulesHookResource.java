package roomaccess.adapter.in.rest;

import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import roomaccess.adapter.in.dto.DecisionResponse;
import roomaccess.adapter.in.dto.MembershipHookRequest;
import roomaccess.adapter.in.dto.RoomCreateHookRequest;
import roomaccess.adapter.in.dto.RuleResponse;
import roomaccess.adapter.in.dto.StateEventDto;
import roomaccess.adapter.in.dto.ThirdPartyInviteHookRequest;
import roomaccess.adapter.in.problem.AccessProblem;
import roomaccess.core.model.AccessDecision;
import roomaccess.core.model.Membership;
import roomaccess.core.model.MembershipChangeRequest;
import roomaccess.core.model.RoomCreationRequest;
import roomaccess.core.model.RuleResolution;
import roomaccess.core.model.ThirdPartyInviteRequest;
import roomaccess.core.port.in.RoomAccessRules;

/**
 * REST hooks called by the host event pipeline.
 *
 * <p>Each hook answers 200 when the host may proceed. A rejected room creation
 * answers 400 and a denied membership change answers 403, both as
 * {@code application/problem+json} with the reason in {@code detail}. Unreadable
 * room state answers 500.
 */
@Path("/_access_rules/v1/rooms")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccessRulesHookResource {

    private final RoomAccessRules accessRules;

    @Inject
    public AccessRulesHookResource(RoomAccessRules accessRules) {
        this.accessRules = accessRules;
    }

    /**
     * Resolve the access rule of a room about to be created.
     *
     * @param request the creation parameters
     * @return the rule to store, or 400 if the requested rule is invalid
     */
    @POST
    @Path("/create")
    public Uni<RuleResponse> onRoomCreate(RoomCreateHookRequest request) {
        if (request == null || isBlank(request.creator())) {
            throw AccessProblem.validationError("creator is required");
        }

        final var creation = new RoomCreationRequest(
                request.creator(),
                Boolean.TRUE.equals(request.isDirect()),
                request.initialState() != null
                        ? request.initialState().stream()
                                .filter(Objects::nonNull)
                                .map(StateEventDto::toModel)
                                .toList()
                        : null,
                request.invite());

        return accessRules.onRoomCreate(creation).map(resolution -> {
            if (resolution instanceof RuleResolution.Rejected rejected) {
                throw AccessProblem.invalidRule(rejected.reason(), rejected.suggestedStatusCode());
            }
            return new RuleResponse(((RuleResolution.Resolved) resolution).rule());
        });
    }

    /**
     * Check a membership change before the host persists it.
     *
     * @param roomId  the room
     * @param request the membership change
     * @return 200 if allowed, or 403 with the reason
     */
    @POST
    @Path("/{roomId}/membership")
    public Uni<DecisionResponse> onMembershipEvent(
            @PathParam("roomId") String roomId, MembershipHookRequest request) {
        if (request == null || isBlank(request.sender()) || isBlank(request.target())) {
            throw AccessProblem.validationError("sender and target are required");
        }

        final var change = new MembershipChangeRequest(
                roomId, request.sender(), request.target(), Membership.fromValue(request.membership()));

        return accessRules.onMembershipEvent(change).map(AccessRulesHookResource::toResponse);
    }

    /**
     * Check a third-party invite before the host sends it.
     *
     * @param roomId  the room
     * @param request the invite
     * @return 200 if allowed, or 403 with the reason
     */
    @POST
    @Path("/{roomId}/third_party_invite")
    public Uni<DecisionResponse> onThirdPartyInvite(
            @PathParam("roomId") String roomId, ThirdPartyInviteHookRequest request) {
        if (request == null || isBlank(request.medium()) || isBlank(request.address())) {
            throw AccessProblem.validationError("medium and address are required");
        }

        final var invite = new ThirdPartyInviteRequest(roomId, request.sender(), request.medium(), request.address());

        return accessRules.onThirdPartyInvite(invite).map(AccessRulesHookResource::toResponse);
    }

    private static DecisionResponse toResponse(AccessDecision decision) {
        if (decision instanceof AccessDecision.Denied denied) {
            throw AccessProblem.policyDenied(denied.reason(), denied.suggestedStatusCode());
        }
        return new DecisionResponse(true);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
