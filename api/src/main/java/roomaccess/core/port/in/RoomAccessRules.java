package roomaccess.core.port.in;

import io.smallrye.mutiny.Uni;

import roomaccess.core.model.AccessDecision;
import roomaccess.core.model.MembershipChangeRequest;
import roomaccess.core.model.RoomCreationRequest;
import roomaccess.core.model.RuleResolution;
import roomaccess.core.model.ThirdPartyInviteRequest;

/**
 * Hooks the host event pipeline calls before committing room events.
 *
 * <p>None of these operations write state. The host persists the rule returned by
 * {@link #onRoomCreate} together with the creation event, and commits a membership
 * event only when it was allowed.
 */
public interface RoomAccessRules {

    /**
     * Assign the access rule of a room being created.
     *
     * <p>Must be called before the creation event is finalized.
     *
     * @param request the creation parameters
     * @return Uni with the resolved rule, or a rejection the host turns into a 400
     */
    Uni<RuleResolution> onRoomCreate(RoomCreationRequest request);

    /**
     * Decide whether a membership change may be committed.
     *
     * <p>Only invites are gated. Joins, leaves, bans and knocks are always allowed.
     *
     * @param request the membership change
     * @return Uni with the decision; fails with
     *         {@link roomaccess.core.service.RoomStatePreconditionException} if the
     *         room state cannot be read
     */
    Uni<AccessDecision> onMembershipEvent(MembershipChangeRequest request);

    /**
     * Decide whether a third-party (email, phone) invite may be sent.
     *
     * @param request the third-party invite
     * @return Uni with the decision; denied when the identity lookup fails
     */
    Uni<AccessDecision> onThirdPartyInvite(ThirdPartyInviteRequest request);
}
