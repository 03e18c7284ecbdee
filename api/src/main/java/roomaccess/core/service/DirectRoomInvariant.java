package roomaccess.core.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import roomaccess.core.model.ClosedMembershipSet;
import roomaccess.core.model.MembershipEvent;
import roomaccess.core.model.RoomCreationRequest;

/**
 * Keeps direct rooms closed to their two original participants.
 *
 * <p>The participants are the creator and the first user invited into or joining
 * the room (see {@link ClosedMembershipSet}). Once both are known, only they may be
 * invited, however often they leave and come back.
 */
@ApplicationScoped
public class DirectRoomInvariant {

    private static final Logger LOG = Logger.getLogger(DirectRoomInvariant.class);

    /**
     * Check an invite into a direct room.
     *
     * @param roomId  the room
     * @param creator the room creator
     * @param sender  the inviting user
     * @param target  the invited user
     * @param history membership history of the room, oldest first
     * @return true if the invite keeps the room within its participants
     */
    public boolean isInviteAllowed(
            String roomId, String creator, String sender, String target, List<MembershipEvent> history) {
        if (target.equals(creator)) {
            return true;
        }

        final var closedSet = ClosedMembershipSet.fold(creator, history);
        if (closedSet.contains(target)) {
            return true;
        }
        if (closedSet.isOpen()) {
            LOG.debugf("Direct room %s: %s invited by %s becomes the second participant", roomId, target, sender);
            return true;
        }

        LOG.debugf("Direct room %s is closed to %s, participants=%s", roomId, target, closedSet.members());
        return false;
    }

    /**
     * Check a third-party invite into a direct room.
     *
     * <p>Allowed only while the second participant is still to be chosen.
     *
     * @param creator the room creator
     * @param history membership history of the room, oldest first
     * @return true if the room still has room for a participant
     */
    public boolean isThirdPartyInviteAllowed(String creator, List<MembershipEvent> history) {
        return ClosedMembershipSet.fold(creator, history).isOpen();
    }

    /**
     * Warn when a direct room is created with several invitees.
     *
     * <p>Only the first invitee accepted by the host becomes a participant.
     *
     * @param request the creation request
     */
    public void checkInitialInvitees(RoomCreationRequest request) {
        if (request.isDirect() && request.invitees().size() > 1) {
            LOG.warnf(
                    "Direct room created by %s with %d invitees %s; only the first accepted invitee will be a participant",
                    request.creator(), request.invitees().size(), request.invitees());
        }
    }
}
