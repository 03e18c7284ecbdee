package roomaccess.core.model;

/**
 * A membership change awaiting admission.
 *
 * @param roomId     the room
 * @param sender     the acting user
 * @param target     the user whose membership would change
 * @param membership the requested membership
 */
public record MembershipChangeRequest(String roomId, String sender, String target, Membership membership) {}
