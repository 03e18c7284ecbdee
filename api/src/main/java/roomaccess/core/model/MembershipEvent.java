package roomaccess.core.model;

/**
 * One entry of the ordered membership history of a room.
 *
 * @param sender     the user who sent the event
 * @param target     the user whose membership changed (the state key)
 * @param membership the new membership
 */
public record MembershipEvent(String sender, String target, Membership membership) {

    public static final String EVENT_TYPE = "m.room.member";

    public static MembershipEvent invite(String sender, String target) {
        return new MembershipEvent(sender, target, Membership.INVITE);
    }

    public static MembershipEvent join(String user) {
        return new MembershipEvent(user, user, Membership.JOIN);
    }

    public static MembershipEvent leave(String user) {
        return new MembershipEvent(user, user, Membership.LEAVE);
    }
}
