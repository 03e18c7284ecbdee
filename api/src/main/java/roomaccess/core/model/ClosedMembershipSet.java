package roomaccess.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The participants a direct room is limited to.
 *
 * <p>Built by folding the membership history of the room in order. The set starts
 * with the creator and takes the targets of invite and join events until it holds
 * {@link #CAPACITY} identities. Leaves and bans never remove anyone.
 */
public final class ClosedMembershipSet {

    public static final int CAPACITY = 2;

    private final Set<String> members;

    private ClosedMembershipSet(Set<String> members) {
        this.members = Collections.unmodifiableSet(members);
    }

    /**
     * Fold a membership history into the closed set.
     *
     * @param creator the room creator
     * @param history membership events, oldest first
     * @return the closed set
     */
    public static ClosedMembershipSet fold(String creator, List<MembershipEvent> history) {
        final var members = new LinkedHashSet<String>();
        members.add(creator);
        for (var event : history) {
            if (members.size() >= CAPACITY) {
                break;
            }
            if (event.membership().isInviteOrJoin()) {
                members.add(event.target());
            }
        }
        return new ClosedMembershipSet(members);
    }

    public boolean contains(String userId) {
        return members.contains(userId);
    }

    /**
     * Whether the second participant is still to be chosen.
     */
    public boolean isOpen() {
        return members.size() < CAPACITY;
    }

    public Set<String> members() {
        return members;
    }

    @Override
    public String toString() {
        return "ClosedMembershipSet" + members;
    }
}
