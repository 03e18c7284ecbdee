package roomaccess.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of a room creation, evaluated once before the room is materialized.
 *
 * @param creator      the user creating the room
 * @param isDirect     whether the client flagged the room as a direct chat
 * @param initialState state events requested at creation
 * @param invitees     users invited as part of the creation
 */
public record RoomCreationRequest(
        String creator, boolean isDirect, List<StateEvent> initialState, List<String> invitees) {

    public RoomCreationRequest {
        initialState = initialState != null
                ? initialState.stream().filter(Objects::nonNull).toList()
                : List.of();
        invitees = invitees != null
                ? invitees.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    /**
     * Find the access rule event among the initial state, if the client sent one.
     */
    public Optional<StateEvent> accessRuleEvent() {
        return initialState.stream().filter(StateEvent::isAccessRuleEvent).findFirst();
    }
}
