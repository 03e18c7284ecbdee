package roomaccess.core.port.out;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import roomaccess.core.model.MembershipEvent;

/**
 * Port interface for reading resolved room state.
 *
 * <p>Implementations must return resolved state only, never a provisional view.
 * The engine reads through this port on every call and keeps no copy.
 */
public interface RoomStateReader {

    /**
     * Check whether the room is known.
     *
     * @param roomId the room
     * @return Uni with true if the room exists
     */
    Uni<Boolean> roomExists(String roomId);

    /**
     * Read the content of a state event.
     *
     * @param roomId    the room
     * @param eventType the event type
     * @param stateKey  the state key, empty for room-wide state
     * @return Uni with the event content, or empty if there is no such state
     */
    Uni<Optional<Map<String, Object>>> getResolvedState(String roomId, String eventType, String stateKey);

    /**
     * Read the membership events of a room in the order they were resolved.
     *
     * @param roomId the room
     * @return Uni with the history, oldest first
     */
    Uni<List<MembershipEvent>> membershipHistory(String roomId);
}
