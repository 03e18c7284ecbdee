package roomaccess.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

/**
 * Port interface through which the host pushes resolved room state.
 */
public interface RoomStateWriter {

    /**
     * Store the resolved content of a state event.
     *
     * <p>Member events ({@code m.room.member}) are also appended to the membership
     * history of the room.
     *
     * @param roomId    the room
     * @param eventType the event type
     * @param stateKey  the state key, empty for room-wide state
     * @param content   the event content
     * @return Uni completing when the state is stored
     */
    Uni<Void> putState(String roomId, String eventType, String stateKey, Map<String, Object> content);
}
