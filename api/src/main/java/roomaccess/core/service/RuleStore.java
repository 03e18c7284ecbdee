package roomaccess.core.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import roomaccess.core.model.AccessRule;
import roomaccess.core.model.MembershipEvent;
import roomaccess.core.port.out.RoomStateReader;

/**
 * Read-only view of the room state the access rules depend on.
 *
 * <p>Every lookup goes to the {@link RoomStateReader}; nothing is cached. Any read
 * that cannot be satisfied fails with {@link RoomStatePreconditionException}.
 */
@ApplicationScoped
public class RuleStore {

    static final String CREATE_EVENT_TYPE = "m.room.create";
    static final String CREATOR_KEY = "creator";

    private final RoomStateReader reader;

    @Inject
    public RuleStore(RoomStateReader reader) {
        this.reader = reader;
    }

    /**
     * Read the resolved access rule of a room.
     *
     * @param roomId the room
     * @return Uni with the rule
     */
    public Uni<AccessRule> currentRule(String roomId) {
        return requireRoom(roomId)
                .flatMap(ignored -> reader.getResolvedState(roomId, AccessRule.EVENT_TYPE, ""))
                .map(content -> parseRule(roomId, content))
                .onFailure(notPrecondition())
                .transform(wrap(roomId, "Failed to read access rule"));
    }

    /**
     * Read the creator of a room from its create event.
     *
     * @param roomId the room
     * @return Uni with the creator's user id
     */
    public Uni<String> creator(String roomId) {
        return reader.getResolvedState(roomId, CREATE_EVENT_TYPE, "")
                .map(content -> {
                    final var creator = content.map(c -> c.get(CREATOR_KEY)).orElse(null);
                    if (!(creator instanceof String value) || value.isBlank()) {
                        throw new RoomStatePreconditionException(roomId, "Room " + roomId + " has no creator in state");
                    }
                    return value;
                })
                .onFailure(notPrecondition())
                .transform(wrap(roomId, "Failed to read room creator"));
    }

    /**
     * Read the membership history of a room.
     *
     * @param roomId the room
     * @return Uni with the membership events, oldest first
     */
    public Uni<List<MembershipEvent>> membershipHistory(String roomId) {
        return reader.membershipHistory(roomId)
                .onFailure(notPrecondition())
                .transform(wrap(roomId, "Failed to read membership history"));
    }

    private Uni<Boolean> requireRoom(String roomId) {
        return reader.roomExists(roomId).invoke(exists -> {
            if (!exists) {
                throw new RoomStatePreconditionException(roomId, "Unknown room " + roomId);
            }
        });
    }

    private static AccessRule parseRule(String roomId, Optional<Map<String, Object>> content) {
        if (content.isEmpty()) {
            throw new RoomStatePreconditionException(roomId, "Room " + roomId + " has no resolved access rule");
        }
        final var raw = content.get().get(AccessRule.CONTENT_KEY);
        return AccessRule.fromValue(raw instanceof String value ? value : null)
                .orElseThrow(() -> new RoomStatePreconditionException(
                        roomId, "Room " + roomId + " has an unreadable access rule: " + raw));
    }

    private static Predicate<Throwable> notPrecondition() {
        return failure -> !(failure instanceof RoomStatePreconditionException);
    }

    private static Function<Throwable, Throwable> wrap(String roomId, String message) {
        return failure -> new RoomStatePreconditionException(roomId, message + " for room " + roomId, failure);
    }
}
