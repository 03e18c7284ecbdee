package roomaccess.adapter.out.storage.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import roomaccess.core.model.Membership;
import roomaccess.core.model.MembershipEvent;
import roomaccess.core.port.out.RoomStateReader;
import roomaccess.core.port.out.RoomStateWriter;

/**
 * In-memory room state, filled by the host through the state write-through endpoint.
 *
 * <p>Data is NOT persisted across restarts. The host remains the owner of room
 * state; this store only mirrors the resolved values it pushes.
 *
 * <p>Every member event pushed is appended to the room's history, which never
 * shrinks. Each push and each {@link #membershipHistory} read copies the
 * history, so both cost O(n) in the number of member events of the room.
 *
 * <p>Thread-safety: Uses ConcurrentHashMap and CopyOnWriteArrayList for safe
 * concurrent access.
 */
@ApplicationScoped
public class InMemoryRoomStateStore implements RoomStateReader, RoomStateWriter {

    static final String MEMBERSHIP_KEY = "membership";
    static final String SENDER_KEY = "sender";

    private final ConcurrentHashMap<String, RoomState> rooms = new ConcurrentHashMap<>();

    private record StateKey(String eventType, String stateKey) {}

    private record RoomState(
            ConcurrentHashMap<StateKey, Map<String, Object>> state, CopyOnWriteArrayList<MembershipEvent> history) {

        RoomState() {
            this(new ConcurrentHashMap<>(), new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public Uni<Void> putState(String roomId, String eventType, String stateKey, Map<String, Object> content) {
        final var key = new StateKey(eventType, stateKey != null ? stateKey : "");
        final Map<String, Object> body = Collections.unmodifiableMap(new LinkedHashMap<>(content));
        return Uni.createFrom().item(() -> {
            final MembershipEvent memberEvent =
                    MembershipEvent.EVENT_TYPE.equals(eventType) ? toMembershipEvent(key.stateKey(), body) : null;
            final var room = rooms.computeIfAbsent(roomId, id -> new RoomState());
            room.state().put(key, body);
            if (memberEvent != null) {
                room.history().add(memberEvent);
            }
            return null;
        });
    }

    @Override
    public Uni<Boolean> roomExists(String roomId) {
        return Uni.createFrom().item(() -> rooms.containsKey(roomId));
    }

    @Override
    public Uni<Optional<Map<String, Object>>> getResolvedState(String roomId, String eventType, String stateKey) {
        return Uni.createFrom().item(() -> Optional.ofNullable(rooms.get(roomId))
                .map(room -> room.state().get(new StateKey(eventType, stateKey))));
    }

    @Override
    public Uni<List<MembershipEvent>> membershipHistory(String roomId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(rooms.get(roomId))
                .<List<MembershipEvent>>map(room -> List.copyOf(room.history()))
                .orElse(List.of()));
    }

    /**
     * Drop every room. Used between tests.
     */
    public void clear() {
        rooms.clear();
    }

    private static MembershipEvent toMembershipEvent(String target, Map<String, Object> content) {
        if (target.isEmpty()) {
            throw new IllegalArgumentException("m.room.member events require the target user as state key");
        }
        final var membership = Membership.fromValue(String.valueOf(content.get(MEMBERSHIP_KEY)));
        final var sender = content.get(SENDER_KEY) instanceof String value ? value : target;
        return new MembershipEvent(sender, target, membership);
    }
}
