package roomaccess.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A room state event as supplied by the host.
 *
 * @param type     the event type
 * @param stateKey the state key, empty for room-wide state
 * @param content  the event body; null values are kept as sent
 */
public record StateEvent(String type, String stateKey, Map<String, Object> content) {

    public StateEvent {
        stateKey = stateKey != null ? stateKey : "";
        content = content != null ? Collections.unmodifiableMap(new LinkedHashMap<>(content)) : Map.of();
    }

    /**
     * Whether this is the access rule event of the room.
     */
    public boolean isAccessRuleEvent() {
        return AccessRule.EVENT_TYPE.equals(type) && stateKey.isEmpty();
    }
}
