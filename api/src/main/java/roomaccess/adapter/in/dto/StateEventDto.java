package roomaccess.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import roomaccess.core.model.StateEvent;

/**
 * DTO for a state event in a room creation request.
 *
 * @param type     the event type
 * @param stateKey the state key (optional, defaults to empty)
 * @param content  the event body
 */
public record StateEventDto(
        String type, @JsonProperty("state_key") String stateKey, Map<String, Object> content) {

    public StateEvent toModel() {
        return new StateEvent(type, stateKey, content);
    }
}
