package roomaccess.adapter.in.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for the room creation hook.
 *
 * @param creator      the user creating the room (required)
 * @param isDirect     whether the room is a direct chat (optional, defaults to false)
 * @param initialState state events requested at creation (optional)
 * @param invite       users invited as part of the creation (optional)
 */
public record RoomCreateHookRequest(
        String creator,
        @JsonProperty("is_direct") Boolean isDirect,
        @JsonProperty("initial_state") List<StateEventDto> initialState,
        List<String> invite) {}
