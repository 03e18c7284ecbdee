package roomaccess.core.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Membership states of a room member event.
 */
public enum Membership {
    INVITE,
    JOIN,
    LEAVE,
    BAN,
    KNOCK;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether this membership counts towards the participants of a room.
     */
    public boolean isInviteOrJoin() {
        return this == INVITE || this == JOIN;
    }

    public static Membership fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("membership is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown membership: " + value, e);
        }
    }
}
