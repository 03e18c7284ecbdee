package roomaccess.core.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Access rule carried by a room as state.
 *
 * <p>Stored under {@link #EVENT_TYPE} with an empty state key and a body of
 * {@code {"rule": "<value>"}}.
 */
public enum AccessRule {

    /**
     * Anyone may be invited except users on denied servers.
     */
    RESTRICTED("restricted"),

    /**
     * Anyone may be invited.
     */
    UNRESTRICTED("unrestricted"),

    /**
     * Membership is closed to the two original participants.
     */
    DIRECT("direct");

    public static final String EVENT_TYPE = "im.vector.room.access_rules";
    public static final String CONTENT_KEY = "rule";

    private final String value;

    AccessRule(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Look up a rule by its wire value.
     *
     * @param value the wire value, e.g. "restricted"
     * @return the rule, or empty if the value is not recognized
     */
    public static Optional<AccessRule> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (var rule : values()) {
            if (rule.value.equals(value)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
