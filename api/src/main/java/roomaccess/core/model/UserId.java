package roomaccess.core.model;

/**
 * A fully qualified user identifier of the form {@code @localpart:server.name}.
 *
 * <p>The server name is everything after the first colon, so explicit ports
 * ({@code example.org:8448}) are part of it.
 *
 * @param value      the full identifier
 * @param localpart  the part between the sigil and the first colon
 * @param serverName the homeserver that owns the user
 */
public record UserId(String value, String localpart, String serverName) {

    private static final char SIGIL = '@';

    /**
     * Parse a user identifier.
     *
     * @param value the raw identifier
     * @return the parsed identifier
     * @throws IllegalArgumentException if the identifier is malformed
     */
    public static UserId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("user id is required");
        }
        if (value.charAt(0) != SIGIL) {
            throw new IllegalArgumentException("Invalid user id '%s': must start with '@'".formatted(value));
        }
        final var colon = value.indexOf(':');
        if (colon < 2 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Invalid user id '%s': expected @localpart:server".formatted(value));
        }
        return new UserId(value, value.substring(1, colon), value.substring(colon + 1));
    }

    @Override
    public String toString() {
        return value;
    }
}
