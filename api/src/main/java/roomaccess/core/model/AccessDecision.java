package roomaccess.core.model;

/**
 * Outcome of an admission check on a membership change.
 */
public sealed interface AccessDecision {

    int FORBIDDEN = 403;

    /**
     * The change may be committed.
     */
    record Allowed() implements AccessDecision {}

    /**
     * The change is blocked by the room's access rule.
     *
     * @param reason              human-readable reason, returned to the client
     * @param suggestedStatusCode HTTP status the host should answer with
     */
    record Denied(String reason, int suggestedStatusCode) implements AccessDecision {}

    default boolean isAllowed() {
        return this instanceof Allowed;
    }

    static AccessDecision allowed() {
        return new Allowed();
    }

    static AccessDecision denied(String reason) {
        return new Denied(reason, FORBIDDEN);
    }
}
