package roomaccess.core.model;

/**
 * Outcome of assigning an access rule to a room being created.
 */
public sealed interface RuleResolution {

    int BAD_REQUEST = 400;

    record Resolved(AccessRule rule) implements RuleResolution {}

    record Rejected(String reason, int suggestedStatusCode) implements RuleResolution {}

    static RuleResolution resolved(AccessRule rule) {
        return new Resolved(rule);
    }

    static RuleResolution rejected(String reason) {
        return new Rejected(reason, BAD_REQUEST);
    }
}
