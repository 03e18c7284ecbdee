package roomaccess.core.port.out;

import roomaccess.core.model.AccessRule;

/**
 * Port interface for recording access decisions.
 */
public interface AccessDecisionMetrics {

    enum Kind {
        CREATE,
        INVITE,
        THIRD_PARTY_INVITE
    }

    enum Outcome {
        ALLOWED,
        DENIED,
        REJECTED,
        IDENTITY_LOOKUP_FAILURE
    }

    /**
     * Record one decision.
     *
     * @param kind    what was evaluated
     * @param rule    the rule in effect, or null if none was resolved
     * @param outcome the result
     */
    void recordDecision(Kind kind, AccessRule rule, Outcome outcome);
}
