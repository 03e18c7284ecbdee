package roomaccess.core.service;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import roomaccess.core.model.AccessRule;
import roomaccess.core.model.RuleResolution;

/**
 * Decides which access rule a new room gets.
 *
 * <p>Direct rooms may only carry {@link AccessRule#DIRECT}, and {@code DIRECT} is
 * only legal on direct rooms. An incompatible request is rejected, never coerced.
 */
@ApplicationScoped
public class RuleValidator {

    /**
     * Resolve the initial rule of a room.
     *
     * @param isDirect  whether the room is a direct chat
     * @param requested the rule the client asked for, if any
     * @return the rule to store, or a rejection
     */
    public RuleResolution resolveInitialRule(boolean isDirect, Optional<AccessRule> requested) {
        if (requested.isEmpty()) {
            return RuleResolution.resolved(isDirect ? AccessRule.DIRECT : AccessRule.RESTRICTED);
        }

        final var rule = requested.get();
        if (rule == AccessRule.DIRECT && !isDirect) {
            return RuleResolution.rejected("Invalid access rule: 'direct' can only be used on direct rooms");
        }
        if (rule != AccessRule.DIRECT && isDirect) {
            return RuleResolution.rejected(
                    "Invalid access rule: '%s' cannot be used on direct rooms".formatted(rule.value()));
        }
        return RuleResolution.resolved(rule);
    }
}
