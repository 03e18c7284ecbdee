package roomaccess.core.service;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import roomaccess.core.config.RoomAccessConfig;
import roomaccess.core.model.AccessRule;

/**
 * Server name check applied to invites into restricted rooms.
 */
@ApplicationScoped
public class DomainPolicy {

    private final Set<String> deniedServers;

    @Inject
    public DomainPolicy(RoomAccessConfig config) {
        this.deniedServers = Set.copyOf(config.domainsForbiddenWhenRestricted().orElse(Set.of()));
    }

    /**
     * Check whether users of a server may be invited under a rule.
     *
     * <p>Only {@link AccessRule#RESTRICTED} consults the denylist. Matching is exact,
     * with no wildcards and no subdomain matching.
     *
     * @param serverName the target's server name
     * @param rule       the rule in effect
     * @return true if the server is permitted
     */
    public boolean isDomainAllowed(String serverName, AccessRule rule) {
        if (rule != AccessRule.RESTRICTED) {
            return true;
        }
        return !deniedServers.contains(serverName);
    }
}
