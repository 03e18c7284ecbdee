package roomaccess.core.config;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for room access rules.
 *
 * <p>Configuration prefix: {@code room-access}
 *
 * <p>Loaded once at startup and never modified afterwards.
 */
@ConfigMapping(prefix = "room-access")
public interface RoomAccessConfig {

    /**
     * Server names whose users may not be invited into restricted rooms.
     *
     * <p>Matching is exact: {@code example.org} does not deny {@code chat.example.org}.
     *
     * @return denied server names (default: none)
     */
    Optional<Set<String>> domainsForbiddenWhenRestricted();

    /**
     * Base address of the identity server used to resolve third-party invites.
     *
     * <p>A value without a scheme is treated as {@code https://}. When unset,
     * every third-party invite is denied.
     *
     * @return identity server address
     */
    Optional<String> idServer();

    /**
     * Upper bound on an identity server lookup.
     *
     * @return lookup timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration identityLookupTimeout();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * Record a counter per access decision.
         *
         * @return true if enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
