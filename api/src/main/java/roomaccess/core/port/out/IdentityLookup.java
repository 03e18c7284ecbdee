package roomaccess.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for resolving third-party addresses to homeservers.
 */
public interface IdentityLookup {

    /**
     * Whether a lookup service is configured.
     */
    boolean isConfigured();

    /**
     * Resolve a third-party address to the homeserver its user lives on.
     *
     * @param medium  the kind of address, e.g. "email"
     * @param address the address
     * @return Uni with the server name, or empty if the address is not bound;
     *         fails if the service is unreachable, times out or answers with an error
     */
    Uni<Optional<String>> lookupHomeserver(String medium, String address);
}
