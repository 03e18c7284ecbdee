package roomaccess.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import roomaccess.core.config.RoomAccessConfig;
import roomaccess.core.port.out.IdentityLookup;

/**
 * Reports the identity server setup used for third-party invites.
 *
 * <p>Always UP: without an identity server, third-party invites are denied but
 * every other decision still works.
 */
@Readiness
@ApplicationScoped
public class IdentityServerHealthCheck implements HealthCheck {

    private final IdentityLookup identityLookup;
    private final RoomAccessConfig config;

    @Inject
    public IdentityServerHealthCheck(IdentityLookup identityLookup, RoomAccessConfig config) {
        this.identityLookup = identityLookup;
        this.config = config;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("identity-server")
                .up()
                .withData("configured", identityLookup.isConfigured())
                .withData("server", config.idServer().orElse("none"))
                .withData("timeout", config.identityLookupTimeout().toString())
                .build();
    }
}
