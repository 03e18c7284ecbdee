package roomaccess.adapter.out.identity;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import roomaccess.core.config.RoomAccessConfig;
import roomaccess.core.port.out.IdentityLookup;

/**
 * Resolves third-party addresses through an identity server.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET /_matrix/identity/api/v1/info?medium=email&address=alice@example.org
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * {
 *   "hs": "example.org"
 * }
 * }</pre>
 *
 * <p>An empty object means the address is not bound to any homeserver. No retries
 * are made; a timeout or error response fails the lookup.
 */
@ApplicationScoped
public class IdentityServerLookupClient implements IdentityLookup {

    private static final Logger LOG = Logger.getLogger(IdentityServerLookupClient.class);

    static final String INFO_PATH = "/_matrix/identity/api/v1/info";
    static final String HOMESERVER_FIELD = "hs";

    private final WebClient webClient;
    private final Optional<String> baseUrl;
    private final long timeoutMillis;

    @Inject
    public IdentityServerLookupClient(Vertx vertx, RoomAccessConfig config) {
        this.webClient = WebClient.create(vertx);
        this.baseUrl =
                config.idServer().filter(server -> !server.isBlank()).map(IdentityServerLookupClient::toBaseUrl);
        this.timeoutMillis = config.identityLookupTimeout().toMillis();
    }

    @Override
    public boolean isConfigured() {
        return baseUrl.isPresent();
    }

    @Override
    public Uni<Optional<String>> lookupHomeserver(String medium, String address) {
        if (baseUrl.isEmpty()) {
            return Uni.createFrom().failure(new IdentityLookupException("No identity server configured"));
        }
        final var url = baseUrl.get() + INFO_PATH;
        final var startTime = System.currentTimeMillis();

        LOG.debugf("Looking up %s address on identity server %s", medium, url);

        return webClient
                .getAbs(url)
                .addQueryParam("medium", medium)
                .addQueryParam("address", address)
                .timeout(timeoutMillis)
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> {
                    final var duration = System.currentTimeMillis() - startTime;
                    if (response.statusCode() != 200) {
                        LOG.warnf(
                                "Identity lookup failed: url=%s, status=%d, duration=%dms",
                                url, response.statusCode(), duration);
                        throw new IdentityLookupException(
                                "Identity server returned status " + response.statusCode());
                    }
                    final var homeserver = parseHomeserver(response.bodyAsString());
                    LOG.debugf("Identity lookup success: url=%s, hs=%s, duration=%dms", url, homeserver, duration);
                    return homeserver;
                })
                .onFailure(failure -> !(failure instanceof IdentityLookupException))
                .transform(failure ->
                        new IdentityLookupException("Identity lookup failed: " + failure.getMessage(), failure));
    }

    private static Optional<String> parseHomeserver(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        final JsonObject json;
        try {
            json = new JsonObject(body);
        } catch (RuntimeException e) {
            throw new IdentityLookupException("Identity server returned an invalid body", e);
        }
        final var homeserver = json.getValue(HOMESERVER_FIELD);
        if (homeserver instanceof String value && !value.isBlank()) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    static String toBaseUrl(String idServer) {
        final var trimmed = idServer.strip();
        final var withScheme = trimmed.contains("://") ? trimmed : "https://" + trimmed;
        return withScheme.endsWith("/") ? withScheme.substring(0, withScheme.length() - 1) : withScheme;
    }

    /**
     * Exception thrown when an identity lookup cannot be completed.
     */
    public static class IdentityLookupException extends RuntimeException {
        public IdentityLookupException(String message) {
            super(message);
        }

        public IdentityLookupException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
