package roomaccess.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import roomaccess.core.config.RoomAccessConfig;
import roomaccess.core.model.AccessRule;
import roomaccess.core.port.out.AccessDecisionMetrics;

/**
 * Metrics for access decisions.
 *
 * <p>Records {@code room_access.decisions}, tagged by:
 * <ul>
 *   <li>{@code kind} - create, invite or third_party_invite</li>
 *   <li>{@code rule} - the rule in effect, or "none"</li>
 *   <li>{@code outcome} - allowed, denied, rejected or identity_lookup_failure</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAccessDecisionMetrics implements AccessDecisionMetrics {

    static final String DECISIONS = "room_access.decisions";

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAccessDecisionMetrics(MeterRegistry registry, RoomAccessConfig config) {
        this.registry = registry;
        this.enabled = config.metrics().enabled();
    }

    @Override
    public void recordDecision(Kind kind, AccessRule rule, Outcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder(DECISIONS)
                .description("Room access decisions")
                .tag("kind", tagValue(kind))
                .tag("rule", rule != null ? rule.value() : "none")
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
