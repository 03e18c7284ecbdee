package roomaccess.core.service;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import roomaccess.core.config.RoomAccessConfig;
import roomaccess.core.model.AccessDecision;
import roomaccess.core.model.AccessRule;
import roomaccess.core.model.ThirdPartyInviteRequest;
import roomaccess.core.port.out.AccessDecisionMetrics;
import roomaccess.core.port.out.AccessDecisionMetrics.Kind;
import roomaccess.core.port.out.AccessDecisionMetrics.Outcome;
import roomaccess.core.port.out.IdentityLookup;

/**
 * Applies the access rules to third-party (email, phone) invites.
 *
 * <p>The address is first resolved to a homeserver through the identity server.
 * That lookup happens whatever the room's rule is, and any failure to complete it
 * denies the invite.
 */
@ApplicationScoped
public class IdentityLookupGate {

    private static final Logger LOG = Logger.getLogger(IdentityLookupGate.class);

    static final String IDENTITY_LOOKUP_FAILED = "identity lookup failed";

    private final IdentityLookup identityLookup;
    private final DomainPolicy domainPolicy;
    private final DirectRoomInvariant directRoomInvariant;
    private final RuleStore ruleStore;
    private final AccessDecisionMetrics metrics;
    private final Duration timeout;

    @Inject
    public IdentityLookupGate(
            IdentityLookup identityLookup,
            DomainPolicy domainPolicy,
            DirectRoomInvariant directRoomInvariant,
            RuleStore ruleStore,
            AccessDecisionMetrics metrics,
            RoomAccessConfig config) {
        this.identityLookup = identityLookup;
        this.domainPolicy = domainPolicy;
        this.directRoomInvariant = directRoomInvariant;
        this.ruleStore = ruleStore;
        this.metrics = metrics;
        this.timeout = config.identityLookupTimeout();
    }

    /**
     * Decide whether a third-party invite may be sent.
     *
     * @param request the invite
     * @return Uni with the decision
     */
    public Uni<AccessDecision> isThirdPartyInviteAllowed(ThirdPartyInviteRequest request) {
        if (!identityLookup.isConfigured()) {
            LOG.warnf(
                    "Denied third-party invite into %s: no identity server configured", request.roomId());
            metrics.recordDecision(Kind.THIRD_PARTY_INVITE, null, Outcome.IDENTITY_LOOKUP_FAILURE);
            return Uni.createFrom().item(AccessDecision.denied(IDENTITY_LOOKUP_FAILED));
        }

        return identityLookup
                .lookupHomeserver(request.medium(), request.address())
                .ifNoItem()
                .after(timeout)
                .fail()
                .onItemOrFailure()
                .transformToUni((homeserver, failure) -> {
                    if (failure != null) {
                        LOG.warnf(
                                failure,
                                "Denied third-party invite into %s: identity lookup of %s failed",
                                request.roomId(),
                                request.medium());
                        metrics.recordDecision(Kind.THIRD_PARTY_INVITE, null, Outcome.IDENTITY_LOOKUP_FAILURE);
                        return Uni.createFrom().item(AccessDecision.denied(IDENTITY_LOOKUP_FAILED));
                    }
                    return evaluate(request, homeserver);
                });
    }

    private Uni<AccessDecision> evaluate(ThirdPartyInviteRequest request, Optional<String> homeserver) {
        final var roomId = request.roomId();
        return ruleStore.currentRule(roomId).flatMap(rule -> decide(request, rule, homeserver)
                .invoke(decision -> {
                    if (decision instanceof AccessDecision.Denied denied) {
                        LOG.infof(
                                "Denied third-party invite into %s room %s: %s", rule.value(), roomId, denied.reason());
                        metrics.recordDecision(Kind.THIRD_PARTY_INVITE, rule, Outcome.DENIED);
                    } else {
                        LOG.debugf("Allowed third-party invite into %s room %s", rule.value(), roomId);
                        metrics.recordDecision(Kind.THIRD_PARTY_INVITE, rule, Outcome.ALLOWED);
                    }
                }));
    }

    private Uni<AccessDecision> decide(ThirdPartyInviteRequest request, AccessRule rule, Optional<String> homeserver) {
        return switch (rule) {
            case RESTRICTED -> Uni.createFrom()
                    .item(homeserver
                                    .map(server -> domainPolicy.isDomainAllowed(server, rule))
                                    .orElse(true)
                            ? AccessDecision.allowed()
                            : AccessDecision.denied(AccessDecisionEngine.TARGET_SERVER_NOT_PERMITTED));
            case UNRESTRICTED -> Uni.createFrom().item(AccessDecision.allowed());
            case DIRECT -> Uni.combine()
                    .all()
                    .unis(ruleStore.creator(request.roomId()), ruleStore.membershipHistory(request.roomId()))
                    .asTuple()
                    .map(state -> directRoomInvariant.isThirdPartyInviteAllowed(state.getItem1(), state.getItem2())
                            ? AccessDecision.allowed()
                            : AccessDecision.denied(AccessDecisionEngine.DIRECT_ROOM_CLOSED));
        };
    }
}
