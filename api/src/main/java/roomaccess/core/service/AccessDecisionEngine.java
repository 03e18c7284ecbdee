package roomaccess.core.service;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import roomaccess.core.model.AccessDecision;
import roomaccess.core.model.AccessRule;
import roomaccess.core.model.Membership;
import roomaccess.core.model.MembershipChangeRequest;
import roomaccess.core.model.RoomCreationRequest;
import roomaccess.core.model.RuleResolution;
import roomaccess.core.model.ThirdPartyInviteRequest;
import roomaccess.core.model.UserId;
import roomaccess.core.port.in.RoomAccessRules;
import roomaccess.core.port.out.AccessDecisionMetrics;
import roomaccess.core.port.out.AccessDecisionMetrics.Kind;
import roomaccess.core.port.out.AccessDecisionMetrics.Outcome;

/**
 * Entry point for the room access rules.
 *
 * <p>Room creation is checked by {@link RuleValidator}. Invites are dispatched on
 * the room's current rule:
 * <ul>
 *   <li>{@code restricted}: {@link DomainPolicy} on the target's server</li>
 *   <li>{@code unrestricted}: always allowed</li>
 *   <li>{@code direct}: {@link DirectRoomInvariant} on the membership history</li>
 * </ul>
 *
 * <p>Other membership changes pass through without reading state. The engine never
 * writes; the host commits whatever is allowed.
 */
@ApplicationScoped
public class AccessDecisionEngine implements RoomAccessRules {

    private static final Logger LOG = Logger.getLogger(AccessDecisionEngine.class);

    static final String TARGET_SERVER_NOT_PERMITTED = "target server is not permitted";
    static final String DIRECT_ROOM_CLOSED = "direct rooms are limited to their original participants";

    private final RuleValidator ruleValidator;
    private final DomainPolicy domainPolicy;
    private final DirectRoomInvariant directRoomInvariant;
    private final RuleStore ruleStore;
    private final IdentityLookupGate identityLookupGate;
    private final AccessDecisionMetrics metrics;

    @Inject
    public AccessDecisionEngine(
            RuleValidator ruleValidator,
            DomainPolicy domainPolicy,
            DirectRoomInvariant directRoomInvariant,
            RuleStore ruleStore,
            IdentityLookupGate identityLookupGate,
            AccessDecisionMetrics metrics) {
        this.ruleValidator = ruleValidator;
        this.domainPolicy = domainPolicy;
        this.directRoomInvariant = directRoomInvariant;
        this.ruleStore = ruleStore;
        this.identityLookupGate = identityLookupGate;
        this.metrics = metrics;
    }

    @Override
    public Uni<RuleResolution> onRoomCreate(RoomCreationRequest request) {
        return Uni.createFrom().item(() -> resolveRule(request));
    }

    private RuleResolution resolveRule(RoomCreationRequest request) {
        Optional<AccessRule> requested = Optional.empty();
        final var ruleEvent = request.accessRuleEvent();
        if (ruleEvent.isPresent()) {
            final var raw = ruleEvent.get().content().get(AccessRule.CONTENT_KEY);
            requested = AccessRule.fromValue(raw instanceof String value ? value : null);
            if (requested.isEmpty()) {
                LOG.infof("Rejected room creation by %s: unknown access rule %s", request.creator(), raw);
                metrics.recordDecision(Kind.CREATE, null, Outcome.REJECTED);
                return RuleResolution.rejected("Invalid access rule: " + raw);
            }
        }

        final var resolution = ruleValidator.resolveInitialRule(request.isDirect(), requested);
        if (resolution instanceof RuleResolution.Resolved resolved) {
            directRoomInvariant.checkInitialInvitees(request);
            LOG.debugf(
                    "Assigned access rule %s to room created by %s (direct=%s)",
                    resolved.rule().value(), request.creator(), request.isDirect());
            metrics.recordDecision(Kind.CREATE, resolved.rule(), Outcome.ALLOWED);
        } else if (resolution instanceof RuleResolution.Rejected rejected) {
            LOG.infof("Rejected room creation by %s: %s", request.creator(), rejected.reason());
            metrics.recordDecision(Kind.CREATE, requested.orElse(null), Outcome.REJECTED);
        }
        return resolution;
    }

    @Override
    public Uni<AccessDecision> onMembershipEvent(MembershipChangeRequest request) {
        if (request.membership() != Membership.INVITE) {
            return Uni.createFrom().item(AccessDecision.allowed());
        }

        final UserId target;
        try {
            target = UserId.parse(request.target());
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }

        return ruleStore.currentRule(request.roomId())
                .flatMap(rule -> evaluateInvite(request, target, rule)
                        .invoke(decision -> record(Kind.INVITE, request.roomId(), request.target(), rule, decision)));
    }

    private Uni<AccessDecision> evaluateInvite(MembershipChangeRequest request, UserId target, AccessRule rule) {
        return switch (rule) {
            case RESTRICTED -> Uni.createFrom()
                    .item(
                            domainPolicy.isDomainAllowed(target.serverName(), rule)
                                    ? AccessDecision.allowed()
                                    : AccessDecision.denied(TARGET_SERVER_NOT_PERMITTED));
            case UNRESTRICTED -> Uni.createFrom().item(AccessDecision.allowed());
            case DIRECT -> evaluateDirectInvite(request);
        };
    }

    private Uni<AccessDecision> evaluateDirectInvite(MembershipChangeRequest request) {
        final var roomId = request.roomId();
        return Uni.combine()
                .all()
                .unis(ruleStore.creator(roomId), ruleStore.membershipHistory(roomId))
                .asTuple()
                .map(state -> directRoomInvariant.isInviteAllowed(
                                roomId, state.getItem1(), request.sender(), request.target(), state.getItem2())
                        ? AccessDecision.allowed()
                        : AccessDecision.denied(DIRECT_ROOM_CLOSED));
    }

    @Override
    public Uni<AccessDecision> onThirdPartyInvite(ThirdPartyInviteRequest request) {
        return identityLookupGate.isThirdPartyInviteAllowed(request);
    }

    private void record(Kind kind, String roomId, String target, AccessRule rule, AccessDecision decision) {
        if (decision instanceof AccessDecision.Denied denied) {
            LOG.infof("Denied %s of %s into %s room %s: %s", kind, target, rule.value(), roomId, denied.reason());
            metrics.recordDecision(kind, rule, Outcome.DENIED);
        } else {
            LOG.debugf("Allowed %s of %s into %s room %s", kind, target, rule.value(), roomId);
            metrics.recordDecision(kind, rule, Outcome.ALLOWED);
        }
    }
}
