package roomaccess.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import roomaccess.adapter.out.storage.memory.InMemoryRoomStateStore;
import roomaccess.core.config.RoomAccessConfig;
import roomaccess.core.model.AccessDecision;
import roomaccess.core.model.AccessRule;
import roomaccess.core.model.MembershipEvent;
import roomaccess.core.model.ThirdPartyInviteRequest;
import roomaccess.core.port.out.AccessDecisionMetrics;
import roomaccess.core.port.out.AccessDecisionMetrics.Kind;
import roomaccess.core.port.out.AccessDecisionMetrics.Outcome;
import roomaccess.core.port.out.IdentityLookup;

@DisplayName("IdentityLookupGate")
@ExtendWith(MockitoExtension.class)
class IdentityLookupGateTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);
    private static final String CREATOR = "@kermit:test";
    private static final String ADDRESS = "someone@example.org";

    @Mock
    private RoomAccessConfig config;

    @Mock
    private IdentityLookup identityLookup;

    @Mock
    private AccessDecisionMetrics metrics;

    private InMemoryRoomStateStore stateStore;
    private IdentityLookupGate gate;

    @BeforeEach
    void setUp() {
        lenient().when(config.domainsForbiddenWhenRestricted()).thenReturn(Optional.of(Set.of("forbidden_domain")));
        lenient().when(config.identityLookupTimeout()).thenReturn(Duration.ofMillis(200));
        lenient().when(identityLookup.isConfigured()).thenReturn(true);

        stateStore = new InMemoryRoomStateStore();
        final var ruleStore = new RuleStore(stateStore);
        gate = new IdentityLookupGate(
                identityLookup, new DomainPolicy(config), new DirectRoomInvariant(), ruleStore, metrics, config);
    }

    private String room(AccessRule rule) {
        final var roomId = "!" + rule.value() + ":test";
        stateStore.putState(roomId, "m.room.create", "", Map.of("creator", CREATOR)).await().atMost(TIMEOUT);
        stateStore.putState(roomId, AccessRule.EVENT_TYPE, "", Map.of("rule", rule.value())).await().atMost(TIMEOUT);
        stateStore.putState(roomId, MembershipEvent.EVENT_TYPE, CREATOR, Map.of("membership", "join"))
                .await()
                .atMost(TIMEOUT);
        return roomId;
    }

    private void lookupReturns(String homeserver) {
        when(identityLookup.lookupHomeserver("email", ADDRESS))
                .thenReturn(Uni.createFrom().item(Optional.ofNullable(homeserver)));
    }

    private AccessDecision check(String roomId) {
        return gate.isThirdPartyInviteAllowed(new ThirdPartyInviteRequest(roomId, CREATOR, "email", ADDRESS))
                .await()
                .atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("fail-closed")
    class FailClosedTests {

        @Test
        @DisplayName("should deny when the lookup fails, even in an unrestricted room")
        void shouldDenyOnLookupFailure() {
            final var roomId = room(AccessRule.UNRESTRICTED);
            when(identityLookup.lookupHomeserver(anyString(), anyString()))
                    .thenReturn(Uni.createFrom().failure(new ConnectException("Connection refused")));

            final var denied = assertInstanceOf(AccessDecision.Denied.class, check(roomId));

            assertEquals("identity lookup failed", denied.reason());
            assertEquals(403, denied.suggestedStatusCode());
            verify(metrics).recordDecision(Kind.THIRD_PARTY_INVITE, null, Outcome.IDENTITY_LOOKUP_FAILURE);
            verify(metrics, never()).recordDecision(any(), any(), eq(Outcome.DENIED));
        }

        @Test
        @DisplayName("should deny when the lookup times out")
        void shouldDenyOnTimeout() {
            final var roomId = room(AccessRule.UNRESTRICTED);
            when(identityLookup.lookupHomeserver(anyString(), anyString()))
                    .thenReturn(Uni.createFrom().nothing());

            assertInstanceOf(AccessDecision.Denied.class, check(roomId));
            verify(metrics).recordDecision(Kind.THIRD_PARTY_INVITE, null, Outcome.IDENTITY_LOOKUP_FAILURE);
        }

        @Test
        @DisplayName("should deny without calling the lookup when no identity server is configured")
        void shouldDenyWhenNotConfigured() {
            final var roomId = room(AccessRule.UNRESTRICTED);
            when(identityLookup.isConfigured()).thenReturn(false);

            assertInstanceOf(AccessDecision.Denied.class, check(roomId));
            verify(identityLookup, never()).lookupHomeserver(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("restricted rooms")
    class RestrictedTests {

        @Test
        @DisplayName("should deny an address bound to a forbidden server")
        void shouldDenyForbiddenServer() {
            final var roomId = room(AccessRule.RESTRICTED);
            lookupReturns("forbidden_domain");

            final var denied = assertInstanceOf(AccessDecision.Denied.class, check(roomId));

            assertEquals("target server is not permitted", denied.reason());
            verify(metrics).recordDecision(Kind.THIRD_PARTY_INVITE, AccessRule.RESTRICTED, Outcome.DENIED);
        }

        @Test
        @DisplayName("should allow an address bound to another server")
        void shouldAllowOtherServer() {
            final var roomId = room(AccessRule.RESTRICTED);
            lookupReturns("not_forbidden_domain");

            assertTrue(check(roomId).isAllowed());
        }

        @Test
        @DisplayName("should allow an address not bound to any server")
        void shouldAllowUnboundAddress() {
            final var roomId = room(AccessRule.RESTRICTED);
            lookupReturns(null);

            assertTrue(check(roomId).isAllowed());
        }
    }

    @Test
    @DisplayName("should allow any resolved server in an unrestricted room")
    void shouldAllowInUnrestrictedRoom() {
        final var roomId = room(AccessRule.UNRESTRICTED);
        lookupReturns("forbidden_domain");

        assertTrue(check(roomId).isAllowed());
    }

    @Nested
    @DisplayName("direct rooms")
    class DirectTests {

        @Test
        @DisplayName("should allow while the second participant is unknown")
        void shouldAllowWhileOpen() {
            final var roomId = room(AccessRule.DIRECT);
            lookupReturns("test");

            assertTrue(check(roomId).isAllowed());
        }

        @Test
        @DisplayName("should deny once the room has its participants")
        void shouldDenyWhenClosed() {
            final var roomId = room(AccessRule.DIRECT);
            stateStore.putState(roomId, MembershipEvent.EVENT_TYPE, "@invitee:test", Map.of("membership", "invite"))
                    .await()
                    .atMost(TIMEOUT);
            lookupReturns("test");

            final var denied = assertInstanceOf(AccessDecision.Denied.class, check(roomId));

            assertEquals("direct rooms are limited to their original participants", denied.reason());
        }
    }

    @Test
    @DisplayName("should report a state failure instead of denying")
    void shouldPropagateStateFailure() {
        lookupReturns("test");

        assertThrows(RoomStatePreconditionException.class, () -> check("!unknown:test"));
    }
}
