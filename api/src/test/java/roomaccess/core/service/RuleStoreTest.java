package roomaccess.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import roomaccess.adapter.out.storage.memory.InMemoryRoomStateStore;
import roomaccess.core.model.AccessRule;
import roomaccess.core.model.MembershipEvent;
import roomaccess.core.port.out.RoomStateReader;

@DisplayName("RuleStore")
class RuleStoreTest {

    private static final String ROOM = "!room:test";
    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private InMemoryRoomStateStore stateStore;
    private RuleStore ruleStore;

    @BeforeEach
    void setUp() {
        stateStore = new InMemoryRoomStateStore();
        ruleStore = new RuleStore(stateStore);
    }

    private void put(String eventType, String stateKey, Map<String, Object> content) {
        stateStore.putState(ROOM, eventType, stateKey, content).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("currentRule()")
    class CurrentRuleTests {

        @Test
        @DisplayName("should read the resolved rule")
        void shouldReadRule() {
            put(AccessRule.EVENT_TYPE, "", Map.of("rule", "unrestricted"));

            assertEquals(AccessRule.UNRESTRICTED, ruleStore.currentRule(ROOM).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should return the latest value")
        void shouldReturnLatestValue() {
            put(AccessRule.EVENT_TYPE, "", Map.of("rule", "restricted"));
            put(AccessRule.EVENT_TYPE, "", Map.of("rule", "unrestricted"));

            assertEquals(AccessRule.UNRESTRICTED, ruleStore.currentRule(ROOM).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should fail for an unknown room")
        void shouldFailForUnknownRoom() {
            final var exception = assertThrows(
                    RoomStatePreconditionException.class,
                    () -> ruleStore.currentRule("!unknown:test").await().atMost(TIMEOUT));

            assertEquals("!unknown:test", exception.roomId());
        }

        @Test
        @DisplayName("should fail when the room has no rule yet")
        void shouldFailWithoutRule() {
            put(RuleStore.CREATE_EVENT_TYPE, "", Map.of("creator", "@kermit:test"));

            final var exception = assertThrows(
                    RoomStatePreconditionException.class,
                    () -> ruleStore.currentRule(ROOM).await().atMost(TIMEOUT));

            assertTrue(exception.getMessage().contains("no resolved access rule"));
        }

        @Test
        @DisplayName("should fail on an unreadable rule")
        void shouldFailOnUnreadableRule() {
            put(AccessRule.EVENT_TYPE, "", Map.of("rule", "public"));

            assertThrows(
                    RoomStatePreconditionException.class,
                    () -> ruleStore.currentRule(ROOM).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should wrap storage failures")
        void shouldWrapStorageFailures() {
            final var reader = mock(RoomStateReader.class);
            when(reader.roomExists(ROOM)).thenReturn(Uni.createFrom().failure(new IOException("store down")));

            final var exception = assertThrows(
                    RoomStatePreconditionException.class,
                    () -> new RuleStore(reader).currentRule(ROOM).await().atMost(TIMEOUT));

            assertInstanceOf(IOException.class, exception.getCause());
        }
    }

    @Nested
    @DisplayName("creator()")
    class CreatorTests {

        @Test
        @DisplayName("should read the creator from the create event")
        void shouldReadCreator() {
            put(RuleStore.CREATE_EVENT_TYPE, "", Map.of("creator", "@kermit:test"));

            assertEquals("@kermit:test", ruleStore.creator(ROOM).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should fail without a create event")
        void shouldFailWithoutCreateEvent() {
            put(AccessRule.EVENT_TYPE, "", Map.of("rule", "direct"));

            assertThrows(
                    RoomStatePreconditionException.class,
                    () -> ruleStore.creator(ROOM).await().atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("should read membership history in order")
    void shouldReadHistoryInOrder() {
        put(MembershipEvent.EVENT_TYPE, "@kermit:test", Map.of("membership", "join"));
        put(MembershipEvent.EVENT_TYPE, "@invitee:test", Map.of("membership", "invite", "sender", "@kermit:test"));

        final var history = ruleStore.membershipHistory(ROOM).await().atMost(TIMEOUT);

        assertEquals(
                List.of(MembershipEvent.join("@kermit:test"), MembershipEvent.invite("@kermit:test", "@invitee:test")),
                history);
    }
}
