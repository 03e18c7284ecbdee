package roomaccess.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AccessRule")
class AccessRuleTest {

    @Test
    @DisplayName("should parse wire values")
    void shouldParseWireValues() {
        assertEquals(Optional.of(AccessRule.RESTRICTED), AccessRule.fromValue("restricted"));
        assertEquals(Optional.of(AccessRule.UNRESTRICTED), AccessRule.fromValue("unrestricted"));
        assertEquals(Optional.of(AccessRule.DIRECT), AccessRule.fromValue("direct"));
    }

    @Test
    @DisplayName("should not parse unknown or differently cased values")
    void shouldRejectUnknownValues() {
        assertTrue(AccessRule.fromValue("public").isEmpty());
        assertTrue(AccessRule.fromValue("RESTRICTED").isEmpty());
        assertTrue(AccessRule.fromValue(null).isEmpty());
    }

    @Test
    @DisplayName("should expose the state event type")
    void shouldExposeEventType() {
        assertEquals("im.vector.room.access_rules", AccessRule.EVENT_TYPE);
        assertEquals("rule", AccessRule.CONTENT_KEY);
    }
}
