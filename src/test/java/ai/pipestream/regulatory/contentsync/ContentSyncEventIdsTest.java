package ai.pipestream.regulatory.contentsync;

import ai.pipestream.regulatory.entity.ContentSyncEventType;
import ai.pipestream.regulatory.util.ContentHashing;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ContentSyncEventIdsTest {

    private static final UUID RULE = UUID.fromString("3f1c2a9e-8d47-4b1e-9a53-0c6e2f7d8b10");
    private static final LocalDate FROM = LocalDate.of(2025, 1, 1);

    @Test
    void testDeterministic() {
        assertEquals(ContentSyncEventIds.eventId(RULE, ContentSyncEventType.RULE_RELEASED, FROM),
                ContentSyncEventIds.eventId(RULE, ContentSyncEventType.RULE_RELEASED, FROM));
    }

    @Test
    void testMatchesCompositeKeyHash() {
        String expected = ContentHashing.sha256Hex(RULE + "|RULE_EFFECTIVE|2025-01-01");

        assertEquals(expected, ContentSyncEventIds.eventId(RULE, ContentSyncEventType.RULE_EFFECTIVE, FROM));
    }

    @Test
    void testMissingDateHashesAsEmpty() {
        String expected = ContentHashing.sha256Hex(RULE + "|SOURCE_CHANGED|");

        assertEquals(expected, ContentSyncEventIds.eventId(RULE, ContentSyncEventType.SOURCE_CHANGED, null));
    }

    @Test
    void testTypeAndDateDistinguishEvents() {
        String released = ContentSyncEventIds.eventId(RULE, ContentSyncEventType.RULE_RELEASED, FROM);

        assertNotEquals(released, ContentSyncEventIds.eventId(RULE, ContentSyncEventType.RULE_EFFECTIVE, FROM));
        assertNotEquals(released, ContentSyncEventIds.eventId(RULE, ContentSyncEventType.RULE_RELEASED,
                FROM.plusDays(1)));
    }

    @Test
    void testRequiresRuleAndType() {
        assertThrows(NullPointerException.class,
                () -> ContentSyncEventIds.eventId(null, ContentSyncEventType.RULE_RELEASED, FROM));
        assertThrows(NullPointerException.class, () -> ContentSyncEventIds.eventId(RULE, null, FROM));
    }
}
