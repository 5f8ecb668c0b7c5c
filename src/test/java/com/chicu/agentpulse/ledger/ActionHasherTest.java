package com.chicu.agentpulse.ledger;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.journal.ActionRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionHasherTest {

    private final ActionHasher hasher = new ActionHasher();
    private final Instant ts = Instant.parse("2026-02-10T12:00:00.123456Z");

    @Test
    void hash_shouldBeSha256Hex() {
        String h = hasher.hash(ActionType.VOTE, "Voted for X", ts, Map.of("projectId", 42));
        assertTrue(h.matches("[0-9a-f]{64}"));
    }

    @Test
    void hash_shouldNotDependOnMetadataKeyOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("b", 2);
        a.put("a", Map.of("y", 1, "x", 2));
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("a", Map.of("x", 2, "y", 1));
        b.put("b", 2);

        assertEquals(hasher.hash(ActionType.VOTE, "s", ts, a), hasher.hash(ActionType.VOTE, "s", ts, b));
    }

    @Test
    void hash_shouldIgnoreWhitespaceNoiseAndSubMillis() {
        String h1 = hasher.hash(ActionType.FORUM_POST, "  Hello   world ", ts, Map.of());
        String h2 = hasher.hash(ActionType.FORUM_POST, "Hello world", Instant.parse("2026-02-10T12:00:00.123Z"), null);
        assertEquals(h1, h2);
    }

    @Test
    void hash_shouldChangeWhenAnyFieldChanges() {
        String base = hasher.hash(ActionType.VOTE, "s", ts, Map.of("k", 1));

        assertNotEquals(base, hasher.hash(ActionType.FORUM_POST, "s", ts, Map.of("k", 1)));
        assertNotEquals(base, hasher.hash(ActionType.VOTE, "s2", ts, Map.of("k", 1)));
        assertNotEquals(base, hasher.hash(ActionType.VOTE, "s", ts.plusSeconds(1), Map.of("k", 1)));
        assertNotEquals(base, hasher.hash(ActionType.VOTE, "s", ts, Map.of("k", 2)));
    }

    @Test
    void verify_shouldRecomputeFromStoredRecord() {
        Map<String, Object> meta = Map.of("projectId", 42, "finalScore", 6.8);
        Instant created = ActionHasher.normalizeTimestamp(ts);

        ActionRecord ok = ActionRecord.builder()
                .actionId("a1")
                .type(ActionType.VOTE)
                .summary("Voted")
                .metadataJson(hasher.canonicalMetadataJson(meta))
                .createdAt(created)
                .contentHash(hasher.hash(ActionType.VOTE, "Voted", created, meta))
                .outcome(ActionOutcome.SUCCESS)
                .build();
        assertTrue(hasher.verify(ok));

        ActionRecord tampered = ActionRecord.builder()
                .actionId("a2")
                .type(ActionType.VOTE)
                .summary("Voted for someone else")
                .metadataJson(ok.getMetadataJson())
                .createdAt(created)
                .contentHash(ok.getContentHash())
                .outcome(ActionOutcome.SUCCESS)
                .build();
        assertFalse(hasher.verify(tampered));
    }

    @Test
    void normalizeSummary_shouldCapLength() {
        String longText = "x".repeat(ActionRecord.SUMMARY_MAX + 50);
        assertEquals(ActionRecord.SUMMARY_MAX, ActionHasher.normalizeSummary(longText).length());
        assertEquals("", ActionHasher.normalizeSummary(null));
    }

    @Test
    void prefix_shouldTakeLeadingChars() {
        String h = hasher.hash(ActionType.VOTE, "s", ts, Map.of());
        assertEquals(h.substring(0, 16), ActionHasher.prefix(h));
        assertEquals(h.substring(0, 8), ActionHasher.prefix(h, 8));
        assertNull(ActionHasher.prefix(null));
    }
}
