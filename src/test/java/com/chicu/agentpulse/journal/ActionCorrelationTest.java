package com.chicu.agentpulse.journal;

import com.chicu.agentpulse.common.enums.ActionType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionCorrelationTest {

    @Test
    void newActionId_shouldReturnLowerHex32_withoutDashes() {
        String id = ActionCorrelation.newActionId();

        assertNotNull(id);
        assertEquals(32, id.length(), "должно быть 32 символа (uuid без '-')");
        assertTrue(id.matches("[0-9a-f]{32}"), "должен быть hex 32");
    }

    @Test
    void subjectKey_shouldBeTypeKindId() {
        assertEquals("VOTE:project:42", ActionCorrelation.subjectKey(ActionType.VOTE, "project", "42"));
        assertEquals("FORUM_POST:insight:top-tools",
                ActionCorrelation.subjectKey(ActionType.FORUM_POST, " Insight ", "top tools"));
    }

    @Test
    void subjectKey_withoutKind_shouldSkipSegment() {
        assertEquals("VOTE:42", ActionCorrelation.subjectKey(ActionType.VOTE, null, "42"));
    }

    @Test
    void subjectKey_shouldRejectBlankId() {
        assertThrows(IllegalArgumentException.class,
                () -> ActionCorrelation.subjectKey(ActionType.VOTE, "project", "  "));
    }

    @Test
    void extractSubjectId_shouldReturnLastSegment() {
        assertEquals("42", ActionCorrelation.extractSubjectId("VOTE:project:42"));
        assertNull(ActionCorrelation.extractSubjectId(null));
        assertNull(ActionCorrelation.extractSubjectId("   "));
    }
}
