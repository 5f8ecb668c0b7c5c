package com.chicu.agentpulse.decision.gate;

import com.chicu.agentpulse.common.enums.Decision;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionGateTest {

    /**
     * Гейт из total проверок, первые passing проходят.
     */
    private static DecisionGate<String> gate(int total, int passing) {
        List<GateCheck<String>> checks = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            final boolean ok = i < passing;
            final String name = "check" + i;
            checks.add(GateCheck.of(name, s -> CheckResult.of(name, ok, ok ? "fine" : "nope")));
        }
        return new DecisionGate<>("test", checks);
    }

    @Test
    void exactlyThresholdPassing_shouldAct() {
        GateVerdict v = gate(8, 6).evaluate("x", 6);

        assertEquals(Decision.ACT, v.decision());
        assertTrue(v.accepted());
        assertEquals(6, v.passed());
        assertEquals(8, v.total());
    }

    @Test
    void oneBelowThreshold_shouldSkip() {
        GateVerdict v = gate(8, 5).evaluate("x", 6);

        assertEquals(Decision.SKIP, v.decision());
        assertFalse(v.accepted());
    }

    @Test
    void verdict_shouldKeepEveryCheckInOrder() {
        GateVerdict v = gate(4, 2).evaluate("x", 3);

        assertEquals(List.of("check0", "check1", "check2", "check3"),
                v.checks().stream().map(CheckResult::name).toList());
        assertEquals(0.5, v.confidence(), 1e-9);

        String trace = v.reasoning();
        assertTrue(trace.startsWith("test: 2/4 passed (threshold 3) -> SKIP"));
        assertTrue(trace.contains("✅ check0: fine"));
        assertTrue(trace.contains("❌ check3: nope"));
    }

    @Test
    void throwingCheck_shouldCountAsFailedNotAbort() {
        DecisionGate<String> g = new DecisionGate<>("test", List.of(
                GateCheck.of("ok", s -> CheckResult.pass("ok", "")),
                GateCheck.of("boom", s -> {
                    throw new IllegalStateException("broken");
                })
        ));

        GateVerdict v = g.evaluate("x", 1);

        assertEquals(Decision.ACT, v.decision());
        assertEquals(1, v.passed());
        CheckResult boom = v.checks().get(1);
        assertFalse(boom.passed());
        assertTrue(boom.rationale().contains("broken"));
    }

    @Test
    void emptyChecklist_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DecisionGate<String>("empty", List.of()));
    }
}
