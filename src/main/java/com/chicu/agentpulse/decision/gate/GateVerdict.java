package com.chicu.agentpulse.decision.gate;

import com.chicu.agentpulse.common.enums.Decision;

import java.util.List;

/**
 * Итог чек-листа. Хранит каждую проверку, а не только сумму.
 */
public record GateVerdict(
        String gate,
        Decision decision,
        int passed,
        int total,
        int threshold,
        List<CheckResult> checks
) {
    public GateVerdict {
        checks = List.copyOf(checks);
    }

    public boolean accepted() {
        return decision == Decision.ACT;
    }

    /**
     * passed / total.
     */
    public double confidence() {
        return total == 0 ? 0.0 : (double) passed / total;
    }

    public String reasoning() {
        StringBuilder sb = new StringBuilder();
        sb.append(gate).append(": ").append(passed).append('/').append(total)
                .append(" passed (threshold ").append(threshold).append(") -> ").append(decision)
                .append('\n');
        for (CheckResult c : checks) {
            sb.append(c.passed() ? "✅ " : "❌ ").append(c.name());
            if (c.rationale() != null && !c.rationale().isBlank()) sb.append(": ").append(c.rationale());
            sb.append('\n');
        }
        return sb.toString().trim();
    }
}
