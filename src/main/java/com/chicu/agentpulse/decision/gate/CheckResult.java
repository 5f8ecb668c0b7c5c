package com.chicu.agentpulse.decision.gate;

public record CheckResult(
        String name,
        boolean passed,
        String rationale
) {
    public static CheckResult pass(String name, String rationale) {
        return new CheckResult(name, true, rationale);
    }

    public static CheckResult fail(String name, String rationale) {
        return new CheckResult(name, false, rationale);
    }

    public static CheckResult of(String name, boolean passed, String rationale) {
        return new CheckResult(name, passed, rationale);
    }
}
