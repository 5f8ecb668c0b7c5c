package com.chicu.agentpulse.decision.gate;

import com.chicu.agentpulse.common.enums.Decision;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Упорядоченный чек-лист: ACT, если прошло не меньше threshold проверок.
 * Упавшая с исключением проверка считается непройденной.
 */
@Slf4j
public class DecisionGate<T> {

    private final String name;
    private final List<GateCheck<T>> checks;

    public DecisionGate(String name, List<GateCheck<T>> checks) {
        if (checks == null || checks.isEmpty()) throw new IllegalArgumentException("gate '" + name + "' has no checks");
        this.name = name;
        this.checks = List.copyOf(checks);
    }

    public int size() {
        return checks.size();
    }

    public GateVerdict evaluate(T subject, int threshold) {
        List<CheckResult> results = new ArrayList<>(checks.size());
        int passed = 0;

        for (GateCheck<T> check : checks) {
            CheckResult r;
            try {
                r = check.evaluate(subject);
                if (r == null) r = CheckResult.fail(check.name(), "no result");
            } catch (RuntimeException e) {
                log.warn("⚖ gate={} check={} error: {}", name, check.name(), e.getMessage());
                r = CheckResult.fail(check.name(), "error: " + e.getMessage());
            }
            if (r.passed()) passed++;
            results.add(r);
        }

        Decision d = passed >= threshold ? Decision.ACT : Decision.SKIP;
        return new GateVerdict(name, d, passed, checks.size(), threshold, results);
    }
}
