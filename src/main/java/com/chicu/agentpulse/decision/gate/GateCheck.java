package com.chicu.agentpulse.decision.gate;

import java.util.function.Function;

/**
 * Именованная проверка над типизированным субъектом.
 */
public interface GateCheck<T> {

    String name();

    CheckResult evaluate(T subject);

    static <T> GateCheck<T> of(String name, Function<T, CheckResult> fn) {
        return new GateCheck<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public CheckResult evaluate(T subject) {
                return fn.apply(subject);
            }
        };
    }
}
