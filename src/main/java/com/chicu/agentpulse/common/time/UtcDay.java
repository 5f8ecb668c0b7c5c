package com.chicu.agentpulse.common.time;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Дневные лимиты считаются по календарному дню UTC.
 */
public final class UtcDay {

    private UtcDay() {
    }

    public static Instant startOf(Instant now) {
        return now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
    }
}
