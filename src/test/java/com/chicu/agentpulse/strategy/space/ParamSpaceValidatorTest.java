package com.chicu.agentpulse.strategy.space;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParamSpaceValidatorTest {

    @Test
    void unknownParameter_shouldBeDenied() {
        ValidatedParam v = ParamSpaceValidator.validate("maxVotesPerDay", 100);

        assertFalse(v.allowed());
        assertEquals("parameter is not adaptable", v.reason());
        assertFalse(ParamSpaceValidator.validate(null, 5).allowed());
    }

    @Test
    void intParameter_shouldAcceptOnlyExactIntegersInRange() {
        assertEquals(7, ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, 7).value());
        assertEquals(7, ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, "7").value());
        assertEquals(7, ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, 7.0).value());
        assertEquals(4, ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, 4).value());
        assertEquals(8, ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, 8).value());

        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, 7.5).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, 3).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, 9).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, "seven").allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, true).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, null).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_QUALITY_SCORE, List.of(6)).allowed());
    }

    @Test
    void hourAndDailyActions_shouldRespectTheirRanges() {
        assertTrue(ParamSpaceValidator.validate(ParamSpace.OPTIMAL_HOUR, 0).allowed());
        assertTrue(ParamSpaceValidator.validate(ParamSpace.OPTIMAL_HOUR, 23).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.OPTIMAL_HOUR, 24).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.OPTIMAL_HOUR, -1).allowed());

        assertTrue(ParamSpaceValidator.validate(ParamSpace.MAX_DAILY_ACTIONS, 2).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MAX_DAILY_ACTIONS, 1).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MAX_DAILY_ACTIONS, 50).allowed());
    }

    @Test
    void decimalParameter_shouldRejectNonFiniteValues() {
        assertEquals(6.5, ParamSpaceValidator.validate(ParamSpace.MIN_VOTE_SCORE, 6.5).value());
        assertEquals(6.5, ParamSpaceValidator.validate(ParamSpace.MIN_VOTE_SCORE, " 6.5 ").value());

        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_VOTE_SCORE, Double.NaN).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_VOTE_SCORE, Double.POSITIVE_INFINITY).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_VOTE_SCORE, "NaN").allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_VOTE_SCORE, 9.01).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.MIN_VOTE_SCORE, new BigDecimal("3.99")).allowed());
    }

    @Test
    void enumParameter_shouldBeCaseInsensitiveButStrict() {
        assertEquals("analytical", ParamSpaceValidator.validate(ParamSpace.POSTING_TONE, "ANALYTICAL").value());
        assertEquals("technical", ParamSpaceValidator.validate(ParamSpace.INSIGHT_FOCUS, " Technical ").value());

        assertFalse(ParamSpaceValidator.validate(ParamSpace.POSTING_TONE, "aggressive").allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.POSTING_TONE, 1).allowed());
        assertFalse(ParamSpaceValidator.validate(ParamSpace.INSIGHT_FOCUS, Map.of("v", "trends")).allowed());
    }

    @Test
    void spaceDefinition_shouldRejectBrokenItems() {
        assertThrows(IllegalArgumentException.class, () -> ParamSpaceValidator.validateOrThrow(
                ParamSpaceItem.builder().name("x").type(ParamValueType.INT)
                        .min(new BigDecimal("5")).max(new BigDecimal("1")).build()));
        assertThrows(IllegalArgumentException.class, () -> ParamSpaceValidator.validateOrThrow(
                ParamSpaceItem.builder().name("x").type(ParamValueType.INT)
                        .min(new BigDecimal("0.5")).max(new BigDecimal("1")).build()));
        assertThrows(IllegalArgumentException.class, () -> ParamSpaceValidator.validateOrThrow(
                ParamSpaceItem.builder().name("x").type(ParamValueType.ENUM).build()));
    }
}
