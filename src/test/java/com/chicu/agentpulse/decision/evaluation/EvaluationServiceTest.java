package com.chicu.agentpulse.decision.evaluation;

import com.chicu.agentpulse.common.enums.Decision;
import com.chicu.agentpulse.decision.voting.ProjectEvaluation;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({EvaluationService.class, EvaluationServiceTest.Config.class})
class EvaluationServiceTest {

    @TestConfiguration
    static class Config {
        @Bean
        @Primary
        Clock fixedTestClock() {
            return Clock.fixed(Instant.parse("2026-02-10T12:00:00Z"), ZoneOffset.UTC);
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    EvaluationService service;
    @Autowired
    EvaluationRepository repo;

    private static ProjectEvaluation eval(String subjectId, double finalScore, Decision d) {
        return ProjectEvaluation.builder()
                .subjectId(subjectId)
                .subjectName("Project " + subjectId)
                .objectiveScore(7.0)
                .modelScore(5.0)
                .finalScore(finalScore)
                .breakdown(Map.of("objective.repo", 2.0))
                .reasoning("trace " + finalScore)
                .decision(d)
                .confidence(75)
                .threshold(5.5)
                .strategyVersion(1)
                .build();
    }

    @Test
    void reevaluation_shouldOverwriteInsteadOfDuplicating() {
        service.upsert(eval("42", 5.0, Decision.SKIP));
        service.upsert(eval("42", 6.1, Decision.ACT));

        assertEquals(1, repo.count());
        EvaluationEntity row = repo.findBySubjectId("42").orElseThrow();
        assertEquals(Decision.ACT, row.getDecision());
        assertEquals(0, row.getFinalScore().compareTo(new java.math.BigDecimal("6.10")));
        assertEquals(EvaluationState.EVALUATED, row.getState());
    }

    @Test
    void actedSubject_shouldNeverBeOverwritten() {
        service.upsert(eval("7", 6.8, Decision.ACT));
        assertTrue(service.markActed("7", "a".repeat(32)));

        EvaluationEntity kept = service.upsert(eval("7", 2.0, Decision.SKIP));

        assertEquals(EvaluationState.ACTED, kept.getState());
        assertEquals(Decision.ACT, kept.getDecision());
        assertTrue(service.isActed("7"));
        assertTrue(service.actedSubjectIds().contains("7"));
        assertEquals(1, service.countActed());
    }

    @Test
    void markActed_twice_shouldBeNoOp() {
        service.upsert(eval("9", 7.0, Decision.ACT));

        assertTrue(service.markActed("9", "b".repeat(32)));
        assertFalse(service.markActed("9", "c".repeat(32)));
        assertEquals("b".repeat(32), repo.findBySubjectId("9").orElseThrow().getActionId());
    }

    @Test
    void markActed_withoutEvaluation_shouldFail() {
        assertThrows(IllegalStateException.class, () -> service.markActed("missing", null));
    }
}
