package com.chicu.agentpulse.decision.evaluation;

import com.chicu.agentpulse.common.enums.Decision;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Одна оценка на субъект: повторная оценка перезаписывает строку.
 * ACTED — конечное состояние, такие строки больше не трогаются.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(
        name = "subject_evaluation",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_subject_evaluation_subject", columnNames = {"subject_id"})
        },
        indexes = {
                @Index(name = "ix_subject_evaluation_state", columnList = "state"),
                @Index(name = "ix_subject_evaluation_evaluated_at", columnList = "evaluated_at")
        }
)
public class EvaluationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subject_id", nullable = false, length = 64)
    private String subjectId;

    @Column(name = "subject_name", length = 255)
    private String subjectName;

    @Column(name = "objective_score", precision = 6, scale = 2)
    private BigDecimal objectiveScore;

    @Column(name = "model_score", precision = 6, scale = 2)
    private BigDecimal modelScore;

    @Column(name = "final_score", precision = 6, scale = 2)
    private BigDecimal finalScore;

    @Lob
    @Column(name = "breakdown_json")
    private String breakdownJson;

    @Lob
    @Column(name = "reasoning")
    private String reasoning;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false, length = 8)
    private Decision decision;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private EvaluationState state;

    @Column(name = "threshold_used", precision = 6, scale = 2)
    private BigDecimal thresholdUsed;

    @Column(name = "strategy_version")
    private Integer strategyVersion;

    @Column(name = "confidence")
    private Integer confidence;

    @Column(name = "evaluated_at", nullable = false)
    private Instant evaluatedAt;

    @Column(name = "acted_at")
    private Instant actedAt;

    /**
     * VOTE запись журнала.
     */
    @Column(name = "action_id", length = 32)
    private String actionId;

    @PrePersist
    @PreUpdate
    void normalize() {
        if (state == null) state = EvaluationState.EVALUATED;
        if (subjectId != null) subjectId = subjectId.trim();
    }
}
