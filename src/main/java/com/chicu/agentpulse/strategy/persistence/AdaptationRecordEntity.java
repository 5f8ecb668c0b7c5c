package com.chicu.agentpulse.strategy.persistence;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Полная (неограниченная) история адаптаций стратегии.
 * Последняя строка = текущая версия после рестарта.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(
        name = "strategy_adaptation",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_strategy_adaptation_to_version", columnNames = {"to_version"})
        },
        indexes = {
                @Index(name = "ix_strategy_adaptation_created", columnList = "created_at")
        }
)
public class AdaptationRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "from_version", nullable = false)
    private Integer fromVersion;

    @Column(name = "to_version", nullable = false)
    private Integer toVersion;

    @Lob
    @Column(name = "changes_json", nullable = false)
    private String changesJson;

    @Lob
    @Column(name = "metrics_json")
    private String metricsJson;

    /**
     * Полный набор параметров после применения.
     */
    @Lob
    @Column(name = "parameters_json", nullable = false)
    private String parametersJson;

    @Column(name = "performance_score", precision = 6, scale = 2)
    private BigDecimal performanceScore;

    @Column(name = "summary", length = 1000)
    private String summary;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (summary != null && summary.length() > 1000) summary = summary.substring(0, 1000);
    }
}
