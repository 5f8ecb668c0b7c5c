package com.chicu.agentpulse.journal;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Запись аудита одного автономного действия.
 * <p>
 * Неизменяема после создания, кроме двух полей: {@code ledgerTxRef} и {@code outcome}.
 * Каждое из них переходит из "не задано" в "задано" не более одного раза.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Table(
        name = "action_record",
        indexes = {
                @Index(name = "ix_action_type_created", columnList = "action_type,created_at"),
                @Index(name = "ix_action_created_at", columnList = "created_at"),
                @Index(name = "ix_action_content_hash", columnList = "content_hash"),
                @Index(name = "ix_action_ledger_tx", columnList = "ledger_tx_ref")
        }
)
public class ActionRecord {

    public static final int SUMMARY_MAX = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // ==========================
    // ИДЕНТИФИКАЦИЯ
    // ==========================
    @Column(name = "action_id", nullable = false, length = 32, unique = true, updatable = false)
    private String actionId;

    /**
     * Ключ субъекта (VOTE:project:42, FORUM_POST:...). Уникален: повтор того же действия
     * после ретрая/наложения циклов превращается в no-op.
     */
    @Column(name = "subject_key", length = 160, unique = true, updatable = false)
    private String subjectKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 32, updatable = false)
    private ActionType type;

    @Column(name = "summary", nullable = false, length = SUMMARY_MAX, updatable = false)
    private String summary;

    @Lob
    @Column(name = "metadata_json", updatable = false)
    private String metadataJson;

    /**
     * Полное рассуждение. В леджер не попадает, только хэш.
     */
    @Lob
    @Column(name = "reasoning", updatable = false)
    private String reasoning;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "content_hash", nullable = false, length = 64, updatable = false)
    private String contentHash;

    // ==========================
    // ПЕРЕХОДЫ (один раз)
    // ==========================
    @Column(name = "ledger_tx_ref", length = 128)
    private String ledgerTxRef;

    @Column(name = "ledger_committed_at")
    private Instant ledgerCommittedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private ActionOutcome outcome;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    public void attachLedgerRef(String signature, Instant committedAt) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("ledger signature is blank");
        }
        if (ledgerTxRef != null) {
            throw new IllegalStateException("ledgerTxRef already set for action " + actionId);
        }
        this.ledgerTxRef = signature.trim();
        this.ledgerCommittedAt = committedAt;
    }

    public void resolveOutcome(ActionOutcome resolved, String error) {
        if (resolved == null || resolved == ActionOutcome.PENDING) {
            throw new IllegalArgumentException("outcome must be SUCCESS or FAILED");
        }
        if (outcome != ActionOutcome.PENDING) {
            throw new IllegalStateException("outcome already resolved to " + outcome + " for action " + actionId);
        }
        this.outcome = resolved;
        this.errorMessage = error;
    }

    public boolean isCommitted() {
        return ledgerTxRef != null;
    }

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (outcome == null) outcome = ActionOutcome.PENDING;
        if (subjectKey != null) subjectKey = subjectKey.trim();
    }
}
