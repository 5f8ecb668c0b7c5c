package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import com.chicu.agentpulse.ledger.LedgerCommitService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Внешнее действие по субъекту: PENDING-запись -> вызов -> SUCCESS/FAILED -> леджер.
 * <p>
 * Запись с subjectKey пишется ДО вызова. Если запись не удалась, вызова нет;
 * если вызов прошёл, а итерация упала дальше, субъект уже занят и повтора не будет.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubjectActionRunner {

    private final ActionJournalService journal;
    private final LedgerCommitService ledgerCommit;

    public <T> Attempt<T> run(ActionDraft draft, Supplier<T> effect) {
        return run(draft, effect, r -> { });
    }

    /**
     * @param beforeCommit выполняется после SUCCESS и до записи в леджер (например, пометка ACTED)
     */
    public <T> Attempt<T> run(ActionDraft draft, Supplier<T> effect, Consumer<ActionRecord> beforeCommit) {
        ActionRecord pending = journal.claim(draft).orElse(null);
        if (pending == null) {
            log.info("🔁 {} already claimed -> no-op", draft.subjectKey());
            return Attempt.duplicate();
        }

        T value;
        try {
            value = effect.get();
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("🔁 {} FAILED: {}", draft.subjectKey(), msg);
            ActionRecord failed = journal.resolveOutcome(pending.getActionId(), ActionOutcome.FAILED, msg)
                    .orElse(pending);
            return Attempt.failed(failed, e);
        }

        ActionRecord done = journal.resolveOutcome(pending.getActionId(), ActionOutcome.SUCCESS, null)
                .orElse(pending);
        beforeCommit.accept(done);
        ledgerCommit.commit(done);
        return Attempt.succeeded(done, value);
    }

    public enum Status { SUCCEEDED, FAILED, DUPLICATE }

    public record Attempt<T>(Status status, ActionRecord record, T value, RuntimeException error) {

        static <T> Attempt<T> duplicate() {
            return new Attempt<>(Status.DUPLICATE, null, null, null);
        }

        static <T> Attempt<T> failed(ActionRecord record, RuntimeException error) {
            return new Attempt<>(Status.FAILED, record, null, error);
        }

        static <T> Attempt<T> succeeded(ActionRecord record, T value) {
            return new Attempt<>(Status.SUCCEEDED, record, value, null);
        }

        public boolean succeeded() {
            return status == Status.SUCCEEDED;
        }
    }
}
