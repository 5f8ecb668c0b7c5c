package com.chicu.agentpulse.ledger;

import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * record -> memo -> подтверждённая транзакция -> ledgerTxRef.
 * Сбой леджера не влияет на исход самого действия: запись остаётся как была, просто без ссылки.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerCommitService {

    private final LedgerClient ledger;
    private final LedgerPayloadCodec codec;
    private final ActionJournalService journal;

    public Optional<String> commit(ActionRecord record) {
        if (record == null) return Optional.empty();
        if (record.isCommitted()) return Optional.of(record.getLedgerTxRef());

        if (!ledger.canWrite()) {
            log.debug("⛓ Ledger SKIP (read-only) type={} action={}", record.getType(), record.getActionId());
            return Optional.empty();
        }

        try {
            String memo = codec.encode(record);
            String signature = ledger.writeMemo(memo);
            journal.attachLedgerRef(record.getActionId(), signature);

            log.info("⛓ Ledger COMMIT type={} action={} hash={} sig={}",
                    record.getType(),
                    record.getActionId(),
                    ActionHasher.prefix(record.getContentHash()),
                    ActionHasher.prefix(signature));
            return Optional.of(signature);

        } catch (RuntimeException e) {
            log.warn("⛓ Ledger commit FAILED (action kept without proof) type={} action={} : {}",
                    record.getType(), record.getActionId(), e.getMessage());
            return Optional.empty();
        }
    }
}
