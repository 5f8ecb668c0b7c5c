package com.chicu.agentpulse.ledger;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Восстановление proof'ов: история кошелька -> наши memo -> запись в журнале по префиксу хэша.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProofService {

    private final LedgerClient ledger;
    private final LedgerPayloadCodec codec;
    private final ActionJournalService journal;
    private final LedgerProperties props;

    /**
     * @param limit максимум proof'ов в ответе
     * @param type  фильтр по типу, null = все
     */
    public List<Proof> reconstruct(int limit, ActionType type) {
        int max = Math.max(1, limit);
        List<Proof> out = new ArrayList<>();

        for (LedgerTransaction tx : ledger.recentTransactions(props.getHistoryScanLimit())) {
            if (out.size() >= max) break;
            if (tx.failed()) continue;

            Optional<LedgerPayload> payload = codec.decode(tx.memo());
            if (payload.isEmpty()) continue;

            LedgerPayload p = payload.get();
            if (type != null && !type.name().equals(p.type())) continue;

            Optional<ActionRecord> local = journal.findByHashPrefix(p.hashPrefix());

            out.add(Proof.builder()
                    .ledgerTxSignature(tx.signature())
                    .contentHashPrefix(p.hashPrefix())
                    .declaredType(p.type())
                    .declaredSummary(p.summary())
                    .declaredAt(p.timestamp() != null ? p.timestamp() : tx.blockTime())
                    .actionId(local.map(ActionRecord::getActionId).orElse(null))
                    .fullReasoning(local.map(ActionRecord::getReasoning).orElse(null))
                    .verified(true)
                    .explorerUrl(explorerUrl(tx.signature()))
                    .build());
        }

        log.debug("⛓ Proofs reconstructed: {} (type={})", out.size(), type);
        return out;
    }

    /**
     * Proof для конкретной записи. Нет ссылки или нет совпадающей транзакции -> verified=false.
     */
    public Optional<Proof> proofFor(String actionId) {
        Optional<ActionRecord> found = journal.findByActionId(actionId);
        if (found.isEmpty()) return Optional.empty();

        ActionRecord r = found.get();
        String prefix = ActionHasher.prefix(r.getContentHash(), props.getHashPrefixLength());

        Proof.ProofBuilder b = Proof.builder()
                .actionId(r.getActionId())
                .contentHashPrefix(prefix)
                .declaredType(r.getType().name())
                .declaredSummary(r.getSummary())
                .declaredAt(r.getCreatedAt())
                .fullReasoning(r.getReasoning())
                .ledgerTxSignature(r.getLedgerTxRef())
                .verified(false);

        if (!r.isCommitted()) {
            return Optional.of(b.build());
        }

        b.explorerUrl(explorerUrl(r.getLedgerTxRef()));

        Optional<LedgerTransaction> tx;
        try {
            tx = ledger.transaction(r.getLedgerTxRef());
        } catch (LedgerException e) {
            log.warn("⛓ proof lookup failed action={} : {}", actionId, e.getMessage());
            return Optional.of(b.build());
        }

        boolean verified = tx.filter(t -> !t.failed())
                .flatMap(t -> codec.decode(t.memo()))
                .map(p -> prefix.startsWith(p.hashPrefix()) || p.hashPrefix().startsWith(prefix))
                .orElse(false);

        return Optional.of(b.verified(verified).build());
    }

    public ProofStats stats() {
        List<Proof> proofs = reconstruct(props.getHistoryScanLimit(), null);

        Map<String, Long> byType = new TreeMap<>();
        int correlated = 0;
        for (Proof p : proofs) {
            byType.merge(p.declaredType(), 1L, Long::sum);
            if (p.actionId() != null) correlated++;
        }

        long total = journal.countAll();
        long committed = journal.countCommitted();

        return ProofStats.builder()
                .totalActions(total)
                .committedActions(committed)
                .uncommittedActions(total - committed)
                .onLedgerProofs(proofs.size())
                .correlatedProofs(correlated)
                .proofsByType(byType)
                .build();
    }

    private String explorerUrl(String signature) {
        if (signature == null) return null;
        String base = props.getExplorerBaseUrl();
        String url = (base.endsWith("/") ? base : base + "/") + signature;
        String net = props.getNetwork();
        if (net == null || net.isBlank() || net.startsWith("mainnet")) return url;
        return url + "?cluster=" + net;
    }
}
