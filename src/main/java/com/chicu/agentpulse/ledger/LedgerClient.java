package com.chicu.agentpulse.ledger;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Доступ к публичному append-only леджеру.
 * Все методы могут бросить {@link LedgerException}.
 */
public interface LedgerClient {

    /**
     * Есть ключ и запись разрешена.
     */
    boolean canWrite();

    Optional<String> address();

    String network();

    OptionalLong balanceLamports();

    /**
     * Последние транзакции кошелька, новые первыми.
     */
    List<LedgerTransaction> recentTransactions(int limit);

    Optional<LedgerTransaction> transaction(String signature);

    /**
     * Отправляет memo и ждёт подтверждения сети.
     *
     * @return подпись транзакции
     */
    String writeMemo(String memo);

    LedgerNetworkStatus networkStatus();
}
