package com.chicu.agentpulse.ledger;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.journal.ActionJournalService;
import com.chicu.agentpulse.journal.ActionRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProofServiceTest {

    private static final String HASH = "abcdef0123456789" + "0".repeat(48);

    @Mock
    LedgerClient ledger;
    @Mock
    ActionJournalService journal;

    private LedgerProperties props;
    private LedgerPayloadCodec codec;
    private ProofService service;

    private final Instant ts = Instant.parse("2026-02-10T12:00:00Z");

    @BeforeEach
    void setUp() {
        props = new LedgerProperties();
        codec = new LedgerPayloadCodec(new ObjectMapper().findAndRegisterModules(), props);
        service = new ProofService(ledger, codec, journal, props);
    }

    private ActionRecord record(String ledgerRef) {
        ActionRecord r = ActionRecord.builder()
                .actionId("act-1")
                .type(ActionType.VOTE)
                .summary("Voted for Alpha")
                .reasoning("full reasoning text")
                .createdAt(ts)
                .contentHash(HASH)
                .outcome(ActionOutcome.SUCCESS)
                .build();
        if (ledgerRef != null) r.attachLedgerRef(ledgerRef, ts);
        return r;
    }

    @Test
    void reconstruct_shouldCorrelateOwnMemosAndSkipForeignOnes() {
        String ours = codec.encode("VOTE", "Voted for Alpha", HASH.substring(0, 16), ts);
        when(ledger.recentTransactions(anyInt())).thenReturn(List.of(
                new LedgerTransaction("sig-1", 10, ts, ours, false),
                new LedgerTransaction("sig-2", 11, ts, "gm frens", false),
                new LedgerTransaction("sig-3", 12, ts, null, false),
                new LedgerTransaction("sig-4", 13, ts, ours, true)
        ));
        when(journal.findByHashPrefix("abcdef0123456789")).thenReturn(Optional.of(record("sig-1")));

        List<Proof> proofs = service.reconstruct(50, null);

        assertEquals(1, proofs.size());
        Proof p = proofs.get(0);
        assertTrue(p.verified());
        assertEquals("sig-1", p.ledgerTxSignature());
        assertEquals("act-1", p.actionId());
        assertEquals("full reasoning text", p.fullReasoning());
        assertEquals("VOTE", p.declaredType());
        assertEquals("https://explorer.solana.com/tx/sig-1?cluster=devnet", p.explorerUrl());
    }

    @Test
    void reconstruct_shouldKeepUncorrelatedProofsAsVerifiedOnLedger() {
        String memo = codec.encode("FORUM_POST", "Trends", "ffffffffffffffff", ts);
        when(ledger.recentTransactions(anyInt())).thenReturn(List.of(new LedgerTransaction("sig-9", 1, ts, memo, false)));
        when(journal.findByHashPrefix("ffffffffffffffff")).thenReturn(Optional.empty());

        List<Proof> proofs = service.reconstruct(10, ActionType.FORUM_POST);

        assertEquals(1, proofs.size());
        assertTrue(proofs.get(0).verified());
        assertNull(proofs.get(0).actionId());
    }

    @Test
    void reconstruct_shouldFilterByType() {
        String memo = codec.encode("VOTE", "Voted", "abcdef0123456789", ts);
        when(ledger.recentTransactions(anyInt())).thenReturn(List.of(new LedgerTransaction("s", 1, ts, memo, false)));

        assertTrue(service.reconstruct(10, ActionType.DAILY_SNAPSHOT).isEmpty());
    }

    @Test
    void proofFor_uncommittedRecord_shouldBeExecutedButUnverifiable() {
        when(journal.findByActionId("act-1")).thenReturn(Optional.of(record(null)));

        Proof p = service.proofFor("act-1").orElseThrow();

        assertFalse(p.verified());
        assertNull(p.ledgerTxSignature());
        assertEquals("full reasoning text", p.fullReasoning());
    }

    @Test
    void proofFor_committedRecord_shouldVerifyAgainstLedgerMemo() {
        when(journal.findByActionId("act-1")).thenReturn(Optional.of(record("sig-1")));
        String memo = codec.encode("VOTE", "Voted for Alpha", HASH.substring(0, 16), ts);
        when(ledger.transaction("sig-1")).thenReturn(Optional.of(new LedgerTransaction("sig-1", 1, ts, memo, false)));

        assertTrue(service.proofFor("act-1").orElseThrow().verified());
    }

    @Test
    void proofFor_ledgerUnavailable_shouldDegradeToUnverified() {
        when(journal.findByActionId("act-1")).thenReturn(Optional.of(record("sig-1")));
        when(ledger.transaction("sig-1")).thenThrow(new LedgerException("rpc down"));

        Proof p = service.proofFor("act-1").orElseThrow();

        assertFalse(p.verified());
        assertEquals("sig-1", p.ledgerTxSignature());
    }

    @Test
    void proofFor_unknownAction_shouldBeEmpty() {
        when(journal.findByActionId("nope")).thenReturn(Optional.empty());
        assertTrue(service.proofFor("nope").isEmpty());
    }
}
