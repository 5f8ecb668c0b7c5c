package com.chicu.agentpulse.ledger.solana;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MemoTransactionBuilderTest {

    @Test
    void buildMessage_shouldFollowLegacyLayout() {
        byte[] payer = new byte[32];
        Arrays.fill(payer, (byte) 7);
        byte[] blockhash = new byte[32];
        Arrays.fill(blockhash, (byte) 9);
        byte[] memo = "{\"ns\":\"agentpulse/v1\"}".getBytes(StandardCharsets.UTF_8);

        byte[] msg = MemoTransactionBuilder.buildMessage(payer, blockhash, memo);

        // header
        assertEquals(1, msg[0]);
        assertEquals(0, msg[1]);
        assertEquals(1, msg[2]);
        // 2 ключа: payer, memo program
        assertEquals(2, msg[3]);
        assertArrayEquals(payer, Arrays.copyOfRange(msg, 4, 36));
        assertArrayEquals(Base58.decode(MemoTransactionBuilder.MEMO_PROGRAM_ID), Arrays.copyOfRange(msg, 36, 68));
        assertArrayEquals(blockhash, Arrays.copyOfRange(msg, 68, 100));
        // 1 инструкция, program index 1, без аккаунтов
        assertEquals(1, msg[100]);
        assertEquals(1, msg[101]);
        assertEquals(0, msg[102]);
        assertEquals(memo.length, msg[103]);
        assertArrayEquals(memo, Arrays.copyOfRange(msg, 104, msg.length));
    }

    @Test
    void buildSigned_signatureShouldVerifyAgainstPayerKey() throws Exception {
        SolanaWallet wallet = SolanaWallet.fromKeypairBytes(SolanaWalletTest.randomKeypairBytes());
        byte[] blockhash = new byte[32];
        byte[] memo = "hello".getBytes(StandardCharsets.UTF_8);

        byte[] tx = MemoTransactionBuilder.buildSigned(wallet, blockhash, memo);

        assertEquals(1, tx[0], "одна подпись");
        byte[] sig = Arrays.copyOfRange(tx, 1, 65);
        byte[] message = Arrays.copyOfRange(tx, 65, tx.length);

        assertArrayEquals(MemoTransactionBuilder.buildMessage(wallet.publicKey(), blockhash, memo), message);
        assertTrue(SolanaWallet.verify(SolanaWallet.publicKeyFromRaw(wallet.publicKey()), message, sig));
    }

    @Test
    void writeShortVec_shouldUseSevenBitGroups() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MemoTransactionBuilder.writeShortVec(out, 0x7f);
        MemoTransactionBuilder.writeShortVec(out, 0x80);
        MemoTransactionBuilder.writeShortVec(out, 0x3fff);

        assertArrayEquals(new byte[]{0x7f, (byte) 0x80, 0x01, (byte) 0xff, 0x7f}, out.toByteArray());
    }

    @Test
    void buildMessage_shouldRejectBadKeys() {
        assertThrows(IllegalArgumentException.class,
                () -> MemoTransactionBuilder.buildMessage(new byte[31], new byte[32], new byte[0]));
        assertThrows(IllegalArgumentException.class,
                () -> MemoTransactionBuilder.buildMessage(new byte[32], new byte[10], new byte[0]));
    }
}
