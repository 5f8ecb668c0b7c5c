package com.chicu.agentpulse.ledger.solana;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class Base58Test {

    @Test
    void encode_knownVectors() {
        assertEquals("2NEpo7TZRRrLZSi2U", Base58.encode("Hello World!".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("112", Base58.encode(new byte[]{0, 0, 1}));
        assertEquals("", Base58.encode(new byte[0]));
    }

    @Test
    void decode_shouldRestoreLeadingZeros() {
        assertArrayEquals(new byte[]{0, 0, 1}, Base58.decode("112"));
        assertArrayEquals("Hello World!".getBytes(StandardCharsets.US_ASCII), Base58.decode("2NEpo7TZRRrLZSi2U"));
    }

    @Test
    void memoProgramId_shouldBe32Bytes() {
        byte[] raw = Base58.decode(MemoTransactionBuilder.MEMO_PROGRAM_ID);
        assertEquals(32, raw.length);
        assertEquals(MemoTransactionBuilder.MEMO_PROGRAM_ID, Base58.encode(raw));
    }

    @Test
    void decode_shouldRejectNonAlphabetChars() {
        assertThrows(IllegalArgumentException.class, () -> Base58.decode("0OIl"));
    }
}
