package com.chicu.agentpulse.ledger.solana;

import java.io.ByteArrayOutputStream;

/**
 * Минимальная legacy-транзакция: одна инструкция Memo-программы, плательщик = подписант.
 */
public final class MemoTransactionBuilder {

    public static final String MEMO_PROGRAM_ID = "MemoSq4gqABAXKb96qnH8TysNcWxMyWCqXgDLGmfcHr";

    private static final byte[] MEMO_PROGRAM = Base58.decode(MEMO_PROGRAM_ID);

    private MemoTransactionBuilder() {}

    /**
     * Сообщение, которое подписывается.
     * header(1 signer, 0 ro-signed, 1 ro-unsigned) | keys[payer, memo] | blockhash | [ix(program=1, no accounts, data)]
     */
    public static byte[] buildMessage(byte[] payer, byte[] recentBlockhash, byte[] memo) {
        if (payer == null || payer.length != 32) throw new IllegalArgumentException("payer must be 32 bytes");
        if (recentBlockhash == null || recentBlockhash.length != 32) {
            throw new IllegalArgumentException("blockhash must be 32 bytes");
        }
        if (memo == null) throw new IllegalArgumentException("memo is null");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(1);
        out.write(0);
        out.write(1);

        writeShortVec(out, 2);
        out.writeBytes(payer);
        out.writeBytes(MEMO_PROGRAM);

        out.writeBytes(recentBlockhash);

        writeShortVec(out, 1);
        out.write(1);
        writeShortVec(out, 0);
        writeShortVec(out, memo.length);
        out.writeBytes(memo);

        return out.toByteArray();
    }

    public static byte[] assemble(byte[] signature, byte[] message) {
        if (signature == null || signature.length != 64) throw new IllegalArgumentException("signature must be 64 bytes");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeShortVec(out, 1);
        out.writeBytes(signature);
        out.writeBytes(message);
        return out.toByteArray();
    }

    public static byte[] buildSigned(SolanaWallet wallet, byte[] recentBlockhash, byte[] memo) {
        byte[] message = buildMessage(wallet.publicKey(), recentBlockhash, memo);
        return assemble(wallet.sign(message), message);
    }

    /**
     * compact-u16: по 7 бит, старший бит = продолжение.
     */
    static void writeShortVec(ByteArrayOutputStream out, int value) {
        if (value < 0 || value > 0xffff) throw new IllegalArgumentException("shortvec out of range: " + value);
        int v = value;
        while (true) {
            int b = v & 0x7f;
            v >>>= 7;
            if (v == 0) {
                out.write(b);
                return;
            }
            out.write(b | 0x80);
        }
    }
}
