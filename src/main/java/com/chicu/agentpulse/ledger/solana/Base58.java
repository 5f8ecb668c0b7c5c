package com.chicu.agentpulse.ledger.solana;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Bitcoin-алфавит base58 (ключи и подписи Solana).
 */
public final class Base58 {

    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            INDEXES[ALPHABET.charAt(i)] = i;
        }
    }

    private Base58() {}

    public static String encode(byte[] input) {
        if (input == null || input.length == 0) return "";

        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) zeros++;

        BigInteger n = new BigInteger(1, input);
        StringBuilder sb = new StringBuilder();
        while (n.signum() > 0) {
            BigInteger[] qr = n.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(qr[1].intValue()));
            n = qr[0];
        }
        for (int i = 0; i < zeros; i++) sb.append('1');
        return sb.reverse().toString();
    }

    public static byte[] decode(String input) {
        if (input == null || input.isEmpty()) return new byte[0];

        BigInteger n = BigInteger.ZERO;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("invalid base58 character at " + i);
            }
            n = n.multiply(BASE).add(BigInteger.valueOf(digit));
        }

        int zeros = 0;
        while (zeros < input.length() && input.charAt(zeros) == '1') zeros++;

        byte[] raw = n.signum() == 0 ? new byte[0] : n.toByteArray();
        // BigInteger может добавить ведущий 0 под знак
        int strip = (raw.length > 1 && raw[0] == 0) ? 1 : 0;

        byte[] out = new byte[zeros + raw.length - strip];
        System.arraycopy(raw, strip, out, zeros, raw.length - strip);
        return out;
    }
}
