package com.chicu.agentpulse.ledger.solana;

import com.chicu.agentpulse.ledger.LedgerException;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.EdECPublicKey;
import java.security.spec.EdECPoint;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.EdECPublicKeySpec;
import java.security.spec.NamedParameterSpec;
import java.util.Arrays;

/**
 * Кошелёк Solana поверх встроенного в JDK Ed25519.
 * Секрет — 64 байта: seed(32) + publicKey(32), как в solana-keygen.
 */
public final class SolanaWallet {

    private static final byte[] SELF_CHECK = "agentpulse-key-check".getBytes(StandardCharsets.UTF_8);

    private final PrivateKey privateKey;
    private final byte[] publicKey;
    private final String address;

    private SolanaWallet(PrivateKey privateKey, byte[] publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        this.address = Base58.encode(publicKey);
    }

    /**
     * Принимает base58 строку или JSON-массив байт ("[12,34,...]").
     */
    public static SolanaWallet fromSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("wallet secret is blank");
        }
        String s = secret.trim();
        byte[] raw = s.startsWith("[") ? parseByteArray(s) : Base58.decode(s);
        if (raw.length != 64) {
            throw new IllegalArgumentException("wallet secret must be 64 bytes, got " + raw.length);
        }
        return fromKeypairBytes(raw);
    }

    public static SolanaWallet fromKeypairBytes(byte[] keypair) {
        byte[] seed = Arrays.copyOfRange(keypair, 0, 32);
        byte[] pub = Arrays.copyOfRange(keypair, 32, 64);
        try {
            KeyFactory kf = KeyFactory.getInstance("Ed25519");
            PrivateKey pk = kf.generatePrivate(new EdECPrivateKeySpec(NamedParameterSpec.ED25519, seed));
            SolanaWallet w = new SolanaWallet(pk, pub);

            // публичная половина должна соответствовать seed
            if (!verify(publicKeyFromRaw(pub), SELF_CHECK, w.sign(SELF_CHECK))) {
                throw new IllegalArgumentException("wallet secret: public key does not match seed");
            }
            return w;
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("wallet secret is not a valid ed25519 key: " + e.getMessage(), e);
        }
    }

    public String address() {
        return address;
    }

    public byte[] publicKey() {
        return publicKey.clone();
    }

    public byte[] sign(byte[] message) {
        try {
            Signature sig = Signature.getInstance("Ed25519");
            sig.initSign(privateKey);
            sig.update(message);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new LedgerException("ed25519 sign failed: " + e.getMessage(), e);
        }
    }

    // =====================================================
    // raw <-> JDK key
    // =====================================================

    public static boolean verify(PublicKey key, byte[] message, byte[] signature) {
        try {
            Signature sig = Signature.getInstance("Ed25519");
            sig.initVerify(key);
            sig.update(message);
            return sig.verify(signature);
        } catch (GeneralSecurityException e) {
            throw new LedgerException("ed25519 verify failed: " + e.getMessage(), e);
        }
    }

    /**
     * 32 байта little-endian y, старший бит последнего байта = нечётность x.
     */
    public static PublicKey publicKeyFromRaw(byte[] raw) {
        if (raw == null || raw.length != 32) {
            throw new IllegalArgumentException("ed25519 public key must be 32 bytes");
        }
        byte[] le = raw.clone();
        boolean xOdd = (le[31] & 0x80) != 0;
        le[31] &= 0x7f;

        byte[] be = new byte[32];
        for (int i = 0; i < 32; i++) be[i] = le[31 - i];

        try {
            EdECPoint point = new EdECPoint(xOdd, new BigInteger(1, be));
            return KeyFactory.getInstance("Ed25519")
                    .generatePublic(new EdECPublicKeySpec(NamedParameterSpec.ED25519, point));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("invalid ed25519 public key: " + e.getMessage(), e);
        }
    }

    public static byte[] rawPublicKey(EdECPublicKey key) {
        EdECPoint p = key.getPoint();
        byte[] be = p.getY().toByteArray();
        byte[] le = new byte[32];
        for (int i = 0; i < 32 && i < be.length; i++) {
            le[i] = be[be.length - 1 - i];
        }
        if (p.isXOdd()) le[31] |= (byte) 0x80;
        return le;
    }

    private static byte[] parseByteArray(String json) {
        String body = json.substring(1, json.length() - 1).trim();
        if (body.isEmpty()) return new byte[0];
        String[] parts = body.split(",");
        byte[] out = new byte[parts.length];
        for (int i = 0; i < parts.length; i++) {
            int v = Integer.parseInt(parts[i].trim());
            if (v < 0 || v > 255) throw new IllegalArgumentException("wallet secret byte out of range at " + i);
            out[i] = (byte) v;
        }
        return out;
    }

    @Override
    public String toString() {
        // секрет в toString не попадает
        return "SolanaWallet{" + address + "}";
    }
}
