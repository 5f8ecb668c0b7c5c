package com.chicu.agentpulse.ledger.solana;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.EdECPublicKey;

import static org.junit.jupiter.api.Assertions.*;

class SolanaWalletTest {

    /**
     * 64 байта в формате solana-keygen: seed(32) + pub(32).
     */
    static byte[] randomKeypairBytes() throws Exception {
        KeyPair kp = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        byte[] seed = ((EdECPrivateKey) kp.getPrivate()).getBytes().orElseThrow();
        byte[] pub = SolanaWallet.rawPublicKey((EdECPublicKey) kp.getPublic());

        byte[] keypair = new byte[64];
        System.arraycopy(seed, 0, keypair, 0, 32);
        System.arraycopy(pub, 0, keypair, 32, 32);
        return keypair;
    }

    @Test
    void fromSecret_shouldAcceptBase58AndJsonArrayForms() throws Exception {
        byte[] keypair = randomKeypairBytes();

        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < keypair.length; i++) {
            if (i > 0) json.append(',');
            json.append(keypair[i] & 0xff);
        }
        json.append(']');

        SolanaWallet fromB58 = SolanaWallet.fromSecret(Base58.encode(keypair));
        SolanaWallet fromJson = SolanaWallet.fromSecret(json.toString());

        assertEquals(fromB58.address(), fromJson.address());
        assertEquals(32, fromB58.publicKey().length);
        assertEquals(Base58.encode(fromB58.publicKey()), fromB58.address());
    }

    @Test
    void sign_shouldVerifyWithRawPublicKey() throws Exception {
        SolanaWallet w = SolanaWallet.fromKeypairBytes(randomKeypairBytes());
        byte[] msg = "memo".getBytes(StandardCharsets.UTF_8);

        byte[] sig = w.sign(msg);

        assertEquals(64, sig.length);
        assertTrue(SolanaWallet.verify(SolanaWallet.publicKeyFromRaw(w.publicKey()), msg, sig));
        assertFalse(SolanaWallet.verify(SolanaWallet.publicKeyFromRaw(w.publicKey()),
                "other".getBytes(StandardCharsets.UTF_8), sig));
    }

    @Test
    void fromKeypairBytes_shouldRejectMismatchedPublicHalf() throws Exception {
        byte[] a = randomKeypairBytes();
        byte[] b = randomKeypairBytes();
        System.arraycopy(b, 32, a, 32, 32);

        assertThrows(IllegalArgumentException.class, () -> SolanaWallet.fromKeypairBytes(a));
    }

    @Test
    void fromSecret_shouldRejectWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> SolanaWallet.fromSecret("[1,2,3]"));
        assertThrows(IllegalArgumentException.class, () -> SolanaWallet.fromSecret(" "));
    }

    @Test
    void toString_shouldNotLeakSecret() throws Exception {
        byte[] keypair = randomKeypairBytes();
        SolanaWallet w = SolanaWallet.fromKeypairBytes(keypair);

        assertFalse(w.toString().contains(Base58.encode(keypair)));
        assertTrue(w.toString().contains(w.address()));
    }
}
