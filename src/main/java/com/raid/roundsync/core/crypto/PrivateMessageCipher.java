package com.raid.roundsync.core.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Authenticated encryption between two identities.
 *
 * <p>X25519 agreement on the converted identity keys, HKDF-SHA256 to a conversation key,
 * ChaCha20-Poly1305 with a random 96-bit nonce. The payload is
 * {@code base64(version || nonce || ciphertext+tag)}. The conversation key is symmetric, so
 * either side can decrypt what the other side encrypted.</p>
 */
public final class PrivateMessageCipher {

    private static final byte VERSION = 1;
    private static final int NONCE_LENGTH = 12;
    private static final byte[] SALT = "raid-private-message-v1".getBytes(StandardCharsets.US_ASCII);
    private static final SecureRandom RANDOM = new SecureRandom();

    private PrivateMessageCipher() {
    }

    public static String encrypt(String plaintext, IdentityKeys sender, String recipientPublicKeyHex) {
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance("ChaCha20-Poly1305");
            cipher.init(Cipher.ENCRYPT_MODE, conversationKey(sender, recipientPublicKeyHex), new IvParameterSpec(nonce));
            byte[] ct = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer out = ByteBuffer.allocate(1 + NONCE_LENGTH + ct.length);
            out.put(VERSION).put(nonce).put(ct);
            return Base64.getEncoder().encodeToString(out.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    /**
     * @throws GeneralSecurityException when the payload was not produced for this pair of keys or
     *                                  was altered
     */
    public static String decrypt(String payload, IdentityKeys recipient, String senderPublicKeyHex)
            throws GeneralSecurityException {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Payload is not base64", e);
        }
        if (raw.length < 1 + NONCE_LENGTH + 16 || raw[0] != VERSION) {
            throw new GeneralSecurityException("Unsupported payload version or length");
        }
        byte[] nonce = Arrays.copyOfRange(raw, 1, 1 + NONCE_LENGTH);
        Cipher cipher = Cipher.getInstance("ChaCha20-Poly1305");
        cipher.init(Cipher.DECRYPT_MODE, conversationKey(recipient, senderPublicKeyHex), new IvParameterSpec(nonce));
        byte[] pt = cipher.doFinal(raw, 1 + NONCE_LENGTH, raw.length - 1 - NONCE_LENGTH);
        return new String(pt, StandardCharsets.UTF_8);
    }

    private static SecretKeySpec conversationKey(IdentityKeys self, String peerPublicKeyHex)
            throws GeneralSecurityException {
        KeyAgreement agreement = KeyAgreement.getInstance("XDH");
        agreement.init(self.agreementKey());
        agreement.doPhase(IdentityKeys.agreementPublicKey(peerPublicKeyHex), true);
        byte[] shared = agreement.generateSecret();
        return new SecretKeySpec(hkdf(shared), "ChaCha20");
    }

    private static byte[] hkdf(byte[] ikm) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SALT, "HmacSHA256"));
        byte[] prk = mac.doFinal(ikm);
        mac.init(new SecretKeySpec(prk, "HmacSHA256"));
        mac.update("conversation-key".getBytes(StandardCharsets.US_ASCII));
        mac.update((byte) 1);
        return mac.doFinal();
    }
}
