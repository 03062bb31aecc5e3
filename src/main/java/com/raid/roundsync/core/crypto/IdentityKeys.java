package com.raid.roundsync.core.crypto;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.EdECPublicKey;
import java.security.spec.EdECPoint;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.EdECPublicKeySpec;
import java.security.spec.NamedParameterSpec;
import java.security.spec.XECPrivateKeySpec;
import java.security.spec.XECPublicKeySpec;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Ed25519 identity of a device (or of a one-off ephemeral signer).
 *
 * <p>The public key is exchanged as 64 lowercase hex characters: the standard 32-byte Ed25519
 * encoding (little-endian y, sign of x in the top bit). The same key pair is converted to
 * X25519 for private-message key agreement, so a recipient is reachable knowing only its
 * public key.</p>
 */
public final class IdentityKeys {

    private static final HexFormat HEX = HexFormat.of();
    private static final Pattern KEY_HEX = Pattern.compile("^[0-9a-f]{64}$");
    private static final BigInteger P = BigInteger.TWO.pow(255).subtract(BigInteger.valueOf(19));

    private final byte[] seed;
    private final String publicKeyHex;
    private final PrivateKey signingKey;

    private IdentityKeys(byte[] seed, String publicKeyHex) {
        this.seed = seed.clone();
        this.publicKeyHex = publicKeyHex;
        try {
            this.signingKey = KeyFactory.getInstance("Ed25519")
                    .generatePrivate(new EdECPrivateKeySpec(NamedParameterSpec.ED25519, this.seed));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 unavailable", e);
        }
    }

    public static IdentityKeys generate() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
            byte[] seed = ((EdECPrivateKey) pair.getPrivate()).getBytes()
                    .orElseThrow(() -> new IllegalStateException("Provider did not expose the Ed25519 seed"));
            String pub = HEX.formatHex(encodePoint(((EdECPublicKey) pair.getPublic()).getPoint()));
            return new IdentityKeys(seed, pub);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 unavailable", e);
        }
    }

    /**
     * Restores a stored identity and checks that seed and public key belong together.
     */
    public static IdentityKeys restore(String seedHex, String publicKeyHex) {
        requireKeyHex(publicKeyHex);
        IdentityKeys keys = new IdentityKeys(HEX.parseHex(seedHex), publicKeyHex);
        byte[] probe = "identity-check".getBytes(StandardCharsets.UTF_8);
        if (!verify(publicKeyHex, probe, keys.sign(probe))) {
            throw new IllegalArgumentException("Stored public key does not match the stored seed");
        }
        return keys;
    }

    public String publicKeyHex() {
        return publicKeyHex;
    }

    public String seedHex() {
        return HEX.formatHex(seed);
    }

    public byte[] sign(byte[] message) {
        try {
            Signature s = Signature.getInstance("Ed25519");
            s.initSign(signingKey);
            s.update(message);
            return s.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    public static boolean verify(String publicKeyHex, byte[] message, byte[] signature) {
        if (!isKeyHex(publicKeyHex) || signature == null || signature.length != 64) {
            return false;
        }
        try {
            Signature s = Signature.getInstance("Ed25519");
            s.initVerify(edPublicKey(publicKeyHex));
            s.update(message);
            return s.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }

    /** X25519 private key derived from the Ed25519 seed (first half of SHA-512(seed)). */
    PrivateKey agreementKey() {
        try {
            byte[] h = MessageDigest.getInstance("SHA-512").digest(seed);
            byte[] scalar = Arrays.copyOf(h, 32);
            return KeyFactory.getInstance("XDH")
                    .generatePrivate(new XECPrivateKeySpec(NamedParameterSpec.X25519, scalar));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("X25519 unavailable", e);
        }
    }

    /** X25519 public key of an Ed25519 public key: u = (1 + y) / (1 - y) mod p. */
    static PublicKey agreementPublicKey(String publicKeyHex) {
        requireKeyHex(publicKeyHex);
        BigInteger y = decodePoint(HEX.parseHex(publicKeyHex)).getY();
        BigInteger u = BigInteger.ONE.add(y)
                .multiply(BigInteger.ONE.subtract(y).mod(P).modInverse(P))
                .mod(P);
        try {
            return KeyFactory.getInstance("XDH").generatePublic(new XECPublicKeySpec(NamedParameterSpec.X25519, u));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("X25519 unavailable", e);
        }
    }

    public static boolean isKeyHex(String value) {
        return value != null && KEY_HEX.matcher(value).matches();
    }

    private static void requireKeyHex(String value) {
        if (!isKeyHex(value)) {
            throw new IllegalArgumentException("Not a 64-char lowercase hex public key: " + value);
        }
    }

    private static PublicKey edPublicKey(String publicKeyHex) throws GeneralSecurityException {
        EdECPoint point = decodePoint(HEX.parseHex(publicKeyHex));
        return KeyFactory.getInstance("Ed25519").generatePublic(new EdECPublicKeySpec(NamedParameterSpec.ED25519, point));
    }

    private static byte[] encodePoint(EdECPoint point) {
        byte[] be = point.getY().toByteArray();
        byte[] le = new byte[32];
        for (int i = 0; i < be.length && i < 32; i++) {
            le[i] = be[be.length - 1 - i];
        }
        if (point.isXOdd()) {
            le[31] |= (byte) 0x80;
        }
        return le;
    }

    private static EdECPoint decodePoint(byte[] le) {
        if (le.length != 32) {
            throw new IllegalArgumentException("Ed25519 public key must be 32 bytes");
        }
        byte[] be = new byte[32];
        for (int i = 0; i < 32; i++) {
            be[i] = le[31 - i];
        }
        boolean xOdd = (be[0] & 0x80) != 0;
        be[0] &= 0x7f;
        return new EdECPoint(xOdd, new BigInteger(1, be));
    }
}
