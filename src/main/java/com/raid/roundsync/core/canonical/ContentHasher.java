package com.raid.roundsync.core.canonical;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * SHA-256 over the UTF-8 bytes of canonical JSON, rendered as lowercase hex.
 */
public final class ContentHasher {

    private static final HexFormat HEX = HexFormat.of();

    private ContentHasher() {
    }

    public static String hash(JsonNode content) {
        return sha256Hex(CanonicalJson.write(content));
    }

    public static String sha256Hex(String text) {
        return HEX.formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
