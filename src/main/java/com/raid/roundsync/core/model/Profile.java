package com.raid.roundsync.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Cached profile metadata of a public key.
 *
 * <p>Merging is field-by-field: a sparse profile never blanks a field that is already known.</p>
 */
public record Profile(
        String publicKeyHex,
        String name,
        String displayName,
        String about,
        String picture,
        String banner,
        String nip05,
        Instant eventCreatedAt
) {

    private static final int SHORT_KEY_LENGTH = 8;

    public Profile {
        Objects.requireNonNull(publicKeyHex, "publicKeyHex");
        Objects.requireNonNull(eventCreatedAt, "eventCreatedAt");
    }

    public static Profile empty(String publicKeyHex) {
        return new Profile(publicKeyHex, null, null, null, null, null, null, Instant.EPOCH);
    }

    /**
     * Merges two versions of the same key's profile. Non-blank fields of the more recent
     * version win; blank fields fall back to the older version.
     */
    public Profile mergedWith(Profile other) {
        if (other == null) {
            return this;
        }
        if (!publicKeyHex.equals(other.publicKeyHex)) {
            throw new IllegalArgumentException("Cannot merge profiles of different keys");
        }
        Profile newer = other.eventCreatedAt.isAfter(eventCreatedAt) ? other : this;
        Profile older = newer == this ? other : this;
        return new Profile(
                publicKeyHex,
                pick(newer.name, older.name),
                pick(newer.displayName, older.displayName),
                pick(newer.about, older.about),
                pick(newer.picture, older.picture),
                pick(newer.banner, older.banner),
                pick(newer.nip05, older.nip05),
                newer.eventCreatedAt);
    }

    /** displayName, then name, then a shortened key. */
    public String label() {
        if (!isBlank(displayName)) {
            return displayName;
        }
        if (!isBlank(name)) {
            return name;
        }
        return shortKey(publicKeyHex);
    }

    public static String shortKey(String publicKeyHex) {
        if (publicKeyHex.length() <= SHORT_KEY_LENGTH) {
            return publicKeyHex;
        }
        return publicKeyHex.substring(0, SHORT_KEY_LENGTH) + "...";
    }

    private static String pick(String preferred, String fallback) {
        return isBlank(preferred) ? fallback : preferred;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
