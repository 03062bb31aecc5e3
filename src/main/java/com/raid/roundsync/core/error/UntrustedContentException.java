package com.raid.roundsync.core.error;

/**
 * A content hash recomputed from received content disagrees with the hash embedded alongside it.
 *
 * <p>This means the content was altered or a relay served stale data. It is never the same as
 * {@link ContentNotFoundException}.</p>
 */
public class UntrustedContentException extends RuntimeException {

    private final String expectedHash;
    private final String actualHash;

    public UntrustedContentException(String what, String expectedHash, String actualHash) {
        super(what + " hash mismatch: embedded=" + expectedHash + " recomputed=" + actualHash);
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public UntrustedContentException(String message) {
        super(message);
        this.expectedHash = null;
        this.actualHash = null;
    }

    public String getExpectedHash() {
        return expectedHash;
    }

    public String getActualHash() {
        return actualHash;
    }
}
