package com.raid.roundsync.core.error;

/**
 * A write to the local store failed.
 *
 * <p>The only error class that is surfaced as blocking to the caller: it represents a real
 * durability risk for the score log or the one-shot network record guard.</p>
 */
public class LocalStorageException extends RuntimeException {

    public LocalStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
