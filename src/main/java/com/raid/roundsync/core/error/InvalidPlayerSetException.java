package com.raid.roundsync.core.error;

/**
 * Raised at round creation when the player list contains duplicates or malformed keys.
 */
public class InvalidPlayerSetException extends RuntimeException {

    public InvalidPlayerSetException(String message) {
        super(message);
    }
}
