package com.raid.roundsync.core.error;

/**
 * Requested content (course snapshot, round, network event) does not exist locally or on any
 * reachable relay.
 */
public class ContentNotFoundException extends RuntimeException {

    public ContentNotFoundException(String message) {
        super(message);
    }
}
