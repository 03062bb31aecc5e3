package com.raid.roundsync.core.error;

public class RelayUnavailableException extends RuntimeException {

    public RelayUnavailableException(String relayUrl, Throwable cause) {
        super("Relay unavailable: " + relayUrl, cause);
    }
}
