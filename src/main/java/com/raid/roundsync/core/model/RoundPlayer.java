package com.raid.roundsync.core.model;

/**
 * Player slot in a round. Index 0 is always the owner of this device.
 */
public record RoundPlayer(long roundId, int playerIndex, String publicKeyHex) {

    public boolean isLocal() {
        return playerIndex == 0;
    }
}
