package com.raid.roundsync.core.model;

/**
 * Where the players of a round keep score.
 *
 * <ul>
 *   <li>{@link #SAME_DEVICE}: everybody is scored on the creator's device and the creator's key
 *       signs every player's final record.</li>
 *   <li>{@link #MULTI_DEVICE}: every player scores on their own device; this device only
 *       writes and publishes the local player's (index 0) scores.</li>
 * </ul>
 */
public enum ScoringMode {
    SAME_DEVICE,
    MULTI_DEVICE;

    public boolean scoresLocally(int playerIndex) {
        return this == SAME_DEVICE || playerIndex == 0;
    }
}
