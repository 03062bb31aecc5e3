package com.raid.roundsync.core.error;

/**
 * The local identity is not listed among the players of a round it tried to join.
 */
public class NotAParticipantException extends RuntimeException {

    public NotAParticipantException(String initiationEventId) {
        super("Local identity is not a player in round " + initiationEventId);
    }
}
