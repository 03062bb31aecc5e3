package com.raid.roundsync.service.join;

/**
 * @param alreadyJoined true when the round was already on this device and nothing was written
 */
public record JoinResult(long roundId, String initiationEventId, boolean alreadyJoined) {
}
