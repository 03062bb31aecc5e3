package com.raid.roundsync.core.model;

import java.time.Instant;

/**
 * The round's identity on the relay network. Written at most once per round.
 */
public record RoundNetworkRecord(
        long roundId,
        String initiationEventId,
        JoinedVia joinedVia,
        Instant createdAt
) {
}
