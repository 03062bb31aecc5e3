package com.raid.roundsync.core.model;

import java.time.Instant;

/**
 * One row of the append-only score log. {@code scoreId} reflects insertion order and breaks
 * ties between rows with the same {@code recordedAt}.
 */
public record HoleScoreEvent(
        long scoreId,
        long roundId,
        int playerIndex,
        int holeNumber,
        int strokes,
        Instant recordedAt
) {
}
