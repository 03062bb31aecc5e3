package com.raid.roundsync.core.event;

import java.util.Map;

import com.raid.roundsync.core.model.ScorecardStatus;

/**
 * Scores of one player as read from a final record or a live scorecard.
 */
public record ScoreSnapshot(
        String eventId,
        String authorPubkey,
        String initiationEventId,
        String scoredPlayerPubkey,
        Map<Integer, Integer> scores,
        ScorecardStatus status,
        boolean finalRecord,
        long createdAt
) {

    public ScoreSnapshot {
        scores = Map.copyOf(scores);
    }
}
