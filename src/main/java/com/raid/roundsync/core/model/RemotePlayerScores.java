package com.raid.roundsync.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Latest known progress of a player scoring on another device. Kept apart from the local
 * score log; it is a read-model only.
 *
 * @param fromFinalRecord true when the snapshot came from a final record rather than a live
 *                        scorecard
 */
public record RemotePlayerScores(
        long roundId,
        String playerPublicKeyHex,
        Map<Integer, Integer> scores,
        ScorecardStatus status,
        String sourceEventId,
        boolean fromFinalRecord,
        Instant eventCreatedAt
) {

    public RemotePlayerScores {
        scores = Collections.unmodifiableMap(new TreeMap<>(scores));
    }

    public int total() {
        return scores.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int holesScored() {
        return scores.size();
    }

    /**
     * Whether this snapshot should replace {@code current}. A final record always beats a live
     * scorecard; otherwise the later event wins.
     */
    public boolean supersedes(RemotePlayerScores current) {
        if (current == null) {
            return true;
        }
        if (fromFinalRecord != current.fromFinalRecord) {
            return fromFinalRecord;
        }
        return eventCreatedAt.isAfter(current.eventCreatedAt)
                || (eventCreatedAt.equals(current.eventCreatedAt) && !sourceEventId.equals(current.sourceEventId)
                        && sourceEventId.compareTo(current.sourceEventId) > 0);
    }
}
