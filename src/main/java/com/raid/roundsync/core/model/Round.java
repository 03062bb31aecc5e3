package com.raid.roundsync.core.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A locally created or joined round. {@code completedAt} is derived from the append-only
 * completion table and is null while the round is in progress.
 */
public record Round(
        long roundId,
        String courseHash,
        LocalDate roundDate,
        ScoringMode scoringMode,
        Instant createdAt,
        Instant completedAt
) {

    public boolean isCompleted() {
        return completedAt != null;
    }
}
