package com.raid.roundsync.core.event;

import java.time.LocalDate;
import java.util.List;

import com.raid.roundsync.core.model.CourseSnapshot;

/**
 * A verified round initiation: the course hash and rules hash recomputed from the content
 * matched the tags.
 */
public record InitiationRecord(
        String eventId,
        String authorPubkey,
        CourseSnapshot course,
        String rulesHash,
        LocalDate roundDate,
        List<String> playerPubkeys
) {

    public InitiationRecord {
        playerPubkeys = List.copyOf(playerPubkeys);
    }
}
