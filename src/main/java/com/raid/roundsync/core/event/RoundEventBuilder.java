package com.raid.roundsync.core.event;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.ScorecardStatus;

/**
 * Pure construction of the round-level events. No storage and no network access; callers sign
 * and publish the result.
 */
public final class RoundEventBuilder {

    public static final String CLIENT = "raid-round-sync";

    private RoundEventBuilder() {
    }

    /**
     * Kind 1501. Tags carry the recomputed course and rules hashes, the round date and every
     * participant key in player-index order.
     */
    public static UnsignedEvent initiation(
            String authorPubkey,
            long createdAt,
            CourseSnapshot course,
            LocalDate roundDate,
            List<String> playerPubkeys
    ) {
        String courseHash = RoundContent.courseHash(course.courseName(), course.teeSetName(), course.holes());
        if (!courseHash.equals(course.contentHash())) {
            throw new IllegalStateException("Stored course " + course.contentHash() + " re-hashes to " + courseHash);
        }
        List<List<String>> tags = new ArrayList<>();
        tags.add(Tags.tag("course_hash", courseHash));
        tags.add(Tags.tag("rules_hash", RoundContent.rulesHash()));
        tags.add(Tags.tag("date", roundDate.toString()));
        addCommonTags(tags);
        for (String pk : playerPubkeys) {
            tags.add(Tags.tag("p", pk));
        }
        return new UnsignedEvent(authorPubkey, createdAt, EventKind.ROUND_INITIATION, tags,
                RoundContent.initiationContent(course));
    }

    /**
     * Kind 1502. The scored player's {@code p} tag comes first, followed by the other
     * participants; {@code scored_by} names the scored player explicitly.
     */
    public static UnsignedEvent finalRecord(
            String authorPubkey,
            long createdAt,
            String initiationEventId,
            String scoredPlayerPubkey,
            List<String> playerPubkeys,
            Map<Integer, Integer> scores
    ) {
        Map<Integer, Integer> ordered = new TreeMap<>(scores);
        int total = ordered.values().stream().mapToInt(Integer::intValue).sum();

        List<List<String>> tags = new ArrayList<>();
        tags.add(Tags.tag("e", initiationEventId));
        tags.add(Tags.tag("total", Integer.toString(total)));
        addCommonTags(tags);
        ordered.forEach((hole, strokes) -> tags.add(Tags.tag("score", hole.toString(), strokes.toString())));
        tags.add(Tags.tag("scored_by", scoredPlayerPubkey));
        tags.add(Tags.tag("p", scoredPlayerPubkey));
        for (String pk : playerPubkeys) {
            if (!pk.equals(scoredPlayerPubkey)) {
                tags.add(Tags.tag("p", pk));
            }
        }
        return new UnsignedEvent(authorPubkey, createdAt, EventKind.FINAL_RECORD, tags, "");
    }

    /**
     * Kind 30501, addressable by {@code d = initiation id}. Relays keep the latest per author.
     */
    public static UnsignedEvent liveScorecard(
            String authorPubkey,
            long createdAt,
            String initiationEventId,
            ScorecardStatus status,
            List<String> playerPubkeys,
            Map<Integer, Integer> scores
    ) {
        List<List<String>> tags = new ArrayList<>();
        tags.add(Tags.tag("d", initiationEventId));
        tags.add(Tags.tag("e", initiationEventId));
        tags.add(Tags.tag("status", status.wireValue()));
        addCommonTags(tags);
        new TreeMap<>(scores).forEach((hole, strokes) ->
                tags.add(Tags.tag("score", hole.toString(), strokes.toString())));
        for (String pk : playerPubkeys) {
            tags.add(Tags.tag("p", pk));
        }
        return new UnsignedEvent(authorPubkey, createdAt, EventKind.LIVE_SCORECARD, tags, "");
    }

    private static void addCommonTags(List<List<String>> tags) {
        tags.add(Tags.tag("t", "golf"));
        tags.add(Tags.tag("t", "raidgolf"));
        tags.add(Tags.tag("client", CLIENT));
    }
}
