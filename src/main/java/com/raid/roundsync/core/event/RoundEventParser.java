package com.raid.roundsync.core.event;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.raid.roundsync.core.canonical.CanonicalJson;
import com.raid.roundsync.core.canonical.ContentHasher;
import com.raid.roundsync.core.error.UntrustedContentException;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.ScorecardStatus;

/**
 * Inverse of {@link RoundEventBuilder}. Pure, no storage or network access.
 */
public final class RoundEventParser {

    private static final Pattern SMALL_INT = Pattern.compile("^\\d{1,3}$");

    private RoundEventParser() {
    }

    /**
     * Parses a kind 1501 event and recomputes both hashes from its content.
     *
     * @throws UntrustedContentException if either recomputed hash differs from its tag, or a tag
     *                                   is missing
     * @throws IllegalArgumentException  if the event is not an initiation or its content is
     *                                   malformed
     */
    public static InitiationRecord parseInitiation(RelayEvent event) {
        requireKind(event, EventKind.ROUND_INITIATION);
        String taggedCourseHash = event.firstTag("course_hash")
                .orElseThrow(() -> new UntrustedContentException("Initiation " + event.id() + " has no course_hash tag"));
        String taggedRulesHash = event.firstTag("rules_hash")
                .orElseThrow(() -> new UntrustedContentException("Initiation " + event.id() + " has no rules_hash tag"));

        JsonNode content = CanonicalJson.parse(event.content());
        JsonNode courseNode = content.get("course_snapshot");
        JsonNode rulesNode = content.get("rules_template");
        if (rulesNode == null || !rulesNode.isObject()) {
            throw new IllegalArgumentException("Initiation " + event.id() + " has no rules_template");
        }

        CourseSnapshot course = RoundContent.readCourse(courseNode);
        if (!course.contentHash().equals(taggedCourseHash)) {
            throw new UntrustedContentException("course", taggedCourseHash, course.contentHash());
        }
        String rulesHash = ContentHasher.hash(rulesNode);
        if (!rulesHash.equals(taggedRulesHash)) {
            throw new UntrustedContentException("rules", taggedRulesHash, rulesHash);
        }

        LocalDate date;
        try {
            date = LocalDate.parse(event.firstTag("date").orElse(""));
        } catch (DateTimeParseException e) {
            date = LocalDate.ofEpochDay(event.createdAt() / 86_400);
        }

        List<String> players = event.tagValues("p");
        return new InitiationRecord(event.id(), event.pubkey(), course, rulesHash, date, players);
    }

    /**
     * Parses a kind 1502 event. The scored player is the {@code scored_by} tag, falling back to
     * the first {@code p} tag and then to the author.
     */
    public static ScoreSnapshot parseFinalRecord(RelayEvent event) {
        requireKind(event, EventKind.FINAL_RECORD);
        String initiation = event.firstTag("e").orElse(null);
        String scored = event.firstTag("scored_by")
                .or(() -> event.firstTag("p"))
                .orElse(event.pubkey());
        return new ScoreSnapshot(event.id(), event.pubkey(), initiation, scored,
                readScores(event), ScorecardStatus.COMPLETED, true, event.createdAt());
    }

    /** Parses a kind 30501 event. The author is always the scored player. */
    public static ScoreSnapshot parseLiveScorecard(RelayEvent event) {
        requireKind(event, EventKind.LIVE_SCORECARD);
        String initiation = event.firstTag("d").or(() -> event.firstTag("e")).orElse(null);
        ScorecardStatus status = ScorecardStatus.fromWire(event.firstTag("status").orElse(null));
        return new ScoreSnapshot(event.id(), event.pubkey(), initiation, event.pubkey(),
                readScores(event), status, false, event.createdAt());
    }

    private static Map<Integer, Integer> readScores(RelayEvent event) {
        Map<Integer, Integer> scores = new HashMap<>();
        for (List<String> tag : Tags.all(event.tags(), "score")) {
            if (tag.size() < 3 || !SMALL_INT.matcher(tag.get(1)).matches() || !SMALL_INT.matcher(tag.get(2)).matches()) {
                continue;
            }
            int hole = Integer.parseInt(tag.get(1));
            int strokes = Integer.parseInt(tag.get(2));
            if (hole >= 1 && hole <= 18 && strokes >= 1 && strokes <= 20) {
                scores.put(hole, strokes);
            }
        }
        return scores;
    }

    private static void requireKind(RelayEvent event, int kind) {
        if (event.kind() != kind) {
            throw new IllegalArgumentException("Expected kind " + kind + " but event " + event.id() + " is kind " + event.kind());
        }
    }
}
