package com.raid.roundsync.core.event;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.raid.roundsync.core.crypto.EventSigner;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.UntrustedContentException;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.HoleDefinition;
import com.raid.roundsync.core.model.ScorecardStatus;

public class RoundEventParserTest {

    private static final long NOW = 1_760_000_000L;
    private static final LocalDate DATE = LocalDate.of(2026, 5, 2);

    private final IdentityKeys host = IdentityKeys.generate();
    private final IdentityKeys guest = IdentityKeys.generate();

    private static CourseSnapshot course() {
        List<HoleDefinition> holes = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            holes.add(new HoleDefinition(i, i % 3 == 0 ? 3 : 4));
        }
        return new CourseSnapshot(RoundContent.courseHash("Pebble Creek", "Blue", holes), "Pebble Creek", "Blue", holes);
    }

    private RelayEvent initiation() {
        UnsignedEvent e = RoundEventBuilder.initiation(host.publicKeyHex(), NOW, course(), DATE,
                List.of(host.publicKeyHex(), guest.publicKeyHex()));
        return EventSigner.sign(e, host);
    }

    @Test
    public void parseInitiation_recomputesHashesAndReadsPlayersInOrder() {
        InitiationRecord record = RoundEventParser.parseInitiation(initiation());

        assertEquals(course().contentHash(), record.course().contentHash());
        assertEquals(RoundContent.rulesHash(), record.rulesHash());
        assertEquals(DATE, record.roundDate());
        assertEquals(List.of(host.publicKeyHex(), guest.publicKeyHex()), record.playerPubkeys());
        assertEquals(host.publicKeyHex(), record.authorPubkey());
        assertEquals(9, record.course().holeCount());
    }

    @Test(expected = UntrustedContentException.class)
    public void parseInitiation_rejectsTamperedCourse() {
        RelayEvent original = initiation();
        String tampered = original.content().replace("\"par\":3", "\"par\":5");
        UnsignedEvent resigned = new UnsignedEvent(host.publicKeyHex(), NOW, EventKind.ROUND_INITIATION,
                original.tags(), tampered);
        RoundEventParser.parseInitiation(EventSigner.sign(resigned, host));
    }

    @Test(expected = UntrustedContentException.class)
    public void parseInitiation_rejectsMissingCourseHashTag() {
        RelayEvent original = initiation();
        List<List<String>> tags = new ArrayList<>(original.tags());
        tags.removeIf(t -> t.get(0).equals("course_hash"));
        UnsignedEvent stripped = new UnsignedEvent(host.publicKeyHex(), NOW, EventKind.ROUND_INITIATION, tags,
                original.content());
        RoundEventParser.parseInitiation(EventSigner.sign(stripped, host));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseInitiation_rejectsOtherKind() {
        RelayEvent live = EventSigner.sign(RoundEventBuilder.liveScorecard(host.publicKeyHex(), NOW, "ab".repeat(32),
                ScorecardStatus.IN_PROGRESS, List.of(host.publicKeyHex()), Map.of(1, 4)), host);
        RoundEventParser.parseInitiation(live);
    }

    @Test
    public void parseFinalRecord_readsScoredPlayerAndScores() {
        String initiationId = initiation().id();
        UnsignedEvent e = RoundEventBuilder.finalRecord(host.publicKeyHex(), NOW, initiationId, guest.publicKeyHex(),
                List.of(host.publicKeyHex(), guest.publicKeyHex()), Map.of(2, 5, 1, 4));
        RelayEvent signed = EventSigner.sign(e, host);

        assertEquals("9", signed.firstTag("total").orElseThrow());
        assertEquals(guest.publicKeyHex(), signed.firstTag("p").orElseThrow());

        ScoreSnapshot s = RoundEventParser.parseFinalRecord(signed);
        assertEquals(initiationId, s.initiationEventId());
        assertEquals(guest.publicKeyHex(), s.scoredPlayerPubkey());
        assertEquals(host.publicKeyHex(), s.authorPubkey());
        assertEquals(Map.of(1, 4, 2, 5), s.scores());
        assertEquals(ScorecardStatus.COMPLETED, s.status());
        assertTrue(s.finalRecord());
    }

    @Test
    public void parseLiveScorecard_dropsOutOfRangeScores() {
        List<List<String>> tags = List.of(
                Tags.tag("d", "cd".repeat(32)),
                Tags.tag("status", "in_progress"),
                Tags.tag("score", "1", "4"),
                Tags.tag("score", "2", "0"),
                Tags.tag("score", "19", "4"),
                Tags.tag("score", "3", "x"));
        RelayEvent signed = EventSigner.sign(new UnsignedEvent(guest.publicKeyHex(), NOW, EventKind.LIVE_SCORECARD,
                tags, ""), guest);

        ScoreSnapshot s = RoundEventParser.parseLiveScorecard(signed);
        assertEquals(Map.of(1, 4), s.scores());
        assertEquals(guest.publicKeyHex(), s.scoredPlayerPubkey());
        assertEquals(ScorecardStatus.IN_PROGRESS, s.status());
        assertFalse(s.finalRecord());
    }

    @Test
    public void initiation_sameInputsGiveSameContent() {
        assertEquals(initiation().content(), initiation().content());
    }
}
