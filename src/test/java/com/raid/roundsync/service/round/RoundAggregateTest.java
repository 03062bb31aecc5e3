package com.raid.roundsync.service.round;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.InvalidPlayerSetException;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.Round;
import com.raid.roundsync.core.model.RoundPlayer;
import com.raid.roundsync.core.model.ScoringMode;
import com.raid.roundsync.support.Courses;
import com.raid.roundsync.support.TestDevice;

import reactor.test.StepVerifier;

public class RoundAggregateTest {

    private static final LocalDate DATE = LocalDate.of(2026, 5, 2);

    private TestDevice device;
    private CourseSnapshot nine;
    private final String partner = IdentityKeys.generate().publicKeyHex();

    @Before
    public void setUp() {
        device = TestDevice.create();
        nine = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.frontNine()).block();
    }

    @After
    public void tearDown() {
        device.close();
    }

    private Round sameDeviceRound() {
        return device.rounds.createRound(nine, device.key(), List.of(partner), DATE).block();
    }

    @Test
    public void createRound_putsCreatorAtIndexZero() {
        Round round = sameDeviceRound();
        List<RoundPlayer> players = device.rounds.players(round.roundId()).block();

        assertEquals(2, players.size());
        assertEquals(device.key(), players.get(0).publicKeyHex());
        assertEquals(partner, players.get(1).publicKeyHex());
        assertEquals(ScoringMode.SAME_DEVICE, round.scoringMode());
        assertFalse(round.isCompleted());
    }

    @Test
    public void createRound_rejectsDuplicateOrMalformedKeys() {
        StepVerifier.create(device.rounds.createRound(nine, device.key(), List.of(device.key()), DATE))
                .expectError(InvalidPlayerSetException.class)
                .verify();
        StepVerifier.create(device.rounds.createRound(nine, device.key(), List.of("not-a-key"), DATE))
                .expectError(InvalidPlayerSetException.class)
                .verify();
        assertEquals(0, device.rounds.rounds().collectList().block().size());
    }

    @Test
    public void recordScore_changesAppendRowsAndLatestWins() {
        long id = sameDeviceRound().roundId();
        device.rounds.recordScore(id, 0, 1, 5).block();
        device.clock.advance(Duration.ofSeconds(10));
        device.rounds.recordScore(id, 0, 1, 4).block();
        device.rounds.recordScore(id, 1, 1, 6).block();

        assertEquals(Map.of(1, 4), device.rounds.currentScores(id, 0).block());
        assertEquals(Map.of(1, 6), device.rounds.currentScores(id, 1).block());
        assertEquals(2, device.scoreRows.events(id, 0).count().block().intValue());
    }

    @Test
    public void recordScore_validatesInput() {
        long id = sameDeviceRound().roundId();
        StepVerifier.create(device.rounds.recordScore(id, 0, 1, 0)).expectError(IllegalArgumentException.class).verify();
        StepVerifier.create(device.rounds.recordScore(id, 0, 1, 21)).expectError(IllegalArgumentException.class).verify();
        StepVerifier.create(device.rounds.recordScore(id, 0, 10, 4)).expectError(IllegalArgumentException.class).verify();
        StepVerifier.create(device.rounds.recordScore(id, 2, 1, 4)).expectError(IllegalArgumentException.class).verify();
        StepVerifier.create(device.rounds.recordScore(999, 0, 1, 4)).expectError(ContentNotFoundException.class).verify();
    }

    @Test
    public void recordScore_multiDeviceRoundOnlyScoresLocalPlayer() {
        long id = device.rounds.createRound(nine, device.key(), List.of(partner), DATE, ScoringMode.MULTI_DEVICE)
                .block().roundId();
        device.rounds.recordScore(id, 0, 1, 4).block();
        StepVerifier.create(device.rounds.recordScore(id, 1, 1, 4))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    public void completeRound_requiresEveryHoleOfLocalPlayer() {
        long id = sameDeviceRound().roundId();
        for (int hole = 1; hole <= 8; hole++) {
            device.rounds.recordScore(id, 0, hole, 4).block();
        }
        assertFalse(device.rounds.isFinishEnabled(id, 0).block());
        StepVerifier.create(device.rounds.completeRound(id)).expectError(IllegalStateException.class).verify();

        device.rounds.recordScore(id, 0, 9, 5).block();
        assertTrue(device.rounds.isFinishEnabled(id, 0).block());
        assertFalse(device.rounds.isFinishEnabled(id, 1).block());

        Round done = device.rounds.completeRound(id).block();
        assertTrue(done.isCompleted());
        assertEquals(TestDevice.START, done.completedAt());
    }

    @Test
    public void isFinishEnabled_multiDeviceEighteenIgnoresRemotePlayerWithoutScores() {
        CourseSnapshot eighteen = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.eighteen())
                .block();
        long id = device.rounds.createRound(eighteen, device.key(), List.of(partner), DATE, ScoringMode.MULTI_DEVICE)
                .block().roundId();
        for (int hole = 1; hole <= 17; hole++) {
            device.rounds.recordScore(id, 0, hole, eighteen.parFor(hole)).block();
        }
        assertFalse(device.rounds.isFinishEnabled(id, 0).block());

        device.rounds.recordScore(id, 0, 18, 5).block();

        assertTrue(device.rounds.currentScores(id, 1).block().isEmpty());
        assertTrue(device.rounds.isFinishEnabled(id, 0).block());
        assertTrue(device.rounds.completeRound(id).block().isCompleted());
    }

    @Test
    public void completeRound_secondCallKeepsFirstCompletionTime() {
        long id = sameDeviceRound().roundId();
        for (int hole = 1; hole <= 9; hole++) {
            device.rounds.recordScore(id, 0, hole, 4).block();
        }
        Round first = device.rounds.completeRound(id).block();
        device.clock.advance(Duration.ofMinutes(5));
        Round again = device.rounds.completeRound(id).block();
        assertEquals(first.completedAt(), again.completedAt());
    }

    @Test
    public void playerList_keepsSuppliedOrder() {
        String a = IdentityKeys.generate().publicKeyHex();
        String b = IdentityKeys.generate().publicKeyHex();
        assertEquals(List.of(device.key(), b, a), RoundAggregate.playerList(device.key(), List.of(b, a)));
    }
}
