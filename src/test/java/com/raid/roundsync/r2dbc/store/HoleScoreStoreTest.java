package com.raid.roundsync.r2dbc.store;

import static org.junit.Assert.assertEquals;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.HoleScoreEvent;
import com.raid.roundsync.core.model.Round;
import com.raid.roundsync.core.model.ScoringMode;
import com.raid.roundsync.support.Courses;
import com.raid.roundsync.support.TestDevice;

public class HoleScoreStoreTest {

    private static final Instant T0 = Instant.parse("2026-05-02T14:00:00Z");

    private TestDevice device;
    private long roundId;

    @Before
    public void setUp() {
        device = TestDevice.create();
        CourseSnapshot course = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.frontNine()).block();
        Round round = device.roundRows.insertWithPlayers(course.contentHash(), LocalDate.of(2026, 5, 2),
                ScoringMode.SAME_DEVICE, List.of(device.key()), T0).block();
        roundId = round.roundId();
    }

    @After
    public void tearDown() {
        device.close();
    }

    @Test
    public void currentScores_sameTimestampLaterRowWins() {
        device.scoreRows.append(roundId, 0, 1, 5, T0).block();
        device.scoreRows.append(roundId, 0, 1, 4, T0).block();

        assertEquals(Map.of(1, 4), device.scoreRows.currentScores(roundId, 0).block());
    }

    @Test
    public void currentScores_laterTimestampWinsOverLaterRow() {
        device.scoreRows.append(roundId, 0, 2, 3, T0.plusSeconds(30)).block();
        device.scoreRows.append(roundId, 0, 2, 6, T0).block();

        assertEquals(Map.of(2, 3), device.scoreRows.currentScores(roundId, 0).block());
    }

    @Test
    public void events_keepEveryRowInInsertionOrder() {
        device.scoreRows.append(roundId, 0, 1, 5, T0).block();
        device.scoreRows.append(roundId, 0, 1, 4, T0.plusSeconds(1)).block();
        device.scoreRows.append(roundId, 0, 2, 3, T0.plusSeconds(2)).block();

        List<HoleScoreEvent> events = device.scoreRows.events(roundId, 0).collectList().block();
        assertEquals(3, events.size());
        assertEquals(5, events.get(0).strokes());
        assertEquals(2, events.get(2).holeNumber());
        assertEquals(2, device.scoreRows.scoredHoles(roundId, 0).block().size());
    }

    @Test
    public void resolveLatest_breaksTiesByScoreId() {
        Map<Integer, Integer> current = HoleScoreStore.resolveLatest(List.of(
                new HoleScoreEvent(7, roundId, 0, 3, 4, T0),
                new HoleScoreEvent(9, roundId, 0, 3, 6, T0),
                new HoleScoreEvent(8, roundId, 0, 3, 5, T0)));
        assertEquals(Map.of(3, 6), current);
    }
}
