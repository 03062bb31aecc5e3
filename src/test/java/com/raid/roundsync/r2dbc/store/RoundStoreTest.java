package com.raid.roundsync.r2dbc.store;

import static org.junit.Assert.assertEquals;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.LocalStorageException;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.JoinedVia;
import com.raid.roundsync.core.model.Round;
import com.raid.roundsync.core.model.RoundNetworkRecord;
import com.raid.roundsync.core.model.ScoringMode;
import com.raid.roundsync.support.Courses;
import com.raid.roundsync.support.TestDevice;

import reactor.test.StepVerifier;

public class RoundStoreTest {

    private static final Instant T0 = Instant.parse("2026-05-02T14:00:00Z");
    private static final LocalDate DATE = LocalDate.of(2026, 5, 2);
    private static final String INITIATION = "1d".repeat(32);

    private TestDevice device;
    private String courseHash;
    private List<String> players;

    @Before
    public void setUp() {
        device = TestDevice.create();
        CourseSnapshot course = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.frontNine()).block();
        courseHash = course.contentHash();
        players = List.of(device.key(), IdentityKeys.generate().publicKeyHex());
    }

    @After
    public void tearDown() {
        device.close();
    }

    @Test
    public void insertJoined_bindsRoundToInitiation() {
        Round round = device.roundRows.insertJoined(courseHash, DATE, players, INITIATION, T0).block();

        assertEquals(ScoringMode.MULTI_DEVICE, round.scoringMode());
        RoundNetworkRecord record = device.network.findByInitiationEventId(INITIATION).block();
        assertEquals(round.roundId(), record.roundId());
        assertEquals(JoinedVia.JOINED, record.joinedVia());
        assertEquals(2, device.roundRows.players(round.roundId()).count().block().intValue());
    }

    @Test
    public void insertJoined_failedBindingLeavesNoRound() {
        Round first = device.roundRows.insertJoined(courseHash, DATE, players, INITIATION, T0).block();

        // the initiation id is unique, so the binding row of the second round fails
        StepVerifier.create(device.roundRows.insertJoined(courseHash, DATE, players, INITIATION, T0))
                .expectError(LocalStorageException.class)
                .verify();

        List<Round> all = device.roundRows.findAll().collectList().block();
        assertEquals(1, all.size());
        assertEquals(first.roundId(), all.get(0).roundId());
        assertEquals(first.roundId(), device.network.findByInitiationEventId(INITIATION).block().roundId());
    }
}
