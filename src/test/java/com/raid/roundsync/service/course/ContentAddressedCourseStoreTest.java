package com.raid.roundsync.service.course;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.InvalidCourseDefinitionException;
import com.raid.roundsync.core.error.UntrustedContentException;
import com.raid.roundsync.core.event.RoundContent;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.HoleDefinition;
import com.raid.roundsync.support.Courses;
import com.raid.roundsync.support.TestDevice;

import reactor.test.StepVerifier;

public class ContentAddressedCourseStoreTest {

    private TestDevice device;

    @Before
    public void setUp() {
        device = TestDevice.create();
    }

    @After
    public void tearDown() {
        device.close();
    }

    @Test
    public void getOrCreate_sameDefinitionGivesSameHashAndOneRow() {
        List<HoleDefinition> shuffled = new ArrayList<>(Courses.eighteen());
        Collections.reverse(shuffled);

        CourseSnapshot first = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.eighteen()).block();
        CourseSnapshot second = device.courses.getOrCreate(" Pebble Creek ", Courses.BLUE_TEES, shuffled).block();

        assertEquals(first.contentHash(), second.contentHash());
        assertEquals(Long.valueOf(1), device.courseRows.count().block());
        assertEquals(18, second.holeCount());
        assertEquals(1, second.holes().get(0).holeNumber());
        assertEquals(72, first.totalPar());
    }

    @Test
    public void getOrCreate_hashIsIndependentOfDevice() {
        CourseSnapshot here = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.eighteen()).block();
        try (TestDevice other = TestDevice.create()) {
            CourseSnapshot there = other.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.eighteen()).block();
            assertEquals(here.contentHash(), there.contentHash());
        }
    }

    @Test
    public void getOrCreate_hashIsIndependentOfDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.ROOT);
            String root = hashUnderCurrentLocale();
            for (Locale l : List.of(Locale.forLanguageTag("ar-EG"), Locale.forLanguageTag("de-DE"))) {
                Locale.setDefault(l);
                assertEquals(l.toLanguageTag(), root, hashUnderCurrentLocale());
            }
        } finally {
            Locale.setDefault(saved);
        }
    }

    private String hashUnderCurrentLocale() {
        return device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.eighteen()).block()
                .contentHash();
    }

    @Test
    public void getOrCreate_differentTeeIsDifferentCourse() {
        CourseSnapshot blue = device.courses.getOrCreate(Courses.PEBBLE_CREEK, "Blue", Courses.frontNine()).block();
        CourseSnapshot white = device.courses.getOrCreate(Courses.PEBBLE_CREEK, "White", Courses.frontNine()).block();
        assertNotEquals(blue.contentHash(), white.contentHash());
        assertEquals(Long.valueOf(2), device.courseRows.count().block());
    }

    @Test
    public void getOrCreate_rejectsInvalidHoleSets() {
        List<HoleDefinition> ten = new ArrayList<>(Courses.frontNine());
        ten.add(new HoleDefinition(10, 4));
        StepVerifier.create(device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, ten))
                .expectError(InvalidCourseDefinitionException.class)
                .verify();

        List<HoleDefinition> gap = new ArrayList<>(Courses.eighteen().subList(1, 10));
        StepVerifier.create(device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, gap))
                .expectError(InvalidCourseDefinitionException.class)
                .verify();

        List<HoleDefinition> duplicate = new ArrayList<>(Courses.frontNine().subList(0, 8));
        duplicate.add(new HoleDefinition(1, 4));
        StepVerifier.create(device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, duplicate))
                .expectError(InvalidCourseDefinitionException.class)
                .verify();

        StepVerifier.create(device.courses.getOrCreate(" ", Courses.BLUE_TEES, Courses.frontNine()))
                .expectError(InvalidCourseDefinitionException.class)
                .verify();
    }

    @Test
    public void getOrCreate_acceptsBackNine() {
        List<HoleDefinition> back = Courses.eighteen().subList(9, 18);
        CourseSnapshot course = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, back).block();
        assertEquals(10, course.holes().get(0).holeNumber());
    }

    @Test
    public void importVerified_rejectsWrongHash() {
        List<HoleDefinition> holes = Courses.frontNine();
        String hash = RoundContent.courseHash(Courses.PEBBLE_CREEK, "Red", holes);
        CourseSnapshot lying = new CourseSnapshot(hash, Courses.PEBBLE_CREEK, Courses.BLUE_TEES, holes);

        StepVerifier.create(device.courses.importVerified(lying))
                .expectError(UntrustedContentException.class)
                .verify();
    }

    @Test
    public void verify_comparesRecomputedHash() {
        CourseSnapshot course = device.courses.getOrCreate(Courses.PEBBLE_CREEK, Courses.BLUE_TEES, Courses.frontNine()).block();
        CourseSnapshot verified = device.courses.verify(RoundContent.courseNode(course), course.contentHash());
        assertEquals(course, verified);
    }

    @Test
    public void find_unknownHashIsNotFound() {
        StepVerifier.create(device.courses.find("00".repeat(32)))
                .expectError(ContentNotFoundException.class)
                .verify();
    }
}
