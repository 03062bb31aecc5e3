package com.raid.roundsync.service.course;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.InvalidCourseDefinitionException;
import com.raid.roundsync.core.error.UntrustedContentException;
import com.raid.roundsync.core.event.RoundContent;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.HoleDefinition;
import com.raid.roundsync.r2dbc.store.CourseSnapshotStore;

import reactor.core.publisher.Mono;

/**
 * Course and tee definitions addressed by the hash of their canonical form.
 *
 * <p>Two devices that enter the same course agree on its id without talking to each other. Rows
 * are insert-if-absent; there is no update path.</p>
 */
@Service
public class ContentAddressedCourseStore {

    private static final Logger log = LoggerFactory.getLogger(ContentAddressedCourseStore.class);

    private static final Set<Integer> FRONT_NINE = range(1, 9);
    private static final Set<Integer> BACK_NINE = range(10, 18);
    private static final Set<Integer> EIGHTEEN = range(1, 18);

    private final CourseSnapshotStore store;
    private final Clock clock;

    public ContentAddressedCourseStore(CourseSnapshotStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Returns the stored snapshot for this definition, inserting it on first use.
     *
     * @throws InvalidCourseDefinitionException if the name or tee is blank, or the holes are not
     *                                          exactly 1-9, 10-18 or 1-18
     */
    public Mono<CourseSnapshot> getOrCreate(String courseName, String teeSetName, List<HoleDefinition> holes) {
        return Mono.fromCallable(() -> {
            validate(courseName, teeSetName, holes);
            String name = courseName.trim();
            String tee = teeSetName.trim();
            return new CourseSnapshot(RoundContent.courseHash(name, tee, holes), name, tee, sorted(holes));
        }).flatMap(this::persist);
    }

    /**
     * Stores a snapshot received from another device. Its hash is recomputed first; callers
     * normally obtain it from a parsed initiation, where this already happened.
     */
    public Mono<CourseSnapshot> importVerified(CourseSnapshot course) {
        return Mono.fromCallable(() -> {
            validate(course.courseName(), course.teeSetName(), course.holes());
            String recomputed = RoundContent.courseHash(course.courseName(), course.teeSetName(), course.holes());
            if (!recomputed.equals(course.contentHash())) {
                throw new UntrustedContentException("course", course.contentHash(), recomputed);
            }
            return course;
        }).flatMap(this::persist);
    }

    /**
     * @throws ContentNotFoundException if nothing is stored under {@code contentHash}
     */
    public Mono<CourseSnapshot> find(String contentHash) {
        return store.findByHash(contentHash)
                .switchIfEmpty(Mono.error(() -> new ContentNotFoundException("No course snapshot " + contentHash)));
    }

    /**
     * Recomputes the hash of received course JSON and compares it with the hash that came with
     * it.
     *
     * @throws UntrustedContentException on mismatch
     */
    public CourseSnapshot verify(JsonNode courseContent, String embeddedHash) {
        CourseSnapshot course = RoundContent.readCourse(courseContent);
        if (!course.contentHash().equals(embeddedHash)) {
            throw new UntrustedContentException("course", embeddedHash, course.contentHash());
        }
        return course;
    }

    private Mono<CourseSnapshot> persist(CourseSnapshot course) {
        return store.insertIfAbsent(course, clock.instant())
                .doOnNext(c -> log.debug("Course {} '{}' / '{}' ready", c.contentHash(), c.courseName(), c.teeSetName()));
    }

    static void validate(String courseName, String teeSetName, List<HoleDefinition> holes) {
        if (courseName == null || courseName.isBlank()) {
            throw new InvalidCourseDefinitionException("Course name is required");
        }
        if (teeSetName == null || teeSetName.isBlank()) {
            throw new InvalidCourseDefinitionException("Tee set name is required");
        }
        if (holes == null || (holes.size() != 9 && holes.size() != 18)) {
            throw new InvalidCourseDefinitionException(
                    "A course has 9 or 18 holes, got " + (holes == null ? 0 : holes.size()));
        }
        Set<Integer> numbers = new HashSet<>();
        for (HoleDefinition h : holes) {
            if (!numbers.add(h.holeNumber())) {
                throw new InvalidCourseDefinitionException("Hole " + h.holeNumber() + " is listed twice");
            }
        }
        if (!numbers.equals(FRONT_NINE) && !numbers.equals(BACK_NINE) && !numbers.equals(EIGHTEEN)) {
            throw new InvalidCourseDefinitionException("Holes must be 1-9, 10-18 or 1-18, got " + numbers);
        }
    }

    private static List<HoleDefinition> sorted(List<HoleDefinition> holes) {
        return holes.stream()
                .sorted((a, b) -> Integer.compare(a.holeNumber(), b.holeNumber()))
                .collect(Collectors.toList());
    }

    private static Set<Integer> range(int from, int to) {
        return IntStream.rangeClosed(from, to).boxed().collect(Collectors.toUnmodifiableSet());
    }
}
