package com.raid.roundsync.service.round;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.InvalidPlayerSetException;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.HoleDefinition;
import com.raid.roundsync.core.model.HoleScoreEvent;
import com.raid.roundsync.core.model.Round;
import com.raid.roundsync.core.model.RoundPlayer;
import com.raid.roundsync.core.model.ScoringMode;
import com.raid.roundsync.r2dbc.store.HoleScoreStore;
import com.raid.roundsync.r2dbc.store.RoundStore;
import com.raid.roundsync.service.course.ContentAddressedCourseStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Owns a round, its players and the append-only score log.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Player index 0 is the device owner; other players follow in the order supplied.</li>
 *   <li>A score change is a new row; the current value of a hole is its latest row.</li>
 *   <li>Every accepted score is persisted before the call completes. A failed write surfaces as
 *       {@link com.raid.roundsync.core.error.LocalStorageException}.</li>
 * </ul>
 */
@Service
public class RoundAggregate {

    public static final int MIN_STROKES = 1;
    public static final int MAX_STROKES = 20;

    private static final Logger log = LoggerFactory.getLogger(RoundAggregate.class);

    private final RoundStore rounds;
    private final HoleScoreStore scores;
    private final ContentAddressedCourseStore courses;
    private final Clock clock;

    public RoundAggregate(RoundStore rounds, HoleScoreStore scores, ContentAddressedCourseStore courses, Clock clock) {
        this.rounds = rounds;
        this.scores = scores;
        this.courses = courses;
        this.clock = clock;
    }

    /**
     * Creates a round with the creator at index 0. Round and players are inserted atomically.
     *
     * @throws InvalidPlayerSetException for duplicate, blank or malformed keys
     */
    public Mono<Round> createRound(CourseSnapshot course, String creatorKey, List<String> otherKeys,
            LocalDate roundDate, ScoringMode mode) {
        return Mono.fromCallable(() -> playerList(creatorKey, otherKeys))
                .flatMap(keys -> rounds.insertWithPlayers(course.contentHash(), roundDate, mode, keys, clock.instant()))
                .doOnNext(r -> log.info("Created round {} on {} with {} player(s), mode={}", r.roundId(),
                        course.contentHash(), otherKeys.size() + 1, mode));
    }

    public Mono<Round> createRound(CourseSnapshot course, String creatorKey, List<String> otherKeys, LocalDate roundDate) {
        return createRound(course, creatorKey, otherKeys, roundDate, ScoringMode.SAME_DEVICE);
    }

    /**
     * Creates the local copy of a multi-device round joined from its initiation. The round, its
     * players and the binding to {@code initiationEventId} are written atomically.
     */
    public Mono<Round> createJoinedRound(CourseSnapshot course, String localKey, List<String> otherKeys,
            LocalDate roundDate, String initiationEventId) {
        return Mono.fromCallable(() -> playerList(localKey, otherKeys))
                .flatMap(keys -> rounds.insertJoined(course.contentHash(), roundDate, keys, initiationEventId,
                        clock.instant()));
    }

    /**
     * Appends a score row stamped with the current clock time.
     *
     * @throws IllegalArgumentException if strokes are outside 1..20, the hole is not on the course,
     *                                  or the player is not scored on this device
     */
    public Mono<HoleScoreEvent> recordScore(long roundId, int playerIndex, int holeNumber, int strokes) {
        if (strokes < MIN_STROKES || strokes > MAX_STROKES) {
            return Mono.error(new IllegalArgumentException(
                    "Strokes must be " + MIN_STROKES + ".." + MAX_STROKES + ", got " + strokes));
        }
        return details(roundId).flatMap(d -> {
            if (d.player(playerIndex).isEmpty()) {
                return Mono.error(new IllegalArgumentException("Round " + roundId + " has no player " + playerIndex));
            }
            if (!d.round().scoringMode().scoresLocally(playerIndex)) {
                return Mono.error(new IllegalArgumentException(
                        "Player " + playerIndex + " of round " + roundId + " scores on their own device"));
            }
            if (!d.course().hasHole(holeNumber)) {
                return Mono.error(new IllegalArgumentException(
                        "Hole " + holeNumber + " is not part of course " + d.course().contentHash()));
            }
            return scores.append(roundId, playerIndex, holeNumber, strokes, clock.instant());
        }).doOnNext(e -> log.debug("Round {} player {} hole {} = {}", roundId, playerIndex, holeNumber, strokes));
    }

    public Mono<Map<Integer, Integer>> currentScores(long roundId, int playerIndex) {
        return scores.currentScores(roundId, playerIndex);
    }

    /**
     * True iff every hole of the course has at least one score row for the player.
     */
    public Mono<Boolean> isFinishEnabled(long roundId, int playerIndex) {
        return details(roundId).flatMap(d -> scores.scoredHoles(roundId, playerIndex)
                .map(scored -> allHolesScored(d.course(), scored)));
    }

    /**
     * Marks the round completed. Allowed only once the local player has scored every hole;
     * calling it again keeps the first completion time.
     *
     * @throws IllegalStateException if holes remain unscored
     */
    public Mono<Round> completeRound(long roundId) {
        return isFinishEnabled(roundId, 0).flatMap(enabled -> {
            if (!enabled) {
                return Mono.error(new IllegalStateException("Round " + roundId + " still has unscored holes"));
            }
            return rounds.markCompleted(roundId, clock.instant());
        }).doOnNext(r -> log.info("Round {} completed at {}", roundId, r.completedAt()));
    }

    /**
     * @throws ContentNotFoundException if no such round exists
     */
    public Mono<Round> round(long roundId) {
        return rounds.findById(roundId)
                .switchIfEmpty(Mono.error(() -> new ContentNotFoundException("No round " + roundId)));
    }

    public Mono<List<RoundPlayer>> players(long roundId) {
        return rounds.players(roundId).collectList();
    }

    public Mono<RoundDetails> details(long roundId) {
        return round(roundId).flatMap(r -> Mono.zip(courses.find(r.courseHash()), players(roundId))
                .map(t -> new RoundDetails(r, t.getT1(), t.getT2())));
    }

    public Flux<Round> rounds() {
        return rounds.findAll();
    }

    static boolean allHolesScored(CourseSnapshot course, Set<Integer> scored) {
        for (HoleDefinition h : course.holes()) {
            if (!scored.contains(h.holeNumber())) {
                return false;
            }
        }
        return true;
    }

    static List<String> playerList(String creatorKey, List<String> otherKeys) {
        List<String> keys = new ArrayList<>();
        keys.add(creatorKey);
        if (otherKeys != null) {
            keys.addAll(otherKeys);
        }
        Set<String> seen = new HashSet<>();
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                throw new InvalidPlayerSetException("Player key must not be blank");
            }
            if (!IdentityKeys.isKeyHex(key)) {
                throw new InvalidPlayerSetException("Not a 64-char lowercase hex public key: " + key);
            }
            if (!seen.add(key)) {
                throw new InvalidPlayerSetException("Duplicate player key " + key);
            }
        }
        return keys;
    }
}
