package com.raid.roundsync.service.round;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.raid.roundsync.core.model.HoleDefinition;
import com.raid.roundsync.core.model.RoundPlayer;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Headless scoring session over one round.
 *
 * <p>Per hole and player: Unscored, then Confirmed on the first tap (strokes = par), then further
 * +/- taps append new rows clamped to 1..20. Every command that changes a score writes through
 * {@link RoundAggregate} before the new {@link RoundState} is published. Navigation does not
 * write.</p>
 *
 * <p>Score commands run one at a time in the order they are issued. Each reads the stored
 * scores when it runs, so a score recorded through {@link RoundAggregate} directly is never
 * overwritten by a stale tap.</p>
 */
public final class ActiveRound {

    private static final Logger log = LoggerFactory.getLogger(ActiveRound.class);

    private final RoundAggregate aggregate;
    private volatile RoundState state;
    private Mono<RoundState> tail = Mono.empty();

    private ActiveRound(RoundAggregate aggregate, RoundState initial) {
        this.aggregate = aggregate;
        this.state = initial;
    }

    /** Loads the round and the current scores of every locally scored player. */
    public static Mono<ActiveRound> open(RoundAggregate aggregate, long roundId) {
        return aggregate.details(roundId).flatMap(d -> {
            List<RoundPlayer> scorable = d.players().stream()
                    .filter(p -> d.round().scoringMode().scoresLocally(p.playerIndex()))
                    .toList();
            return Flux.fromIterable(scorable)
                    .concatMap(p -> aggregate.currentScores(roundId, p.playerIndex())
                            .map(s -> Map.entry(p.playerIndex(), s)))
                    .collectMap(Map.Entry::getKey, Map.Entry::getValue, HashMap::new)
                    .zipWith(aggregate.isFinishEnabled(roundId, 0))
                    .map(t -> {
                        int firstHole = d.course().holes().get(0).holeNumber();
                        RoundState initial = new RoundState(roundId, d.course().holes(), scorable, firstHole, 0,
                                t.getT1(), t.getT2(), d.round().isCompleted());
                        return new ActiveRound(aggregate, initial);
                    });
        });
    }

    public RoundState state() {
        return state;
    }

    /** First tap on an unscored hole: records par. On a scored hole nothing is written. */
    public synchronized Mono<RoundState> confirmAtPar() {
        RoundState s = state;
        int player = s.currentPlayer();
        int hole = s.currentHole();
        int par = s.par(hole);
        return enqueue(() -> stored(player).flatMap(scores -> scores.containsKey(hole)
                ? Mono.just(refresh(player, scores))
                : write(player, hole, par)));
    }

    public synchronized Mono<RoundState> increment() {
        return adjust(1);
    }

    public synchronized Mono<RoundState> decrement() {
        return adjust(-1);
    }

    public synchronized RoundState advanceHole() {
        return moveHole(1);
    }

    public synchronized RoundState retreatHole() {
        return moveHole(-1);
    }

    /**
     * @throws IllegalArgumentException if the player is not scored on this device
     */
    public synchronized RoundState switchPlayer(int playerIndex) {
        RoundState s = state;
        boolean known = s.players().stream().anyMatch(p -> p.playerIndex() == playerIndex);
        if (!known) {
            throw new IllegalArgumentException("Player " + playerIndex + " is not scored on this device");
        }
        state = s.withPosition(s.currentHole(), playerIndex);
        return state;
    }

    /**
     * Completes the round when every hole of the local player is scored; otherwise returns the
     * unchanged state with {@code finishEnabled = false}.
     */
    public synchronized Mono<RoundState> requestFinish() {
        long roundId = state.roundId();
        return enqueue(() -> {
            if (state.completed()) {
                return Mono.just(state);
            }
            return aggregate.isFinishEnabled(roundId, 0).flatMap(enabled -> {
                if (!enabled) {
                    log.debug("Finish requested for round {} with unscored holes", roundId);
                    return Mono.just(state);
                }
                return aggregate.completeRound(roundId).map(r -> markCompleted());
            });
        });
    }

    /**
     * The hole and player are taken when the command is issued; the stored score is read when it
     * runs, so scores recorded outside this session are the base.
     */
    private Mono<RoundState> adjust(int delta) {
        RoundState s = state;
        int player = s.currentPlayer();
        int hole = s.currentHole();
        int par = s.par(hole);
        return enqueue(() -> stored(player).flatMap(scores -> {
            Integer current = scores.get(hole);
            int base = current == null ? par : current;
            int next = clamp(base + delta);
            if (current != null && next == base) {
                return Mono.just(refresh(player, scores));
            }
            return write(player, hole, next);
        }));
    }

    /**
     * Runs score commands one after another in issue order. A failed command does not block the
     * ones after it.
     */
    private Mono<RoundState> enqueue(Supplier<Mono<RoundState>> command) {
        Mono<RoundState> previous = tail;
        Mono<RoundState> next = previous.onErrorResume(err -> Mono.empty())
                .then(Mono.defer(command))
                .cache();
        tail = next;
        return next;
    }

    private Mono<Map<Integer, Integer>> stored(int playerIndex) {
        return aggregate.currentScores(state.roundId(), playerIndex);
    }

    private Mono<RoundState> write(int playerIndex, int holeNumber, int strokes) {
        long roundId = state.roundId();
        return aggregate.recordScore(roundId, playerIndex, holeNumber, strokes)
                .then(aggregate.isFinishEnabled(roundId, 0))
                .map(enabled -> applyScore(playerIndex, holeNumber, strokes, enabled));
    }

    private synchronized RoundState refresh(int playerIndex, Map<Integer, Integer> scores) {
        state = state.withPlayerScores(playerIndex, scores);
        return state;
    }

    private synchronized RoundState applyScore(int playerIndex, int holeNumber, int strokes, boolean finishEnabled) {
        state = state.withScore(playerIndex, holeNumber, strokes, finishEnabled);
        return state;
    }

    private synchronized RoundState markCompleted() {
        state = state.withCompleted();
        return state;
    }

    private RoundState moveHole(int step) {
        RoundState s = state;
        List<HoleDefinition> holes = s.holes();
        int idx = 0;
        for (int i = 0; i < holes.size(); i++) {
            if (holes.get(i).holeNumber() == s.currentHole()) {
                idx = i;
                break;
            }
        }
        int target = Math.max(0, Math.min(holes.size() - 1, idx + step));
        state = s.withPosition(holes.get(target).holeNumber(), s.currentPlayer());
        return state;
    }

    static int clamp(int strokes) {
        return Math.max(RoundAggregate.MIN_STROKES, Math.min(RoundAggregate.MAX_STROKES, strokes));
    }
}
