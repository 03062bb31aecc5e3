package com.raid.roundsync.service.round;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.raid.roundsync.core.model.HoleDefinition;
import com.raid.roundsync.core.model.RoundPlayer;

/**
 * Immutable snapshot of an {@link ActiveRound}: position (current hole and player) plus the
 * current strokes of every locally scored player.
 *
 * @param scores player index to (hole number to strokes); unscored holes are absent
 */
public record RoundState(
        long roundId,
        List<HoleDefinition> holes,
        List<RoundPlayer> players,
        int currentHole,
        int currentPlayer,
        Map<Integer, Map<Integer, Integer>> scores,
        boolean finishEnabled,
        boolean completed
) {

    public RoundState {
        holes = List.copyOf(holes);
        players = List.copyOf(players);
        Map<Integer, Map<Integer, Integer>> copy = new TreeMap<>();
        scores.forEach((idx, byHole) -> copy.put(idx, Collections.unmodifiableMap(new TreeMap<>(byHole))));
        scores = Collections.unmodifiableMap(copy);
    }

    public Optional<Integer> strokes(int playerIndex, int holeNumber) {
        return Optional.ofNullable(scores.getOrDefault(playerIndex, Map.of()).get(holeNumber));
    }

    public boolean isScored(int playerIndex, int holeNumber) {
        return strokes(playerIndex, holeNumber).isPresent();
    }

    public int par(int holeNumber) {
        return holes.stream().filter(h -> h.holeNumber() == holeNumber).mapToInt(HoleDefinition::par).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No hole " + holeNumber));
    }

    public int total(int playerIndex) {
        return scores.getOrDefault(playerIndex, Map.of()).values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Strokes relative to par over the scored holes only. */
    public int toPar(int playerIndex) {
        int diff = 0;
        for (Map.Entry<Integer, Integer> e : scores.getOrDefault(playerIndex, Map.of()).entrySet()) {
            diff += e.getValue() - par(e.getKey());
        }
        return diff;
    }

    RoundState withPosition(int hole, int player) {
        return new RoundState(roundId, holes, players, hole, player, scores, finishEnabled, completed);
    }

    RoundState withScore(int playerIndex, int holeNumber, int strokes, boolean finishEnabled) {
        Map<Integer, Map<Integer, Integer>> next = new TreeMap<>();
        scores.forEach((idx, byHole) -> next.put(idx, new TreeMap<>(byHole)));
        next.computeIfAbsent(playerIndex, k -> new TreeMap<>()).put(holeNumber, strokes);
        return new RoundState(roundId, holes, players, currentHole, currentPlayer, next, finishEnabled, completed);
    }

    RoundState withPlayerScores(int playerIndex, Map<Integer, Integer> byHole) {
        Map<Integer, Map<Integer, Integer>> next = new TreeMap<>(scores);
        next.put(playerIndex, byHole);
        return new RoundState(roundId, holes, players, currentHole, currentPlayer, next, finishEnabled, completed);
    }

    RoundState withCompleted() {
        return new RoundState(roundId, holes, players, currentHole, currentPlayer, scores, finishEnabled, true);
    }
}
