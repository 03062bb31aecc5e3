package com.raid.roundsync.service.round;

import java.util.List;
import java.util.Optional;

import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.Round;
import com.raid.roundsync.core.model.RoundPlayer;

/**
 * A round with its course and players, players ordered by index.
 */
public record RoundDetails(Round round, CourseSnapshot course, List<RoundPlayer> players) {

    public RoundDetails {
        players = List.copyOf(players);
    }

    public long roundId() {
        return round.roundId();
    }

    public RoundPlayer localPlayer() {
        return players.get(0);
    }

    public Optional<RoundPlayer> player(int playerIndex) {
        return players.stream().filter(p -> p.playerIndex() == playerIndex).findFirst();
    }

    public List<String> playerKeys() {
        return players.stream().map(RoundPlayer::publicKeyHex).toList();
    }

    /** Keys of everyone but the local player. */
    public List<String> remoteKeys() {
        return players.stream().filter(p -> !p.isLocal()).map(RoundPlayer::publicKeyHex).toList();
    }
}
