package com.raid.roundsync.service.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.event.RoundEventParser;
import com.raid.roundsync.core.event.ScoreSnapshot;
import com.raid.roundsync.core.model.RemotePlayerScores;
import com.raid.roundsync.core.model.RoundNetworkRecord;
import com.raid.roundsync.core.relay.RelayClient;
import com.raid.roundsync.core.relay.RelayFilter;
import com.raid.roundsync.r2dbc.store.RemoteScoreStore;
import com.raid.roundsync.r2dbc.store.RoundNetworkStore;
import com.raid.roundsync.service.round.RoundAggregate;
import com.raid.roundsync.service.round.RoundDetails;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Pulls remote players' progress into the remote-score side table and waits for a round's
 * initiation id.
 *
 * <p>Remote data never reaches {@code hole_scores}. Snapshots are accepted only when signed by a
 * round participant and only for players other than the local one.</p>
 */
@Service
public class SyncPoller {

    private static final Logger log = LoggerFactory.getLogger(SyncPoller.class);

    private final RoundAggregate rounds;
    private final RoundNetworkStore network;
    private final RemoteScoreStore remoteScores;
    private final RelayClient relays;
    private final Clock clock;

    public SyncPoller(RoundAggregate rounds, RoundNetworkStore network, RemoteScoreStore remoteScores,
            RelayClient relays, Clock clock) {
        this.rounds = rounds;
        this.network = network;
        this.remoteScores = remoteScores;
        this.relays = relays;
        this.clock = clock;
    }

    /**
     * Fetches the newest live scorecard and any final record of every player except index 0,
     * stores what supersedes the cached state, and returns the cached state afterwards keyed by
     * player key. A round without an initiation id has nothing to fetch.
     */
    public Mono<Map<String, RemotePlayerScores>> refreshRemoteScores(long roundId) {
        return rounds.details(roundId)
                .flatMap(d -> network.findByRoundId(roundId)
                        .flatMap(record -> fetch(d, record).then(cached(roundId)))
                        .switchIfEmpty(Mono.defer(() -> {
                            log.debug("Round {} has no initiation id; nothing to refresh", roundId);
                            return cached(roundId);
                        })));
    }

    /**
     * Polls the local network record until it holds an initiation id. Completes empty once
     * {@code maxAttempts} checks found nothing; disposing the subscription stops it.
     */
    public Mono<String> awaitInitiationRecord(long roundId, int maxAttempts, Duration interval) {
        return Flux.interval(Duration.ZERO, interval)
                .take(maxAttempts)
                .concatMap(tick -> network.findByRoundId(roundId))
                .next()
                .map(RoundNetworkRecord::initiationEventId)
                .doOnNext(id -> log.debug("Round {} initiation {} available", roundId, id));
    }

    private Mono<Void> fetch(RoundDetails d, RoundNetworkRecord record) {
        List<String> remoteKeys = d.remoteKeys();
        if (remoteKeys.isEmpty()) {
            return Mono.empty();
        }
        String initiationId = record.initiationEventId();
        Set<String> participants = Set.copyOf(d.playerKeys());
        Set<String> remote = Set.copyOf(remoteKeys);

        Flux<ScoreSnapshot> live = relays
                .query(RelayFilter.kind(EventKind.LIVE_SCORECARD).authors(remoteKeys).ref(initiationId))
                .concatMap(e -> parse(e, RoundEventParser::parseLiveScorecard));
        Flux<ScoreSnapshot> finals = relays
                .query(RelayFilter.kind(EventKind.FINAL_RECORD).authors(participants).ref(initiationId))
                .concatMap(e -> parse(e, RoundEventParser::parseFinalRecord));

        return Flux.merge(live, finals)
                .filter(s -> accept(s, initiationId, participants, remote))
                .map(s -> toRemote(d.roundId(), s))
                .concatMap(s -> remoteScores.upsertIfNewer(s, clock.instant()))
                .doOnNext(s -> log.debug("Round {} remote {} now {} holes ({})", d.roundId(),
                        s.playerPublicKeyHex(), s.holesScored(), s.status()))
                .then();
    }

    private Mono<Map<String, RemotePlayerScores>> cached(long roundId) {
        return remoteScores.findByRound(roundId).collectMap(RemotePlayerScores::playerPublicKeyHex);
    }

    static boolean accept(ScoreSnapshot s, String initiationId, Set<String> participants, Set<String> remote) {
        if (!initiationId.equals(s.initiationEventId())) {
            return false;
        }
        if (!participants.contains(s.authorPubkey())) {
            log.warn("Dropping score event {} from non-participant {}", s.eventId(), s.authorPubkey());
            return false;
        }
        return remote.contains(s.scoredPlayerPubkey());
    }

    private static RemotePlayerScores toRemote(long roundId, ScoreSnapshot s) {
        return new RemotePlayerScores(roundId, s.scoredPlayerPubkey(), s.scores(), s.status(), s.eventId(),
                s.finalRecord(), Instant.ofEpochSecond(s.createdAt()));
    }

    private static Mono<ScoreSnapshot> parse(RelayEvent event, Function<RelayEvent, ScoreSnapshot> parser) {
        return Mono.fromCallable(() -> parser.apply(event))
                .onErrorResume(IllegalArgumentException.class, err -> {
                    log.debug("Skipping malformed event {}: {}", event.id(), err.getMessage());
                    return Mono.empty();
                });
    }
}
