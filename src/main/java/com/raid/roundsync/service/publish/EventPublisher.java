package com.raid.roundsync.service.publish;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.raid.roundsync.core.crypto.EventSigner;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.ReadOnlyAccountException;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.event.RoundEventBuilder;
import com.raid.roundsync.core.event.UnsignedEvent;
import com.raid.roundsync.core.model.AccountState;
import com.raid.roundsync.core.model.JoinedVia;
import com.raid.roundsync.core.model.RoundPlayer;
import com.raid.roundsync.core.model.ScorecardStatus;
import com.raid.roundsync.core.model.ScoringMode;
import com.raid.roundsync.core.relay.RelayClient;
import com.raid.roundsync.r2dbc.store.RoundNetworkStore;
import com.raid.roundsync.service.round.RoundAggregate;
import com.raid.roundsync.service.round.RoundDetails;
import com.raid.roundsync.service.task.RoundTaskRegistry;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Publishes a round's network records.
 *
 * <h2>Exactly-once rules</h2>
 * <ul>
 *   <li>The initiation (kind 1501) is published once per round. Its id is written to the
 *       round's network record, which is set at most once; later calls reuse the stored id.</li>
 *   <li>Concurrent initiation requests for the same round share one in-flight publish.</li>
 *   <li>A final record (kind 1502) is published once per player and is never sent before the
 *       round's initiation id is known. If the initiation never made it out, it is published
 *       first, synchronously, as part of the same call.</li>
 *   <li>Relays de-duplicate by event id, so a repeated publish after a partial failure is
 *       harmless.</li>
 * </ul>
 *
 * <h2>Signing</h2>
 * Everything is signed with the device key. In same-device rounds that key signs every
 * player's final record; in multi-device and joined rounds only the local player's.
 */
@Service
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final RoundAggregate rounds;
    private final RoundNetworkStore network;
    private final RelayClient relays;
    private final IdentityKeys keys;
    private final AccountState account;
    private final RoundTaskRegistry tasks;
    private final Clock clock;

    private final Map<Long, Mono<String>> initiationsInFlight = new ConcurrentHashMap<>();

    public EventPublisher(RoundAggregate rounds, RoundNetworkStore network, RelayClient relays, IdentityKeys keys,
            AccountState account, RoundTaskRegistry tasks, Clock clock) {
        this.rounds = rounds;
        this.network = network;
        this.relays = relays;
        this.keys = keys;
        this.account = account;
        this.tasks = tasks;
        this.clock = clock;
    }

    /**
     * Publishes the round's initiation unless its id is already stored, and returns the id.
     *
     * @throws ReadOnlyAccountException if the account may not publish
     */
    public Mono<String> publishInitiation(long roundId, JoinedVia joinedVia) {
        if (!account.canPublish()) {
            return Mono.error(new ReadOnlyAccountException("publish round " + roundId));
        }
        return Mono.defer(() -> initiationsInFlight.computeIfAbsent(roundId, id -> network.findByRoundId(id)
                .map(existing -> {
                    log.debug("Round {} already has initiation {}", id, existing.initiationEventId());
                    return existing.initiationEventId();
                })
                .switchIfEmpty(Mono.defer(() -> broadcastInitiation(id, joinedVia)))
                .doFinally(signal -> initiationsInFlight.remove(id))
                .cache()));
    }

    /**
     * Starts {@link #publishInitiation} in the background. Failures are logged only; the final
     * record path repairs a missing initiation later.
     */
    public Disposable publishInitiationInBackground(long roundId, JoinedVia joinedVia) {
        return tasks.submit("initiation-" + roundId, publishInitiation(roundId, joinedVia)
                .doOnError(err -> log.warn("Background initiation publish for round {} failed: {}", roundId,
                        err.toString())));
    }

    /**
     * Publishes the final record of one player and returns its id. A second call returns the id
     * stored by the first.
     *
     * @throws IllegalArgumentException if the player is not scored on this device
     */
    public Mono<String> publishFinalRecord(long roundId, int playerIndex) {
        if (!account.canPublish()) {
            return Mono.error(new ReadOnlyAccountException("publish final record of round " + roundId));
        }
        return rounds.details(roundId).flatMap(d -> {
            RoundPlayer scored = d.player(playerIndex).orElse(null);
            if (scored == null) {
                return Mono.error(new IllegalArgumentException("Round " + roundId + " has no player " + playerIndex));
            }
            if (!d.round().scoringMode().scoresLocally(playerIndex)) {
                return Mono.error(new IllegalArgumentException(
                        "Player " + playerIndex + " of round " + roundId + " publishes from their own device"));
            }
            return network.findFinalRecordId(roundId, playerIndex)
                    .switchIfEmpty(Mono.defer(() -> ensureInitiation(d)
                            .flatMap(initiationId -> broadcastFinalRecord(d, scored, initiationId))));
        });
    }

    /**
     * Publishes every final record this device is responsible for: all players of a
     * same-device round, otherwise only the local player.
     */
    public Mono<List<String>> publishFinalRecords(long roundId) {
        return rounds.details(roundId).flatMapMany(d -> {
            List<Integer> indexes = d.round().scoringMode() == ScoringMode.SAME_DEVICE
                    ? d.players().stream().map(RoundPlayer::playerIndex).toList()
                    : List.of(0);
            return Flux.fromIterable(indexes).concatMap(idx -> publishFinalRecord(roundId, idx));
        }).collectList();
    }

    /**
     * Publishes the local player's current scores as a replaceable live scorecard. This is what
     * other devices read when they refresh remote scores.
     */
    public Mono<String> publishLiveScorecard(long roundId, ScorecardStatus status) {
        if (!account.canPublish()) {
            return Mono.error(new ReadOnlyAccountException("publish live scorecard of round " + roundId));
        }
        return rounds.details(roundId).flatMap(d -> ensureInitiation(d)
                .zipWith(rounds.currentScores(roundId, 0))
                .flatMap(t -> {
                    UnsignedEvent event = RoundEventBuilder.liveScorecard(keys.publicKeyHex(), nowSeconds(), t.getT1(),
                            status, d.playerKeys(), t.getT2());
                    RelayEvent signed = EventSigner.sign(event, keys);
                    return relays.publish(signed)
                            .doOnNext(acked -> log.debug("Live scorecard {} for round {} ({} holes, {}) on {}",
                                    signed.id(), roundId, t.getT2().size(), status.wireValue(), acked))
                            .thenReturn(signed.id());
                }));
    }

    private Mono<String> ensureInitiation(RoundDetails d) {
        return network.findByRoundId(d.roundId())
                .map(r -> r.initiationEventId())
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("Round {} has no initiation yet; publishing it before its final records", d.roundId());
                    return publishInitiation(d.roundId(), JoinedVia.forCreatedRound(d.round().scoringMode()));
                }));
    }

    private Mono<String> broadcastInitiation(long roundId, JoinedVia joinedVia) {
        return rounds.details(roundId).flatMap(d -> {
            UnsignedEvent event = RoundEventBuilder.initiation(keys.publicKeyHex(), nowSeconds(), d.course(),
                    d.round().roundDate(), d.playerKeys());
            RelayEvent signed = EventSigner.sign(event, keys);
            return relays.publish(signed)
                    .flatMap(acked -> {
                        log.info("Initiation {} for round {} accepted by {}", signed.id(), roundId, acked);
                        return network.insertIfAbsent(roundId, signed.id(), joinedVia, clock.instant());
                    })
                    .map(stored -> stored.initiationEventId());
        });
    }

    private Mono<String> broadcastFinalRecord(RoundDetails d, RoundPlayer scored, String initiationId) {
        return rounds.currentScores(d.roundId(), scored.playerIndex()).flatMap(scores -> {
            UnsignedEvent event = RoundEventBuilder.finalRecord(keys.publicKeyHex(), nowSeconds(), initiationId,
                    scored.publicKeyHex(), d.playerKeys(), scores);
            RelayEvent signed = EventSigner.sign(event, keys);
            return relays.publish(signed)
                    .flatMap(acked -> {
                        log.info("Final record {} for round {} player {} accepted by {}", signed.id(), d.roundId(),
                                scored.playerIndex(), acked);
                        return network.saveFinalRecordId(d.roundId(), scored.playerIndex(), signed.id(),
                                clock.instant());
                    });
        });
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
