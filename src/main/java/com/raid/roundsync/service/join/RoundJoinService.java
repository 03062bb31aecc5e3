package com.raid.roundsync.service.join;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.NotAParticipantException;
import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.InitiationRecord;
import com.raid.roundsync.core.event.RoundEventParser;
import com.raid.roundsync.core.relay.RelayClient;
import com.raid.roundsync.core.relay.RelayFilter;
import com.raid.roundsync.jetstream.config.RaidProperties;
import com.raid.roundsync.r2dbc.store.RoundNetworkStore;
import com.raid.roundsync.service.course.ContentAddressedCourseStore;
import com.raid.roundsync.service.invite.InviteCodec;
import com.raid.roundsync.service.invite.InviteToken;
import com.raid.roundsync.service.round.RoundAggregate;

import reactor.core.publisher.Mono;

/**
 * Joins a round created on another device from its invite token.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Decode the token and look for a local round already bound to that initiation id.</li>
 *   <li>Fetch the initiation from the hinted relays plus the configured read relays. Only
 *       events with a valid signature are returned by the relay client.</li>
 *   <li>Recompute course and rules hashes; a mismatch is
 *       {@link com.raid.roundsync.core.error.UntrustedContentException}.</li>
 *   <li>Require the local key among the players, store the course, create the round with the
 *       local key at index 0 and bind it to the initiation id as {@code joined}.</li>
 * </ol>
 *
 * Joining twice returns the existing round.
 */
@Service
public class RoundJoinService {

    private static final Logger log = LoggerFactory.getLogger(RoundJoinService.class);

    private final RelayClient relays;
    private final ContentAddressedCourseStore courses;
    private final RoundAggregate rounds;
    private final RoundNetworkStore network;
    private final IdentityKeys keys;
    private final RaidProperties props;

    private final Map<String, Mono<JoinResult>> inFlight = new ConcurrentHashMap<>();

    public RoundJoinService(RelayClient relays, ContentAddressedCourseStore courses, RoundAggregate rounds,
            RoundNetworkStore network, IdentityKeys keys, RaidProperties props) {
        this.relays = relays;
        this.courses = courses;
        this.rounds = rounds;
        this.network = network;
        this.keys = keys;
        this.props = props;
    }

    /**
     * @throws IllegalArgumentException  if the token cannot be decoded
     * @throws ContentNotFoundException  if no reachable relay has the initiation
     * @throws NotAParticipantException  if the local key is not a player of the round
     */
    public Mono<JoinResult> joinRound(String token) {
        return Mono.fromCallable(() -> InviteCodec.decode(token))
                .flatMap(invite -> inFlight.computeIfAbsent(invite.eventId(), id -> network.findByInitiationEventId(id)
                        .map(existing -> new JoinResult(existing.roundId(), id, true))
                        .switchIfEmpty(Mono.defer(() -> join(invite)))
                        .doFinally(signal -> inFlight.remove(id))
                        .cache()));
    }

    private Mono<JoinResult> join(InviteToken invite) {
        String eventId = invite.eventId();
        return relays.query(RelayFilter.kind(EventKind.ROUND_INITIATION).id(eventId), targets(invite))
                .next()
                .switchIfEmpty(Mono.error(() -> new ContentNotFoundException(
                        "Initiation " + eventId + " not found on " + targets(invite))))
                .map(RoundEventParser::parseInitiation)
                .flatMap(this::createLocalRound);
    }

    private Mono<JoinResult> createLocalRound(InitiationRecord initiation) {
        String local = keys.publicKeyHex();
        if (!initiation.playerPubkeys().contains(local)) {
            return Mono.error(new NotAParticipantException(initiation.eventId()));
        }
        List<String> others = new ArrayList<>();
        for (String pk : new LinkedHashSet<>(initiation.playerPubkeys())) {
            if (!pk.equals(local)) {
                others.add(pk);
            }
        }
        return courses.importVerified(initiation.course())
                .flatMap(course -> rounds.createJoinedRound(course, local, others, initiation.roundDate(),
                        initiation.eventId()))
                .map(round -> {
                    log.info("Joined round {} (initiation {}) hosted by {}", round.roundId(), initiation.eventId(),
                            initiation.authorPubkey());
                    return new JoinResult(round.roundId(), initiation.eventId(), false);
                });
    }

    private List<String> targets(InviteToken invite) {
        Set<String> out = new LinkedHashSet<>(invite.relayHints());
        out.addAll(props.getRelays().getRead());
        return new ArrayList<>(out);
    }
}
