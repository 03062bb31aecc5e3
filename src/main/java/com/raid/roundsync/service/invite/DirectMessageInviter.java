package com.raid.roundsync.service.invite;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.raid.roundsync.core.crypto.GiftWrap;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.ReadOnlyAccountException;
import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.event.Tags;
import com.raid.roundsync.core.event.UnsignedEvent;
import com.raid.roundsync.core.model.AccountState;
import com.raid.roundsync.core.model.Profile;
import com.raid.roundsync.core.model.SocialListKind;
import com.raid.roundsync.core.relay.RelayClient;
import com.raid.roundsync.core.relay.RelayFilter;
import com.raid.roundsync.jetstream.config.RaidProperties;
import com.raid.roundsync.r2dbc.store.RoundNetworkStore;
import com.raid.roundsync.service.identity.ThreeTierIdentityCache;
import com.raid.roundsync.service.round.RoundAggregate;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Sends and receives round invites as gift-wrapped private messages.
 *
 * <p>Each recipient gets an individually wrapped message on their inbox relays, or on the
 * fallback relays when they have none. Failures are per recipient and never stop the others.</p>
 */
@Service
public class DirectMessageInviter {

    private static final Logger log = LoggerFactory.getLogger(DirectMessageInviter.class);

    private final RoundAggregate rounds;
    private final RoundNetworkStore network;
    private final ThreeTierIdentityCache identities;
    private final RelayClient relays;
    private final IdentityKeys keys;
    private final AccountState account;
    private final RaidProperties props;
    private final Clock clock;

    public DirectMessageInviter(RoundAggregate rounds, RoundNetworkStore network, ThreeTierIdentityCache identities,
            RelayClient relays, IdentityKeys keys, AccountState account, RaidProperties props, Clock clock) {
        this.rounds = rounds;
        this.network = network;
        this.identities = identities;
        this.relays = relays;
        this.keys = keys;
        this.account = account;
        this.props = props;
        this.clock = clock;
    }

    static String messageText(String courseName, String inviteUri) {
        return "You've been invited to play golf at " + courseName + "!\n\nJoin: " + inviteUri + "\n\nSent from RAID Golf";
    }

    /**
     * Invite URI of a round whose initiation id is known.
     *
     * @throws ContentNotFoundException if the round has not been published yet
     */
    public Mono<String> inviteUri(long roundId) {
        return network.findByRoundId(roundId)
                .switchIfEmpty(Mono.error(() -> new ContentNotFoundException("Round " + roundId + " is not published yet")))
                .map(r -> InviteCodec.toUri(r.initiationEventId(), props.getRelays().getPublish()));
    }

    /**
     * Sends the round's invite to every recipient except the local player.
     */
    public Mono<InviteReport> sendInvites(long roundId, Collection<String> recipients) {
        if (!account.canPublish()) {
            return Mono.error(new ReadOnlyAccountException("send invites for round " + roundId));
        }
        Set<String> targets = new LinkedHashSet<>(recipients);
        targets.remove(keys.publicKeyHex());

        return Mono.zip(rounds.details(roundId), network.findByRoundId(roundId)
                .switchIfEmpty(Mono.error(() -> new ContentNotFoundException("Round " + roundId + " is not published yet"))))
                .flatMap(t -> {
                    String initiationId = t.getT2().initiationEventId();
                    String uri = InviteCodec.toUri(initiationId, props.getRelays().getPublish());
                    String text = messageText(t.getT1().course().courseName(), uri);
                    List<String> sent = new ArrayList<>();
                    List<String> failed = new ArrayList<>();
                    return Flux.fromIterable(targets)
                            .concatMap(recipient -> sendOne(recipient, text)
                                    .doOnNext(acked -> sent.add(recipient))
                                    .onErrorResume(err -> {
                                        log.warn("Invite for round {} to {} failed: {}", roundId,
                                                Profile.shortKey(recipient), err.toString());
                                        failed.add(recipient);
                                        return Mono.empty();
                                    }))
                            .then(Mono.fromCallable(() -> new InviteReport(initiationId, uri, sent, failed)));
                })
                .doOnNext(r -> log.info("Round {} invites sent={} failed={}", roundId, r.sent().size(),
                        r.failed().size()));
    }

    /**
     * Invites addressed to the local key within the lookback window, newest first, one per
     * round, excluding rounds already on this device.
     */
    public Flux<IncomingInvite> fetchIncomingInvites() {
        Duration lookback = props.getInvite().getLookback();
        Instant now = clock.instant();
        Instant since = now.minus(lookback);
        // wraps are backdated up to two days, so the relay window is wider than the rumor window
        RelayFilter filter = RelayFilter.kind(EventKind.GIFT_WRAP).ref(keys.publicKeyHex())
                .since(since.minus(Duration.ofDays(2)));

        return identities.cachedList(SocialListKind.INBOX_RELAYS, keys.publicKeyHex())
                .flatMapMany(own -> relays.query(filter, readTargets(own.members())))
                .concatMap(this::open)
                .filter(o -> o.rumor().kind() == EventKind.PRIVATE_MESSAGE)
                .filter(o -> !o.rumor().createdInstant().isBefore(since))
                .concatMap(o -> {
                    String token = InviteCodec.findToken(o.rumor().content());
                    if (token == null) {
                        return Mono.empty();
                    }
                    return Mono.fromCallable(() -> InviteCodec.decode(token))
                            .onErrorResume(IllegalArgumentException.class, err -> {
                                log.debug("Ignoring malformed invite in wrap {}: {}", o.wrapEventId(), err.getMessage());
                                return Mono.empty();
                            })
                            .map(invite -> new Received(invite, o));
                })
                .sort((a, b) -> Long.compare(b.opened().rumor().createdAt(), a.opened().rumor().createdAt()))
                .distinct(r -> r.invite().eventId())
                .filterWhen(r -> network.findByInitiationEventId(r.invite().eventId()).hasElement().map(joined -> !joined))
                .collectList()
                .flatMapMany(received -> identities.cached(senders(received))
                        .flatMapMany(labels -> Flux.fromIterable(received).map(r -> toInvite(r, labels))));
    }

    private Mono<List<String>> sendOne(String recipient, String text) {
        UnsignedEvent rumor = new UnsignedEvent(keys.publicKeyHex(), clock.instant().getEpochSecond(),
                EventKind.PRIVATE_MESSAGE, List.of(Tags.tag("p", recipient)), text);
        return identities.inboxRelays(recipient).flatMap(inbox -> {
            RelayEvent wrap = GiftWrap.wrap(rumor, keys, recipient, clock.instant().getEpochSecond());
            List<String> targets = inboxOrFallback(inbox);
            log.debug("Invite wrap {} to {} via {}", wrap.id(), Profile.shortKey(recipient), targets);
            return relays.publish(wrap, targets);
        });
    }

    private List<String> inboxOrFallback(List<String> inbox) {
        return inbox.isEmpty() ? props.getRelays().getInboxFallback() : inbox;
    }

    private List<String> readTargets(List<String> ownInbox) {
        Set<String> out = new LinkedHashSet<>(ownInbox);
        out.addAll(props.getRelays().getRead());
        out.addAll(props.getRelays().getInboxFallback());
        return new ArrayList<>(out);
    }

    private Mono<GiftWrap.Opened> open(RelayEvent wrap) {
        return Mono.fromCallable(() -> GiftWrap.open(wrap, keys))
                .onErrorResume(GeneralSecurityException.class, err -> {
                    log.debug("Cannot open wrap {}: {}", wrap.id(), err.getMessage());
                    return Mono.empty();
                });
    }

    private static List<String> senders(List<Received> received) {
        return received.stream().map(r -> r.opened().senderPublicKeyHex()).distinct().toList();
    }

    private static IncomingInvite toInvite(Received r, Map<String, Profile> labels) {
        String sender = r.opened().senderPublicKeyHex();
        Profile p = labels.get(sender);
        return new IncomingInvite(r.invite().eventId(), r.invite().relayHints(), sender,
                p == null ? Profile.shortKey(sender) : p.label(), r.opened().rumor().content(),
                r.opened().rumor().createdInstant());
    }

    private record Received(InviteToken invite, GiftWrap.Opened opened) {
    }
}
