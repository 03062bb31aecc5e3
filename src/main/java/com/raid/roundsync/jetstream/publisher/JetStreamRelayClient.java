package com.raid.roundsync.jetstream.publisher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raid.roundsync.core.crypto.EventSigner;
import com.raid.roundsync.core.error.RelayPublishException;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.relay.RelayClient;
import com.raid.roundsync.core.relay.RelayFilter;
import com.raid.roundsync.core.subject.RelaySubject;
import com.raid.roundsync.jetstream.config.RaidProperties;
import com.raid.roundsync.jetstream.config.RelayConnectionPool;
import com.raid.roundsync.jetstream.config.RelayStreamProperties;

import io.nats.client.JetStream;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PublishOptions;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.PublishAck;
import io.nats.client.api.ReplayPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Relay client backed by NATS JetStream.
 *
 * <h2>Publishing</h2>
 * <ul>
 *   <li>Each event goes to {@code raid.<kind>.<author>.<ref>.<id>} on every target relay.</li>
 *   <li>{@code Msg-Id == event.id}, so a re-publish (retry, fallback path) is dropped by the
 *       relay inside its duplicate window.</li>
 *   <li>Relays are tried independently; the call fails only when no relay acknowledged.</li>
 * </ul>
 *
 * <h2>Querying</h2>
 * <ul>
 *   <li>A short-lived pull consumer per filter subject: no durable name, no acks
 *       ({@link AckPolicy#None}), removed after the fetch.</li>
 *   <li>Pending count is read first so the fetch returns as soon as the available messages
 *       arrive instead of waiting for the full timeout.</li>
 *   <li>Events whose id or signature do not verify are dropped and logged.</li>
 *   <li>An unreachable or slow relay contributes nothing; other relays still answer.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * All NATS calls are blocking and run on {@link Schedulers#boundedElastic()}.
 */
@Component
public class JetStreamRelayClient implements RelayClient {

    private static final Logger log = LoggerFactory.getLogger(JetStreamRelayClient.class);

    private final RelayConnectionPool pool;
    private final RaidProperties.Relays relays;
    private final RelayStreamProperties stream;
    private final ObjectMapper mapper;

    public JetStreamRelayClient(
            RelayConnectionPool pool,
            RaidProperties props,
            RelayStreamProperties stream,
            ObjectMapper mapper
    ) {
        this.pool = pool;
        this.relays = props.getRelays();
        this.stream = stream;
        this.mapper = mapper;
    }

    @Override
    public Mono<List<String>> publish(RelayEvent event) {
        return publish(event, relays.getPublish());
    }

    @Override
    public Mono<List<String>> publish(RelayEvent event, Collection<String> relayUrls) {
        List<String> targets = new ArrayList<>(new LinkedHashSet<>(relayUrls));
        if (targets.isEmpty()) {
            return Mono.error(new RelayPublishException(event.id(), List.of(), null));
        }
        byte[] payload = toJson(event);
        String subject = RelaySubject.of(event).toSubject();
        List<String> failed = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<Throwable> lastError = new AtomicReference<>();

        return Flux.fromIterable(targets)
                .flatMap(relay -> publishOne(relay, subject, event.id(), payload)
                        .onErrorResume(err -> {
                            log.warn("Publish of event {} to {} failed: {}", event.id(), relay, err.toString());
                            failed.add(relay);
                            lastError.set(err);
                            return Mono.empty();
                        }))
                .collectList()
                .flatMap(accepted -> accepted.isEmpty()
                        ? Mono.error(new RelayPublishException(event.id(), failed, lastError.get()))
                        : Mono.just(accepted));
    }

    private Mono<String> publishOne(String relay, String subject, String eventId, byte[] payload) {
        return Mono.fromCallable(() -> {
                    JetStream js = pool.connection(relay).jetStream();
                    PublishOptions opts = PublishOptions.builder()
                            .messageId(eventId)
                            .build();

                    PublishAck ack = js.publish(subject, payload, opts);

                    if (ack.isDuplicate()) {
                        log.debug("Relay {} already had event {}", relay, eventId);
                    } else {
                        log.info("Published event id={} subject={} relay={} stream={} seq={}",
                                eventId, subject, relay, ack.getStream(), ack.getSeqno());
                    }
                    return relay;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<RelayEvent> query(RelayFilter filter) {
        return query(filter, relays.getRead());
    }

    @Override
    public Flux<RelayEvent> query(RelayFilter filter, Collection<String> relayUrls) {
        Duration timeout = relays.getReadTimeout();
        return Flux.fromIterable(new LinkedHashSet<>(relayUrls))
                .flatMap(relay -> Flux.fromIterable(filter.subjects())
                        .concatMap(subject -> fetchSubject(relay, subject, filter))
                        .timeout(timeout.plus(timeout))
                        .onErrorResume(err -> {
                            log.warn("Query {} on relay {} failed: {}", filter.subjects(), relay, err.toString());
                            return Flux.empty();
                        }))
                .filter(this::verified)
                .filter(filter::matches)
                .distinct(RelayEvent::id);
    }

    private Flux<RelayEvent> fetchSubject(String relay, String subject, RelayFilter filter) {
        return Mono.fromCallable(() -> fetchBlocking(relay, subject, filter))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(list -> list);
    }

    private List<RelayEvent> fetchBlocking(String relay, String subject, RelayFilter filter) throws Exception {
        JetStream js = pool.connection(relay).jetStream();

        ConsumerConfiguration.Builder cc = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.None)
                .replayPolicy(ReplayPolicy.Instant)
                .filterSubject(subject)
                .inactiveThreshold(Duration.ofSeconds(30));
        if (filter.since() != null) {
            cc.deliverPolicy(DeliverPolicy.ByStartTime)
                    .startTime(ZonedDateTime.ofInstant(filter.since(), ZoneOffset.UTC));
        } else {
            cc.deliverPolicy(DeliverPolicy.All);
        }

        PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(stream.getName())
                .configuration(cc.build())
                .build();

        JetStreamSubscription sub = js.subscribe(subject, pso);
        try {
            long pending = sub.getConsumerInfo().getNumPending();
            if (pending == 0) {
                return List.of();
            }
            // drain every pending message; the newest ones are at the end of the stream
            List<RelayEvent> out = new ArrayList<>();
            long remaining = pending;
            while (remaining > 0) {
                int batch = (int) Math.min(remaining, relays.getFetchBatch());
                List<Message> messages = sub.fetch(batch, relays.getReadTimeout());
                if (messages.isEmpty()) {
                    break;
                }
                remaining -= messages.size();
                for (Message m : messages) {
                    RelayEvent e = parse(relay, m);
                    if (e != null && filter.matches(e)) {
                        out.add(e);
                    }
                }
            }
            log.debug("Fetched {} of {} pending events for {} from {}", out.size(), pending, subject, relay);
            return newest(out, filter.limit());
        } finally {
            unsubscribe(relay, sub);
        }
    }

    /** The {@code limit} most recent events, newest first; ties by id. */
    static List<RelayEvent> newest(List<RelayEvent> events, int limit) {
        List<RelayEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(RelayEvent::createdAt).reversed().thenComparing(RelayEvent::id));
        return sorted.size() <= limit ? sorted : new ArrayList<>(sorted.subList(0, limit));
    }

    private RelayEvent parse(String relay, Message m) {
        try {
            return mapper.readValue(new String(m.getData(), StandardCharsets.UTF_8), RelayEvent.class);
        } catch (IOException e) {
            log.warn("Dropping unreadable message on {} subject={}: {}", relay, m.getSubject(), e.getMessage());
            return null;
        }
    }

    private boolean verified(RelayEvent event) {
        if (EventSigner.verify(event)) {
            return true;
        }
        log.warn("Dropping event {} from {} with invalid id or signature", event.id(), event.pubkey());
        return false;
    }

    private static void unsubscribe(String relay, JetStreamSubscription sub) {
        try {
            sub.unsubscribe();
        } catch (IllegalStateException e) {
            log.debug("Unsubscribe on {} failed: {}", relay, e.toString());
        }
    }

    private byte[] toJson(RelayEvent event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event " + event.id() + " cannot be serialized", e);
        }
    }
}
