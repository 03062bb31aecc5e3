package com.raid.roundsync.core.relay;

import java.util.Collection;
import java.util.List;

import com.raid.roundsync.core.event.RelayEvent;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Publish/query contract for the relay network.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@code publish} sends the event to every target relay and completes with the relays that
 *       acknowledged it. It errors with a
 *       {@link com.raid.roundsync.core.error.RelayPublishException} only when none did.</li>
 *   <li>Publishing the same event twice is harmless: relays de-duplicate by event id.</li>
 *   <li>{@code query} merges results from every target relay, de-duplicated by id. Only events
 *       with a valid id and signature are emitted. Unreachable relays are skipped, so an empty
 *       result does not prove that no data exists.</li>
 *   <li>Implementations must not block the calling thread.</li>
 * </ul>
 */
public interface RelayClient {

    /** Publishes to the configured default publish relays. */
    Mono<List<String>> publish(RelayEvent event);

    Mono<List<String>> publish(RelayEvent event, Collection<String> relayUrls);

    /** Queries the configured default read relays. */
    Flux<RelayEvent> query(RelayFilter filter);

    Flux<RelayEvent> query(RelayFilter filter, Collection<String> relayUrls);
}
