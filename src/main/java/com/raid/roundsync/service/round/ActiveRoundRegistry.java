package com.raid.roundsync.service.round;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import reactor.core.publisher.Mono;

/**
 * Keeps one {@link ActiveRound} per round id for the lifetime of the process.
 */
@Component
public class ActiveRoundRegistry {

    private final RoundAggregate aggregate;
    private final Map<Long, Mono<ActiveRound>> sessions = new ConcurrentHashMap<>();

    public ActiveRoundRegistry(RoundAggregate aggregate) {
        this.aggregate = aggregate;
    }

    public Mono<ActiveRound> get(long roundId) {
        return sessions.computeIfAbsent(roundId, id -> ActiveRound.open(aggregate, id)
                .doOnError(err -> sessions.remove(id))
                .cache());
    }

    public void close(long roundId) {
        sessions.remove(roundId);
    }
}
