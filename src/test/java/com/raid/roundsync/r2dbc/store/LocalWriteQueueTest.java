package com.raid.roundsync.r2dbc.store;

import static org.junit.Assert.assertEquals;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.After;
import org.junit.Test;

import com.raid.roundsync.core.error.LocalStorageException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

public class LocalWriteQueueTest {

    private final LocalWriteQueue queue = new LocalWriteQueue();

    @After
    public void tearDown() {
        queue.destroy();
    }

    @Test
    public void submit_runsWritesOneAtATimeInOrder() {
        List<String> log = new CopyOnWriteArrayList<>();
        Mono<String> slow = Mono.delay(Duration.ofMillis(50))
                .then(Mono.fromCallable(() -> { log.add("first"); return "first"; }));
        Mono<String> fast = Mono.fromCallable(() -> { log.add("second"); return "second"; });

        Flux.merge(queue.submit("slow", slow), queue.submit("fast", fast)).collectList().block(Duration.ofSeconds(5));

        assertEquals(List.of("first", "second"), log);
    }

    @Test
    public void submit_failureIsReportedAsLocalStorageAndQueueKeepsRunning() {
        StepVerifier.create(queue.submit("broken", Mono.error(new IllegalStateException("disk full"))))
                .expectError(LocalStorageException.class)
                .verify(Duration.ofSeconds(5));

        StepVerifier.create(queue.submit("next", Mono.just(42)))
                .expectNext(42)
                .verifyComplete();
    }

    @Test
    public void submit_emptyWriteCompletesEmpty() {
        StepVerifier.create(queue.submit("noop", Mono.<Integer>empty()))
                .verifyComplete();
    }
}
